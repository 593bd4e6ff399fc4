package io.github.cyfko.torm.core.model;

import io.github.cyfko.torm.core.api.Op;
import io.github.cyfko.torm.core.exception.QueryDefinitionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of a query: AND-combined filters, an optional single-field sort, and
 * optional {@code skip}/{@code limit}.
 *
 * <h2>Component Details</h2>
 * <dl>
 *   <dt><strong>{@code filters}</strong></dt>
 *   <dd>Conjunction of {@link QueryFilter}s. Empty means every document matches.</dd>
 *
 *   <dt><strong>{@code sort}</strong></dt>
 *   <dd>{@code null} keeps the order the repository returned documents in.</dd>
 *
 *   <dt><strong>{@code skip}</strong>, <strong>{@code limit}</strong></dt>
 *   <dd>{@code null} means unset. Skip is applied before limit. Both must be {@code >= 0}.</dd>
 * </dl>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * QueryPlan plan = QueryPlan.builder()
 *         .filter("age", Op.GTE, 18)
 *         .filter("city", Op.EQ, "Lomé")
 *         .sort(SortBy.desc("age"))
 *         .skip(20)
 *         .limit(10)
 *         .build();
 * }</pre>
 *
 * @param filters immutable filter list
 * @param sort    sort order, nullable
 * @param skip    number of matches to drop, nullable
 * @param limit   maximum number of results, nullable
 * @throws QueryDefinitionException if {@code skip} or {@code limit} is negative
 * @since 1.0.0
 * @see io.github.cyfko.torm.core.query.QueryEvaluator
 */
public record QueryPlan(List<QueryFilter> filters, SortBy sort, Integer skip, Integer limit) {

    private static final QueryPlan ALL = new QueryPlan(List.of(), null, null, null);

    public QueryPlan {
        filters = filters == null ? List.of() : List.copyOf(filters);
        if (skip != null && skip < 0) {
            throw new QueryDefinitionException("skip cannot be negative. Provided: " + skip);
        }
        if (limit != null && limit < 0) {
            throw new QueryDefinitionException("limit cannot be negative. Provided: " + limit);
        }
    }

    /**
     * @return the plan matching every document, unsorted and unpaginated
     */
    public static QueryPlan all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasSort() {
        return sort != null;
    }

    /**
     * @return a builder pre-filled with this plan
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.filters.addAll(filters);
        builder.sort = sort;
        builder.skip = skip;
        builder.limit = limit;
        return builder;
    }

    @Override
    public String toString() {
        return String.format("QueryPlan{filters=%s, sort=%s, skip=%s, limit=%s}", filters, sort, skip, limit);
    }

    /**
     * Mutable accumulator for {@link QueryPlan}. {@link #build()} freezes a snapshot; the
     * builder can keep being used afterwards without affecting built plans.
     */
    public static final class Builder {
        private final List<QueryFilter> filters = new ArrayList<>();
        private SortBy sort;
        private Integer skip;
        private Integer limit;

        private Builder() {}

        public Builder filter(QueryFilter filter) {
            if (filter == null) {
                throw new QueryDefinitionException("filter cannot be null");
            }
            filters.add(filter);
            return this;
        }

        public Builder filter(String field, Op op, Object value) {
            return filter(QueryFilter.of(field, op, value));
        }

        public Builder filter(String field, String op, Object value) {
            return filter(new QueryFilter(field, op, value));
        }

        public Builder sort(SortBy sort) {
            this.sort = sort;
            return this;
        }

        public Builder skip(int skip) {
            if (skip < 0) {
                throw new QueryDefinitionException("skip cannot be negative. Provided: " + skip);
            }
            this.skip = skip;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new QueryDefinitionException("limit cannot be negative. Provided: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public QueryPlan build() {
            return new QueryPlan(filters, sort, skip, limit);
        }
    }
}
