package io.github.cyfko.torm.core.query;

import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.QueryFilter;
import io.github.cyfko.torm.core.model.QueryPlan;
import io.github.cyfko.torm.core.model.SortBy;
import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.core.utils.ValueComparisons;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Applies a {@link QueryPlan} to documents held in memory.
 * <p>
 * Execution runs three stages in a fixed order:
 * </p>
 * <ol>
 *   <li><strong>Filter:</strong> keep documents satisfying every filter (AND)</li>
 *   <li><strong>Sort:</strong> stable sort on the plan's field, if any; equal keys keep their input order</li>
 *   <li><strong>Paginate:</strong> drop {@code skip} documents, then keep at most {@code limit}</li>
 * </ol>
 *
 * <pre>{@code
 * List<Document> page = QueryEvaluator.apply(repository.fetchAll(prefix), QueryPlan.builder()
 *         .filter("age", Op.GTE, 18)
 *         .sort(SortBy.asc("name"))
 *         .skip(1).limit(2)
 *         .build());
 * }</pre>
 *
 * <p>Evaluation never fails for a well-formed plan: a comparison between incompatible types is
 * simply a non-match. The input list is never modified. See {@link ValueComparisons} for the
 * comparison rules.</p>
 *
 * @since 1.0.0
 */
public final class QueryEvaluator {

    private QueryEvaluator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Filters, sorts and paginates documents.
     *
     * @param documents the candidates, in repository order
     * @param plan      the query
     * @return a new unmodifiable list
     */
    public static List<Document> apply(List<Document> documents, QueryPlan plan) {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(plan, "plan");

        List<Document> result = new ArrayList<>();
        for (Document document : documents) {
            if (matches(document, plan.filters())) {
                result.add(document);
            }
        }

        if (plan.hasSort()) {
            result.sort(comparator(plan.sort()));
        }

        int from = plan.skip() == null ? 0 : Math.min(plan.skip(), result.size());
        int to = plan.limit() == null ? result.size() : (int) Math.min((long) from + plan.limit(), result.size());
        return List.copyOf(result.subList(from, to));
    }

    /**
     * @return {@code true} when the document satisfies all filters; an empty list matches everything
     */
    public static boolean matches(Document document, List<QueryFilter> filters) {
        for (QueryFilter filter : filters) {
            if (!matches(document, filter)) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(Document document, QueryFilter filter) {
        Value actual = document.get(filter.field());
        Value expected = filter.value();
        if (filter.op().expectsArray() && !(expected instanceof Value.Arr)) {
            return false;
        }
        return switch (filter.op()) {
            case EQ -> ValueComparisons.looseEquals(actual, expected);
            case NE -> !ValueComparisons.looseEquals(actual, expected);
            case GT -> ValueComparisons.compare(actual, expected).stream().anyMatch(c -> c > 0);
            case GTE -> ValueComparisons.compare(actual, expected).stream().anyMatch(c -> c >= 0);
            case LT -> ValueComparisons.compare(actual, expected).stream().anyMatch(c -> c < 0);
            case LTE -> ValueComparisons.compare(actual, expected).stream().anyMatch(c -> c <= 0);
            case CONTAINS -> ValueComparisons.contains(actual, expected);
            case IN -> ValueComparisons.isMember(actual, expected);
            case NOT_IN -> !ValueComparisons.isMember(actual, expected);
        };
    }

    /**
     * Counts matching documents, ignoring sort and pagination.
     */
    public static long count(List<Document> documents, List<QueryFilter> filters) {
        long count = 0;
        for (Document document : documents) {
            if (matches(document, filters)) {
                count++;
            }
        }
        return count;
    }

    private static Comparator<Document> comparator(SortBy sort) {
        Comparator<Document> ascending = Comparator.comparing(d -> d.get(sort.field()), ValueComparisons.SORT_ORDER);
        return sort.isDescending() ? ascending.reversed() : ascending;
    }
}
