package io.github.cyfko.torm.core.orm;

import io.github.cyfko.torm.core.api.Op;
import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.QueryPlan;
import io.github.cyfko.torm.core.model.SortBy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fluent query over one {@link Model}'s collection.
 * <p>
 * Each call adds to the plan; nothing is read until {@link #exec()}, {@link #first()} or
 * {@link #count()}. Calling {@code sort}, {@code skip} or {@code limit} again replaces the
 * previous setting. Filters accumulate and are AND-combined.
 * </p>
 *
 * <pre>{@code
 * List<Document> page = users.query()
 *         .where("status", "ACTIVE")
 *         .filter("age", "gte", 18)
 *         .sort("age", "desc")
 *         .skip(20)
 *         .limit(10)
 *         .exec();
 * }</pre>
 *
 * <p>Not thread-safe; build a query on one thread and execute it.</p>
 *
 * @since 1.0.0
 */
public final class QueryBuilder {

    private final Model model;
    private final QueryPlan.Builder plan = QueryPlan.builder();

    QueryBuilder(Model model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    public QueryBuilder filter(String field, Op op, Object value) {
        plan.filter(field, op, value);
        return this;
    }

    /**
     * @param op operator code or symbol, e.g. {@code "not_in"} or {@code "NOT IN"}
     * @throws io.github.cyfko.torm.core.exception.QueryDefinitionException for an unknown operator
     */
    public QueryBuilder filter(String field, String op, Object value) {
        plan.filter(field, op, value);
        return this;
    }

    /** Equality shorthand for {@code filter(field, Op.EQ, value)}. */
    public QueryBuilder where(String field, Object value) {
        return filter(field, Op.EQ, value);
    }

    public QueryBuilder sort(String field) {
        return sort(SortBy.asc(field));
    }

    public QueryBuilder sort(String field, String direction) {
        return sort(new SortBy(field, direction));
    }

    public QueryBuilder sort(SortBy sort) {
        plan.sort(Objects.requireNonNull(sort, "sort"));
        return this;
    }

    public QueryBuilder skip(int skip) {
        plan.skip(skip);
        return this;
    }

    public QueryBuilder limit(int limit) {
        plan.limit(limit);
        return this;
    }

    /**
     * @return an immutable snapshot of the query built so far
     */
    public QueryPlan toPlan() {
        return plan.build();
    }

    public List<Document> exec() {
        return model.execute(toPlan());
    }

    /**
     * Runs the query and keeps its first result; {@code skip} still applies.
     */
    public Optional<Document> first() {
        QueryPlan current = toPlan();
        int limit = current.limit() == null ? 1 : Math.min(current.limit(), 1);
        return model.execute(current.toBuilder().limit(limit).build()).stream().findFirst();
    }

    /**
     * Counts the documents matching the filters. Sort, skip and limit are ignored.
     */
    public long count() {
        return model.countMatching(toPlan().filters());
    }
}
