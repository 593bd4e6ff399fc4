package io.github.cyfko.torm.core.model;

import io.github.cyfko.torm.core.exception.QueryDefinitionException;

import java.util.Locale;

/**
 * Sort order with field name and direction.
 *
 * @param field     field name to sort by
 * @param direction sort direction ("asc" or "desc", case-insensitive, stored lower-case)
 */
public record SortBy(String field, String direction) {

    public static final String ASC = "asc";
    public static final String DESC = "desc";

    /**
     * Canonical constructor with validation.
     */
    public SortBy {
        if (field == null || field.isBlank()) {
            throw new QueryDefinitionException("Sorting field cannot be null nor blank");
        }
        if (direction == null) {
            throw new QueryDefinitionException("Sorting direction is required. Either 'asc' (ascending) or 'desc' (descending)");
        }

        direction = direction.trim().toLowerCase(Locale.ROOT);
        if (!direction.equals(ASC) && !direction.equals(DESC)) {
            throw new QueryDefinitionException("direction must be 'asc' or 'desc', got: " + direction);
        }
    }

    /**
     * Creates an ascending sort order.
     *
     * @param field field name
     * @return sort order with ascending direction
     */
    public static SortBy asc(String field) {
        return new SortBy(field, ASC);
    }

    /**
     * Creates a descending sort order.
     *
     * @param field field name
     * @return sort order with descending direction
     */
    public static SortBy desc(String field) {
        return new SortBy(field, DESC);
    }

    public boolean isDescending() {
        return DESC.equals(direction);
    }
}
