package io.github.cyfko.torm.core.api;

import io.github.cyfko.torm.core.exception.QueryDefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Op Tests")
class OpTest {

    @ParameterizedTest
    @CsvSource({
            "eq, EQ", "=, EQ", "ne, NE", "!=, NE",
            "gt, GT", ">, GT", "gte, GTE", ">=, GTE",
            "lt, LT", "<, LT", "lte, LTE", "<=, LTE",
            "contains, CONTAINS", "in, IN", "not_in, NOT_IN", "NOT IN, NOT_IN"
    })
    @DisplayName("Should resolve operators from code or symbol")
    void shouldResolveFromCodeOrSymbol(String input, Op expected) {
        assertEquals(expected, Op.fromString(input));
    }

    @Test
    @DisplayName("Should ignore case and surrounding whitespace")
    void shouldIgnoreCase() {
        assertEquals(Op.GTE, Op.fromString("  GTE "));
        assertEquals(Op.NOT_IN, Op.fromString("Not In"));
        assertEquals(Op.CONTAINS, Op.fromString("CONTAINS"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"between", "like", "~", ""})
    @DisplayName("Should reject unknown operators")
    void shouldRejectUnknownOperators(String input) {
        assertThrows(QueryDefinitionException.class, () -> Op.fromString(input));
    }

    @Test
    @DisplayName("Should reject null operator")
    void shouldRejectNull() {
        assertThrows(QueryDefinitionException.class, () -> Op.fromString(null));
    }

    @Test
    @DisplayName("Only membership operators expect arrays")
    void onlyMembershipOperatorsExpectArrays() {
        for (Op op : Op.values()) {
            assertEquals(op == Op.IN || op == Op.NOT_IN, op.expectsArray(), op.name());
        }
    }
}
