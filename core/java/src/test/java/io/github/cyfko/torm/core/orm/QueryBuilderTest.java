package io.github.cyfko.torm.core.orm;

import io.github.cyfko.torm.core.Torm;
import io.github.cyfko.torm.core.api.Op;
import io.github.cyfko.torm.core.exception.QueryDefinitionException;
import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.QueryPlan;
import io.github.cyfko.torm.core.model.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryBuilder Tests")
class QueryBuilderTest {

    private Model products;

    @BeforeEach
    void setUp() {
        products = new Torm(new InMemoryDocumentRepository()).model("Product");
        products.create(Map.of("_id", "p1", "name", "Pen", "price", 2, "category", "office"));
        products.create(Map.of("_id", "p2", "name", "Desk", "price", 150, "category", "furniture"));
        products.create(Map.of("_id", "p3", "name", "Lamp", "price", 35, "category", "furniture"));
        products.create(Map.of("_id", "p4", "name", "Chair", "price", 80, "category", "furniture"));
        products.create(Map.of("_id", "p5", "name", "Stapler", "price", 12, "category", "office"));
    }

    private static List<String> names(List<Document> documents) {
        return documents.stream().map(d -> d.get("name").asText()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should filter, sort and paginate")
    void shouldFilterSortAndPaginate() {
        // When
        List<Document> page = products.query()
                .where("category", "furniture")
                .filter("price", Op.GTE, 40)
                .sort("price", "desc")
                .exec();

        // Then
        assertEquals(List.of("Desk", "Chair"), names(page));
    }

    @Test
    @DisplayName("Should accept operator codes")
    void shouldAcceptOperatorCodes() {
        List<Document> result = products.query().filter("category", "in", List.of("office")).sort("name").exec();

        assertEquals(List.of("Pen", "Stapler"), names(result));
    }

    @Test
    @DisplayName("Should skip before limiting")
    void shouldSkipBeforeLimiting() {
        List<Document> result = products.query().sort("price").skip(1).limit(2).exec();

        assertEquals(List.of("Stapler", "Lamp"), names(result));
    }

    @Test
    @DisplayName("Should return the first result after skipping")
    void shouldReturnFirst() {
        assertEquals(Value.of("Pen"), products.query().sort("price").first().orElseThrow().get("name"));
        assertEquals(Value.of("Stapler"), products.query().sort("price").skip(1).first().orElseThrow().get("name"));
        assertTrue(products.query().limit(0).first().isEmpty());
        assertTrue(products.query().where("name", "Sofa").first().isEmpty());
    }

    @Test
    @DisplayName("Should count filtered documents ignoring pagination")
    void shouldCountIgnoringPagination() {
        long count = products.query().where("category", "furniture").sort("price").skip(2).limit(1).count();

        assertEquals(3, count);
    }

    @Test
    @DisplayName("Should expose an immutable plan")
    void shouldExposePlan() {
        QueryBuilder query = products.query().filter("price", "<", 50).limit(3);

        QueryPlan plan = query.toPlan();
        query.where("category", "office");

        assertEquals(1, plan.filters().size());
        assertEquals(Op.LT, plan.filters().get(0).op());
        assertEquals(3, plan.limit());
    }

    @Test
    @DisplayName("Should reject invalid construction eagerly")
    void shouldRejectInvalidConstruction() {
        QueryBuilder query = products.query();

        assertThrows(QueryDefinitionException.class, () -> query.filter("price", "between", List.of(1, 2)));
        assertThrows(QueryDefinitionException.class, () -> query.sort("price", "sideways"));
        assertThrows(QueryDefinitionException.class, () -> query.skip(-1));
        assertThrows(QueryDefinitionException.class, () -> query.limit(-5));
    }
}
