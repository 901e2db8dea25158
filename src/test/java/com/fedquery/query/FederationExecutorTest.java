package com.fedquery.query;

import com.fedquery.exception.UnknownParameterException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FederationExecutorTest {
    private final QueryParser parser = new QueryParser();
    private final FederationExecutor executor = new FederationExecutor();

    private static Row row(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Row.of(values);
    }

    private Map<String, List<Row>> usersAndOrders() {
        Map<String, List<Row>> collections = new HashMap<>();
        collections.put("users", List.of(row("uid", "1", "name", "Ann")));
        collections.put("orders", List.of(row("orderId", "o1", "userId", "1", "amount", 9.5)));
        return collections;
    }

    private List<Row> run(String text, Map<String, List<Row>> collections, Map<String, ?> params) throws Exception {
        return executor.execute(parser.parse(text), collections, params);
    }

    @Test
    void joinsAcrossCollectionsAndProjectsQualifiedFields() throws Exception {
        List<Row> rows = run("SELECT users.name, orders.amount FROM users JOIN orders ON users.uid = orders.userId",
            usersAndOrders(), Map.of());

        assertThat(rows).containsExactly(row("name", "Ann", "amount", 9.5));
    }

    @Test
    void bindsParameters() throws Exception {
        List<Row> rows = run("SELECT * FROM users WHERE uid = :id", usersAndOrders(), Map.of("id", "1"));

        assertThat(rows).containsExactly(row("uid", "1", "name", "Ann"));
    }

    @Test
    void missingParameterFailsBeforeEvaluation() {
        assertThatThrownBy(() -> run("SELECT * FROM users WHERE uid = :id AND name = :name", usersAndOrders(), Map.of()))
            .isInstanceOf(UnknownParameterException.class)
            .satisfies(e -> assertThat(((UnknownParameterException) e).getParameterNames()).containsExactly("id", "name"));
    }

    @Test
    void ordersDescendingAndLimits() throws Exception {
        Map<String, List<Row>> collections = Map.of("orders", List.of(row("amount", 9.5), row("amount", 20)));

        List<Row> rows = run("SELECT amount FROM orders ORDER BY amount DESC LIMIT 1", collections, Map.of());

        assertThat(rows).containsExactly(row("amount", 20));
    }

    @Test
    void missingBaseCollectionYieldsEmptyResult() throws Exception {
        assertThat(run("SELECT * FROM nowhere", usersAndOrders(), Map.of())).isEmpty();
    }

    @Test
    void leftOuterJoinKeepsEveryBaseRowAndEmitsEveryMatch() throws Exception {
        Map<String, List<Row>> collections = new HashMap<>();
        collections.put("users", List.of(row("uid", 1, "name", "Ann"), row("uid", 2, "name", "Bob"),
            row("uid", null, "name", "Nobody")));
        collections.put("orders", List.of(row("userId", 1, "amount", 5), row("userId", 1, "amount", 7),
            row("userId", null, "amount", 99)));

        List<Row> rows = run("SELECT * FROM users JOIN orders ON users.uid = orders.userId", collections, Map.of());

        assertThat(rows).hasSize(4);
        assertThat(rows.get(0).get("orders.amount")).isEqualTo(FieldValue.of(5));
        assertThat(rows.get(1).get("orders.amount")).isEqualTo(FieldValue.of(7));
        assertThat(rows.get(2)).isEqualTo(row("uid", 2, "name", "Bob"));
        assertThat(rows.get(3)).isEqualTo(row("uid", null, "name", "Nobody"));
    }

    @Test
    void joinOnClauseMayNameJoinedCollectionFirst() throws Exception {
        List<Row> rows = run("SELECT users.name, orders.orderId FROM users JOIN orders ON orders.userId = users.uid",
            usersAndOrders(), Map.of());

        assertThat(rows).containsExactly(row("name", "Ann", "orderId", "o1"));
    }

    @Test
    void joinNotReferencingJoinedCollectionIsSkipped() throws Exception {
        List<Row> rows = run("SELECT * FROM users JOIN orders ON users.uid = payments.userId", usersAndOrders(), Map.of());

        assertThat(rows).containsExactly(row("uid", "1", "name", "Ann"));
    }

    @Test
    void numericComparisonIgnoresNumberRepresentation() throws Exception {
        Map<String, List<Row>> collections = Map.of("orders",
            List.of(row("amount", 10L), row("amount", new BigDecimal("10.00")), row("amount", 3.5)));

        assertThat(run("SELECT * FROM orders WHERE amount = 10", collections, Map.of())).hasSize(2);
        assertThat(run("SELECT * FROM orders WHERE amount < 5", collections, Map.of())).hasSize(1);
    }

    @Test
    void comparisonsAgainstNullOrMixedTypesDoNotMatch() throws Exception {
        Map<String, List<Row>> collections = Map.of("items",
            List.of(row("qty", 3), row("qty", "3"), row("qty", null), row("name", "no qty")));

        assertThat(run("SELECT * FROM items WHERE qty > 1", collections, Map.of())).hasSize(1);
        assertThat(run("SELECT * FROM items WHERE qty = NULL", collections, Map.of())).hasSize(2);
        assertThat(run("SELECT * FROM items WHERE qty != NULL", collections, Map.of())).hasSize(2);
    }

    @Test
    void datesCompareWithIsoText() throws Exception {
        Map<String, List<Row>> collections = Map.of("events", List.of(
            row("id", 1, "at", Instant.parse("2024-01-01T10:00:00Z")),
            row("id", 2, "at", Instant.parse("2024-03-01T10:00:00Z"))));

        List<Row> rows = run("SELECT id FROM events WHERE at >= :since", collections, Map.of("since", "2024-02-01"));

        assertThat(rows).containsExactly(row("id", 2));
    }

    @Test
    void fieldToFieldComparisonUsesSameRow() throws Exception {
        Map<String, List<Row>> collections = Map.of("stock", List.of(
            row("sku", "a", "onHand", 5, "reserved", 2),
            row("sku", "b", "onHand", 1, "reserved", 4)));

        List<Row> rows = run("SELECT sku FROM stock WHERE onHand > reserved", collections, Map.of());

        assertThat(rows).containsExactly(row("sku", "a"));
    }

    @Test
    void nullsSortFirstAscendingAndLastDescending() throws Exception {
        Map<String, List<Row>> collections = Map.of("t", List.of(row("k", 2), row("k", null), row("k", 1), row("x", 0)));

        List<Row> ascending = run("SELECT * FROM t ORDER BY k", collections, Map.of());
        List<Row> descending = run("SELECT * FROM t ORDER BY k DESC", collections, Map.of());

        assertThat(ascending.get(0).get("k").isNull()).isTrue();
        assertThat(ascending.get(1).get("k").isNull()).isTrue();
        assertThat(ascending.subList(2, 4)).containsExactly(row("k", 1), row("k", 2));
        assertThat(descending.subList(0, 2)).containsExactly(row("k", 2), row("k", 1));
        assertThat(descending.get(3).get("k").isNull()).isTrue();
    }

    @Test
    void sortIsStableAndUsesLaterKeysForTies() throws Exception {
        List<Row> input = new ArrayList<>(Arrays.asList(
            row("g", "b", "n", 2, "id", 1),
            row("g", "a", "n", 1, "id", 2),
            row("g", "b", "n", 1, "id", 3),
            row("g", "a", "n", 1, "id", 4)));
        Map<String, List<Row>> collections = Map.of("t", input);

        List<Row> first = run("SELECT id, g, n FROM t ORDER BY g, n DESC", collections, Map.of());
        List<Row> second = run("SELECT id, g, n FROM t ORDER BY g, n DESC", collections, Map.of());

        assertThat(first).extracting(r -> r.get("id")).containsExactly(
            FieldValue.of(2), FieldValue.of(4), FieldValue.of(1), FieldValue.of(3));
        assertThat(second).isEqualTo(first);
    }

    @Test
    void orderingAppliesToProjectedRows() throws Exception {
        Map<String, List<Row>> collections = Map.of("t", List.of(row("id", 1, "k", 2), row("id", 2, "k", 1)));

        List<Row> rows = run("SELECT id FROM t ORDER BY k", collections, Map.of());

        assertThat(rows).containsExactly(row("id", 1), row("id", 2));
    }

    @Test
    void projectionOmitsFieldsAbsentFromRow() throws Exception {
        List<Row> rows = run("SELECT name, email FROM users", usersAndOrders(), Map.of());

        assertThat(rows).containsExactly(row("name", "Ann"));
    }

    @Test
    void inputCollectionsAreNotModified() throws Exception {
        Map<String, List<Row>> collections = usersAndOrders();
        List<Row> before = new ArrayList<>(collections.get("users"));

        run("SELECT users.name FROM users JOIN orders ON users.uid = orders.userId ORDER BY name", collections, Map.of());

        assertThat(collections.get("users")).isEqualTo(before);
    }

    @Test
    void sameNamedFieldsFromDifferentCollectionsKeepQualifiedKeys() throws Exception {
        Map<String, List<Row>> collections = new HashMap<>();
        collections.put("users", List.of(row("id", "u1", "name", "Ann")));
        collections.put("orders", List.of(row("id", "o1", "userId", "u1")));

        List<Row> rows = run("SELECT users.id, orders.id, name FROM users JOIN orders ON users.id = orders.userId",
            collections, Map.of());

        assertThat(rows).containsExactly(row("users.id", "u1", "orders.id", "o1", "name", "Ann"));
    }
}
