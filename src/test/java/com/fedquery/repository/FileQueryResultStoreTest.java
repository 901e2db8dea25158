package com.fedquery.repository;

import com.fedquery.federation.FederatedResult;
import com.fedquery.federation.FederationStrategy;
import com.fedquery.query.FieldValue;
import com.fedquery.query.Row;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileQueryResultStoreTest {

    @TempDir
    Path tempDir;

    private static FederatedResult result(String key, double amount) {
        return new FederatedResult(key, FederationStrategy.MATERIALIZED,
            List.of(Row.of(Map.of("orderId", "o1", "amount", amount))), 12L, false,
            Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T10:15:00Z"), List.of("slow source"));
    }

    @Test
    void storesLatestResultPerKey() throws Exception {
        FileQueryResultStore store = new FileQueryResultStore(new PathManager(tempDir.toString(), "test"));

        store.saveQueryResult("query-big-orders", result("query-big-orders", 9.5));
        store.saveQueryResult("query-big-orders", result("query-big-orders", 20));
        store.saveQueryResult("adhoc-0123456789abcdef", result("adhoc-0123456789abcdef", 1));

        FederatedResult latest = store.getLatest("query-big-orders");
        assertThat(latest.getQueryKey()).isEqualTo("query-big-orders");
        assertThat(latest.getStrategy()).isEqualTo(FederationStrategy.MATERIALIZED);
        assertThat(latest.getRows().get(0).get("amount")).isEqualTo(FieldValue.of(20));
        assertThat(latest.getExecutionTimeMs()).isEqualTo(12L);
        assertThat(latest.getLastUpdated()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(latest.getNextUpdate()).isEqualTo(Instant.parse("2024-05-01T10:15:00Z"));
        assertThat(latest.getWarnings()).containsExactly("slow source");
    }

    @Test
    void missingAndDeletedKeysReturnNull() throws Exception {
        FileQueryResultStore store = new FileQueryResultStore(new PathManager(tempDir.toString(), "test"));

        assertThat(store.getLatest("query-unknown")).isNull();

        store.saveQueryResult("query-x", result("query-x", 1));
        store.delete("query-x");
        store.delete("query-x");

        assertThat(store.getLatest("query-x")).isNull();
    }

    @Test
    void deletesResultsByKeyPrefix() throws Exception {
        FileQueryResultStore store = new FileQueryResultStore(new PathManager(tempDir.toString(), "test"));
        store.saveQueryResult("query-big-orders-1a2b", result("query-big-orders-1a2b", 1));
        store.saveQueryResult("query-big-orders-3c4d", result("query-big-orders-3c4d", 2));
        store.saveQueryResult("query-small-orders", result("query-small-orders", 3));

        int deleted = store.deleteByPrefix("query-big-orders-");

        assertThat(deleted).isEqualTo(2);
        assertThat(store.getLatest("query-big-orders-1a2b")).isNull();
        assertThat(store.getLatest("query-small-orders")).isNotNull();
        assertThat(store.deleteByPrefix("query-none")).isZero();
    }
}
