package com.fedquery.repository;

import com.fedquery.federation.MutableClock;
import com.fedquery.query.Field;
import com.fedquery.query.FieldValue;
import com.fedquery.query.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private PathManager pathManager;
    private FileSnapshotStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        pathManager = new PathManager(tempDir.toString(), "test");
        store = new FileSnapshotStore(pathManager, 3, clock);
    }

    private static List<Row> rows(int n) {
        return List.of(Row.of(Map.of("n", n, "label", "row-" + n)));
    }

    @Test
    void emptyStoreHasNoSnapshots() throws Exception {
        assertThat(store.getLatest("crm", "users")).isNull();
        assertThat(store.history("crm", "users")).isEmpty();
    }

    @Test
    void latestSnapshotSurvivesJsonRoundTrip() throws Exception {
        List<Field> schema = List.of(new Field("n", "number"), new Field("label", "string"));
        store.put("crm", "users", rows(1), schema);

        CollectionSnapshot latest = store.getLatest("crm", "users");

        assertThat(latest.getSourceId()).isEqualTo("crm");
        assertThat(latest.getCollectionName()).isEqualTo("users");
        assertThat(latest.getSchema()).isEqualTo(schema);
        assertThat(latest.getRows()).isEqualTo(rows(1));
        assertThat(latest.getFetchedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void historyIsOldestFirstAndPruned() throws Exception {
        for (int i = 1; i <= 5; i++) {
            store.put("crm", "users", rows(i), List.of());
            clock.advance(Duration.ofSeconds(1));
        }

        List<CollectionSnapshot> history = store.history("crm", "users");

        assertThat(history).hasSize(3);
        assertThat(history).extracting(s -> s.getRows().get(0).get("n"))
            .containsExactly(FieldValue.of(3), FieldValue.of(4), FieldValue.of(5));
        assertThat(store.getLatest("crm", "users").getRows()).isEqualTo(rows(5));
    }

    @Test
    void fetchedAtIncreasesUnderStoppedClock() throws Exception {
        CollectionSnapshot first = store.put("crm", "users", rows(1), List.of());
        CollectionSnapshot second = store.put("crm", "users", rows(2), List.of());

        assertThat(second.getFetchedAt()).isAfter(first.getFetchedAt());
        assertThat(store.getLatest("crm", "users").getRows()).isEqualTo(rows(2));
    }

    @Test
    void evictRemovesOnlyThatSource() throws Exception {
        store.put("crm", "users", rows(1), List.of());
        store.put("crm", "accounts", rows(1), List.of());
        store.put("shop", "orders", rows(1), List.of());

        store.evict("crm");

        assertThat(store.getLatest("crm", "users")).isNull();
        assertThat(store.getLatest("crm", "accounts")).isNull();
        assertThat(store.getLatest("shop", "orders")).isNotNull();
        assertThat(Files.exists(Paths.get(pathManager.getSourceSnapshotDir("crm")))).isFalse();
    }

    @Test
    void unusualNamesMapToSafePaths() throws Exception {
        store.put("crm/eu", "客户", rows(1), List.of());

        assertThat(store.getLatest("crm/eu", "客户")).isNotNull();
        assertThat(pathManager.getSnapshotDir("crm/eu", "客户")).doesNotContain("客户").contains("crm_eu");
    }

    @Test
    void putOrdersAfterLatestFileNameWithoutReadingIt() throws Exception {
        Instant later = Instant.parse("2024-05-01T11:00:00Z");
        Path dir = Paths.get(pathManager.getSnapshotDir("crm", "users"));
        Files.createDirectories(dir);
        Files.write(Paths.get(pathManager.getSnapshotPath("crm", "users", later)), "not json".getBytes());

        CollectionSnapshot snapshot = store.put("crm", "users", rows(1), List.of());

        assertThat(snapshot.getFetchedAt()).isEqualTo(later.plusNanos(1));
    }

    @Test
    void foreignFilesAreIgnored() throws Exception {
        store.put("crm", "users", rows(1), List.of());
        Files.write(Paths.get(pathManager.getSnapshotDir("crm", "users"), "notes.json"), "{}".getBytes());

        assertThat(store.history("crm", "users")).hasSize(1);
        assertThat(store.put("crm", "users", rows(2), List.of()).getRows()).isEqualTo(rows(2));
    }

    @Test
    void fileStemRoundTripsFetchedAt() {
        Instant fetchedAt = Instant.parse("2024-05-01T10:00:00.123456789Z");

        String fileName = PathManager.snapshotFileStem(fetchedAt) + ".json";

        assertThat(PathManager.fetchedAtOf(fileName)).isEqualTo(fetchedAt);
    }
}
