package com.fedquery.federation;

import com.fedquery.adapter.FilterSpec;
import com.fedquery.adapter.SourceAdapter;
import com.fedquery.adapter.SourceAdapterFactory;
import com.fedquery.exception.ErrorKind;
import com.fedquery.exception.FederationException;
import com.fedquery.exception.QuerySyntaxException;
import com.fedquery.exception.SourceConnectionException;
import com.fedquery.exception.UnknownParameterException;
import com.fedquery.exception.UnknownStrategyException;
import com.fedquery.mapping.SchemaMappingApplier;
import com.fedquery.meta.DataSourceConfig;
import com.fedquery.meta.Loader;
import com.fedquery.meta.SchemaMapping;
import com.fedquery.query.Field;
import com.fedquery.query.Row;
import com.fedquery.repository.InMemoryQueryResultStore;
import com.fedquery.repository.InMemorySnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FederationEngineTest {
    private final AtomicBoolean flakyFailing = new AtomicBoolean();
    private final AtomicInteger flakyConnects = new AtomicInteger();

    private MutableClock clock;
    private Loader loader;
    private InMemorySnapshotStore snapshotStore;
    private FederationEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        loader = new Loader(Paths.get(FederationEngineTest.class.getResource("/catalog-test.yaml").toURI()).toString());
        loader.load();
        snapshotStore = new InMemorySnapshotStore(5, clock);

        SourceAdapterFactory factory = new SourceAdapterFactory();
        factory.register("flaky", FlakyAdapter::new);

        engine = new FederationEngine(loader, snapshotStore, new InMemoryQueryResultStore(), factory,
            new SchemaMappingApplier(), clock, Duration.ofMinutes(15), Duration.ofSeconds(5), Duration.ofSeconds(5), 1);
        engine.initialize();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static Row row(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Row.of(values);
    }

    private FederatedResult query(String text, List<String> sources, Map<String, Object> params, String strategy)
            throws FederationException {
        return engine.executeFederatedQuery(new FederatedQueryRequest(text, sources, params, strategy));
    }

    @Test
    void connectsCatalogSourcesOnInitialize() {
        List<ConnectedSource> sources = engine.listConnectedSources();

        assertThat(sources).extracting(ConnectedSource::getId).containsExactly("a", "b");
        assertThat(sources).allMatch(ConnectedSource::isConnected);
        assertThat(sources.get(0).getCollections()).contains("users", "accounts");
        assertThat(engine.listActiveMappings()).extracting(SchemaMapping::getId).containsExactly("acct");
    }

    @Test
    void joinsCollectionsFromDifferentSources() throws Exception {
        FederatedResult result = query(
            "SELECT users.name, orders.amount FROM users JOIN orders ON users.uid = orders.userId",
            List.of("a", "b"), Map.of(), "virtual");

        assertThat(result.getRows()).containsExactly(row("name", "Ann", "amount", 9.5));
        assertThat(result.isCacheHit()).isFalse();
        assertThat(result.getStrategy()).isEqualTo(FederationStrategy.VIRTUAL);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void emptySourceListMeansAllSources() throws Exception {
        FederatedResult result = query("SELECT * FROM orders WHERE amount > :min", List.of(), Map.of("min", 10), null);

        assertThat(result.getRows())
            .containsExactly(row("orderId", "o2", "userId", "2", "amount", 20, "__source", "b"));
    }

    @Test
    void rowsOfSameCollectionFromSeveralSourcesCarryTheirSource() throws Exception {
        engine.addDataSource(new DataSourceConfig("c", "memory",
            Map.of("documents", Map.of("orders", List.of(Map.of("orderId", "o9", "userId", "1", "amount", 42))))));

        FederatedResult result = query("SELECT orderId, __source FROM orders", List.of("b", "c"), Map.of(), "virtual");

        assertThat(result.getRows()).containsExactly(
            row("orderId", "o1", "__source", "b"),
            row("orderId", "o2", "__source", "b"),
            row("orderId", "o9", "__source", "c"));
    }

    @Test
    void callerErrorsSurfaceBeforeAnyFetch() throws Exception {
        assertThatThrownBy(() -> query("SELECT * FROM users WHERE uid = :id", List.of(), Map.of(), "virtual"))
            .isInstanceOf(UnknownParameterException.class);
        assertThatThrownBy(() -> query("SELECT * FROM users", List.of(), Map.of(), "eventual"))
            .isInstanceOf(UnknownStrategyException.class);
        assertThatThrownBy(() -> query("SELECT * users", List.of(), Map.of(), "virtual"))
            .isInstanceOf(QuerySyntaxException.class);

        assertThat(snapshotStore.getLatest("a", "users")).isNull();
    }

    @Test
    void materializedQueriesAreServedFromCache() throws Exception {
        FederatedResult first = query("SELECT * FROM users", List.of("a"), Map.of(), "materialized");
        FederatedResult second = query("SELECT * FROM users", List.of("a"), Map.of(), "materialized");

        assertThat(first.isCacheHit()).isFalse();
        assertThat(second.isCacheHit()).isTrue();
        assertThat(second.getLastUpdated()).isEqualTo(first.getLastUpdated());
        assertThat(second.getQueryKey()).isEqualTo(first.getQueryKey());

        FederatedResult otherParams = query("SELECT * FROM users WHERE uid = :id", List.of("a"), Map.of("id", "1"),
            "materialized");
        FederatedResult otherParamsAgain = query("SELECT * FROM users WHERE uid = :id", List.of("a"), Map.of("id", "2"),
            "materialized");
        assertThat(otherParams.getQueryKey()).isNotEqualTo(otherParamsAgain.getQueryKey());
        assertThat(otherParamsAgain.getRows()).isEmpty();
    }

    @Test
    void synthesizesMissingCollectionThroughMapping() throws Exception {
        FederatedResult result = query("SELECT id, amount FROM balances", List.of("a"), Map.of(), "virtual");

        assertThat(result.getRows()).containsExactly(row("id", 10, "amount", 120.5));
        assertThat(snapshotStore.getLatest("a", "balances")).isNotNull();
    }

    @Test
    void synthesizedCollectionCanBeJoined() throws Exception {
        FederatedResult result = query(
            "SELECT users.name, balances.amount FROM users JOIN balances ON users.uid = balances.userId",
            List.of("a"), Map.of(), "virtual");

        assertThat(result.getRows()).containsExactly(row("name", "Ann", "amount", 120.5));
    }

    @Test
    void inactiveMappingLeavesWorkingSet() throws Exception {
        SchemaMapping mapping = new SchemaMapping(loader.getMappingById("acct"));
        mapping.setStatus(SchemaMapping.STATUS_INACTIVE);
        engine.updateMapping(mapping);

        FederatedResult result = query("SELECT * FROM balances", List.of("a"), Map.of(), "virtual");

        assertThat(engine.listActiveMappings()).isEmpty();
        assertThat(result.getRows()).isEmpty();
    }

    @Test
    void unknownSourceIdProducesWarning() throws Exception {
        FederatedResult result = query("SELECT * FROM users", List.of("a", "nope"), Map.of(), "virtual");

        assertThat(result.getRows()).hasSize(1);
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("nope"));
    }

    @Test
    void failedFetchFallsBackToLatestSnapshot() throws Exception {
        engine.addDataSource(new DataSourceConfig("f", "flaky", Map.of()));
        FederatedResult fresh = query("SELECT * FROM events", List.of("f"), Map.of(), "virtual");
        assertThat(fresh.getRows()).hasSize(2);

        flakyFailing.set(true);
        FederatedResult degraded = query("SELECT * FROM events", List.of("f"), Map.of(), "virtual");

        assertThat(degraded.getRows()).isEqualTo(fresh.getRows());
        assertThat(degraded.getWarnings()).hasSize(1);
        assertThat(degraded.getWarnings().get(0)).contains("using snapshot");
    }

    @Test
    void failsWhenNoSourceAndNoSnapshotCanServeQuery() {
        flakyFailing.set(true);
        engine.addDataSource(new DataSourceConfig("f", "flaky", Map.of()));

        assertThatThrownBy(() -> query("SELECT * FROM events", List.of("f"), Map.of(), "virtual"))
            .isInstanceOf(SourceConnectionException.class)
            .satisfies(e -> assertThat(((FederationException) e).getKind()).isEqualTo(ErrorKind.SOURCE_CONNECTION));
    }

    @Test
    void partialResultsWhenOneSourceFails() throws Exception {
        flakyFailing.set(true);
        engine.addDataSource(new DataSourceConfig("f", "flaky", Map.of()));

        FederatedResult result = query("SELECT users.name FROM users JOIN events ON users.uid = events.uid",
            List.of("a", "f"), Map.of(), "virtual");

        assertThat(result.getRows()).containsExactly(row("name", "Ann"));
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("no snapshot available"));
    }

    @Test
    void unsupportedSourceTypeStaysDisconnected() {
        boolean connected = engine.addDataSource(new DataSourceConfig("m", "mongodb", Map.of()));

        ConnectedSource source = engine.listConnectedSources().stream()
            .filter(s -> s.getId().equals("m")).findFirst().orElseThrow();
        assertThat(connected).isFalse();
        assertThat(source.isConnected()).isFalse();
        assertThat(source.getError()).contains("mongodb");
    }

    @Test
    void unchangedConnectionIsNotReconnected() {
        engine.addDataSource(new DataSourceConfig("f", "flaky", Map.of()));
        int connectsBefore = flakyConnects.get();

        DataSourceConfig renamed = new DataSourceConfig("f", "flaky", Map.of());
        renamed.setName("renamed");
        engine.updateDataSource(renamed);

        assertThat(flakyConnects.get()).isEqualTo(connectsBefore);
        assertThat(engine.listConnectedSources()).anyMatch(s -> "renamed".equals(s.getName()));
    }

    @Test
    void removedSourceIsDisconnectedAndItsSnapshotsEvicted() throws Exception {
        query("SELECT * FROM orders", List.of("b"), Map.of(), "virtual");
        assertThat(snapshotStore.getLatest("b", "orders")).isNotNull();

        assertThat(engine.removeDataSource("b")).isTrue();

        assertThat(engine.listConnectedSources()).extracting(ConnectedSource::getId).containsExactly("a");
        assertThat(snapshotStore.getLatest("b", "orders")).isNull();
        assertThat(query("SELECT * FROM orders", List.of(), Map.of(), "virtual").getRows()).isEmpty();
    }

    @Test
    void savedQueryMergesDefaultAndCallParameters() throws Exception {
        FederatedResult defaults = engine.executeSavedQuery("big-orders", Map.of());
        FederatedResult overridden = engine.executeSavedQuery("big-orders", Map.of("min", 5));

        assertThat(defaults.getStrategy()).isEqualTo(FederationStrategy.MATERIALIZED);
        assertThat(defaults.getRows()).containsExactly(row("orderId", "o2", "amount", 20));
        assertThat(overridden.getRows()).containsExactly(row("orderId", "o2", "amount", 20), row("orderId", "o1", "amount", 9.5));
        assertThat(defaults.getQueryKey()).startsWith("query-big-orders");
    }

    @Test
    void savedQueryCanBeRunThroughRequest() throws Exception {
        FederatedQueryRequest request = new FederatedQueryRequest();
        request.setQueryId("big-orders");

        assertThat(engine.executeFederatedQuery(request).getRows()).hasSize(1);
    }

    @Test
    void unknownSavedQueryIsNotFound() {
        assertThatThrownBy(() -> engine.executeSavedQuery("missing", Map.of()))
            .isInstanceOf(FederationException.class)
            .satisfies(e -> assertThat(((FederationException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void validatesQuerySyntax() {
        assertThat(engine.validateQuerySyntax("SELECT * FROM users").isValid()).isTrue();

        ValidationResult invalid = engine.validateQuerySyntax("SELECT * FROM users WHERE a = 1 OR b = 2");
        assertThat(invalid.isValid()).isFalse();
        assertThat(invalid.getError()).contains("OR");
    }

    @Test
    void logicalSchemaPrefersSnapshotThenMappingThenAdapter() throws Exception {
        assertThat(engine.getLogicalCollectionSchema("a", "users"))
            .containsExactly(new Field("uid", "string"), new Field("name", "string"));
        assertThat(engine.getLogicalCollectionSchema("a", "balances"))
            .extracting(Field::getName).containsExactly("id", "userId", "amount");
        assertThat(engine.getLogicalCollectionSchema("a", "nothing")).isNull();
        assertThat(engine.getLogicalCollectionSchema("zzz", "users")).isNull();

        snapshotStore.put("a", "users", List.of(row("uid", "1", "joined", Instant.EPOCH)),
            List.of(new Field("uid", "string"), new Field("joined", "date")));
        assertThat(engine.getLogicalCollectionSchema("a", "users"))
            .extracting(Field::getName).containsExactly("uid", "joined");
    }

    /**
     * 可切换为失败状态的数据源，提供 events 集合
     */
    private class FlakyAdapter implements SourceAdapter {
        private volatile boolean connected;

        @Override
        public boolean connect(DataSourceConfig config, Duration timeout) {
            flakyConnects.incrementAndGet();
            connected = true;
            return true;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public List<String> listCollections() {
            return List.of("events");
        }

        @Override
        public List<Field> getCollectionSchema(String collection) {
            return List.of();
        }

        @Override
        public List<Row> executeQuery(String collection, FilterSpec filterSpec) throws SourceConnectionException {
            if (flakyFailing.get()) {
                throw new SourceConnectionException("f", "source is down");
            }
            return List.of(row("uid", "1", "kind", "login"), row("uid", "1", "kind", "logout"));
        }

        @Override
        public void disconnect() {
            connected = false;
        }
    }
}
