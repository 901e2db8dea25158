package com.fedquery.federation;

import com.fedquery.adapter.SourceAdapter;
import com.fedquery.adapter.SourceAdapterFactory;
import com.fedquery.config.Config;
import com.fedquery.exception.ErrorKind;
import com.fedquery.exception.FederationException;
import com.fedquery.exception.QuerySyntaxException;
import com.fedquery.exception.SourceConnectionException;
import com.fedquery.mapping.SchemaMappingApplier;
import com.fedquery.meta.ConfigurationStore;
import com.fedquery.meta.DataSourceConfig;
import com.fedquery.meta.Loader;
import com.fedquery.meta.SavedQuery;
import com.fedquery.meta.SchemaMapping;
import com.fedquery.query.FederationExecutor;
import com.fedquery.query.Field;
import com.fedquery.query.ParsedQuery;
import com.fedquery.query.QueryParser;
import com.fedquery.query.Row;
import com.fedquery.query.SchemaInference;
import com.fedquery.repository.CollectionSnapshot;
import com.fedquery.repository.QueryResultStore;
import com.fedquery.repository.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 联邦查询引擎
 * <p>
 * 持有已注册数据源与 active 映射两个工作集。工作集以不可变副本发布，配置变更在写锁内生成新副本后整体替换，
 * 查询在读锁内取得当前副本后即不再受后续变更影响。
 */
@Service
public class FederationEngine {
    private static final Logger logger = LoggerFactory.getLogger(FederationEngine.class);

    private final ConfigurationStore configurationStore;
    private final SnapshotStore snapshotStore;
    private final SourceAdapterFactory adapterFactory;
    private final SchemaMappingApplier mappingApplier;
    private final Duration connectTimeout;

    private final QueryParser parser = new QueryParser();
    private final FederationExecutor executor = new FederationExecutor();
    private final ExecutorService ioExecutor;
    private final ExecutorService refreshExecutor;
    private final CollectionResolver resolver;
    private final FederationStrategyController strategyController;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, ConnectedSource> sources = Collections.emptyMap();
    private List<SchemaMapping> mappings = Collections.emptyList();

    @Autowired
    public FederationEngine(Config config, ConfigurationStore configurationStore, SnapshotStore snapshotStore,
                            QueryResultStore resultStore, SourceAdapterFactory adapterFactory,
                            SchemaMappingApplier mappingApplier, Clock clock) {
        this(configurationStore, snapshotStore, resultStore, adapterFactory, mappingApplier, clock,
            Duration.ofMillis(config.getRefreshIntervalMs()),
            Duration.ofMillis(config.getConnectTimeoutMs()),
            Duration.ofMillis(config.getFetchTimeoutMs()),
            config.getRefreshPoolSize());
    }

    public FederationEngine(ConfigurationStore configurationStore, SnapshotStore snapshotStore,
                            QueryResultStore resultStore, SourceAdapterFactory adapterFactory,
                            SchemaMappingApplier mappingApplier, Clock clock, Duration refreshInterval,
                            Duration connectTimeout, Duration fetchTimeout, int refreshPoolSize) {
        this.configurationStore = configurationStore;
        this.snapshotStore = snapshotStore;
        this.adapterFactory = adapterFactory;
        this.mappingApplier = mappingApplier;
        this.connectTimeout = connectTimeout;
        this.ioExecutor = Executors.newCachedThreadPool(daemonThreads("fedquery-io"));
        this.refreshExecutor = Executors.newFixedThreadPool(Math.max(1, refreshPoolSize), daemonThreads("fedquery-refresh"));
        this.resolver = new CollectionResolver(snapshotStore, mappingApplier, ioExecutor, fetchTimeout);
        this.strategyController = new FederationStrategyController(resultStore, refreshExecutor, clock, refreshInterval);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 从配置存储加载数据源与映射并连接全部数据源
     */
    @PostConstruct
    public void initialize() {
        Map<String, ConnectedSource> connected = new LinkedHashMap<>();
        for (DataSourceConfig dataSource : configurationStore.listDataSources()) {
            if (!dataSource.isActive()) {
                logger.info("Data source {} is inactive, not connecting", dataSource.getId());
                continue;
            }
            connected.put(dataSource.getId(), connect(dataSource));
        }
        List<SchemaMapping> active = new ArrayList<>(configurationStore.listActiveMappings());

        lock.writeLock().lock();
        try {
            this.sources = Collections.unmodifiableMap(connected);
            this.mappings = Collections.unmodifiableList(active);
        } finally {
            lock.writeLock().unlock();
        }
        long up = connected.values().stream().filter(ConnectedSource::isConnected).count();
        logger.info("Federation engine initialized: {}/{} data sources connected, {} active mappings",
            up, connected.size(), active.size());
    }

    // ---------------------------------------------------------------- 数据源

    /**
     * 注册并连接数据源，返回是否连接成功；连接失败的数据源仍留在工作集中
     */
    public boolean addDataSource(DataSourceConfig dataSource) {
        if (!dataSource.isActive()) {
            removeFromWorkingSet(dataSource.getId());
            return false;
        }
        ConnectedSource connected = connect(dataSource);
        ConnectedSource previous = publishSource(connected);
        if (previous != null) {
            disconnect(previous);
        }
        return connected.isConnected();
    }

    /**
     * 连接配置或声明的集合变化时重新连接，否则只替换配置
     */
    public boolean updateDataSource(DataSourceConfig dataSource) {
        ConnectedSource current = getSources().get(dataSource.getId());
        if (current == null || !dataSource.isActive() || !current.isConnected()
            || !current.getConfig().sameConnection(dataSource)
            || !current.getConfig().getCollections().equals(dataSource.getCollections())) {
            return addDataSource(dataSource);
        }
        ConnectedSource updated = current.withConfig(dataSource);
        publishSource(updated);
        logger.info("Data source {} updated without reconnecting", dataSource.getId());
        return true;
    }

    /**
     * 断开数据源并清除其快照
     */
    public boolean removeDataSource(String dataSourceId) {
        ConnectedSource removed = removeFromWorkingSet(dataSourceId);
        try {
            snapshotStore.evict(dataSourceId);
        } catch (IOException e) {
            logger.warn("Failed to evict snapshots of {}: {}", dataSourceId, e.getMessage());
        }
        return removed != null;
    }

    private ConnectedSource removeFromWorkingSet(String dataSourceId) {
        ConnectedSource removed;
        lock.writeLock().lock();
        try {
            Map<String, ConnectedSource> updated = new LinkedHashMap<>(sources);
            removed = updated.remove(dataSourceId);
            this.sources = Collections.unmodifiableMap(updated);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            disconnect(removed);
            logger.info("Data source {} removed", dataSourceId);
        }
        return removed;
    }

    private ConnectedSource publishSource(ConnectedSource source) {
        lock.writeLock().lock();
        try {
            Map<String, ConnectedSource> updated = new LinkedHashMap<>(sources);
            ConnectedSource previous = updated.put(source.getId(), source);
            this.sources = Collections.unmodifiableMap(updated);
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 创建适配器并在超时内完成连接；失败时返回带错误信息的未连接数据源
     */
    ConnectedSource connect(DataSourceConfig dataSource) {
        SourceAdapter adapter;
        try {
            adapter = adapterFactory.create(dataSource);
        } catch (SourceConnectionException e) {
            logger.warn("Cannot create adapter for {}: {}", dataSource.getId(), e.getMessage());
            return ConnectedSource.failed(dataSource, e.getMessage());
        }

        Future<List<String>> future = ioExecutor.submit(() -> {
            if (!adapter.connect(dataSource, connectTimeout)) {
                throw new SourceConnectionException(dataSource.getId(), "connection is not valid");
            }
            return adapter.listCollections();
        });
        try {
            List<String> listed = future.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            List<String> collections = new ArrayList<>(dataSource.getCollections());
            for (String name : listed) {
                if (!collections.contains(name)) {
                    collections.add(name);
                }
            }
            logger.info("Data source {} connected, collections: {}", dataSource.getId(), collections);
            return new ConnectedSource(dataSource, adapter, collections, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return connectFailed(dataSource, adapter, "connect timed out after " + connectTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            return connectFailed(dataSource, adapter, String.valueOf(e.getCause().getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return connectFailed(dataSource, adapter, "interrupted while connecting");
        }
    }

    private ConnectedSource connectFailed(DataSourceConfig dataSource, SourceAdapter adapter, String reason) {
        logger.warn("Failed to connect data source {}: {}", dataSource.getId(), reason);
        adapter.disconnect();
        return ConnectedSource.failed(dataSource, reason);
    }

    private void disconnect(ConnectedSource source) {
        if (source.getAdapter() != null) {
            try {
                source.getAdapter().disconnect();
            } catch (RuntimeException e) {
                logger.warn("Error disconnecting data source {}: {}", source.getId(), e.getMessage());
            }
        }
    }

    // ---------------------------------------------------------------- 映射

    public void addMapping(SchemaMapping mapping) {
        updateMapping(mapping);
    }

    /**
     * 替换同 ID 映射；inactive 映射从工作集移除
     */
    public void updateMapping(SchemaMapping mapping) {
        lock.writeLock().lock();
        try {
            List<SchemaMapping> updated = new ArrayList<>();
            boolean replaced = false;
            for (SchemaMapping existing : mappings) {
                if (existing.getId().equals(mapping.getId())) {
                    if (mapping.isActive()) {
                        updated.add(mapping);
                    }
                    replaced = true;
                } else {
                    updated.add(existing);
                }
            }
            if (!replaced && mapping.isActive()) {
                updated.add(mapping);
            }
            this.mappings = Collections.unmodifiableList(updated);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Mapping {} {} working set", mapping.getId(), mapping.isActive() ? "placed in" : "removed from");
    }

    public boolean removeMapping(String mappingId) {
        lock.writeLock().lock();
        try {
            List<SchemaMapping> updated = new ArrayList<>(mappings);
            boolean removed = updated.removeIf(m -> m.getId().equals(mappingId));
            this.mappings = Collections.unmodifiableList(updated);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- 查询

    public FederatedResult executeFederatedQuery(FederatedQueryRequest request) throws FederationException {
        if (request.getQueryId() != null && !request.getQueryId().isEmpty()) {
            return executeSavedQuery(request.getQueryId(), request.getParams());
        }
        // 调用方错误在任何 I/O 之前暴露
        FederationStrategy strategy = FederationStrategy.fromToken(request.getStrategy());
        ParsedQuery query = parser.parse(request.getQuery());
        Map<String, Object> params = request.getParams();
        executor.bindParameters(query, params);

        String queryKey = adHocKey(request.getQuery(), request.getDataSources(), params);
        return execute(queryKey, strategy, query, request.getDataSources(), params);
    }

    /**
     * 执行已保存查询；传入参数覆盖已保存的默认参数
     */
    public FederatedResult executeSavedQuery(String queryId, Map<String, Object> params) throws FederationException {
        SavedQuery saved;
        try {
            saved = configurationStore.getQueryById(queryId);
        } catch (Loader.NotFoundException e) {
            throw new FederationException(ErrorKind.NOT_FOUND, e.getMessage(), e);
        }
        FederationStrategy strategy = FederationStrategy.fromToken(saved.getFederationStrategy());
        ParsedQuery query = parser.parse(saved.getQuery());
        Map<String, Object> merged = new HashMap<>(saved.getParams());
        if (params != null) {
            merged.putAll(params);
        }
        executor.bindParameters(query, merged);

        String queryKey = savedQueryKeyPrefix(queryId) + paramsSuffix(merged);
        return execute(queryKey, strategy, query, saved.getDataSources(), merged);
    }

    /**
     * 已保存查询的缓存键不含查询文本，修改或删除后清除该查询全部参数组合的缓存
     */
    public void invalidateSavedQuery(String queryId) {
        strategyController.invalidate(savedQueryKeyPrefix(queryId));
        strategyController.invalidatePrefix(savedQueryKeyPrefix(queryId) + "-");
        logger.info("Cached results of saved query {} invalidated", queryId);
    }

    private FederatedResult execute(String queryKey, FederationStrategy strategy, ParsedQuery query,
                                    List<String> dataSourceIds, Map<String, Object> params) throws FederationException {
        FederatedResult result = strategyController.execute(queryKey, strategy,
            () -> runPipeline(query, dataSourceIds, params));
        logger.info("Query {} executed: strategy={}, cacheHit={}, rows={}, {} ms", queryKey, strategy.getToken(),
            result.isCacheHit(), result.getRows().size(), result.getExecutionTimeMs());
        return result;
    }

    private PipelineOutcome runPipeline(ParsedQuery query, List<String> dataSourceIds, Map<String, Object> params)
            throws FederationException {
        Map<String, ConnectedSource> currentSources;
        List<SchemaMapping> currentMappings;
        lock.readLock().lock();
        try {
            currentSources = sources;
            currentMappings = mappings;
        } finally {
            lock.readLock().unlock();
        }

        List<String> warnings = new ArrayList<>();
        List<ConnectedSource> requested = new ArrayList<>();
        if (dataSourceIds == null || dataSourceIds.isEmpty()) {
            requested.addAll(currentSources.values());
        } else {
            for (String id : dataSourceIds) {
                ConnectedSource source = currentSources.get(id);
                if (source == null) {
                    String warning = "Data source '" + id + "' is not registered";
                    logger.warn(warning);
                    warnings.add(warning);
                } else {
                    requested.add(source);
                }
            }
        }

        CollectionResolver.Resolution resolution =
            resolver.resolve(query.referencedCollections(), requested, currentSources, currentMappings);
        warnings.addAll(resolution.getWarnings());
        List<Row> rows = executor.execute(query, resolution.getCollections(), params);
        return new PipelineOutcome(rows, warnings);
    }

    public ValidationResult validateQuerySyntax(String text) {
        try {
            parser.parse(text);
            return ValidationResult.ok();
        } catch (QuerySyntaxException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * 逻辑集合结构：依次查询快照、映射合成、数据源适配器，都没有时返回 null
     */
    public List<Field> getLogicalCollectionSchema(String sourceId, String name) {
        try {
            CollectionSnapshot snapshot = snapshotStore.getLatest(sourceId, name);
            if (snapshot != null) {
                return snapshot.getSchema();
            }
        } catch (IOException e) {
            logger.warn("Failed to read snapshot of {}/{}: {}", sourceId, name, e.getMessage());
        }

        Map<String, ConnectedSource> currentSources = getSources();
        for (SchemaMapping mapping : getMappings()) {
            if (!name.equals(mapping.getTargetCollection())) {
                continue;
            }
            if (mapping.getTargetId() != null && !mapping.getTargetId().equals(sourceId)) {
                continue;
            }
            String inputSourceId = mapping.getSourceId() != null ? mapping.getSourceId() : sourceId;
            ConnectedSource input = currentSources.get(inputSourceId);
            if (input == null) {
                continue;
            }
            CollectionResolver.Resolution scratch = new CollectionResolver.Resolution();
            List<Row> sourceRows = resolver.fetchWithFallback(input, mapping.getSourceCollection(), scratch);
            if (sourceRows != null) {
                return SchemaInference.infer(mappingApplier.apply(mapping, sourceRows));
            }
        }

        ConnectedSource source = currentSources.get(sourceId);
        if (source != null && source.isConnected()) {
            try {
                List<Field> fields = source.getAdapter().getCollectionSchema(name);
                if (!fields.isEmpty()) {
                    return fields;
                }
            } catch (SourceConnectionException e) {
                logger.warn("Failed to read schema of {}/{}: {}", sourceId, name, e.getMessage());
            }
        }
        return null;
    }

    public List<ConnectedSource> listConnectedSources() {
        return new ArrayList<>(getSources().values());
    }

    public List<SchemaMapping> listActiveMappings() {
        return getMappings();
    }

    private Map<String, ConnectedSource> getSources() {
        lock.readLock().lock();
        try {
            return sources;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<SchemaMapping> getMappings() {
        lock.readLock().lock();
        try {
            return mappings;
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        Map<String, ConnectedSource> current;
        lock.writeLock().lock();
        try {
            current = sources;
            this.sources = Collections.emptyMap();
        } finally {
            lock.writeLock().unlock();
        }
        for (ConnectedSource source : current.values()) {
            disconnect(source);
        }
        refreshExecutor.shutdownNow();
        ioExecutor.shutdownNow();
        logger.info("Federation engine shut down, {} data sources disconnected", current.size());
    }

    // ---------------------------------------------------------------- 缓存键

    static String adHocKey(String text, List<String> dataSourceIds, Map<String, ?> params) {
        String material = text.trim() + "\n" + dataSourceIds + "\n" + new TreeMap<>(params);
        return "adhoc-" + sha256(material).substring(0, 16);
    }

    static String savedQueryKeyPrefix(String queryId) {
        return "query-" + queryId;
    }

    static String paramsSuffix(Map<String, ?> params) {
        if (params.isEmpty()) {
            return "";
        }
        return "-" + sha256(new TreeMap<>(params).toString()).substring(0, 12);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
