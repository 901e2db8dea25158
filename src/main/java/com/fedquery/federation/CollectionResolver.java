package com.fedquery.federation;

import com.fedquery.adapter.FilterSpec;
import com.fedquery.adapter.SourceAdapter;
import com.fedquery.exception.SourceConnectionException;
import com.fedquery.mapping.SchemaMappingApplier;
import com.fedquery.meta.SchemaMapping;
import com.fedquery.query.Row;
import com.fedquery.query.SchemaInference;
import com.fedquery.repository.CollectionSnapshot;
import com.fedquery.repository.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 为一次查询准备输入集合
 * <ol>
 *   <li>对每个需要的集合名，依次从列出该集合的数据源拉取全量数据并保存为新快照，同名集合的行按数据源顺序拼接并标记来源</li>
 *   <li>拉取失败（含超时）时退回到该数据源的最近快照，并记录告警</li>
 *   <li>仍缺失的集合按 active 映射从源集合合成</li>
 * </ol>
 * 只有在所有拉取都失败且没有任何可用快照时才抛出 {@link SourceConnectionException}
 */
public class CollectionResolver {
    private static final Logger logger = LoggerFactory.getLogger(CollectionResolver.class);

    /**
     * 从数据源拉取的每一行附带的来源数据源 ID 字段
     */
    public static final String SOURCE_FIELD = "__source";

    private final SnapshotStore snapshotStore;
    private final SchemaMappingApplier mappingApplier;
    private final ExecutorService fetchExecutor;
    private final Duration fetchTimeout;

    public CollectionResolver(SnapshotStore snapshotStore, SchemaMappingApplier mappingApplier,
                              ExecutorService fetchExecutor, Duration fetchTimeout) {
        this.snapshotStore = snapshotStore;
        this.mappingApplier = mappingApplier;
        this.fetchExecutor = fetchExecutor;
        this.fetchTimeout = fetchTimeout;
    }

    /**
     * @param needed           查询引用的集合名（FROM 与各 JOIN）
     * @param requestedSources 参与查询的数据源，按请求顺序
     * @param allSources       工作集中的全部数据源，映射的源集合可来自其中任意一个
     * @param mappings         active 映射
     */
    public Resolution resolve(Set<String> needed, List<ConnectedSource> requestedSources,
                              Map<String, ConnectedSource> allSources, Collection<SchemaMapping> mappings)
            throws SourceConnectionException {
        Resolution resolution = new Resolution();

        for (String name : needed) {
            List<Row> rows = fetchFromSources(name, requestedSources, resolution);
            if (rows != null) {
                resolution.collections.put(name, rows);
            }
        }

        for (String name : needed) {
            if (resolution.collections.containsKey(name)) {
                continue;
            }
            synthesize(name, requestedSources, allSources, mappings, resolution);
        }

        if (!needed.isEmpty() && resolution.collections.isEmpty() && resolution.failures > 0) {
            throw new SourceConnectionException(null,
                "No data available for " + needed + ": " + String.join("; ", resolution.warnings));
        }
        return resolution;
    }

    /**
     * 所有列出该集合的数据源的行拼接，每行以 {@link #SOURCE_FIELD} 标记来源；没有任何数据源提供时返回 null
     */
    private List<Row> fetchFromSources(String name, List<ConnectedSource> sources, Resolution resolution) {
        List<Row> combined = null;
        for (ConnectedSource source : sources) {
            if (!source.hasCollection(name)) {
                continue;
            }
            List<Row> rows = fetchWithFallback(source, name, resolution);
            if (rows != null) {
                if (combined == null) {
                    combined = new ArrayList<>();
                }
                for (Row row : rows) {
                    combined.add(Row.builder().putAll(row).put(SOURCE_FIELD, source.getId()).build());
                }
            }
        }
        return combined;
    }

    List<Row> fetchWithFallback(ConnectedSource source, String name, Resolution resolution) {
        String reason;
        if (source.isConnected()) {
            try {
                List<Row> rows = fetch(source, name);
                storeSnapshot(source.getId(), name, rows);
                return rows;
            } catch (SourceConnectionException e) {
                reason = e.getMessage();
            }
        } else {
            reason = "data source '" + source.getId() + "' is not connected"
                + (source.getError() != null ? " (" + source.getError() + ")" : "");
        }
        resolution.failures++;

        CollectionSnapshot snapshot = latestSnapshot(source.getId(), name);
        if (snapshot != null) {
            resolution.warn(String.format("Fetching %s/%s failed (%s), using snapshot from %s",
                source.getId(), name, reason, snapshot.getFetchedAt()));
            return snapshot.getRows();
        }
        resolution.warn(String.format("Fetching %s/%s failed (%s), no snapshot available", source.getId(), name, reason));
        return null;
    }

    private List<Row> fetch(ConnectedSource source, String name) throws SourceConnectionException {
        SourceAdapter adapter = source.getAdapter();
        Future<List<Row>> future = fetchExecutor.submit(() -> adapter.executeQuery(name, FilterSpec.all()));
        try {
            return future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SourceConnectionException(source.getId(), "timed out after " + fetchTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceConnectionException) {
                throw (SourceConnectionException) cause;
            }
            throw new SourceConnectionException(source.getId(), String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SourceConnectionException(source.getId(), "interrupted", e);
        }
    }

    private void synthesize(String target, List<ConnectedSource> requestedSources,
                            Map<String, ConnectedSource> allSources, Collection<SchemaMapping> mappings,
                            Resolution resolution) {
        for (SchemaMapping mapping : mappings) {
            if (!mapping.isActive() || !target.equals(mapping.getTargetCollection())) {
                continue;
            }
            List<Row> sourceRows = mappingInput(mapping, requestedSources, allSources, resolution);
            if (sourceRows == null) {
                continue;
            }
            Map<String, List<Row>> available = new LinkedHashMap<>(resolution.collections);
            available.put(mapping.getSourceCollection(), sourceRows);
            List<Row> rows = mappingApplier.synthesize(List.of(mapping), available).get(target);
            if (rows == null) {
                continue;
            }
            resolution.collections.put(target, rows);
            String ownerId = mapping.getTargetId() != null ? mapping.getTargetId() : mapping.getSourceId();
            if (ownerId != null) {
                storeSnapshot(ownerId, target, rows);
            }
            logger.debug("Collection {} synthesized through mapping {}", target, mapping.getId());
            return;
        }
    }

    /**
     * 映射的源集合：已解析的集合优先，其次映射声明的数据源，未声明时使用请求中的数据源
     */
    private List<Row> mappingInput(SchemaMapping mapping, List<ConnectedSource> requestedSources,
                                   Map<String, ConnectedSource> allSources, Resolution resolution) {
        String sourceCollection = mapping.getSourceCollection();
        if (resolution.collections.containsKey(sourceCollection)) {
            return resolution.collections.get(sourceCollection);
        }
        if (mapping.getSourceId() != null) {
            ConnectedSource source = allSources.get(mapping.getSourceId());
            if (source == null) {
                resolution.warn("Mapping " + mapping.getId() + " refers to unknown data source '" + mapping.getSourceId() + "'");
                return null;
            }
            return fetchWithFallback(source, sourceCollection, resolution);
        }
        return fetchFromSources(sourceCollection, requestedSources, resolution);
    }

    private void storeSnapshot(String sourceId, String name, List<Row> rows) {
        try {
            snapshotStore.put(sourceId, name, rows, SchemaInference.infer(rows));
        } catch (IOException e) {
            logger.warn("Failed to store snapshot of {}/{}: {}", sourceId, name, e.getMessage());
        }
    }

    private CollectionSnapshot latestSnapshot(String sourceId, String name) {
        try {
            return snapshotStore.getLatest(sourceId, name);
        } catch (IOException e) {
            logger.warn("Failed to read snapshot of {}/{}: {}", sourceId, name, e.getMessage());
            return null;
        }
    }

    /**
     * 解析结果：集合名 → 行，以及降级告警
     */
    public static class Resolution {
        private final Map<String, List<Row>> collections = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();
        private int failures;

        void warn(String message) {
            logger.warn(message);
            warnings.add(message);
        }

        public Map<String, List<Row>> getCollections() {
            return collections;
        }

        public List<String> getWarnings() {
            return warnings;
        }

        public int getFailures() {
            return failures;
        }
    }
}
