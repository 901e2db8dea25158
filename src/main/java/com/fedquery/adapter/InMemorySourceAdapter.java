package com.fedquery.adapter;

import com.fedquery.exception.SourceConnectionException;
import com.fedquery.meta.DataSourceConfig;
import com.fedquery.query.Field;
import com.fedquery.query.Row;
import com.fedquery.query.SchemaInference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存文档数据源
 * 文档在目录中以 config.documents 声明：集合名 → 文档列表
 */
public class InMemorySourceAdapter implements SourceAdapter {
    private static final Logger logger = LoggerFactory.getLogger(InMemorySourceAdapter.class);

    public static final String TYPE = "memory";

    private volatile Map<String, List<Row>> collections;
    private String sourceId;

    @Override
    public boolean connect(DataSourceConfig config, Duration timeout) throws SourceConnectionException {
        Object documents = config.getConfig().get("documents");
        if (documents != null && !(documents instanceof Map)) {
            throw new SourceConnectionException(config.getId(),
                "config.documents of data source '" + config.getId() + "' must map collection names to document lists");
        }
        Map<String, List<Row>> loaded = new LinkedHashMap<>();
        for (String name : config.getCollections()) {
            loaded.put(name, List.of());
        }
        if (documents != null) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) documents).entrySet()) {
                loaded.put(String.valueOf(entry.getKey()), toRows(config.getId(), entry.getKey(), entry.getValue()));
            }
        }
        this.sourceId = config.getId();
        this.collections = loaded;
        logger.info("In-memory source {} connected with {} collections", sourceId, loaded.size());
        return true;
    }

    private static List<Row> toRows(String sourceId, Object collection, Object value) throws SourceConnectionException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new SourceConnectionException(sourceId,
                "config.documents." + collection + " of data source '" + sourceId + "' must be a list of documents");
        }
        List<Row> rows = new ArrayList<>();
        for (Object document : (List<?>) value) {
            if (!(document instanceof Map)) {
                throw new SourceConnectionException(sourceId,
                    "config.documents." + collection + " of data source '" + sourceId + "' contains a non-object document");
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> field : ((Map<?, ?>) document).entrySet()) {
                fields.put(String.valueOf(field.getKey()), field.getValue());
            }
            rows.add(Row.of(fields));
        }
        return List.copyOf(rows);
    }

    @Override
    public boolean isConnected() {
        return collections != null;
    }

    @Override
    public List<String> listCollections() throws SourceConnectionException {
        return new ArrayList<>(requireConnected().keySet());
    }

    @Override
    public List<Field> getCollectionSchema(String collection) throws SourceConnectionException {
        List<Row> rows = requireConnected().get(collection);
        return rows != null ? SchemaInference.infer(rows) : List.of();
    }

    @Override
    public List<Row> executeQuery(String collection, FilterSpec filterSpec) throws SourceConnectionException {
        List<Row> rows = requireConnected().get(collection);
        if (rows == null) {
            return List.of();
        }
        return filterSpec.apply(rows);
    }

    @Override
    public void disconnect() {
        collections = null;
    }

    private Map<String, List<Row>> requireConnected() throws SourceConnectionException {
        Map<String, List<Row>> current = collections;
        if (current == null) {
            throw new SourceConnectionException(sourceId, "Data source '" + sourceId + "' is not connected");
        }
        return current;
    }
}
