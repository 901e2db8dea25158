package com.fedquery.repository;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fedquery.query.Field;
import com.fedquery.query.Row;

import java.time.Instant;
import java.util.List;

/**
 * 集合快照：某次拉取的行与推断结构，不可变；刷新产生新快照而不是修改旧快照
 */
public class CollectionSnapshot {
    private final String sourceId;
    private final String collectionName;
    private final List<Field> schema;
    private final List<Row> rows;
    private final Instant fetchedAt;

    @JsonCreator
    public CollectionSnapshot(@JsonProperty("source_id") String sourceId,
                              @JsonProperty("collection_name") String collectionName,
                              @JsonProperty("schema") List<Field> schema,
                              @JsonProperty("rows") List<Row> rows,
                              @JsonProperty("fetched_at") Instant fetchedAt) {
        this.sourceId = sourceId;
        this.collectionName = collectionName;
        this.schema = schema != null ? List.copyOf(schema) : List.of();
        this.rows = rows != null ? List.copyOf(rows) : List.of();
        this.fetchedAt = fetchedAt;
    }

    @JsonProperty("source_id")
    public String getSourceId() {
        return sourceId;
    }

    @JsonProperty("collection_name")
    public String getCollectionName() {
        return collectionName;
    }

    @JsonProperty("schema")
    public List<Field> getSchema() {
        return schema;
    }

    @JsonProperty("rows")
    public List<Row> getRows() {
        return rows;
    }

    @JsonProperty("fetched_at")
    public Instant getFetchedAt() {
        return fetchedAt;
    }

    @Override
    public String toString() {
        return "CollectionSnapshot{" + sourceId + "/" + collectionName + ", rows=" + rows.size() + ", fetchedAt=" + fetchedAt + "}";
    }
}
