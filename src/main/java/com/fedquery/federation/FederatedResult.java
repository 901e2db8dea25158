package com.fedquery.federation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fedquery.query.Row;

import java.time.Instant;
import java.util.List;

/**
 * 一次联邦查询的结果与执行元数据，不可变
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FederatedResult {
    private final String queryKey;
    private final FederationStrategy strategy;
    private final List<Row> rows;
    private final long executionTimeMs;
    private final boolean cacheHit;
    private final Instant lastUpdated;
    private final Instant nextUpdate;
    private final List<String> warnings;

    @JsonCreator
    public FederatedResult(@JsonProperty("query_key") String queryKey,
                           @JsonProperty("strategy") FederationStrategy strategy,
                           @JsonProperty("rows") List<Row> rows,
                           @JsonProperty("execution_time_ms") long executionTimeMs,
                           @JsonProperty("cache_hit") boolean cacheHit,
                           @JsonProperty("last_updated") Instant lastUpdated,
                           @JsonProperty("next_update") Instant nextUpdate,
                           @JsonProperty("warnings") List<String> warnings) {
        this.queryKey = queryKey;
        this.strategy = strategy;
        this.rows = rows != null ? List.copyOf(rows) : List.of();
        this.executionTimeMs = executionTimeMs;
        this.cacheHit = cacheHit;
        this.lastUpdated = lastUpdated;
        this.nextUpdate = nextUpdate;
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * 相同结果，标记为缓存命中
     */
    public FederatedResult asCacheHit() {
        return new FederatedResult(queryKey, strategy, rows, executionTimeMs, true, lastUpdated, nextUpdate, warnings);
    }

    @JsonProperty("query_key")
    public String getQueryKey() {
        return queryKey;
    }

    @JsonProperty("strategy")
    public FederationStrategy getStrategy() {
        return strategy;
    }

    @JsonProperty("rows")
    public List<Row> getRows() {
        return rows;
    }

    @JsonProperty("execution_time_ms")
    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    @JsonProperty("cache_hit")
    public boolean isCacheHit() {
        return cacheHit;
    }

    @JsonProperty("last_updated")
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @JsonProperty("next_update")
    public Instant getNextUpdate() {
        return nextUpdate;
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "FederatedResult{queryKey=" + queryKey + ", strategy=" + strategy + ", rows=" + rows.size()
            + ", cacheHit=" + cacheHit + ", lastUpdated=" + lastUpdated + ", nextUpdate=" + nextUpdate + "}";
    }
}
