package com.fedquery.federation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 联邦查询请求
 */
public class FederatedQueryRequest {
    @JsonProperty("query")
    private String query;

    /**
     * 参与查询的数据源，为空时使用全部已注册的数据源
     */
    @JsonProperty("data_sources")
    private List<String> dataSources;

    @JsonProperty("params")
    private Map<String, Object> params;

    @JsonProperty("strategy")
    private String strategy;

    /**
     * 已保存查询的 ID；设置后 query / data_sources / strategy 取自已保存查询
     */
    @JsonProperty("query_id")
    private String queryId;

    public FederatedQueryRequest() {
    }

    public FederatedQueryRequest(String query, List<String> dataSources, Map<String, Object> params, String strategy) {
        this.query = query;
        this.dataSources = dataSources;
        this.params = params;
        this.strategy = strategy;
    }

    @JsonIgnore
    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    @JsonIgnore
    public List<String> getDataSources() {
        return dataSources != null ? dataSources : List.of();
    }

    public void setDataSources(List<String> dataSources) {
        this.dataSources = dataSources;
    }

    @JsonIgnore
    public Map<String, Object> getParams() {
        return params != null ? params : Map.of();
    }

    public void setParams(Map<String, Object> params) {
        this.params = params;
    }

    @JsonIgnore
    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    @JsonIgnore
    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }
}
