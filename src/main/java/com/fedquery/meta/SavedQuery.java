package com.fedquery.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 已保存的联邦查询
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SavedQuery {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("query")
    private String query;

    @JsonProperty("data_sources")
    private List<String> dataSources;

    @JsonProperty("collections")
    private List<String> collections;

    /**
     * virtual / materialized / hybrid，为空时按 virtual 执行
     */
    @JsonProperty("federation_strategy")
    private String federationStrategy;

    /**
     * 默认参数，执行时传入的同名参数优先
     */
    @JsonProperty("params")
    private Map<String, Object> params;

    @JsonIgnore
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @JsonIgnore
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
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
    public List<String> getCollections() {
        return collections != null ? collections : List.of();
    }

    public void setCollections(List<String> collections) {
        this.collections = collections;
    }

    @JsonIgnore
    public String getFederationStrategy() {
        return federationStrategy;
    }

    public void setFederationStrategy(String federationStrategy) {
        this.federationStrategy = federationStrategy;
    }

    @JsonIgnore
    public Map<String, Object> getParams() {
        return params != null ? params : Map.of();
    }

    public void setParams(Map<String, Object> params) {
        this.params = params;
    }
}
