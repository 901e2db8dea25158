package com.fedquery.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 联邦目录：数据源、模式映射与已保存查询
 */
public class FederationCatalog {
    @JsonProperty("version")
    private String version;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("data_sources")
    private List<DataSourceConfig> dataSources;

    @JsonProperty("schema_mappings")
    private List<SchemaMapping> schemaMappings;

    @JsonProperty("queries")
    private List<SavedQuery> queries;

    public FederationCatalog() {
    }

    /**
     * 列表浅拷贝，用于写时复制
     */
    public FederationCatalog(FederationCatalog other) {
        this.version = other.version;
        this.namespace = other.namespace;
        this.dataSources = new ArrayList<>(other.getDataSources());
        this.schemaMappings = new ArrayList<>(other.getSchemaMappings());
        this.queries = new ArrayList<>(other.getQueries());
    }

    public static FederationCatalog empty() {
        FederationCatalog catalog = new FederationCatalog();
        catalog.setVersion("1.0");
        catalog.setDataSources(new ArrayList<>());
        catalog.setSchemaMappings(new ArrayList<>());
        catalog.setQueries(new ArrayList<>());
        return catalog;
    }

    @JsonIgnore
    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    @JsonIgnore
    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    @JsonIgnore
    public List<DataSourceConfig> getDataSources() {
        return dataSources != null ? dataSources : List.of();
    }

    public void setDataSources(List<DataSourceConfig> dataSources) {
        this.dataSources = dataSources;
    }

    @JsonIgnore
    public List<SchemaMapping> getSchemaMappings() {
        return schemaMappings != null ? schemaMappings : List.of();
    }

    public void setSchemaMappings(List<SchemaMapping> schemaMappings) {
        this.schemaMappings = schemaMappings;
    }

    @JsonIgnore
    public List<SavedQuery> getQueries() {
        return queries != null ? queries : List.of();
    }

    public void setQueries(List<SavedQuery> queries) {
        this.queries = queries;
    }

    /**
     * 根据 ID 查找数据源配置
     */
    @JsonIgnore
    public DataSourceConfig getDataSourceById(String id) {
        if (id == null) {
            return null;
        }
        return getDataSources().stream()
            .filter(ds -> id.equals(ds.getId()))
            .findFirst()
            .orElse(null);
    }

    @JsonIgnore
    public SchemaMapping getMappingById(String id) {
        if (id == null) {
            return null;
        }
        return getSchemaMappings().stream()
            .filter(m -> id.equals(m.getId()))
            .findFirst()
            .orElse(null);
    }

    @JsonIgnore
    public SavedQuery getQueryById(String id) {
        if (id == null) {
            return null;
        }
        return getQueries().stream()
            .filter(q -> id.equals(q.getId()))
            .findFirst()
            .orElse(null);
    }
}
