package com.fedquery.federation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fedquery.adapter.SourceAdapter;
import com.fedquery.meta.DataSourceConfig;

import java.util.List;

/**
 * 引擎工作集中的数据源：配置、适配器句柄与连接状态，不可变
 * 连接失败的数据源也保留在工作集中，查询时退回到其快照
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectedSource {
    private final DataSourceConfig config;
    private final SourceAdapter adapter;
    private final List<String> collections;
    private final String error;

    ConnectedSource(DataSourceConfig config, SourceAdapter adapter, List<String> collections, String error) {
        this.config = config;
        this.adapter = adapter;
        this.collections = collections != null ? List.copyOf(collections) : List.of();
        this.error = error;
    }

    static ConnectedSource failed(DataSourceConfig config, String error) {
        return new ConnectedSource(config, null, config.getCollections(), error);
    }

    @JsonProperty("id")
    public String getId() {
        return config.getId();
    }

    @JsonProperty("name")
    public String getName() {
        return config.getName();
    }

    @JsonProperty("type")
    public String getType() {
        return config.getType();
    }

    @JsonProperty("connected")
    public boolean isConnected() {
        return adapter != null && adapter.isConnected();
    }

    @JsonProperty("collections")
    public List<String> getCollections() {
        return collections;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonIgnore
    public DataSourceConfig getConfig() {
        return config;
    }

    @JsonIgnore
    public SourceAdapter getAdapter() {
        return adapter;
    }

    public boolean hasCollection(String name) {
        return collections.contains(name);
    }

    ConnectedSource withConfig(DataSourceConfig updated) {
        return new ConnectedSource(updated, adapter, collections, error);
    }
}
