package com.fedquery.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 集合间的模式映射
 * 当目标集合在数据源上不存在时，由源集合的文档按规则合成
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaMapping {
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_INACTIVE = "inactive";

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    /**
     * 源集合所在的数据源 ID
     */
    @JsonProperty("source_id")
    private String sourceId;

    @JsonProperty("source_collection")
    private String sourceCollection;

    /**
     * 目标集合所属的数据源 ID（逻辑归属，可为空）
     */
    @JsonProperty("target_id")
    private String targetId;

    @JsonProperty("target_collection")
    private String targetCollection;

    @JsonProperty("mapping_rules")
    private List<MappingRule> mappingRules;

    @JsonProperty("status")
    private String status;

    public SchemaMapping() {
    }

    /**
     * 复制构造，规则列表浅拷贝
     */
    public SchemaMapping(SchemaMapping other) {
        this.id = other.id;
        this.name = other.name;
        this.sourceId = other.sourceId;
        this.sourceCollection = other.sourceCollection;
        this.targetId = other.targetId;
        this.targetCollection = other.targetCollection;
        this.mappingRules = other.mappingRules != null ? new ArrayList<>(other.mappingRules) : null;
        this.status = other.status;
    }

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
    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    @JsonIgnore
    public String getSourceCollection() {
        return sourceCollection;
    }

    public void setSourceCollection(String sourceCollection) {
        this.sourceCollection = sourceCollection;
    }

    @JsonIgnore
    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    @JsonIgnore
    public String getTargetCollection() {
        return targetCollection;
    }

    public void setTargetCollection(String targetCollection) {
        this.targetCollection = targetCollection;
    }

    @JsonIgnore
    public List<MappingRule> getMappingRules() {
        return mappingRules != null ? mappingRules : List.of();
    }

    public void setMappingRules(List<MappingRule> mappingRules) {
        this.mappingRules = mappingRules;
    }

    @JsonIgnore
    public String getStatus() {
        return status != null ? status : STATUS_ACTIVE;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @JsonIgnore
    public boolean isActive() {
        return STATUS_ACTIVE.equalsIgnoreCase(getStatus());
    }
}
