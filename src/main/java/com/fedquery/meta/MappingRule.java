package com.fedquery.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 字段级映射规则
 * type 取值：direct（原样复制）、transform（内置转换函数）、custom（注册的自定义转换）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MappingRule {
    public static final String TYPE_DIRECT = "direct";
    public static final String TYPE_TRANSFORM = "transform";
    public static final String TYPE_CUSTOM = "custom";

    @JsonProperty("source_field")
    private String sourceField;

    @JsonProperty("target_field")
    private String targetField;

    @JsonProperty("type")
    private String type;

    /**
     * 转换名称，例如 toUpperCase / to-number；custom 规则为注册的自定义转换名
     */
    @JsonProperty("transform")
    private String transform;

    public MappingRule() {
    }

    public MappingRule(String sourceField, String targetField, String type, String transform) {
        this.sourceField = sourceField;
        this.targetField = targetField;
        this.type = type;
        this.transform = transform;
    }

    public static MappingRule direct(String sourceField, String targetField) {
        return new MappingRule(sourceField, targetField, TYPE_DIRECT, null);
    }

    public static MappingRule transform(String sourceField, String targetField, String transform) {
        return new MappingRule(sourceField, targetField, TYPE_TRANSFORM, transform);
    }

    public static MappingRule custom(String sourceField, String targetField, String transform) {
        return new MappingRule(sourceField, targetField, TYPE_CUSTOM, transform);
    }

    @JsonIgnore
    public String getSourceField() {
        return sourceField;
    }

    public void setSourceField(String sourceField) {
        this.sourceField = sourceField;
    }

    @JsonIgnore
    public String getTargetField() {
        return targetField;
    }

    public void setTargetField(String targetField) {
        this.targetField = targetField;
    }

    /**
     * 未声明类型时按 direct 处理
     */
    @JsonIgnore
    public String getType() {
        return type != null && !type.isEmpty() ? type : TYPE_DIRECT;
    }

    public void setType(String type) {
        this.type = type;
    }

    @JsonIgnore
    public String getTransform() {
        return transform;
    }

    public void setTransform(String transform) {
        this.transform = transform;
    }

    @Override
    public String toString() {
        return sourceField + " -> " + targetField + " (" + getType() + (transform != null ? ":" + transform : "") + ")";
    }
}
