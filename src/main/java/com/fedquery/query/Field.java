package com.fedquery.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 集合字段定义
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Field {
    private final String name;
    private final String type;
    private final String nativeType;

    public Field(String name, String type) {
        this(name, type, null);
    }

    @JsonCreator
    public Field(@JsonProperty("name") String name,
                 @JsonProperty("type") String type,
                 @JsonProperty("native_type") String nativeType) {
        this.name = name;
        this.type = type;
        this.nativeType = nativeType;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    /**
     * 数据源原生类型，例如 JDBC 列的 VARCHAR，文档型数据源为空
     */
    @JsonProperty("native_type")
    public String getNativeType() {
        return nativeType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Field)) {
            return false;
        }
        Field field = (Field) o;
        return Objects.equals(name, field.name)
            && Objects.equals(type, field.type)
            && Objects.equals(nativeType, field.nativeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nativeType);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
