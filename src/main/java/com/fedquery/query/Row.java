package com.fedquery.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一行文档数据：字段名到 {@link FieldValue} 的有序映射，不可变
 */
public final class Row {
    private static final Row EMPTY = new Row(new LinkedHashMap<>());

    private final Map<String, FieldValue> fields;

    private Row(LinkedHashMap<String, FieldValue> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Row of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, FieldValue> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            copy.put(entry.getKey(), FieldValue.of(entry.getValue()));
        }
        return new Row(copy);
    }

    public static Row empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * 字段不存在时返回 {@link FieldValue#NULL}，需要区分缺失与空值时先调用 {@link #has(String)}
     */
    public FieldValue get(String field) {
        FieldValue value = fields.get(field);
        return value != null ? value : FieldValue.NULL;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, FieldValue> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValue> entry : fields.entrySet()) {
            result.put(entry.getKey(), entry.getValue().toJava());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        return fields.equals(((Row) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static class Builder {
        private final LinkedHashMap<String, FieldValue> fields = new LinkedHashMap<>();

        public Builder put(String field, FieldValue value) {
            fields.put(field, value != null ? value : FieldValue.NULL);
            return this;
        }

        public Builder put(String field, Object value) {
            return put(field, FieldValue.of(value));
        }

        public Builder putAll(Row row) {
            fields.putAll(row.fields);
            return this;
        }

        public Row build() {
            return fields.isEmpty() ? EMPTY : new Row(new LinkedHashMap<>(fields));
        }
    }
}
