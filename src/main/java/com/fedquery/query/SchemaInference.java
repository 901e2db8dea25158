package com.fedquery.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从文档推断集合结构
 * 字段按首次出现顺序排列，类型取第一个非空值的类型
 */
public final class SchemaInference {

    private SchemaInference() {
    }

    public static List<Field> infer(List<Row> rows) {
        Map<String, String> types = new LinkedHashMap<>();
        for (Row row : rows) {
            for (Map.Entry<String, FieldValue> entry : row.asMap().entrySet()) {
                String current = types.get(entry.getKey());
                if (current == null || "null".equals(current)) {
                    types.put(entry.getKey(), entry.getValue().typeName());
                }
            }
        }
        List<Field> fields = new ArrayList<>(types.size());
        for (Map.Entry<String, String> entry : types.entrySet()) {
            fields.add(new Field(entry.getKey(), entry.getValue()));
        }
        return fields;
    }
}
