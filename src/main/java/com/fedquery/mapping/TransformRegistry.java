package com.fedquery.mapping;

import com.fedquery.exception.MappingSynthesisException;
import com.fedquery.query.FieldValue;
import com.fedquery.query.Row;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 映射转换函数注册表
 * 内置转换名不区分大小写，且忽略 '-' 与 '_'，因此 toUpperCase / uppercase / to-upper-case 等写法等价；
 * custom 规则使用通过 {@link #registerCustom} 注册的函数
 */
public class TransformRegistry {

    /**
     * 内置转换：纯函数，无法转换时抛出 {@link MappingSynthesisException}
     */
    @FunctionalInterface
    public interface FieldTransform {
        FieldValue apply(FieldValue value) throws MappingSynthesisException;
    }

    /**
     * 调用方提供的自定义转换，可读取整行源文档
     */
    @FunctionalInterface
    public interface CustomTransform {
        FieldValue apply(FieldValue value, Row sourceRow) throws MappingSynthesisException;
    }

    private static final BigDecimal MAX_LONG = BigDecimal.valueOf(Long.MAX_VALUE);
    private static final Map<String, FieldTransform> BUILTINS = new HashMap<>();

    static {
        FieldTransform upper = value -> value.getKind() == FieldValue.Kind.STRING
            ? FieldValue.ofString(value.asString().toUpperCase(Locale.ROOT)) : value;
        FieldTransform lower = value -> value.getKind() == FieldValue.Kind.STRING
            ? FieldValue.ofString(value.asString().toLowerCase(Locale.ROOT)) : value;
        BUILTINS.put("touppercase", upper);
        BUILTINS.put("uppercase", upper);
        BUILTINS.put("tolowercase", lower);
        BUILTINS.put("lowercase", lower);
        BUILTINS.put("trim", value -> value.getKind() == FieldValue.Kind.STRING
            ? FieldValue.ofString(value.asString().trim()) : value);
        BUILTINS.put("tonumber", TransformRegistry::toNumber);
        BUILTINS.put("tostring", value -> value.isNull() ? value : FieldValue.ofString(value.displayString()));
        BUILTINS.put("todate", TransformRegistry::toDate);
    }

    private final Map<String, CustomTransform> customTransforms = new ConcurrentHashMap<>();

    static String normalize(String name) {
        return name.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    public boolean isBuiltin(String name) {
        return name != null && BUILTINS.containsKey(normalize(name));
    }

    /**
     * 执行内置转换；未知转换名抛出 {@link MappingSynthesisException}
     */
    public FieldValue applyBuiltin(String name, FieldValue value) throws MappingSynthesisException {
        FieldTransform transform = name != null ? BUILTINS.get(normalize(name)) : null;
        if (transform == null) {
            throw new MappingSynthesisException("Unknown transform '" + name + "'");
        }
        return transform.apply(value);
    }

    public void registerCustom(String name, CustomTransform transform) {
        customTransforms.put(name, transform);
    }

    public void unregisterCustom(String name) {
        customTransforms.remove(name);
    }

    /**
     * 未注册时返回 null
     */
    public CustomTransform getCustom(String name) {
        return name != null ? customTransforms.get(name) : null;
    }

    private static FieldValue toNumber(FieldValue value) throws MappingSynthesisException {
        if (value.getKind() != FieldValue.Kind.STRING) {
            return value;
        }
        String text = value.asString().trim();
        try {
            BigDecimal number = new BigDecimal(text);
            if (number.stripTrailingZeros().scale() <= 0 && number.abs().compareTo(MAX_LONG) <= 0) {
                return FieldValue.ofNumber(number.longValue());
            }
            return FieldValue.ofNumber(number.doubleValue());
        } catch (NumberFormatException e) {
            throw new MappingSynthesisException("Cannot convert '" + text + "' to a number", e);
        }
    }

    private static FieldValue toDate(FieldValue value) throws MappingSynthesisException {
        switch (value.getKind()) {
            case STRING:
                Instant parsed = FieldValue.parseDate(value.asString());
                if (parsed == null) {
                    throw new MappingSynthesisException("Cannot convert '" + value.asString() + "' to a date");
                }
                return FieldValue.ofDate(parsed);
            case NUMBER:
                // 数值按毫秒时间戳处理
                return FieldValue.ofDate(Instant.ofEpochMilli(value.asNumber().longValue()));
            default:
                return value;
        }
    }
}
