package com.fedquery.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 文档字段值
 * 字符串 / 数值 / 布尔 / 日期 / 空值 / 嵌套结构 六种取值之一
 */
public final class FieldValue implements Comparable<FieldValue> {

    public enum Kind {
        NULL, BOOLEAN, NUMBER, STRING, DATE, NESTED
    }

    public static final FieldValue NULL = new FieldValue(Kind.NULL, null);
    public static final FieldValue TRUE = new FieldValue(Kind.BOOLEAN, Boolean.TRUE);
    public static final FieldValue FALSE = new FieldValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private FieldValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static FieldValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof FieldValue) {
            return (FieldValue) raw;
        }
        if (raw instanceof Boolean) {
            return ((Boolean) raw) ? TRUE : FALSE;
        }
        if (raw instanceof Number) {
            return new FieldValue(Kind.NUMBER, raw);
        }
        if (raw instanceof CharSequence || raw instanceof Character) {
            return new FieldValue(Kind.STRING, raw.toString());
        }
        Instant instant = toInstant(raw);
        if (instant != null) {
            return new FieldValue(Kind.DATE, instant);
        }
        if (raw instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), of(entry.getValue()).toJava());
            }
            return new FieldValue(Kind.NESTED, Collections.unmodifiableMap(copy));
        }
        if (raw instanceof Iterable) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Iterable<?>) raw) {
                copy.add(of(item).toJava());
            }
            return new FieldValue(Kind.NESTED, Collections.unmodifiableList(copy));
        }
        if (raw instanceof Object[]) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Object[]) raw) {
                copy.add(of(item).toJava());
            }
            return new FieldValue(Kind.NESTED, Collections.unmodifiableList(copy));
        }
        if (raw instanceof byte[]) {
            return new FieldValue(Kind.STRING, Base64.getEncoder().encodeToString((byte[]) raw));
        }
        return new FieldValue(Kind.STRING, raw.toString());
    }

    public static FieldValue ofString(String value) {
        return value == null ? NULL : new FieldValue(Kind.STRING, value);
    }

    public static FieldValue ofNumber(Number value) {
        return value == null ? NULL : new FieldValue(Kind.NUMBER, value);
    }

    public static FieldValue ofDate(Instant value) {
        return value == null ? NULL : new FieldValue(Kind.DATE, value);
    }

    private static Instant toInstant(Object raw) {
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (raw instanceof java.sql.Time) {
            return Instant.ofEpochMilli(((java.sql.Time) raw).getTime());
        }
        if (raw instanceof Date) {
            return ((Date) raw).toInstant();
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (raw instanceof LocalDateTime) {
            return ((LocalDateTime) raw).toInstant(ZoneOffset.UTC);
        }
        if (raw instanceof OffsetDateTime) {
            return ((OffsetDateTime) raw).toInstant();
        }
        if (raw instanceof ZonedDateTime) {
            return ((ZonedDateTime) raw).toInstant();
        }
        return null;
    }

    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').append(DateTimeFormatter.ISO_LOCAL_TIME).optionalEnd()
        .optionalStart().appendOffsetId().optionalEnd()
        .toFormatter();

    /**
     * 解析 ISO-8601 日期文本，支持带偏移 / 本地日期时间 / 纯日期，无法解析时返回 null
     */
    public static Instant parseDate(String text) {
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(text.trim(),
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public String asString() {
        return kind == Kind.STRING ? (String) value : null;
    }

    public Number asNumber() {
        return kind == Kind.NUMBER ? (Number) value : null;
    }

    public Boolean asBoolean() {
        return kind == Kind.BOOLEAN ? (Boolean) value : null;
    }

    public Instant asDate() {
        return kind == Kind.DATE ? (Instant) value : null;
    }

    /**
     * 转回普通 Java 对象，用于 JSON 输出
     */
    @JsonValue
    public Object toJava() {
        return value;
    }

    /**
     * 文档类型名：string / number / boolean / date / null / object / array
     */
    public String typeName() {
        switch (kind) {
            case NULL:
                return "null";
            case BOOLEAN:
                return "boolean";
            case NUMBER:
                return "number";
            case STRING:
                return "string";
            case DATE:
                return "date";
            default:
                return value instanceof List ? "array" : "object";
        }
    }

    /**
     * 文本形式，供 toString 类转换与日志使用
     */
    public String displayString() {
        if (kind == Kind.NULL) {
            return null;
        }
        if (kind == Kind.NUMBER) {
            return formatNumber((Number) value);
        }
        return value.toString();
    }

    private static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).stripTrailingZeros().toPlainString();
        }
        return number.toString();
    }

    /**
     * WHERE 条件比较：类型不可比较（或任一侧为空值）时返回 null
     * 日期与可解析为日期的字符串按日期比较
     */
    public Integer compareForFilter(FieldValue other) {
        if (kind == Kind.NULL || other.kind == Kind.NULL) {
            return null;
        }
        if (kind == other.kind) {
            return compareSameKind(other);
        }
        if (kind == Kind.DATE && other.kind == Kind.STRING) {
            Instant parsed = parseDate((String) other.value);
            return parsed == null ? null : ((Instant) value).compareTo(parsed);
        }
        if (kind == Kind.STRING && other.kind == Kind.DATE) {
            Instant parsed = parseDate((String) value);
            return parsed == null ? null : parsed.compareTo((Instant) other.value);
        }
        return null;
    }

    /**
     * 等值判断：数值按数值相等，日期可与日期文本相等，空值仅等于空值
     */
    public boolean sameAs(FieldValue other) {
        if (kind == Kind.NULL || other.kind == Kind.NULL) {
            return kind == other.kind;
        }
        Integer cmp = compareForFilter(other);
        if (cmp != null) {
            return cmp == 0;
        }
        return kind == other.kind && value.equals(other.value);
    }

    /**
     * 排序用全序：空值最小，不同类型按类型序
     */
    @Override
    public int compareTo(FieldValue other) {
        if (kind != other.kind) {
            return Integer.compare(kind.ordinal(), other.kind.ordinal());
        }
        if (kind == Kind.NULL) {
            return 0;
        }
        return compareSameKind(other);
    }

    private int compareSameKind(FieldValue other) {
        switch (kind) {
            case BOOLEAN:
                return ((Boolean) value).compareTo((Boolean) other.value);
            case NUMBER:
                return compareNumbers((Number) value, (Number) other.value);
            case STRING:
                return ((String) value).compareTo((String) other.value);
            case DATE:
                return ((Instant) value).compareTo((Instant) other.value);
            case NESTED:
                return value.toString().compareTo(other.value.toString());
            default:
                return 0;
        }
    }

    private static int compareNumbers(Number left, Number right) {
        if (!isFinite(left) || !isFinite(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return new BigDecimal(number.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue)) {
            return false;
        }
        FieldValue that = (FieldValue) o;
        if (kind != that.kind) {
            return false;
        }
        if (kind == Kind.NUMBER) {
            return compareNumbers((Number) value, (Number) that.value) == 0;
        }
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.NUMBER) {
            Number number = (Number) value;
            if (!isFinite(number)) {
                return Double.hashCode(number.doubleValue());
            }
            return toBigDecimal(number).stripTrailingZeros().hashCode();
        }
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        if (kind == Kind.STRING) {
            return "'" + value + "'";
        }
        return String.valueOf(displayString());
    }
}
