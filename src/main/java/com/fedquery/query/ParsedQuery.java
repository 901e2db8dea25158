package com.fedquery.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 联邦查询语法树
 * SELECT ... FROM ... [JOIN ... ON ...]* [WHERE ...] [ORDER BY ...] [LIMIT n]
 * 每次执行重新解析，不做持久化
 */
public class ParsedQuery {
    /**
     * 选择的字段，仅含一个通配符时表示全部字段
     */
    private final List<FieldRef> selectFields;

    /**
     * 主集合
     */
    private final String fromCollection;

    /**
     * 按声明顺序执行的 JOIN
     */
    private final List<JoinClause> joins;

    /**
     * AND 连接的条件
     */
    private final List<Condition> whereConditions;

    /**
     * 排序键
     */
    private final List<OrderBy> orderBy;

    /**
     * 返回行数上限，为 null 时不限制
     */
    private final Integer limit;

    public ParsedQuery(List<FieldRef> selectFields, String fromCollection, List<JoinClause> joins,
                       List<Condition> whereConditions, List<OrderBy> orderBy, Integer limit) {
        this.selectFields = Collections.unmodifiableList(new ArrayList<>(selectFields));
        this.fromCollection = Objects.requireNonNull(fromCollection, "fromCollection");
        this.joins = Collections.unmodifiableList(new ArrayList<>(joins));
        this.whereConditions = Collections.unmodifiableList(new ArrayList<>(whereConditions));
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(orderBy));
        this.limit = limit;
    }

    public List<FieldRef> getSelectFields() {
        return selectFields;
    }

    public boolean isSelectAll() {
        return selectFields.size() == 1 && selectFields.get(0).isWildcard();
    }

    public String getFromCollection() {
        return fromCollection;
    }

    public List<JoinClause> getJoins() {
        return joins;
    }

    public List<Condition> getWhereConditions() {
        return whereConditions;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    /**
     * 查询需要的所有集合：FROM 加上各 JOIN 集合
     */
    public Set<String> referencedCollections() {
        Set<String> names = new LinkedHashSet<>();
        names.add(fromCollection);
        for (JoinClause join : joins) {
            names.add(join.getCollection());
        }
        return names;
    }

    /**
     * WHERE 中引用的参数名，按出现顺序去重
     */
    public List<String> parameterNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Condition condition : whereConditions) {
            if (condition.getOperand().getKind() == Operand.Kind.PARAMETER) {
                names.add(condition.getOperand().getParameterName());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * 重新序列化为查询文本，再次解析得到等价的语法树
     */
    public String toQueryText() {
        StringBuilder sb = new StringBuilder("SELECT ");
        sb.append(selectFields.stream().map(FieldRef::toString).collect(Collectors.joining(", ")));
        sb.append(" FROM ").append(Identifiers.quoteIfNeeded(fromCollection));
        for (JoinClause join : joins) {
            sb.append(" JOIN ").append(Identifiers.quoteIfNeeded(join.getCollection()))
                .append(" ON ").append(join.getLeft()).append(" = ").append(join.getRight());
        }
        if (!whereConditions.isEmpty()) {
            sb.append(" WHERE ");
            sb.append(whereConditions.stream().map(Condition::toString).collect(Collectors.joining(" AND ")));
        }
        if (!orderBy.isEmpty()) {
            sb.append(" ORDER BY ");
            sb.append(orderBy.stream().map(OrderBy::toString).collect(Collectors.joining(", ")));
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedQuery)) {
            return false;
        }
        ParsedQuery that = (ParsedQuery) o;
        return selectFields.equals(that.selectFields)
            && fromCollection.equals(that.fromCollection)
            && joins.equals(that.joins)
            && whereConditions.equals(that.whereConditions)
            && orderBy.equals(that.orderBy)
            && Objects.equals(limit, that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selectFields, fromCollection, joins, whereConditions, orderBy, limit);
    }

    @Override
    public String toString() {
        return toQueryText();
    }

    /**
     * 字段引用：name 或 table.name，"*" 为通配符
     */
    public static class FieldRef {
        public static final FieldRef WILDCARD = new FieldRef(null, "*");

        private final String table;
        private final String name;

        public FieldRef(String table, String name) {
            this.table = table;
            this.name = Objects.requireNonNull(name, "name");
        }

        public static FieldRef of(String name) {
            return new FieldRef(null, name);
        }

        public static FieldRef of(String table, String name) {
            return new FieldRef(table, name);
        }

        public String getTable() {
            return table;
        }

        public String getName() {
            return name;
        }

        public boolean isQualified() {
            return table != null;
        }

        public boolean isWildcard() {
            return table == null && "*".equals(name);
        }

        /**
         * 行内的限定键，例如 orders.amount；未限定时即字段名
         */
        public String qualifiedName() {
            return table != null ? table + "." + name : name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FieldRef)) {
                return false;
            }
            FieldRef fieldRef = (FieldRef) o;
            return Objects.equals(table, fieldRef.table) && name.equals(fieldRef.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(table, name);
        }

        @Override
        public String toString() {
            if (isWildcard()) {
                return "*";
            }
            String quotedName = Identifiers.quoteIfNeeded(name);
            return table != null ? Identifiers.quoteIfNeeded(table) + "." + quotedName : quotedName;
        }
    }

    /**
     * JOIN 子句：collection ON left = right
     */
    public static class JoinClause {
        private final String collection;
        private final FieldRef left;
        private final FieldRef right;

        public JoinClause(String collection, FieldRef left, FieldRef right) {
            this.collection = Objects.requireNonNull(collection, "collection");
            this.left = Objects.requireNonNull(left, "left");
            this.right = Objects.requireNonNull(right, "right");
        }

        public String getCollection() {
            return collection;
        }

        public FieldRef getLeft() {
            return left;
        }

        public FieldRef getRight() {
            return right;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof JoinClause)) {
                return false;
            }
            JoinClause that = (JoinClause) o;
            return collection.equals(that.collection) && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(collection, left, right);
        }

        @Override
        public String toString() {
            return "JOIN " + collection + " ON " + left + " = " + right;
        }
    }

    public enum ComparisonOperator {
        EQ("="), NE("!="), GT(">"), GE(">="), LT("<"), LE("<=");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * 按比较结果判断是否满足，cmp 为 null 表示不可比较
         */
        public boolean accepts(Integer cmp) {
            if (cmp == null) {
                return false;
            }
            switch (this) {
                case EQ:
                    return cmp == 0;
                case NE:
                    return cmp != 0;
                case GT:
                    return cmp > 0;
                case GE:
                    return cmp >= 0;
                case LT:
                    return cmp < 0;
                default:
                    return cmp <= 0;
            }
        }

        public static ComparisonOperator fromSymbol(String symbol) {
            if ("<>".equals(symbol)) {
                return NE;
            }
            for (ComparisonOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
        }
    }

    /**
     * 条件右侧：字面量、:参数 或另一个字段
     */
    public static class Operand {
        public enum Kind {
            LITERAL, PARAMETER, FIELD
        }

        private final Kind kind;
        private final FieldValue literal;
        private final String parameterName;
        private final FieldRef field;

        private Operand(Kind kind, FieldValue literal, String parameterName, FieldRef field) {
            this.kind = kind;
            this.literal = literal;
            this.parameterName = parameterName;
            this.field = field;
        }

        public static Operand literal(FieldValue value) {
            return new Operand(Kind.LITERAL, Objects.requireNonNull(value, "value"), null, null);
        }

        public static Operand parameter(String name) {
            return new Operand(Kind.PARAMETER, null, Objects.requireNonNull(name, "name"), null);
        }

        public static Operand field(FieldRef field) {
            return new Operand(Kind.FIELD, null, null, Objects.requireNonNull(field, "field"));
        }

        public Kind getKind() {
            return kind;
        }

        public FieldValue getLiteral() {
            return literal;
        }

        public String getParameterName() {
            return parameterName;
        }

        public FieldRef getField() {
            return field;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Operand)) {
                return false;
            }
            Operand operand = (Operand) o;
            return kind == operand.kind
                && Objects.equals(literal, operand.literal)
                && Objects.equals(parameterName, operand.parameterName)
                && Objects.equals(field, operand.field);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, literal, parameterName, field);
        }

        @Override
        public String toString() {
            switch (kind) {
                case PARAMETER:
                    return ":" + parameterName;
                case FIELD:
                    return field.toString();
                default:
                    return literalText(literal);
            }
        }

        private static String literalText(FieldValue value) {
            switch (value.getKind()) {
                case NULL:
                    return "NULL";
                case BOOLEAN:
                    return value.asBoolean() ? "TRUE" : "FALSE";
                case NUMBER:
                    return value.asNumber().toString();
                default:
                    return "'" + value.displayString().replace("'", "''") + "'";
            }
        }
    }

    /**
     * WHERE 条件：field op operand
     */
    public static class Condition {
        private final FieldRef field;
        private final ComparisonOperator operator;
        private final Operand operand;

        public Condition(FieldRef field, ComparisonOperator operator, Operand operand) {
            this.field = Objects.requireNonNull(field, "field");
            this.operator = Objects.requireNonNull(operator, "operator");
            this.operand = Objects.requireNonNull(operand, "operand");
        }

        public FieldRef getField() {
            return field;
        }

        public ComparisonOperator getOperator() {
            return operator;
        }

        public Operand getOperand() {
            return operand;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Condition)) {
                return false;
            }
            Condition condition = (Condition) o;
            return field.equals(condition.field) && operator == condition.operator && operand.equals(condition.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(field, operator, operand);
        }

        @Override
        public String toString() {
            return field + " " + operator.getSymbol() + " " + operand;
        }
    }

    public enum Direction {
        ASC, DESC
    }

    /**
     * 排序键
     */
    public static class OrderBy {
        private final FieldRef field;
        private final Direction direction;

        public OrderBy(FieldRef field, Direction direction) {
            this.field = Objects.requireNonNull(field, "field");
            this.direction = direction != null ? direction : Direction.ASC;
        }

        public FieldRef getField() {
            return field;
        }

        public Direction getDirection() {
            return direction;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof OrderBy)) {
                return false;
            }
            OrderBy orderBy = (OrderBy) o;
            return field.equals(orderBy.field) && direction == orderBy.direction;
        }

        @Override
        public int hashCode() {
            return Objects.hash(field, direction);
        }

        @Override
        public String toString() {
            return field + " " + direction;
        }
    }
}
