package com.fedquery.query;

import com.fedquery.exception.JoinConditionException;
import com.fedquery.exception.UnknownParameterException;
import com.fedquery.query.ParsedQuery.Condition;
import com.fedquery.query.ParsedQuery.Direction;
import com.fedquery.query.ParsedQuery.FieldRef;
import com.fedquery.query.ParsedQuery.JoinClause;
import com.fedquery.query.ParsedQuery.OrderBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 联邦查询执行器
 * 在已拉取的集合快照上按固定顺序执行：取主集合 → 过滤 → JOIN → 投影 → 排序 → 截断
 * 对输入无副作用，可并发调用
 */
public class FederationExecutor {
    private static final Logger logger = LoggerFactory.getLogger(FederationExecutor.class);

    public List<Row> execute(ParsedQuery query, Map<String, List<Row>> collections, Map<String, ?> params)
            throws UnknownParameterException {
        Map<String, FieldValue> bindings = bindParameters(query, params);

        // 1. 主集合，不存在时视为空集合
        List<Row> rows = collections.get(query.getFromCollection());
        if (rows == null) {
            logger.debug("Collection '{}' not available, base rows are empty", query.getFromCollection());
            rows = Collections.emptyList();
        }

        // 2. 过滤
        rows = filter(rows, query.getWhereConditions(), bindings);

        // 3. JOIN（左外连接）
        for (JoinClause join : query.getJoins()) {
            List<Row> joinRows = collections.getOrDefault(join.getCollection(), Collections.emptyList());
            try {
                JoinKeys keys = resolveJoinKeys(join);
                rows = leftOuterJoin(rows, joinRows, join.getCollection(), keys);
            } catch (JoinConditionException e) {
                logger.warn("Skipping join: {}", e.getMessage());
            }
        }

        // 4. 投影
        rows = project(rows, query);

        // 5. 排序
        rows = order(rows, query.getOrderBy());

        // 6. 截断
        if (query.getLimit() != null && rows.size() > query.getLimit()) {
            rows = new ArrayList<>(rows.subList(0, query.getLimit()));
        }
        return rows;
    }

    /**
     * 绑定 :name 参数，缺少任一绑定时整体失败
     */
    public Map<String, FieldValue> bindParameters(ParsedQuery query, Map<String, ?> params) throws UnknownParameterException {
        Map<String, FieldValue> bindings = new HashMap<>();
        List<String> missing = new ArrayList<>();
        for (String name : query.parameterNames()) {
            if (params == null || !params.containsKey(name)) {
                missing.add(name);
            } else {
                bindings.put(name, FieldValue.of(params.get(name)));
            }
        }
        if (!missing.isEmpty()) {
            throw new UnknownParameterException(missing);
        }
        return bindings;
    }

    List<Row> filter(List<Row> rows, List<Condition> conditions, Map<String, FieldValue> bindings) {
        if (conditions.isEmpty()) {
            return rows;
        }
        List<Row> result = new ArrayList<>();
        for (Row row : rows) {
            if (matchesAll(row, conditions, bindings)) {
                result.add(row);
            }
        }
        return result;
    }

    private boolean matchesAll(Row row, List<Condition> conditions, Map<String, FieldValue> bindings) {
        for (Condition condition : conditions) {
            FieldValue left = lookup(row, condition.getField());
            FieldValue right = operandValue(row, condition, bindings);
            if (!matches(left, condition.getOperator(), right)) {
                return false;
            }
        }
        return true;
    }

    private FieldValue operandValue(Row row, Condition condition, Map<String, FieldValue> bindings) {
        ParsedQuery.Operand operand = condition.getOperand();
        switch (operand.getKind()) {
            case PARAMETER:
                return bindings.get(operand.getParameterName());
            case FIELD:
                return lookup(row, operand.getField());
            default:
                return operand.getLiteral();
        }
    }

    private boolean matches(FieldValue left, ParsedQuery.ComparisonOperator operator, FieldValue right) {
        switch (operator) {
            case EQ:
                return left.sameAs(right);
            case NE:
                return !left.sameAs(right);
            default:
                return operator.accepts(left.compareForFilter(right));
        }
    }

    /**
     * 确定 ON 条件中哪一侧属于被连接集合
     */
    JoinKeys resolveJoinKeys(JoinClause join) throws JoinConditionException {
        FieldRef left = join.getLeft();
        FieldRef right = join.getRight();
        if (join.getCollection().equals(right.getTable())) {
            return new JoinKeys(left, right.getName());
        }
        if (join.getCollection().equals(left.getTable())) {
            return new JoinKeys(right, left.getName());
        }
        throw new JoinConditionException("ON clause of JOIN " + join.getCollection() + " (" + left + " = " + right
            + ") does not reference the joined collection");
    }

    /**
     * 嵌套循环左外连接：每个匹配生成一行，连接表字段以 table.field 作为键；无匹配时保留原行
     */
    List<Row> leftOuterJoin(List<Row> baseRows, List<Row> joinRows, String joinTable, JoinKeys keys) {
        List<Row> result = new ArrayList<>(baseRows.size());
        for (Row base : baseRows) {
            FieldValue mainValue = lookup(base, keys.mainField);
            boolean matched = false;
            if (!mainValue.isNull()) {
                for (Row candidate : joinRows) {
                    FieldValue joinValue = candidate.get(keys.joinField);
                    if (!joinValue.isNull() && mainValue.sameAs(joinValue)) {
                        result.add(combine(base, candidate, joinTable));
                        matched = true;
                    }
                }
            }
            if (!matched) {
                result.add(base);
            }
        }
        return result;
    }

    private Row combine(Row base, Row joined, String joinTable) {
        Row.Builder builder = Row.builder().putAll(base);
        for (Map.Entry<String, FieldValue> entry : joined.asMap().entrySet()) {
            builder.put(joinTable + "." + entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    List<Row> project(List<Row> rows, ParsedQuery query) {
        if (query.isSelectAll()) {
            return rows;
        }
        List<FieldRef> fields = query.getSelectFields();
        List<String> outputKeys = outputKeys(fields);
        List<Row> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Row.Builder builder = Row.builder();
            for (int i = 0; i < fields.size(); i++) {
                String key = resolveKey(row, fields.get(i));
                if (key != null) {
                    builder.put(outputKeys.get(i), row.get(key));
                }
            }
            result.add(builder.build());
        }
        return result;
    }

    /**
     * 输出键为字段名；多个选择字段同名时，带限定的字段改用 table.field
     */
    static List<String> outputKeys(List<FieldRef> fields) {
        Map<String, Integer> counts = new HashMap<>();
        for (FieldRef field : fields) {
            counts.merge(field.getName(), 1, Integer::sum);
        }
        List<String> keys = new ArrayList<>(fields.size());
        for (FieldRef field : fields) {
            boolean shared = counts.get(field.getName()) > 1;
            keys.add(shared && field.isQualified() ? field.qualifiedName() : field.getName());
        }
        return keys;
    }

    List<Row> order(List<Row> rows, List<OrderBy> orderBy) {
        if (orderBy.isEmpty() || rows.size() < 2) {
            return rows;
        }
        Comparator<Row> comparator = null;
        for (OrderBy key : orderBy) {
            Comparator<Row> next = Comparator.comparing((Row row) -> lookup(row, key.getField()));
            if (key.getDirection() == Direction.DESC) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        List<Row> sorted = new ArrayList<>(rows);
        // List.sort 为稳定排序
        sorted.sort(comparator);
        return sorted;
    }

    /**
     * 先按限定键 table.field 查找，不存在时退回字段名
     */
    static FieldValue lookup(Row row, FieldRef field) {
        String key = resolveKey(row, field);
        return key != null ? row.get(key) : FieldValue.NULL;
    }

    private static String resolveKey(Row row, FieldRef field) {
        if (field.isQualified() && row.has(field.qualifiedName())) {
            return field.qualifiedName();
        }
        if (row.has(field.getName())) {
            return field.getName();
        }
        return null;
    }

    /**
     * JOIN 两侧的键：主表字段引用与被连接集合内的字段名
     */
    static final class JoinKeys {
        final FieldRef mainField;
        final String joinField;

        JoinKeys(FieldRef mainField, String joinField) {
            this.mainField = mainField;
            this.joinField = joinField;
        }
    }
}
