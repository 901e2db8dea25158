package com.fedquery.adapter;

import com.fedquery.query.FieldValue;
import com.fedquery.query.ParsedQuery.ComparisonOperator;
import com.fedquery.query.ParsedQuery.Direction;
import com.fedquery.query.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 下推给适配器的过滤、排序与截断条件，不可变
 * 引擎构建快照时使用 {@link #all()} 拉取整个集合
 */
public final class FilterSpec {
    private static final FilterSpec ALL = new FilterSpec(List.of(), List.of(), null);

    private final List<Filter> filters;
    private final List<Sort> orderBy;
    private final Integer limit;

    private FilterSpec(List<Filter> filters, List<Sort> orderBy, Integer limit) {
        this.filters = filters;
        this.orderBy = orderBy;
        this.limit = limit;
    }

    public static FilterSpec all() {
        return ALL;
    }

    public FilterSpec where(String field, ComparisonOperator operator, FieldValue value) {
        List<Filter> next = new ArrayList<>(filters);
        next.add(new Filter(field, operator, value));
        return new FilterSpec(Collections.unmodifiableList(next), orderBy, limit);
    }

    public FilterSpec orderBy(String field, Direction direction) {
        List<Sort> next = new ArrayList<>(orderBy);
        next.add(new Sort(field, direction));
        return new FilterSpec(filters, Collections.unmodifiableList(next), limit);
    }

    public FilterSpec limit(Integer limit) {
        return new FilterSpec(filters, orderBy, limit);
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public List<Sort> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    public boolean isUnrestricted() {
        return filters.isEmpty() && orderBy.isEmpty() && limit == null;
    }

    /**
     * 在内存中执行，供不支持下推的适配器使用
     */
    public List<Row> apply(List<Row> rows) {
        if (isUnrestricted()) {
            return new ArrayList<>(rows);
        }
        List<Row> result = new ArrayList<>();
        for (Row row : rows) {
            if (matches(row)) {
                result.add(row);
            }
        }
        if (!orderBy.isEmpty()) {
            Comparator<Row> comparator = null;
            for (Sort sort : orderBy) {
                Comparator<Row> next = Comparator.comparing((Row row) -> row.get(sort.getField()));
                if (sort.getDirection() == Direction.DESC) {
                    next = next.reversed();
                }
                comparator = comparator == null ? next : comparator.thenComparing(next);
            }
            result.sort(comparator);
        }
        if (limit != null && result.size() > limit) {
            return new ArrayList<>(result.subList(0, limit));
        }
        return result;
    }

    public boolean matches(Row row) {
        for (Filter filter : filters) {
            FieldValue left = row.get(filter.getField());
            boolean ok;
            switch (filter.getOperator()) {
                case EQ:
                    ok = left.sameAs(filter.getValue());
                    break;
                case NE:
                    ok = !left.sameAs(filter.getValue());
                    break;
                default:
                    ok = filter.getOperator().accepts(left.compareForFilter(filter.getValue()));
            }
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "FilterSpec{filters=" + filters + ", orderBy=" + orderBy + ", limit=" + limit + "}";
    }

    public static final class Filter {
        private final String field;
        private final ComparisonOperator operator;
        private final FieldValue value;

        Filter(String field, ComparisonOperator operator, FieldValue value) {
            this.field = field;
            this.operator = operator;
            this.value = value != null ? value : FieldValue.NULL;
        }

        public String getField() {
            return field;
        }

        public ComparisonOperator getOperator() {
            return operator;
        }

        public FieldValue getValue() {
            return value;
        }

        @Override
        public String toString() {
            return field + " " + operator.getSymbol() + " " + value;
        }
    }

    public static final class Sort {
        private final String field;
        private final Direction direction;

        Sort(String field, Direction direction) {
            this.field = field;
            this.direction = direction != null ? direction : Direction.ASC;
        }

        public String getField() {
            return field;
        }

        public Direction getDirection() {
            return direction;
        }

        @Override
        public String toString() {
            return field + " " + direction;
        }
    }
}
