package com.fusestorage.query;

import com.fusestorage.value.StorageValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * One predicate term. Terms of a query are joined with {@code AND}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueryFilter {
    static final String ALWAYS_FALSE = "1=0";

    private final String field;
    private final QueryOperator operator;
    private final List<StorageValue> values;

    private QueryFilter(String field, QueryOperator operator, List<StorageValue> values) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Filter field is required");
        }
        this.field = field;
        this.operator = operator;
        this.values = Collections.unmodifiableList(values);
    }

    public static QueryFilter equalTo(String field, Object value) {
        return single(field, QueryOperator.EQUALS, value);
    }

    public static QueryFilter notEqualTo(String field, Object value) {
        return single(field, QueryOperator.NOT_EQUALS, value);
    }

    /**
     * {@code LIKE} match; the pattern carries its own wildcards.
     *
     * @param field column name
     * @param pattern pattern such as {@code "%milk%"}
     * @return filter
     */
    public static QueryFilter like(String field, String pattern) {
        return single(field, QueryOperator.LIKE, pattern);
    }

    public static QueryFilter greaterThan(String field, Object value) {
        return single(field, QueryOperator.GREATER_THAN, value);
    }

    public static QueryFilter lessThan(String field, Object value) {
        return single(field, QueryOperator.LESS_THAN, value);
    }

    /**
     * Membership test. An empty collection matches no rows.
     *
     * @param field column name
     * @param values candidate values, in placeholder order
     * @return filter
     */
    public static QueryFilter inSet(String field, Collection<?> values) {
        List<StorageValue> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(StorageValue.of(value));
        }
        return new QueryFilter(field, QueryOperator.IN_SET, converted);
    }

    private static QueryFilter single(String field, QueryOperator operator, Object value) {
        List<StorageValue> converted = new ArrayList<>(1);
        converted.add(StorageValue.of(value));
        return new QueryFilter(field, operator, converted);
    }

    /**
     * Predicate text and its arguments.
     *
     * @param arguments receives this term's arguments in placeholder order
     * @return predicate text
     */
    String compile(List<StorageValue> arguments) {
        if (operator != QueryOperator.IN_SET) {
            arguments.add(values.get(0));
            return field + " " + operator.symbol() + " ?";
        }
        if (values.isEmpty()) {
            return ALWAYS_FALSE;
        }
        arguments.addAll(values);
        return field + " IN (" + Sql.placeholders(values.size()) + ")";
    }
}
