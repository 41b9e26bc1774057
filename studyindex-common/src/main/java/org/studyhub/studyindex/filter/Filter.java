package org.studyhub.studyindex.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata predicate used to scope searches, fetches and deletes.
 *
 * <p>Filters are built from four variants and compiled to the backend's native
 * {@code where} document by {@link #toWhere()}:</p>
 * <ul>
 *   <li>{@link Equals}: {@code {"field": {"$eq": value}}}</li>
 *   <li>{@link In}: {@code {"field": {"$in": [..]}}}</li>
 *   <li>{@link And}: {@code {"$and": [..]}}</li>
 *   <li>{@link Or}: {@code {"$or": [..]}}</li>
 * </ul>
 *
 * <p>A logical operator with a single operand compiles to that operand, because the
 * backend rejects one-element {@code $and}/{@code $or} lists.</p>
 */
public interface Filter {

    /**
     * Compiles this filter into the backend {@code where} shape.
     */
    Map<String, Object> toWhere();

    static Filter eq(String field, String value) {
        return new Equals(field, value);
    }

    static Filter in(String field, Collection<String> values) {
        return new In(field, List.copyOf(values));
    }

    static Filter and(Filter... filters) {
        return new And(List.of(filters));
    }

    static Filter or(Filter... filters) {
        return new Or(List.of(filters));
    }

    /**
     * OR over equality on one field, e.g. "assignment_id is any of these ids".
     * Null and blank values are skipped.
     *
     * @throws IllegalArgumentException when no usable value remains
     */
    static Filter anyOf(String field, Collection<String> values) {
        List<Filter> equals = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    equals.add(new Equals(field, value));
                }
            }
        }
        if (equals.isEmpty()) {
            throw new IllegalArgumentException("'" + field + "' scope needs at least one non-blank value");
        }
        return new Or(equals);
    }

    /**
     * Combines two optional filters with AND; either side may be {@code null}.
     */
    static Filter both(Filter left, Filter right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return new And(List.of(left, right));
    }

    record Equals(String field, String value) implements Filter {

        public Equals {
            requireField(field);
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Map<String, Object> toWhere() {
            return Map.of(field, Map.of("$eq", value));
        }
    }

    record In(String field, List<String> values) implements Filter {

        public In {
            requireField(field);
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("$in filter on '" + field + "' needs at least one value");
            }
            values = List.copyOf(values);
        }

        @Override
        public Map<String, Object> toWhere() {
            return Map.of(field, Map.of("$in", values));
        }
    }

    record And(List<Filter> filters) implements Filter {

        public And {
            filters = requireOperands("$and", filters);
        }

        @Override
        public Map<String, Object> toWhere() {
            return compileLogical("$and", filters);
        }
    }

    record Or(List<Filter> filters) implements Filter {

        public Or {
            filters = requireOperands("$or", filters);
        }

        @Override
        public Map<String, Object> toWhere() {
            return compileLogical("$or", filters);
        }
    }

    private static void requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("filter field must not be blank");
        }
    }

    private static List<Filter> requireOperands(String operator, List<Filter> filters) {
        if (filters == null || filters.isEmpty()) {
            throw new IllegalArgumentException(operator + " filter needs at least one operand");
        }
        for (Filter f : filters) {
            Objects.requireNonNull(f, operator + " operand");
        }
        return List.copyOf(filters);
    }

    private static Map<String, Object> compileLogical(String operator, List<Filter> filters) {
        if (filters.size() == 1) {
            return filters.get(0).toWhere();
        }
        List<Map<String, Object>> compiled = new ArrayList<>(filters.size());
        for (Filter f : filters) {
            compiled.add(f.toWhere());
        }
        Map<String, Object> where = new LinkedHashMap<>();
        where.put(operator, compiled);
        return where;
    }
}
