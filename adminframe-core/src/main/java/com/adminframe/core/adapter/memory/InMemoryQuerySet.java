package com.adminframe.core.adapter.memory;

import com.adminframe.api.model.FilterSpec;
import com.adminframe.api.model.ModelAdapter;
import com.adminframe.api.model.QuerySet;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 内存查询集，不可变；每次转换都会记录到 {@link #operations()}，便于观察流水线的实际顺序
 */
public class InMemoryQuerySet implements QuerySet<Map<String, Object>> {

    private final InMemoryModelAdapter adapter;
    private final List<Predicate<Map<String, Object>>> predicates;
    private final List<String> ordering;
    private final List<String> projection;
    private final int offset;
    private final int limit;
    private final List<String> operations;

    InMemoryQuerySet(InMemoryModelAdapter adapter) {
        this(adapter, List.of(), List.of(), List.of(), 0, -1, List.of());
    }

    private InMemoryQuerySet(InMemoryModelAdapter adapter, List<Predicate<Map<String, Object>>> predicates,
                             List<String> ordering, List<String> projection, int offset, int limit,
                             List<String> operations) {
        this.adapter = adapter;
        this.predicates = predicates;
        this.ordering = ordering;
        this.projection = projection;
        this.offset = offset;
        this.limit = limit;
        this.operations = operations;
    }

    @Override
    public ModelAdapter<Map<String, Object>> adapter() {
        return adapter;
    }

    @Override
    public QuerySet<Map<String, Object>> filter(FilterSpec spec) {
        return withPredicate(row -> matches(row.get(spec.field()), spec),
                "filter:" + spec.field() + ":" + spec.op().code());
    }

    @Override
    public QuerySet<Map<String, Object>> search(List<String> fields, String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        return withPredicate(row -> fields.stream().anyMatch(f -> contains(row.get(f), needle)),
                "search:" + String.join(",", fields));
    }

    @Override
    public QuerySet<Map<String, Object>> orderBy(List<String> ordering) {
        return new InMemoryQuerySet(adapter, predicates, List.copyOf(ordering), projection, offset, limit,
                append("orderBy:" + String.join(",", ordering)));
    }

    @Override
    public QuerySet<Map<String, Object>> selectRelated(List<String> relations) {
        return new InMemoryQuerySet(adapter, predicates, ordering, projection, offset, limit,
                append("selectRelated:" + String.join(",", relations)));
    }

    @Override
    public QuerySet<Map<String, Object>> only(List<String> fields) {
        return new InMemoryQuerySet(adapter, predicates, ordering, List.copyOf(fields), offset, limit,
                append("only:" + String.join(",", fields)));
    }

    @Override
    public QuerySet<Map<String, Object>> slice(int offset, int limit) {
        int newOffset = this.offset + Math.max(0, offset);
        int newLimit = this.limit < 0 ? limit : Math.max(0, Math.min(limit, this.limit - Math.max(0, offset)));
        return new InMemoryQuerySet(adapter, predicates, ordering, projection, newOffset, newLimit,
                append("slice:" + offset + "," + limit));
    }

    @Override
    public long count() {
        if (offset == 0 && limit < 0) {
            return adapter.snapshot().stream().filter(this::accepted).count();
        }
        return fetch().size();
    }

    @Override
    public List<Map<String, Object>> fetch() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : adapter.snapshot()) {
            if (accepted(row)) {
                rows.add(row);
            }
        }
        rows.sort(comparator());

        int from = Math.min(offset, rows.size());
        int to = limit < 0 ? rows.size() : Math.min(rows.size(), from + limit);
        List<Map<String, Object>> window = new ArrayList<>();
        for (Map<String, Object> row : rows.subList(from, to)) {
            window.add(project(row));
        }
        return window;
    }

    public List<String> operations() {
        return operations;
    }

    // ==================== 内部实现 ====================

    private InMemoryQuerySet withPredicate(Predicate<Map<String, Object>> predicate, String operation) {
        List<Predicate<Map<String, Object>>> next = new ArrayList<>(predicates);
        next.add(predicate);
        return new InMemoryQuerySet(adapter, List.copyOf(next), ordering, projection, offset, limit,
                append(operation));
    }

    private List<String> append(String operation) {
        List<String> next = new ArrayList<>(operations);
        next.add(operation);
        return List.copyOf(next);
    }

    private boolean accepted(Map<String, Object> row) {
        for (Predicate<Map<String, Object>> predicate : predicates) {
            if (!predicate.test(row)) {
                return false;
            }
        }
        return true;
    }

    private Map<String, Object> project(Map<String, Object> row) {
        if (projection.isEmpty()) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(row));
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        projected.put(adapter.describe().pkField(), row.get(adapter.describe().pkField()));
        for (String field : projection) {
            projected.put(field, row.get(field));
        }
        return Collections.unmodifiableMap(projected);
    }

    private Comparator<Map<String, Object>> comparator() {
        List<String> keys = ordering.isEmpty() ? List.of(adapter.describe().pkField()) : ordering;
        Comparator<Map<String, Object>> result = null;
        for (String key : keys) {
            boolean descending = key.startsWith("-");
            String field = descending ? key.substring(1) : key;
            Comparator<Map<String, Object>> next = (a, b) -> compareValues(a.get(field), b.get(field));
            if (descending) {
                next = next.reversed();
            }
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    private static boolean matches(Object value, FilterSpec spec) {
        return switch (spec.op()) {
            case IS_NULL -> (value == null) == Boolean.TRUE.equals(spec.value());
            case EQ -> value != null && compareValues(value, spec.value()) == 0;
            case ICONTAINS -> contains(value, String.valueOf(spec.value()).toLowerCase(Locale.ROOT));
            case GT -> value != null && compareValues(value, spec.value()) > 0;
            case GTE -> value != null && compareValues(value, spec.value()) >= 0;
            case LT -> value != null && compareValues(value, spec.value()) < 0;
            case LTE -> value != null && compareValues(value, spec.value()) <= 0;
            case IN -> value != null && spec.value() instanceof Collection<?> values
                    && values.stream().anyMatch(candidate -> compareValues(value, candidate) == 0);
        };
    }

    private static boolean contains(Object value, String needle) {
        return value != null && String.valueOf(value).toLowerCase(Locale.ROOT).contains(needle);
    }

    @SuppressWarnings("unchecked")
    static int compareValues(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
        }
        if (a instanceof Comparable<?> && a.getClass().isInstance(b)) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }
}
