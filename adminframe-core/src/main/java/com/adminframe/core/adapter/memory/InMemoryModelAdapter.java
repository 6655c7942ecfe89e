package com.adminframe.core.adapter.memory;

import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.ModelAdapter;
import com.adminframe.api.model.ModelMeta;
import com.adminframe.api.model.QuerySet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于内存的参考适配器，行以 Map 表示
 * <p>
 * 用于测试与示例；主键为空时自动分配自增 Long。
 */
public class InMemoryModelAdapter implements ModelAdapter<Map<String, Object>> {

    private final ModelMeta meta;
    private final Map<Object, Map<String, Object>> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryModelAdapter(ModelMeta meta) {
        this.meta = meta;
    }

    @Override
    public ModelMeta describe() {
        return meta;
    }

    @Override
    public QuerySet<Map<String, Object>> all() {
        return new InMemoryQuerySet(this);
    }

    @Override
    public Object primaryKey(Map<String, Object> obj) {
        return obj.get(meta.pkField());
    }

    @Override
    public Object read(Map<String, Object> obj, String field) {
        return obj.get(field);
    }

    @Override
    public Map<String, Object> create(Map<String, Object> values) {
        checkFields(values);
        Map<String, Object> row = new LinkedHashMap<>();
        for (FieldDescriptor field : meta.fields()) {
            row.put(field.getName(), values.getOrDefault(field.getName(), field.getDefaultValue()));
        }
        Object pk = row.get(meta.pkField());
        if (pk == null) {
            pk = sequence.incrementAndGet();
            row.put(meta.pkField(), pk);
        } else if (pk instanceof Number number) {
            sequence.accumulateAndGet(number.longValue(), Math::max);
        }
        if (rows.putIfAbsent(pk, row) != null) {
            throw new ValidationException(meta.pkField(), "Duplicate primary key: " + pk);
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }

    @Override
    public Map<String, Object> update(Map<String, Object> obj, Map<String, Object> values) {
        checkFields(values);
        Object pk = primaryKey(obj);
        Map<String, Object> updated = rows.computeIfPresent(pk, (key, current) -> {
            Map<String, Object> next = new LinkedHashMap<>(current);
            values.forEach((name, value) -> {
                if (!name.equals(meta.pkField())) {
                    next.put(name, value);
                }
            });
            return next;
        });
        if (updated == null) {
            throw new NotFoundException(meta.modelName() + " #" + pk + " no longer exists");
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(updated));
    }

    @Override
    public void delete(Map<String, Object> obj) {
        rows.remove(primaryKey(obj));
    }

    public int size() {
        return rows.size();
    }

    List<Map<String, Object>> snapshot() {
        return new ArrayList<>(rows.values());
    }

    private void checkFields(Map<String, Object> values) {
        for (String name : values.keySet()) {
            if (meta.field(name).isEmpty()) {
                throw new ValidationException(name, "Unknown field");
            }
        }
    }
}
