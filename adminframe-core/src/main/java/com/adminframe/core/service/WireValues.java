package com.adminframe.core.service;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * 字段值到 JSON 友好值的转换
 */
final class WireValues {

    private WireValues() {
    }

    static Object toWire(Object value) {
        if (value instanceof TemporalAccessor || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            List<Object> converted = new ArrayList<>(values.size());
            for (Object item : values) {
                converted.add(toWire(item));
            }
            return converted;
        }
        return value;
    }
}
