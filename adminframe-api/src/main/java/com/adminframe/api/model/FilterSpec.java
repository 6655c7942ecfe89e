package com.adminframe.api.model;

/**
 * 一个过滤条件。IN 的 value 为集合。
 */
public record FilterSpec(String field, FilterOp op, Object value) {

    public static FilterSpec eq(String field, Object value) {
        return new FilterSpec(field, FilterOp.EQ, value);
    }

    public static FilterSpec in(String field, java.util.Collection<?> values) {
        return new FilterSpec(field, FilterOp.IN, values);
    }
}
