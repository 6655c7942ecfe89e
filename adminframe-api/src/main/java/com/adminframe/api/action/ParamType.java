package com.adminframe.api.action;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 动作参数的基础类型
 */
public enum ParamType {
    BOOLEAN,
    STRING,
    INTEGER,
    NUMBER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 值是否符合该类型（不做隐式转换）
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case BOOLEAN -> value instanceof Boolean;
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof java.math.BigInteger;
            case NUMBER -> value instanceof Number;
        };
    }
}
