package com.adminframe.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 过滤操作符
 */
public enum FilterOp {
    EQ,
    ICONTAINS,
    GTE,
    LTE,
    GT,
    LT,
    IN,
    /** 值为 Boolean，true 表示字段为空 */
    IS_NULL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FilterOp> fromCode(String code) {
        for (FilterOp op : values()) {
            if (op != IS_NULL && op.code().equals(code)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
