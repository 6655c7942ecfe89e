package com.adminframe.api.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 动作作用范围类型：显式 ID 列表，或可重放的查询条件
 */
public enum ScopeKind {
    IDS,
    QUERY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScopeKind fromCode(String code) {
        return ScopeKind.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
