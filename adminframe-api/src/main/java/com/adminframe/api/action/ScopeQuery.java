package com.adminframe.api.action;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.TreeMap;

/**
 * 可重放的列表查询条件
 *
 * @param search  搜索词
 * @param order   排序字段，"-" 前缀表示降序
 * @param filters 过滤条件，键为 "field" 或 "field.op"，值为原始字符串
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScopeQuery(String search, String order, Map<String, String> filters) {

    public ScopeQuery {
        // 排序后的副本，保证签名载荷稳定
        filters = filters == null ? Map.of() : new TreeMap<>(filters);
    }

    public static ScopeQuery empty() {
        return new ScopeQuery(null, null, Map.of());
    }
}
