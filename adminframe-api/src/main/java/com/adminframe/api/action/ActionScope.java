package com.adminframe.api.action;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 动作作用范围
 *
 * @param kind  范围类型
 * @param ids   kind 为 IDS 时的主键列表（字符串形式）
 * @param query kind 为 QUERY 时的查询条件
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionScope(ScopeKind kind, List<String> ids, ScopeQuery query) {

    public static ActionScope ofIds(List<String> ids) {
        return new ActionScope(ScopeKind.IDS, List.copyOf(ids), null);
    }

    public static ActionScope ofQuery(ScopeQuery query) {
        return new ActionScope(ScopeKind.QUERY, null, query == null ? ScopeQuery.empty() : query);
    }
}
