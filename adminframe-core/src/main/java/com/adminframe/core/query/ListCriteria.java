package com.adminframe.core.query;

import com.adminframe.api.model.FilterSpec;

import java.util.List;

/**
 * 已校验的列表查询条件，折叠进流水线的 base 阶段
 *
 * @param filters      过滤条件
 * @param search       搜索词，null 表示不搜索
 * @param searchFields 搜索字段
 * @param ordering     排序
 */
public record ListCriteria(List<FilterSpec> filters, String search, List<String> searchFields, List<String> ordering) {

    public ListCriteria {
        filters = filters == null ? List.of() : List.copyOf(filters);
        searchFields = searchFields == null ? List.of() : List.copyOf(searchFields);
        ordering = ordering == null ? List.of() : List.copyOf(ordering);
    }

    public static ListCriteria none() {
        return new ListCriteria(List.of(), null, List.of(), List.of());
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank() && !searchFields.isEmpty();
    }

    /**
     * 对外展示的排序串，例如 "-id"
     */
    public String orderToken() {
        return ordering.isEmpty() ? null : ordering.get(0);
    }
}
