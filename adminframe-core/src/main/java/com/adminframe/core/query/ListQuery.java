package com.adminframe.core.query;

import java.util.Map;

/**
 * 原始列表请求参数
 *
 * @param search  搜索词
 * @param order   排序字段
 * @param filters 过滤参数，键为 "field" 或 "field.op"（已去掉 "filter." 前缀）
 * @param pageNum 页码，从 1 开始，null 为第一页
 * @param perPage 每页条数，null 为缺省值
 */
public record ListQuery(String search, String order, Map<String, String> filters, Integer pageNum, Integer perPage) {

    public ListQuery {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
    }

    public static ListQuery empty() {
        return new ListQuery(null, null, Map.of(), null, null);
    }
}
