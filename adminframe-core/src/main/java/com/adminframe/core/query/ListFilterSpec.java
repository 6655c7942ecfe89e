package com.adminframe.core.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * 列表过滤器描述，供前端渲染过滤控件
 *
 * @param field   字段名
 * @param label   显示名
 * @param kind    string / boolean / number / date / datetime / choice / relation
 * @param ops     允许的操作符
 * @param choices 可选值（仅 choice）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListFilterSpec(String field, String label, String kind, List<String> ops, Map<String, String> choices) {
}
