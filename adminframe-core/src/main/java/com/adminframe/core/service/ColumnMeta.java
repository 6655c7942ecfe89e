package com.adminframe.core.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * 列表列元数据
 *
 * @param key        字段名
 * @param label      显示名
 * @param type       string / number / boolean / datetime / relation / choice
 * @param sortable   是否可排序
 * @param choicesMap 可选值映射（仅 choice）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnMeta(
        String key,
        String label,
        String type,
        boolean sortable,
        @JsonProperty("choices_map") Map<String, String> choicesMap
) {
}
