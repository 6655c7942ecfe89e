package com.adminframe.core.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 列表页响应
 */
public record ListPage(
        List<String> columns,
        @JsonProperty("columns_meta") List<ColumnMeta> columnsMeta,
        @JsonProperty("id_field") String idField,
        List<Map<String, Object>> items,
        int page,
        int pages,
        @JsonProperty("per_page") int perPage,
        long total,
        String order
) {

    public static final String ROW_PK = "row_pk";
}
