package com.adminframe.starter.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * 错误响应体，只携带对外可见的信息
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdminErrorResponse(String detail, Map<String, String> errors) {

    public static AdminErrorResponse of(String detail) {
        return new AdminErrorResponse(detail, null);
    }
}
