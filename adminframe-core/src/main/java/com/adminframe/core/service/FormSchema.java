package com.adminframe.core.service;

import java.util.Map;

/**
 * 表单描述：JSON Schema、初始值与界面提示
 */
public record FormSchema(Map<String, Object> schema, Map<String, Object> startval, Map<String, Object> ui) {
}
