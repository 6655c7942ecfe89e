package com.adminframe.core.action;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.security.AdminUser;
import com.adminframe.core.descriptor.ModelDescriptor;

import java.util.Map;

/**
 * 动作执行上下文
 *
 * @param contentType 内容类型
 * @param descriptor  描述符
 * @param subject     发起者
 * @param params      已校验的参数
 */
public record ActionContext<T>(
        ContentType contentType,
        ModelDescriptor<T> descriptor,
        AdminUser subject,
        Map<String, Object> params
) {
}
