package com.adminframe.starter.security;

import com.adminframe.api.security.AdminUser;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.Nullable;

/**
 * 从请求属性中读取主体，宿主的过滤器或拦截器在登录校验后写入该属性
 */
@RequiredArgsConstructor
public class RequestAttributeSubjectResolver implements AdminSubjectResolver {

    private final String attributeName;

    @Override
    public @Nullable AdminUser resolve(HttpServletRequest request) {
        Object value = request.getAttribute(attributeName);
        return value instanceof AdminUser user ? user : null;
    }
}
