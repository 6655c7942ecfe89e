package com.adminframe.starter.security;

import com.adminframe.api.security.AdminUser;
import jakarta.servlet.http.HttpServletRequest;
import org.jspecify.annotations.Nullable;

/**
 * 鉴权主体解析 SPI
 * <p>
 * 登录与会话由宿主负责，AdminFrame 只需要知道当前请求属于谁。
 */
@FunctionalInterface
public interface AdminSubjectResolver {

    /**
     * @return 当前主体，匿名请求返回 null（对外为 401）
     */
    @Nullable
    AdminUser resolve(HttpServletRequest request);
}
