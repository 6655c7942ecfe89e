package com.adminframe.api.security;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.exception.PermissionDeniedException;

/**
 * 权限检查器
 * 负责回答 "主体能否对某内容类型（或全局）执行某动作"。
 *
 * @author AdminFrame
 */
public interface PermissionChecker {

    /**
     * 检查权限。
     *
     * @param subject     主体
     * @param action      动作
     * @param contentType 内容类型，null 表示全局权限
     * @return 允许返回 true
     */
    boolean check(AdminUser subject, PermAction action, ContentType contentType);

    /**
     * 检查权限，不通过时抛出 {@link PermissionDeniedException}。
     */
    default void require(AdminUser subject, PermAction action, ContentType contentType) {
        if (!check(subject, action, contentType)) {
            String target = contentType == null ? "<global>" : contentType.dottedName();
            throw new PermissionDeniedException(
                    "Permission denied: " + action.codename() + " on " + target);
        }
    }
}
