package com.adminframe.core.security;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.GrantRepository;
import com.adminframe.api.security.PermAction;
import com.adminframe.api.security.PermissionChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * 默认权限检查器
 * <p>
 * 按顺序短路：未启用或非员工拒绝 → 超级管理员放行 → 用户直接授权 → 所属组授权 → 拒绝。
 * 全局检查（contentType 为 null）与按资源检查互不相通。
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultPermissionChecker implements PermissionChecker {

    private final GrantRepository grants;

    @Override
    public boolean check(AdminUser subject, PermAction action, ContentType contentType) {
        if (subject == null || !subject.active() || !subject.staff()) {
            log.debug("[AdminFrame] DENY: subject [{}] is inactive or not staff",
                    subject == null ? null : subject.id());
            return false;
        }
        if (subject.superuser()) {
            return true;
        }

        ContentTypeId ctId = contentType == null ? null : contentType.id();
        if (grants.hasUserGrant(subject.id(), ctId, action)) {
            return true;
        }

        Set<String> groups = grants.groupsOf(subject.id());
        if (!groups.isEmpty() && grants.hasAnyGroupGrant(groups, ctId, action)) {
            return true;
        }

        log.warn("[AdminFrame] DENY: user [{}] has no [{}] permission on [{}]",
                subject.id(), action.codename(), contentType == null ? "<global>" : contentType.dottedName());
        return false;
    }
}
