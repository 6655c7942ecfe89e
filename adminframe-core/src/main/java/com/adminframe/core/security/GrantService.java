package com.adminframe.core.security;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.event.security.PermissionChangedEvent;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.Grant;
import com.adminframe.api.security.GrantRepository;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.event.EventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * 授权管理服务
 * 职责：写入授权与成员关系，执行授权策略，并发布 {@link PermissionChangedEvent}
 */
@Slf4j
@RequiredArgsConstructor
public class GrantService {

    private final GrantRepository repository;
    private final EventBus eventBus;
    private final GrantPolicy policy;

    // ==================== 用户授权 ====================

    public void grantToUser(String userId, ContentType contentType, PermAction action) {
        requireId(userId, "user_id");
        ContentTypeId ctId = idOf(contentType);
        if (enforcePolicy(Grant.GranteeType.USER, userId, contentType, action)) {
            repository.grantToUser(userId, ctId, PermAction.VIEW);
        }
        repository.grantToUser(userId, ctId, action);
        log.info("[AdminFrame] Granted [{}] to user [{}]", PermissionCodename.format(contentType, action), userId);
        eventBus.publish(PermissionChangedEvent.userGrant(userId));
    }

    public void revokeFromUser(String userId, ContentType contentType, PermAction action) {
        requireId(userId, "user_id");
        repository.revokeFromUser(userId, idOf(contentType), action);
        log.info("[AdminFrame] Revoked [{}] from user [{}]", PermissionCodename.format(contentType, action), userId);
        eventBus.publish(PermissionChangedEvent.userGrant(userId));
    }

    // ==================== 组授权 ====================

    public void grantToGroup(String groupId, ContentType contentType, PermAction action) {
        requireId(groupId, "group_id");
        ContentTypeId ctId = idOf(contentType);
        if (enforcePolicy(Grant.GranteeType.GROUP, groupId, contentType, action)) {
            repository.grantToGroup(groupId, ctId, PermAction.VIEW);
        }
        repository.grantToGroup(groupId, ctId, action);
        log.info("[AdminFrame] Granted [{}] to group [{}]", PermissionCodename.format(contentType, action), groupId);
        eventBus.publish(PermissionChangedEvent.groupGrant(groupId));
    }

    public void revokeFromGroup(String groupId, ContentType contentType, PermAction action) {
        requireId(groupId, "group_id");
        repository.revokeFromGroup(groupId, idOf(contentType), action);
        log.info("[AdminFrame] Revoked [{}] from group [{}]", PermissionCodename.format(contentType, action), groupId);
        eventBus.publish(PermissionChangedEvent.groupGrant(groupId));
    }

    // ==================== 成员关系 ====================

    public void addMember(String groupId, String userId) {
        requireId(groupId, "group_id");
        requireId(userId, "user_id");
        repository.addMember(groupId, userId);
        log.info("[AdminFrame] User [{}] joined group [{}]", userId, groupId);
        eventBus.publish(PermissionChangedEvent.membership(groupId, userId));
    }

    public void removeMember(String groupId, String userId) {
        requireId(groupId, "group_id");
        requireId(userId, "user_id");
        repository.removeMember(groupId, userId);
        log.info("[AdminFrame] User [{}] left group [{}]", userId, groupId);
        eventBus.publish(PermissionChangedEvent.membership(groupId, userId));
    }

    public Set<String> membersOf(String groupId) {
        return repository.membersOf(groupId);
    }

    public List<Grant> listGrants() {
        return repository.listGrants();
    }

    public GrantPolicy getPolicy() {
        return policy;
    }

    /**
     * @return 是否需要顺带授予 view
     */
    private boolean enforcePolicy(Grant.GranteeType type, String granteeId, ContentType contentType, PermAction action) {
        if (action != PermAction.CHANGE && action != PermAction.DELETE) {
            return false;
        }
        ContentTypeId ctId = idOf(contentType);
        boolean hasView = type == Grant.GranteeType.USER
                ? repository.hasUserGrant(granteeId, ctId, PermAction.VIEW)
                : repository.hasAnyGroupGrant(Set.of(granteeId), ctId, PermAction.VIEW);
        if (hasView) {
            return false;
        }
        return switch (policy) {
            case IMPLY_VIEW -> true;
            case STRICT -> throw new ValidationException("action",
                    action.codename() + " requires an existing view grant on "
                            + PermissionCodename.format(contentType, PermAction.VIEW));
            case ADVISORY -> {
                log.warn("[AdminFrame] {} [{}] receives [{}] without view; list and retrieve stay forbidden",
                        type, granteeId, PermissionCodename.format(contentType, action));
                yield false;
            }
        };
    }

    private static ContentTypeId idOf(ContentType contentType) {
        return contentType == null ? null : contentType.id();
    }

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be blank");
        }
    }
}
