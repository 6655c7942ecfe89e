package com.adminframe.api.event.security;

import com.adminframe.api.event.AbstractAdminEvent;
import lombok.Getter;

/**
 * 授权或组成员关系发生变化
 * <p>
 * userId 与 groupId 至少有一个非空：用户授权只有 userId，组授权只有 groupId，成员变更两者都有。
 */
@Getter
public class PermissionChangedEvent extends AbstractAdminEvent {

    public enum Kind {
        USER_GRANT,
        GROUP_GRANT,
        MEMBERSHIP
    }

    private final Kind kind;
    private final String userId;
    private final String groupId;

    public PermissionChangedEvent(Kind kind, String userId, String groupId) {
        super();
        this.kind = kind;
        this.userId = userId;
        this.groupId = groupId;
    }

    public static PermissionChangedEvent userGrant(String userId) {
        return new PermissionChangedEvent(Kind.USER_GRANT, userId, null);
    }

    public static PermissionChangedEvent groupGrant(String groupId) {
        return new PermissionChangedEvent(Kind.GROUP_GRANT, null, groupId);
    }

    public static PermissionChangedEvent membership(String groupId, String userId) {
        return new PermissionChangedEvent(Kind.MEMBERSHIP, userId, groupId);
    }

    @Override
    public String toString() {
        return "PermissionChangedEvent[kind=" + kind + ", user=" + userId + ", group=" + groupId + "]";
    }
}
