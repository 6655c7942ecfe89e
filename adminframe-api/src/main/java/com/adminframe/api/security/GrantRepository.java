package com.adminframe.api.security;

import com.adminframe.api.content.ContentTypeId;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 授权存储 SPI
 * 负责保存用户授权、组授权以及组成员关系。
 * <p>
 * contentType 参数为 null 时表示全局命名空间，与按资源授权互不相通。
 *
 * @author AdminFrame
 */
public interface GrantRepository {

    /**
     * 用户是否拥有直接授权
     */
    boolean hasUserGrant(String userId, ContentTypeId contentType, PermAction action);

    /**
     * 任一组是否拥有授权
     */
    boolean hasAnyGroupGrant(Collection<String> groupIds, ContentTypeId contentType, PermAction action);

    /**
     * 用户当前所属的组
     */
    Set<String> groupsOf(String userId);

    /**
     * 组的当前成员
     */
    Set<String> membersOf(String groupId);

    void grantToUser(String userId, ContentTypeId contentType, PermAction action);

    void revokeFromUser(String userId, ContentTypeId contentType, PermAction action);

    void grantToGroup(String groupId, ContentTypeId contentType, PermAction action);

    void revokeFromGroup(String groupId, ContentTypeId contentType, PermAction action);

    void addMember(String groupId, String userId);

    void removeMember(String groupId, String userId);

    /**
     * 全部授权记录（管理端展示用）
     */
    List<Grant> listGrants();
}
