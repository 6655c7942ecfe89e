package com.adminframe.core.security;

import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.security.Grant;
import com.adminframe.api.security.GrantRepository;
import com.adminframe.api.security.PermAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的授权存储
 * 生产环境通常由宿主提供基于数据库的实现
 */
public class InMemoryGrantRepository implements GrantRepository {

    private final Set<Grant> grants = ConcurrentHashMap.newKeySet();

    // groupId -> userIds / userId -> groupIds
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> memberships = new ConcurrentHashMap<>();

    @Override
    public boolean hasUserGrant(String userId, ContentTypeId contentType, PermAction action) {
        return grants.contains(new Grant(Grant.GranteeType.USER, userId, contentType, action));
    }

    @Override
    public boolean hasAnyGroupGrant(Collection<String> groupIds, ContentTypeId contentType, PermAction action) {
        for (String groupId : groupIds) {
            if (grants.contains(new Grant(Grant.GranteeType.GROUP, groupId, contentType, action))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Set<String> groupsOf(String userId) {
        return Set.copyOf(memberships.getOrDefault(userId, Set.of()));
    }

    @Override
    public Set<String> membersOf(String groupId) {
        return Set.copyOf(members.getOrDefault(groupId, Set.of()));
    }

    @Override
    public void grantToUser(String userId, ContentTypeId contentType, PermAction action) {
        grants.add(new Grant(Grant.GranteeType.USER, userId, contentType, action));
    }

    @Override
    public void revokeFromUser(String userId, ContentTypeId contentType, PermAction action) {
        grants.remove(new Grant(Grant.GranteeType.USER, userId, contentType, action));
    }

    @Override
    public void grantToGroup(String groupId, ContentTypeId contentType, PermAction action) {
        grants.add(new Grant(Grant.GranteeType.GROUP, groupId, contentType, action));
    }

    @Override
    public void revokeFromGroup(String groupId, ContentTypeId contentType, PermAction action) {
        grants.remove(new Grant(Grant.GranteeType.GROUP, groupId, contentType, action));
    }

    @Override
    public synchronized void addMember(String groupId, String userId) {
        members.computeIfAbsent(groupId, k -> ConcurrentHashMap.newKeySet()).add(userId);
        memberships.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(groupId);
    }

    @Override
    public synchronized void removeMember(String groupId, String userId) {
        Set<String> users = members.get(groupId);
        if (users != null) {
            users.remove(userId);
        }
        Set<String> groups = memberships.get(userId);
        if (groups != null) {
            groups.remove(groupId);
        }
    }

    @Override
    public List<Grant> listGrants() {
        return new ArrayList<>(grants);
    }
}
