package com.adminframe.core.security;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.event.security.PermissionChangedEvent;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.GrantRepository;
import com.adminframe.api.security.PermAction;
import com.adminframe.api.security.PermissionChecker;
import com.adminframe.core.event.EventBus;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 带缓存的权限检查器
 * <p>
 * 只缓存需要查询授权表的判定；未启用、非员工和超级管理员的判定每次都直接计算。
 * 授权或成员关系变化时按用户失效。
 * <p>
 * 每次变化推进代数；判定期间代数发生变化时结果只返回不写入缓存，
 * 避免撤销前读到的允许结果在撤销后被缓存。
 */
@Slf4j
public class CachingPermissionChecker implements PermissionChecker, AutoCloseable {

    private final PermissionChecker delegate;
    private final GrantRepository grants;
    private final Cache<CacheKey, Boolean> decisions;
    private final EventBus.Subscription subscription;
    private final AtomicLong generation = new AtomicLong();

    public CachingPermissionChecker(PermissionChecker delegate, GrantRepository grants, EventBus eventBus,
                                    Duration ttl, long maximumSize) {
        this.delegate = delegate;
        this.grants = grants;
        this.decisions = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
        this.subscription = eventBus.subscribe(PermissionChangedEvent.class, this::onPermissionChanged);
    }

    @Override
    public boolean check(AdminUser subject, PermAction action, ContentType contentType) {
        if (subject == null || !subject.active() || !subject.staff()) {
            return false;
        }
        if (subject.superuser()) {
            return true;
        }
        CacheKey key = new CacheKey(subject.id(), contentType == null ? null : contentType.id(), action);
        Boolean cached = decisions.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        long observed = generation.get();
        boolean allowed = delegate.check(subject, action, contentType);
        if (generation.get() == observed) {
            decisions.put(key, allowed);
            // put 与失效交错时再确认一次
            if (generation.get() != observed) {
                decisions.invalidate(key);
            }
        }
        return allowed;
    }

    public void invalidateUser(String userId) {
        generation.incrementAndGet();
        decisions.asMap().keySet().removeIf(key -> key.userId().equals(userId));
    }

    public void invalidateGroup(String groupId) {
        generation.incrementAndGet();
        for (String userId : grants.membersOf(groupId)) {
            invalidateUser(userId);
        }
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        decisions.invalidateAll();
    }

    public long size() {
        return decisions.estimatedSize();
    }

    private void onPermissionChanged(PermissionChangedEvent event) {
        switch (event.getKind()) {
            case USER_GRANT, MEMBERSHIP -> invalidateUser(event.getUserId());
            case GROUP_GRANT -> invalidateGroup(event.getGroupId());
        }
        log.debug("[AdminFrame] Permission cache invalidated by {}", event);
    }

    @Override
    public void close() {
        subscription.unsubscribe();
        decisions.invalidateAll();
    }

    private record CacheKey(String userId, ContentTypeId contentType, PermAction action) {
    }
}
