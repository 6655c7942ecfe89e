package com.adminframe.core.security;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.PermAction;
import com.adminframe.api.security.PermissionChecker;
import com.adminframe.core.event.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("CachingPermissionChecker 单元测试")
class CachingPermissionCheckerTest {

    private static final ContentType POST = new ContentType(new ContentTypeId(1), "blog", "post", "blog.post", false);
    private static final AdminUser ALICE = AdminUser.staff("alice", "alice");

    private InMemoryGrantRepository repository;

    private EventBus eventBus;
    private GrantService grantService;
    private PermissionChecker delegate;
    private CachingPermissionChecker checker;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGrantRepository();
        eventBus = new EventBus();
        grantService = new GrantService(repository, eventBus, GrantPolicy.ADVISORY);
        delegate = spy(new DefaultPermissionChecker(repository));
        checker = new CachingPermissionChecker(delegate, repository, eventBus, Duration.ofMinutes(5), 100);
    }

    @AfterEach
    void tearDown() {
        checker.close();
    }

    @Test
    @DisplayName("重复判定命中缓存")
    void repeatedDecisionIsCached() {
        grantService.grantToUser("alice", POST, PermAction.VIEW);

        assertTrue(checker.check(ALICE, PermAction.VIEW, POST));
        assertTrue(checker.check(ALICE, PermAction.VIEW, POST));

        verify(delegate, times(1)).check(any(), any(), any());
        assertEquals(1, checker.size());
    }

    @Test
    @DisplayName("撤销用户授权后立即生效")
    void userRevokeInvalidates() {
        grantService.grantToUser("alice", POST, PermAction.VIEW);
        assertTrue(checker.check(ALICE, PermAction.VIEW, POST));

        grantService.revokeFromUser("alice", POST, PermAction.VIEW);

        assertFalse(checker.check(ALICE, PermAction.VIEW, POST));
    }

    @Test
    @DisplayName("组授权变化使组成员的缓存失效")
    void groupGrantInvalidatesMembers() {
        grantService.addMember("editors", "alice");
        assertFalse(checker.check(ALICE, PermAction.CHANGE, POST));

        grantService.grantToGroup("editors", POST, PermAction.CHANGE);

        assertTrue(checker.check(ALICE, PermAction.CHANGE, POST));
    }

    @Test
    @DisplayName("移出组后立即失去组授权")
    void membershipRemovalInvalidates() {
        grantService.grantToGroup("editors", POST, PermAction.CHANGE);
        grantService.addMember("editors", "alice");
        assertTrue(checker.check(ALICE, PermAction.CHANGE, POST));

        grantService.removeMember("editors", "alice");

        assertFalse(checker.check(ALICE, PermAction.CHANGE, POST));
    }

    @Test
    @DisplayName("超级管理员和非员工不进入缓存")
    void shortCircuitDecisionsAreNotCached() {
        assertTrue(checker.check(AdminUser.superuser("root", "root"), PermAction.DELETE, POST));
        assertFalse(checker.check(new AdminUser("eve", "eve", true, false, false), PermAction.VIEW, POST));

        verify(delegate, never()).check(any(), any(), any());
        assertEquals(0, checker.size());
    }

    @Test
    @DisplayName("判定进行中发生撤销时不缓存旧的允许结果")
    void revokeDuringInFlightCheckIsNotCached() throws Exception {
        grantService.grantToUser("alice", POST, PermAction.VIEW);
        CountDownLatch granted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DefaultPermissionChecker real = new DefaultPermissionChecker(repository);
        PermissionChecker slow = (subject, action, contentType) -> {
            boolean allowed = real.check(subject, action, contentType);
            granted.countDown();
            try {
                assertTrue(release.await(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return allowed;
        };
        try (CachingPermissionChecker racing =
                     new CachingPermissionChecker(slow, repository, eventBus, Duration.ofMinutes(5), 100)) {
            CompletableFuture<Boolean> inFlight =
                    CompletableFuture.supplyAsync(() -> racing.check(ALICE, PermAction.VIEW, POST));
            assertTrue(granted.await(5, TimeUnit.SECONDS));

            grantService.revokeFromUser("alice", POST, PermAction.VIEW);
            release.countDown();

            assertTrue(inFlight.get(5, TimeUnit.SECONDS));
            assertEquals(0, racing.size());
            assertFalse(racing.check(ALICE, PermAction.VIEW, POST));
        }
    }
}
