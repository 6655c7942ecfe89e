package com.adminframe.core.security;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.event.security.PermissionChangedEvent;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.event.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GrantService 单元测试")
class GrantServiceTest {

    private static final ContentType POST = new ContentType(new ContentTypeId(1), "blog", "post", "blog.post", false);

    private InMemoryGrantRepository repository;
    private EventBus eventBus;
    private List<PermissionChangedEvent> events;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGrantRepository();
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribe(PermissionChangedEvent.class, events::add);
    }

    @Nested
    @DisplayName("授权策略")
    class PolicyTests {

        @Test
        @DisplayName("IMPLY_VIEW：授予 change 时顺带授予 view")
        void implyViewGrantsView() {
            GrantService service = new GrantService(repository, eventBus, GrantPolicy.IMPLY_VIEW);

            service.grantToUser("alice", POST, PermAction.CHANGE);

            assertTrue(repository.hasUserGrant("alice", POST.id(), PermAction.CHANGE));
            assertTrue(repository.hasUserGrant("alice", POST.id(), PermAction.VIEW));
        }

        @Test
        @DisplayName("STRICT：没有 view 时拒绝授予 delete")
        void strictRejectsWithoutView() {
            GrantService service = new GrantService(repository, eventBus, GrantPolicy.STRICT);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> service.grantToGroup("editors", POST, PermAction.DELETE));

            assertTrue(e.getErrors().containsKey("action"));
            assertTrue(repository.listGrants().isEmpty());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("STRICT：已有 view 时允许授予 change")
        void strictAllowsWithView() {
            GrantService service = new GrantService(repository, eventBus, GrantPolicy.STRICT);
            service.grantToUser("alice", POST, PermAction.VIEW);

            service.grantToUser("alice", POST, PermAction.CHANGE);

            assertTrue(repository.hasUserGrant("alice", POST.id(), PermAction.CHANGE));
        }

        @Test
        @DisplayName("ADVISORY：只授予请求的动作")
        void advisoryGrantsOnlyRequested() {
            GrantService service = new GrantService(repository, eventBus, GrantPolicy.ADVISORY);

            service.grantToUser("alice", POST, PermAction.CHANGE);

            assertTrue(repository.hasUserGrant("alice", POST.id(), PermAction.CHANGE));
            assertFalse(repository.hasUserGrant("alice", POST.id(), PermAction.VIEW));
        }
    }

    @Nested
    @DisplayName("成员关系与事件")
    class MembershipTests {

        @Test
        @DisplayName("每次变更都发布事件")
        void changesPublishEvents() {
            GrantService service = new GrantService(repository, eventBus, GrantPolicy.ADVISORY);

            service.addMember("editors", "alice");
            service.grantToGroup("editors", POST, PermAction.VIEW);
            service.removeMember("editors", "alice");

            assertEquals(3, events.size());
            assertEquals(PermissionChangedEvent.Kind.MEMBERSHIP, events.get(0).getKind());
            assertEquals("alice", events.get(0).getUserId());
            assertEquals(PermissionChangedEvent.Kind.GROUP_GRANT, events.get(1).getKind());
            assertEquals("editors", events.get(1).getGroupId());
            assertEquals(Set.of(), service.membersOf("editors"));
        }

        @Test
        @DisplayName("空白标识被拒绝")
        void blankIdsRejected() {
            GrantService service = new GrantService(repository, eventBus, GrantPolicy.ADVISORY);

            assertThrows(ValidationException.class, () -> service.addMember(" ", "alice"));
            assertThrows(ValidationException.class, () -> service.grantToUser(null, POST, PermAction.VIEW));
        }
    }
}
