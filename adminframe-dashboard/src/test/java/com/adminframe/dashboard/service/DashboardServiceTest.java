package com.adminframe.dashboard.service;

import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.content.ContentTypeRegistry;
import com.adminframe.core.event.EventBus;
import com.adminframe.core.security.DefaultPermissionChecker;
import com.adminframe.core.security.GrantPolicy;
import com.adminframe.core.security.GrantService;
import com.adminframe.core.security.InMemoryGrantRepository;
import com.adminframe.dashboard.dto.GrantDTO;
import com.adminframe.dashboard.dto.MembershipDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RBAC 管理服务")
class DashboardServiceTest {

    private ContentTypeRegistry registry;
    private InMemoryGrantRepository repository;
    private DefaultPermissionChecker checker;
    private DashboardService service;

    @BeforeEach
    void setUp() {
        registry = new ContentTypeRegistry();
        registry.register("blog", "post", "blog.post", false);
        registry.register("shop", "cards.sales", "shop.cards.sales", true);
        registry.finalizeRegistry();

        repository = new InMemoryGrantRepository();
        checker = new DefaultPermissionChecker(repository);
        GrantService grantService = new GrantService(repository, new EventBus(), GrantPolicy.IMPLY_VIEW);
        service = new DashboardService(grantService, registry);
    }

    @Test
    @DisplayName("列出全部内容类型，含虚拟条目")
    void listsContentTypes() {
        assertEquals(List.of("blog.post", "shop.cards.sales"),
                service.listContentTypes().stream().map(ct -> ct.getDottedName()).toList());
        assertTrue(service.listContentTypes().get(1).isVirtual());
    }

    @Nested
    @DisplayName("授权")
    class Grants {

        @Test
        @DisplayName("按编码授予组权限，并按策略补齐 view")
        void grantsGroupByCodename() {
            GrantDTO granted = service.grant(GrantDTO.builder()
                    .granteeType("Group").granteeId("editors").codename("blog.post.change").build());

            assertEquals("group", granted.getGranteeType());
            assertEquals("blog.post.change", granted.getCodename());
            assertEquals(List.of("blog.post.change", "blog.post.view"),
                    service.listGrants().stream().map(GrantDTO::getCodename).toList());
        }

        @Test
        @DisplayName("全局授权的编码只有动作部分")
        void globalGrant() {
            service.grant(GrantDTO.builder().granteeType("user").granteeId("carol").codename("view").build());

            assertEquals("view", service.listGrants().get(0).getCodename());
            AdminUser carol = AdminUser.staff("carol", "carol");
            assertTrue(checker.check(carol, PermAction.VIEW, null));
            // 全局授权不外溢到具体资源
            assertFalse(checker.check(carol, PermAction.VIEW, registry.getByDotted("blog.post").orElseThrow()));
        }

        @Test
        @DisplayName("撤销后不再出现在列表中")
        void revokeRemovesGrant() {
            GrantDTO dto = GrantDTO.builder().granteeType("user").granteeId("dave").codename("blog.post.add").build();
            service.grant(dto);
            service.revoke(dto);

            assertTrue(service.listGrants().isEmpty());
        }

        @Test
        @DisplayName("未知的被授权方类型或内容类型被拒绝")
        void rejectsInvalidInput() {
            ValidationException badType = assertThrows(ValidationException.class, () -> service.grant(
                    GrantDTO.builder().granteeType("robot").granteeId("x").codename("blog.post.view").build()));
            assertTrue(badType.getErrors().containsKey("grantee_type"));

            ValidationException badCodename = assertThrows(ValidationException.class, () -> service.grant(
                    GrantDTO.builder().granteeType("user").granteeId("x").codename("blog.missing.view").build()));
            assertTrue(badCodename.getErrors().containsKey("codename"));
        }
    }

    @Nested
    @DisplayName("组成员")
    class Members {

        @Test
        @DisplayName("加入与移除成员")
        void addAndRemove() {
            service.addMember("editors", "bob");
            MembershipDTO membership = service.addMember("editors", "alice");
            assertEquals(List.of("alice", "bob"), membership.getMembers());

            membership = service.removeMember("editors", "bob");
            assertEquals(List.of("alice"), membership.getMembers());
            assertFalse(repository.groupsOf("bob").contains("editors"));
        }
    }
}
