package com.adminframe.core.site;

import com.adminframe.api.exception.ConfigurationException;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.core.action.AdminAction;
import com.adminframe.core.action.DeleteSelectedAction;
import com.adminframe.core.content.ContentTypeRegistry;
import com.adminframe.core.query.QuerySetPipeline;
import com.adminframe.core.support.BlogFixtures;
import com.adminframe.core.support.BlogFixtures.PostDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AdminSite 单元测试")
class AdminSiteTest {

    private ContentTypeRegistry registry;
    private AdminSite site;

    @BeforeEach
    void setUp() {
        registry = new ContentTypeRegistry();
        site = new AdminSite(registry, new QuerySetPipeline());
    }

    @Nested
    @DisplayName("注册校验")
    class RegistrationTests {

        @Test
        @DisplayName("同一资源不能注册两次")
        void duplicateRegistrationFails() {
            site.register("blog", new PostDescriptor(BlogFixtures.posts(0)));

            assertThrows(ConfigurationException.class,
                    () -> site.register("blog", new PostDescriptor(BlogFixtures.posts(0))));
        }

        @Test
        @DisplayName("引用未知字段的声明在注册时失败")
        void unknownFieldFails() {
            PostDescriptor descriptor = new PostDescriptor(BlogFixtures.posts(0)) {
                @Override
                public List<String> getSearchFields() {
                    return List.of("subtitle");
                }
            };

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> site.register("blog", descriptor));
            assertTrue(e.getMessage().contains("search_fields"));
        }

        @Test
        @DisplayName("动作名重复时注册失败")
        void duplicateActionNameFails() {
            PostDescriptor descriptor = new PostDescriptor(BlogFixtures.posts(0)) {
                @Override
                public List<AdminAction<Map<String, Object>>> getActions() {
                    return List.of(new DeleteSelectedAction<>(), new DeleteSelectedAction<>());
                }
            };

            assertThrows(ConfigurationException.class, () -> site.register("blog", descriptor));
        }

        @Test
        @DisplayName("冻结后拒绝注册")
        void frozenSiteRejectsRegistration() {
            site.finalizeSite();
            site.freeze();

            assertThrows(ConfigurationException.class,
                    () -> site.register("blog", new PostDescriptor(BlogFixtures.posts(0))));
            assertThrows(ConfigurationException.class, () -> site.registerCard("shop", "Sales", "Sales"));
            assertTrue(registry.isFrozen());
        }
    }

    @Nested
    @DisplayName("发布与查找")
    class LookupTests {

        @Test
        @DisplayName("finalize 之后可以按路径和内容类型查找")
        void findAfterFinalize() {
            site.register("blog", new PostDescriptor(BlogFixtures.posts(0)));
            site.registerCard("shop", "Sales Total", "Sales total");
            site.finalizeSite();

            RegisteredModel<?> model = site.find("blog", "post");
            assertEquals("blog.post", model.contentType().dottedName());
            assertFalse(model.contentType().virtual());
            assertSame(model, site.lookup(model.contentType()).orElseThrow());

            assertEquals(1, site.virtualEntries().size());
            assertEquals("shop.cards.sales-total", site.virtualEntries().get(0).contentType().dottedName());
            assertTrue(registry.getByDotted("shop.cards.sales-total").orElseThrow().virtual());
        }

        @Test
        @DisplayName("未知资源返回 404")
        void unknownResourceIsNotFound() {
            site.finalizeSite();

            assertThrows(NotFoundException.class, () -> site.find("blog", "page"));
        }

        @Test
        @DisplayName("设置类资源以全局命名空间鉴权")
        void settingsResourceUsesGlobalTarget() {
            site.register("core", new PostDescriptor(BlogFixtures.posts(0)), true);
            site.finalizeSite();

            RegisteredModel<?> model = site.find("core", "post");
            assertTrue(model.settings());
            assertNull(model.permissionTarget());
        }

        @Test
        @DisplayName("finalize 时流水线探测失败则启动失败")
        void probeFailureIsFatal() {
            site.register("blog", new PostDescriptor(BlogFixtures.posts(0)) {
                @Override
                public com.adminframe.api.model.QuerySet<Map<String, Object>> baseQuerySet() {
                    return null;
                }
            });

            assertThrows(ConfigurationException.class, () -> site.finalizeSite());
        }
    }
}
