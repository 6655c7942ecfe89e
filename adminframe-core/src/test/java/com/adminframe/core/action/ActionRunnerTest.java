package com.adminframe.core.action;

import com.adminframe.api.action.ActionResult;
import com.adminframe.api.action.ActionScope;
import com.adminframe.api.action.ActionSpec;
import com.adminframe.api.action.ActionTaskStatus;
import com.adminframe.api.action.ScopeKind;
import com.adminframe.api.action.ScopeQuery;
import com.adminframe.api.action.TaskState;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.exception.PermissionDeniedException;
import com.adminframe.api.exception.TokenException;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.adapter.memory.InMemoryModelAdapter;
import com.adminframe.core.config.AdminFrameConfig;
import com.adminframe.core.content.ContentTypeRegistry;
import com.adminframe.core.event.EventBus;
import com.adminframe.core.query.ListQueryParser;
import com.adminframe.core.query.QuerySetPipeline;
import com.adminframe.core.query.ScopeQueryBuilder;
import com.adminframe.core.security.DefaultPermissionChecker;
import com.adminframe.core.security.InMemoryGrantRepository;
import com.adminframe.core.site.AdminSite;
import com.adminframe.core.site.RegisteredModel;
import com.adminframe.core.support.BlogFixtures;
import com.adminframe.core.support.BlogFixtures.OwnPostsDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.adminframe.core.support.BlogFixtures.ALICE;
import static com.adminframe.core.support.BlogFixtures.BOB;
import static com.adminframe.core.support.BlogFixtures.ROOT;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ActionRunner 单元测试")
class ActionRunnerTest {

    private static final Map<String, Object> CONFIRM = Map.of("confirm", true);

    /**
     * 只接受 ids 范围、需要 change 权限的发布动作
     */
    static class PublishAction implements AdminAction<Map<String, Object>> {

        @Override
        public ActionSpec spec() {
            return ActionSpec.builder()
                    .name("publish")
                    .label("Publish")
                    .scopeKinds(EnumSet.of(ScopeKind.IDS))
                    .build();
        }

        @Override
        public BatchOutcome apply(ActionContext<Map<String, Object>> context, List<Map<String, Object>> batch) {
            for (Map<String, Object> post : batch) {
                context.descriptor().saveUpdate(post, Map.of("status", "published"));
            }
            return new BatchOutcome(batch.size(), 0, List.of());
        }
    }

    private InMemoryModelAdapter adapter;
    private InMemoryGrantRepository grants;
    private ActionTaskManager taskManager;
    private ActionRunner runner;
    private RegisteredModel<?> model;

    private void setUp(int posts) {
        adapter = BlogFixtures.posts(posts);
        grants = new InMemoryGrantRepository();
        QuerySetPipeline pipeline = new QuerySetPipeline();
        AdminSite site = new AdminSite(new ContentTypeRegistry(), pipeline);
        site.register("blog", new OwnPostsDescriptor(adapter) {
            @Override
            public List<AdminAction<Map<String, Object>>> getActions() {
                return List.of(new DeleteSelectedAction<>(), new PublishAction());
            }
        });
        site.finalizeSite();
        model = site.find("blog", "post");

        AdminFrameConfig config = AdminFrameConfig.builder().build();
        taskManager = new ActionTaskManager(1, 100, new InMemoryTaskCheckpointStore(), new EventBus(),
                Clock.systemUTC());
        ScopeTokenService tokens = new ScopeTokenService("secret", Duration.ofMinutes(5), Clock.systemUTC(),
                new ObjectMapper());
        runner = new ActionRunner(pipeline, new ScopeQueryBuilder(new ListQueryParser(config)),
                new DefaultPermissionChecker(grants), tokens, taskManager, config.getBatchThreshold());
    }

    @AfterEach
    void tearDown() {
        if (taskManager != null) {
            taskManager.close();
        }
    }

    private static List<String> ids(int from, int to) {
        List<String> ids = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            ids.add(String.valueOf(i));
        }
        return ids;
    }

    private ActionTaskStatus awaitTerminal(String handle) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        ActionTaskStatus status = runner.taskStatus(model, handle);
        while (!status.state().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            status = runner.taskStatus(model, handle);
        }
        return status;
    }

    @Nested
    @DisplayName("同步与后台执行")
    class ThresholdTests {

        @Test
        @DisplayName("范围等于阈值时同步执行")
        void atThresholdRunsInline() {
            setUp(100);

            ActionResult result = runner.run(model, DeleteSelectedAction.NAME, ActionScope.ofIds(ids(1, 100)),
                    CONFIRM, ROOT);

            assertTrue(result.ok());
            assertNull(result.background());
            assertEquals(100, result.affected());
            assertEquals(0, adapter.size());
            Map<?, ?> json = new ObjectMapper().convertValue(result, Map.class);
            assertEquals(Set.of("ok", "affected", "skipped", "errors"), json.keySet());
        }

        @Test
        @DisplayName("范围超过阈值时转入后台分批执行")
        void aboveThresholdIsDeferred() throws InterruptedException {
            setUp(101);

            ActionResult result = runner.run(model, DeleteSelectedAction.NAME,
                    ActionScope.ofQuery(ScopeQuery.empty()), CONFIRM, ROOT);

            assertEquals(Boolean.TRUE, result.background());
            assertNotNull(result.taskHandle());

            ActionTaskStatus status = awaitTerminal(result.taskHandle());
            assertEquals(TaskState.COMPLETED, status.state());
            assertEquals(101, status.total());
            assertEquals(101, status.processed());
            assertEquals(101, status.affected());
            assertEquals("101", status.lastPk());
            assertEquals(0, adapter.size());
        }

        @Test
        @DisplayName("未知任务句柄返回 404")
        void unknownTaskIsNotFound() {
            setUp(1);

            assertThrows(NotFoundException.class, () -> runner.taskStatus(model, "missing"));
            assertThrows(NotFoundException.class, () -> runner.cancelTask(model, "missing"));
        }
    }

    @Nested
    @DisplayName("执行前检查")
    class CheckTests {

        @Test
        @DisplayName("未知动作返回 404")
        void unknownAction() {
            setUp(3);

            assertThrows(NotFoundException.class,
                    () -> runner.run(model, "archive", ActionScope.ofIds(List.of("1")), Map.of(), ROOT));
        }

        @Test
        @DisplayName("不接受的范围类型返回 422")
        void unsupportedScopeKind() {
            setUp(3);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> runner.run(model, "publish", ActionScope.ofQuery(ScopeQuery.empty()), Map.of(), ROOT));
            assertTrue(e.getErrors().containsKey("scope"));
        }

        @Test
        @DisplayName("破坏性动作未确认时不触碰任何对象")
        void destructiveWithoutConfirm() {
            setUp(5);

            assertThrows(ValidationException.class,
                    () -> runner.run(model, DeleteSelectedAction.NAME, ActionScope.ofIds(ids(1, 5)), Map.of(), ROOT));
            assertThrows(ValidationException.class,
                    () -> runner.run(model, DeleteSelectedAction.NAME, ActionScope.ofIds(ids(1, 5)),
                            Map.of("confirm", false), ROOT));
            assertEquals(5, adapter.size());
        }

        @Test
        @DisplayName("缺少 required_perm 时返回 403，即使持有 change")
        void requiredPermEnforced() {
            setUp(5);
            grants.grantToUser("bob", model.contentType().id(), PermAction.VIEW);
            grants.grantToUser("bob", model.contentType().id(), PermAction.CHANGE);

            assertThrows(PermissionDeniedException.class,
                    () -> runner.run(model, DeleteSelectedAction.NAME, ActionScope.ofIds(ids(1, 5)), CONFIRM, BOB));
            assertEquals(5, adapter.size());
        }

        @Test
        @DisplayName("多余参数返回 422")
        void unexpectedParams() {
            setUp(3);

            assertThrows(ValidationException.class,
                    () -> runner.run(model, "publish", ActionScope.ofIds(List.of("1")), Map.of("force", true), ROOT));
        }

        @Test
        @DisplayName("非法主键返回 422")
        void invalidIds() {
            setUp(3);

            ValidationException e = assertThrows(ValidationException.class,
                    () -> runner.run(model, "publish", ActionScope.ofIds(List.of("x")), Map.of(), ROOT));
            assertTrue(e.getErrors().containsKey("ids"));
            assertThrows(ValidationException.class,
                    () -> runner.run(model, "publish", ActionScope.ofIds(List.of()), Map.of(), ROOT));
        }
    }

    @Nested
    @DisplayName("范围与行级安全")
    class ScopeTests {

        @Test
        @DisplayName("ids 范围同样受行级安全约束")
        void idsScopeRespectsRowLevelSecurity() {
            setUp(4);
            grants.grantToUser("bob", model.contentType().id(), PermAction.CHANGE);

            // 1、3 属于 alice，2、4 属于 bob
            ActionResult result = runner.run(model, "publish", ActionScope.ofIds(ids(1, 4)), Map.of(), BOB);

            assertEquals(2, result.affected());
            assertEquals("draft", adapter.all().first().orElseThrow().get("status"));
        }

        @Test
        @DisplayName("预览计数与浏览时一致")
        void previewMatchesListing() {
            setUp(10);

            ScopeQuery published = new ScopeQuery(null, null, Map.of("status", "published"));
            assertEquals(3, runner.preview(model, ActionScope.ofQuery(published), ROOT));
            // alice 只能看到 3、9
            assertEquals(2, runner.preview(model, ActionScope.ofQuery(published), ALICE));
        }

        @Test
        @DisplayName("query 范围严格校验排序")
        void queryScopeIsStrict() {
            setUp(3);

            ScopeQuery bad = new ScopeQuery(null, "body", Map.of());
            assertThrows(ValidationException.class,
                    () -> runner.preview(model, ActionScope.ofQuery(bad), ROOT));
        }
    }

    @Nested
    @DisplayName("范围令牌")
    class TokenTests {

        @Test
        @DisplayName("令牌绑定签发主体")
        void tokenIsBoundToSubject() {
            setUp(3);
            ActionScope scope = ActionScope.ofIds(List.of("1", "2"));
            String token = runner.issueToken(model, scope, ALICE);

            assertEquals(scope, runner.resolveToken(model, token, ALICE));
            assertThrows(TokenException.class, () -> runner.resolveToken(model, token, BOB));
        }

        @Test
        @DisplayName("签发前校验范围")
        void issueValidatesScope() {
            setUp(3);

            assertThrows(ValidationException.class,
                    () -> runner.issueToken(model, ActionScope.ofQuery(new ScopeQuery(null, null,
                            Map.of("title", "x"))), ALICE));
        }
    }
}
