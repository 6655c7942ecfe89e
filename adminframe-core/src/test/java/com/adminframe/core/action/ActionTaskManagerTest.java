package com.adminframe.core.action;

import com.adminframe.api.action.ActionSpec;
import com.adminframe.api.action.ActionTaskStatus;
import com.adminframe.api.action.TaskState;
import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.core.adapter.memory.InMemoryModelAdapter;
import com.adminframe.core.event.EventBus;
import com.adminframe.core.support.BlogFixtures;
import com.adminframe.core.support.BlogFixtures.PostDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ActionTaskManager 单元测试")
class ActionTaskManagerTest {

    private static final ContentType POST = new ContentType(new ContentTypeId(1), "blog", "post", "blog.post", false);

    /**
     * 只计数不修改数据的动作
     */
    static class CountingAction implements AdminAction<Map<String, Object>> {

        final List<Integer> batchSizes = new CopyOnWriteArrayList<>();

        @Override
        public ActionSpec spec() {
            return ActionSpec.builder().name("touch").label("Touch").build();
        }

        @Override
        public BatchOutcome apply(ActionContext<Map<String, Object>> context, List<Map<String, Object>> batch) {
            batchSizes.add(batch.size());
            return new BatchOutcome(batch.size(), 0, List.of());
        }
    }

    /**
     * 记录每一次检查点
     */
    static class RecordingStore extends InMemoryTaskCheckpointStore {

        final List<ActionTaskStatus> saved = new CopyOnWriteArrayList<>();

        @Override
        public void save(ActionTaskStatus status) {
            saved.add(status);
            super.save(status);
        }
    }

    private RecordingStore store;
    private EventBus eventBus;
    private ActionTaskManager manager;
    private InMemoryModelAdapter adapter;
    private ActionContext<Map<String, Object>> context;

    @BeforeEach
    void setUp() {
        store = new RecordingStore();
        eventBus = new EventBus();
        manager = new ActionTaskManager(Executors.newSingleThreadExecutor(), 10, store, eventBus, Clock.systemUTC());
        adapter = BlogFixtures.posts(25);
        context = new ActionContext<>(POST, new PostDescriptor(adapter), BlogFixtures.ROOT, Map.of());
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private ActionTaskStatus awaitTerminal(String handle) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        ActionTaskStatus status = manager.status(handle);
        while (!status.state().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            status = manager.status(handle);
        }
        return status;
    }

    @Test
    @DisplayName("按批执行并在每批之后写检查点")
    void runsInBatchesWithCheckpoints() throws InterruptedException {
        CountingAction action = new CountingAction();
        List<ActionTaskEvent> events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(ActionTaskEvent.class, events::add);

        String handle = manager.submit(context, action, adapter.all(), 25);
        ActionTaskStatus status = awaitTerminal(handle);

        assertEquals(TaskState.COMPLETED, status.state());
        assertEquals(List.of(10, 10, 5), action.batchSizes);
        assertEquals(25, status.processed());
        assertEquals(25, status.affected());
        assertEquals("25", status.lastPk());

        List<String> checkpoints = store.saved.stream()
                .filter(s -> s.state() == TaskState.RUNNING && s.processed() > 0)
                .map(ActionTaskStatus::lastPk)
                .toList();
        assertEquals(List.of("10", "20", "25"), checkpoints);
        assertEquals(TaskState.SCHEDULED, store.saved.get(0).state());

        // 等待工作线程退出，Finished 事件在最后一次检查点之后发布
        manager.close();
        assertInstanceOf(ActionTaskEvent.Scheduled.class, events.get(0));
        assertInstanceOf(ActionTaskEvent.Finished.class, events.get(events.size() - 1));
    }

    @Test
    @DisplayName("取消后不再启动新的批次")
    void cancelStopsBeforeNextBatch() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger batches = new AtomicInteger();
        AdminAction<Map<String, Object>> blocking = new CountingAction() {
            @Override
            public BatchOutcome apply(ActionContext<Map<String, Object>> ctx, List<Map<String, Object>> batch) {
                batches.incrementAndGet();
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.apply(ctx, batch);
            }
        };

        String handle = manager.submit(context, blocking, adapter.all(), 25);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(manager.cancel(handle));
        assertTrue(manager.status(handle).cancelRequested());
        release.countDown();

        ActionTaskStatus status = awaitTerminal(handle);
        assertEquals(TaskState.CANCELLED, status.state());
        assertEquals(1, batches.get());
        assertEquals(10, status.processed());
        assertTrue(status.cancelRequested());
        assertFalse(manager.cancel(handle), "已结束的任务不能再次取消");
    }

    @Test
    @DisplayName("动作抛出异常时任务失败并保留已完成的进度")
    void failureKeepsPartialProgress() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        AdminAction<Map<String, Object>> failing = new CountingAction() {
            @Override
            public BatchOutcome apply(ActionContext<Map<String, Object>> ctx, List<Map<String, Object>> batch) {
                if (calls.incrementAndGet() == 2) {
                    throw new IllegalStateException("boom");
                }
                return super.apply(ctx, batch);
            }
        };

        String handle = manager.submit(context, failing, adapter.all(), 25);
        ActionTaskStatus status = awaitTerminal(handle);

        assertEquals(TaskState.FAILED, status.state());
        assertEquals(10, status.processed());
        assertEquals("10", status.lastPk());
        assertTrue(status.errors().contains("Task aborted: boom"));
    }

    @Test
    @DisplayName("未知句柄返回 404")
    void unknownHandle() {
        assertThrows(NotFoundException.class, () -> manager.status("nope"));
        assertThrows(NotFoundException.class, () -> manager.cancel("nope"));
    }
}
