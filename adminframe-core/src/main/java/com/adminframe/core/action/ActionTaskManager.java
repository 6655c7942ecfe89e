package com.adminframe.core.action;

import com.adminframe.api.action.ActionTaskStatus;
import com.adminframe.api.action.TaskState;
import com.adminframe.api.exception.AdminException;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.model.FilterOp;
import com.adminframe.api.model.FilterSpec;
import com.adminframe.api.model.ModelAdapter;
import com.adminframe.api.model.QuerySet;
import com.adminframe.core.event.EventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 后台动作任务管理器
 * 职责：分批执行大范围动作、每批写检查点、协作式取消、按句柄查询状态
 * <p>
 * 分批使用主键游标（pk > 上一批最大主键，按主键升序），不会一次性物化整个范围。
 * 批与批之间不回滚，部分完成通过 affected / errors 报告。
 *
 * @author AdminFrame
 */
@Slf4j
public class ActionTaskManager implements AutoCloseable {

    private final ExecutorService executor;
    private final TaskCheckpointStore store;
    private final EventBus eventBus;
    private final int batchSize;
    private final Clock clock;

    // 运行中任务的取消标记
    private final Map<String, TaskControl> controls = new ConcurrentHashMap<>();

    public ActionTaskManager(int workers, int batchSize, TaskCheckpointStore store, EventBus eventBus, Clock clock) {
        this(newExecutor(workers), batchSize, store, eventBus, clock);
    }

    public ActionTaskManager(ExecutorService executor, int batchSize, TaskCheckpointStore store,
                             EventBus eventBus, Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.executor = executor;
        this.batchSize = batchSize;
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    // ==================== 提交 ====================

    /**
     * 提交任务
     *
     * @param scope 已经过流水线的范围查询集
     * @param total 提交时的范围大小
     * @return 任务句柄
     */
    public <T> String submit(ActionContext<T> context, AdminAction<T> action, QuerySet<T> scope, long total) {
        String handle = UUID.randomUUID().toString();
        long now = clock.millis();
        ActionTaskStatus status = new ActionTaskStatus(handle, context.contentType().dottedName(),
                action.spec().getName(), TaskState.SCHEDULED, total, 0, 0, 0, List.of(), false, null, now, now);
        store.save(status);

        TaskControl control = new TaskControl();
        controls.put(handle, control);
        eventBus.publish(new ActionTaskEvent.Scheduled(handle, status.contentType(), status.action(), total));

        try {
            executor.execute(() -> runTask(handle, context, action, scope, control));
        } catch (RejectedExecutionException e) {
            controls.remove(handle);
            finish(status, TaskState.FAILED, new Progress(), control, List.of("Task executor rejected the task"));
            throw new AdminException("Action task executor is not accepting work", e);
        }
        log.info("[AdminFrame] Action task {} scheduled: {} on {} ({} objects)",
                handle, status.action(), status.contentType(), total);
        return handle;
    }

    // ==================== 查询与取消 ====================

    public ActionTaskStatus status(String handle) {
        return store.find(handle).orElseThrow(() -> new NotFoundException("Unknown task: " + handle));
    }

    /**
     * 请求取消：已开始的批次会完成，不再启动新的批次
     *
     * @return 任务尚未结束时返回 true
     */
    public boolean cancel(String handle) {
        status(handle);
        TaskControl control = controls.get(handle);
        if (control == null) {
            return false;
        }
        synchronized (control) {
            if (control.finished) {
                return false;
            }
            control.cancelRequested = true;
            ActionTaskStatus current = status(handle);
            store.save(copy(current, current.state(), current.processed(), current.affected(), current.skipped(),
                    current.errors(), true, current.lastPk()));
        }
        log.info("[AdminFrame] Cancellation requested for action task {}", handle);
        return true;
    }

    // ==================== 执行 ====================

    private <T> void runTask(String handle, ActionContext<T> context, AdminAction<T> action,
                             QuerySet<T> scope, TaskControl control) {
        ModelAdapter<T> adapter = context.descriptor().getAdapter();
        String pkField = context.descriptor().getMeta().pkField();
        Progress progress = new Progress();
        ActionTaskStatus status = status(handle);

        try {
            if (control.cancelRequested) {
                finish(status, TaskState.CANCELLED, progress, control, List.of());
                return;
            }
            status = checkpoint(status, TaskState.RUNNING, progress, control);

            while (true) {
                if (control.cancelRequested) {
                    finish(status, TaskState.CANCELLED, progress, control, List.of());
                    return;
                }

                QuerySet<T> page = scope.orderBy(List.of(pkField));
                if (progress.lastPk != null) {
                    page = page.filter(new FilterSpec(pkField, FilterOp.GT, progress.lastPk));
                }
                List<T> batch = page.slice(0, batchSize).fetch();
                if (batch.isEmpty()) {
                    break;
                }

                BatchOutcome outcome = action.apply(context, batch);
                progress.record(batch.size(), outcome, adapter.primaryKey(batch.get(batch.size() - 1)));
                status = checkpoint(status, TaskState.RUNNING, progress, control);
                eventBus.publish(new ActionTaskEvent.BatchCompleted(handle, progress.processed, progress.affected));

                if (batch.size() < batchSize) {
                    break;
                }
            }
            finish(status, TaskState.COMPLETED, progress, control, List.of());
        } catch (RuntimeException e) {
            log.error("[AdminFrame] Action task {} failed after {} objects", handle, progress.processed, e);
            finish(status, TaskState.FAILED, progress, control, List.of("Task aborted: " + e.getMessage()));
        } finally {
            controls.remove(handle);
        }
    }

    private ActionTaskStatus checkpoint(ActionTaskStatus status, TaskState state, Progress progress,
                                        TaskControl control) {
        synchronized (control) {
            ActionTaskStatus next = copy(status, state, progress.processed, progress.affected, progress.skipped,
                    progress.errors, control.cancelRequested, progress.lastPkText());
            store.save(next);
            return next;
        }
    }

    private void finish(ActionTaskStatus status, TaskState state, Progress progress, TaskControl control,
                        List<String> extraErrors) {
        List<String> errors = new ArrayList<>(progress.errors);
        errors.addAll(extraErrors);
        synchronized (control) {
            control.finished = true;
            boolean cancelRequested = control.cancelRequested || state == TaskState.CANCELLED;
            store.save(copy(status, state, progress.processed, progress.affected, progress.skipped,
                    errors, cancelRequested, progress.lastPkText()));
        }
        eventBus.publish(new ActionTaskEvent.Finished(status.handle(), state, progress.affected, progress.skipped));
        log.info("[AdminFrame] Action task {} {}: processed={}, affected={}, skipped={}",
                status.handle(), state, progress.processed, progress.affected, progress.skipped);
    }

    private ActionTaskStatus copy(ActionTaskStatus status, TaskState state, long processed, long affected,
                                  long skipped, List<String> errors, boolean cancelRequested, String lastPk) {
        return new ActionTaskStatus(status.handle(), status.contentType(), status.action(), state,
                status.total(), processed, affected, skipped, errors, cancelRequested, lastPk,
                status.createdAt(), clock.millis());
    }

    // ==================== 生命周期 ====================

    @Override
    public void close() {
        log.info("[AdminFrame] Shutting down action task executor...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutorService newExecutor(int workers) {
        AtomicInteger counter = new AtomicInteger();
        int size = Math.max(1, workers);
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                r -> {
                    Thread thread = new Thread(r, "adminframe-action-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    thread.setUncaughtExceptionHandler((t, e) ->
                            log.error("[AdminFrame] Uncaught exception in {}: {}", t.getName(), e.getMessage(), e));
                    return thread;
                });
    }

    // ===== 内部类 =====

    private static final class TaskControl {
        private volatile boolean cancelRequested;
        private boolean finished;
    }

    private static final class Progress {
        private long processed;
        private long affected;
        private long skipped;
        private final List<String> errors = new ArrayList<>();
        private Object lastPk;

        void record(int size, BatchOutcome outcome, Object batchLastPk) {
            processed += size;
            affected += outcome.affected();
            skipped += outcome.skipped();
            errors.addAll(outcome.errors());
            lastPk = batchLastPk;
        }

        String lastPkText() {
            return lastPk == null ? null : String.valueOf(lastPk);
        }
    }
}
