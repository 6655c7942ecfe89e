package com.adminframe.core.action;

import com.adminframe.api.action.ActionTaskStatus;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存检查点存储（进程重启后丢失）
 * <p>
 * 未结束的任务一直保留；结束的任务按保留时长和数量上限淘汰。
 */
public class InMemoryTaskCheckpointStore implements TaskCheckpointStore {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);
    public static final long DEFAULT_MAX_FINISHED = 1_000;

    private final Map<String, ActionTaskStatus> active = new ConcurrentHashMap<>();
    private final Cache<String, ActionTaskStatus> finished;

    public InMemoryTaskCheckpointStore() {
        this(DEFAULT_RETENTION, DEFAULT_MAX_FINISHED);
    }

    public InMemoryTaskCheckpointStore(Duration retention, long maxFinished) {
        this(retention, maxFinished, Ticker.systemTicker());
    }

    InMemoryTaskCheckpointStore(Duration retention, long maxFinished, Ticker ticker) {
        this.finished = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maxFinished)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public synchronized void save(ActionTaskStatus status) {
        if (status.state().isTerminal()) {
            active.remove(status.handle());
            finished.put(status.handle(), status);
        } else {
            finished.invalidate(status.handle());
            active.put(status.handle(), status);
        }
    }

    @Override
    public Optional<ActionTaskStatus> find(String handle) {
        ActionTaskStatus status = active.get(handle);
        if (status == null) {
            status = finished.getIfPresent(handle);
        }
        return Optional.ofNullable(status);
    }

    @Override
    public List<ActionTaskStatus> findAll() {
        List<ActionTaskStatus> all = new ArrayList<>(active.values());
        all.addAll(finished.asMap().values());
        return all;
    }

    public long finishedCount() {
        finished.cleanUp();
        return finished.estimatedSize();
    }
}
