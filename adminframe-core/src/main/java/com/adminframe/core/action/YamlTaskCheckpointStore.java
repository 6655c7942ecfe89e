package com.adminframe.core.action;

import com.adminframe.api.action.ActionTaskStatus;
import com.adminframe.api.action.TaskState;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本地 YAML 文件检查点存储
 * 职责：进程重启后仍能报告任务最后一次检查点的部分完成情况，不依赖数据库
 * <p>
 * 加载时仍处于 SCHEDULED / RUNNING 的任务被标记为 FAILED。
 */
@Slf4j
public class YamlTaskCheckpointStore implements TaskCheckpointStore {

    static final String INTERRUPTED = "Task interrupted by process restart";

    private final Map<String, ActionTaskStatus> statuses = new ConcurrentHashMap<>();
    private final Path storePath;

    public YamlTaskCheckpointStore(Path storePath) {
        this.storePath = storePath;
        load();
    }

    @Override
    public synchronized void save(ActionTaskStatus status) {
        statuses.put(status.handle(), status);
        flush();
    }

    @Override
    public Optional<ActionTaskStatus> find(String handle) {
        return Optional.ofNullable(statuses.get(handle));
    }

    @Override
    public List<ActionTaskStatus> findAll() {
        return new ArrayList<>(statuses.values());
    }

    // ==================== 持久化 ====================

    @SuppressWarnings("unchecked")
    private void load() {
        if (!Files.exists(storePath)) return;

        try (Reader reader = Files.newBufferedReader(storePath, StandardCharsets.UTF_8)) {
            Yaml yaml = new Yaml(new LoaderOptions());
            Map<String, Map<String, Object>> loaded = yaml.load(reader);
            if (loaded == null) return;

            int interrupted = 0;
            for (Map.Entry<String, Map<String, Object>> entry : loaded.entrySet()) {
                ActionTaskStatus status = fromMap(entry.getKey(), entry.getValue());
                if (!status.state().isTerminal()) {
                    status = markInterrupted(status);
                    interrupted++;
                }
                statuses.put(status.handle(), status);
            }
            log.info("[AdminFrame] Loaded {} task checkpoints from {} ({} interrupted)",
                    statuses.size(), storePath, interrupted);
        } catch (Exception e) {
            log.error("[AdminFrame] Failed to load task checkpoints from {}", storePath, e);
        }
    }

    private void flush() {
        try {
            Path parent = storePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            DumperOptions options = new DumperOptions();
            options.setIndent(2);
            options.setPrettyFlow(true);
            options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
            Yaml yaml = new Yaml(new Representer(options), options);

            Map<String, Object> document = new LinkedHashMap<>();
            statuses.values().stream()
                    .sorted((a, b) -> Long.compare(a.createdAt(), b.createdAt()))
                    .forEach(status -> document.put(status.handle(), toMap(status)));

            try (Writer writer = Files.newBufferedWriter(storePath, StandardCharsets.UTF_8)) {
                yaml.dump(document, writer);
            }
        } catch (IOException e) {
            log.error("[AdminFrame] Failed to save task checkpoints to {}", storePath, e);
        }
    }

    private static ActionTaskStatus markInterrupted(ActionTaskStatus status) {
        List<String> errors = new ArrayList<>(status.errors());
        errors.add(INTERRUPTED);
        return new ActionTaskStatus(status.handle(), status.contentType(), status.action(), TaskState.FAILED,
                status.total(), status.processed(), status.affected(), status.skipped(), errors,
                status.cancelRequested(), status.lastPk(), status.createdAt(), status.updatedAt());
    }

    private static Map<String, Object> toMap(ActionTaskStatus status) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("contentType", status.contentType());
        map.put("action", status.action());
        map.put("state", status.state().name());
        map.put("total", status.total());
        map.put("processed", status.processed());
        map.put("affected", status.affected());
        map.put("skipped", status.skipped());
        map.put("errors", new ArrayList<>(status.errors()));
        map.put("cancelRequested", status.cancelRequested());
        map.put("lastPk", status.lastPk());
        map.put("createdAt", status.createdAt());
        map.put("updatedAt", status.updatedAt());
        return map;
    }

    @SuppressWarnings("unchecked")
    private static ActionTaskStatus fromMap(String handle, Map<String, Object> map) {
        return new ActionTaskStatus(
                handle,
                (String) map.get("contentType"),
                (String) map.get("action"),
                TaskState.valueOf((String) map.get("state")),
                toLong(map.get("total")),
                toLong(map.get("processed")),
                toLong(map.get("affected")),
                toLong(map.get("skipped")),
                (List<String>) map.getOrDefault("errors", List.of()),
                Boolean.TRUE.equals(map.get("cancelRequested")),
                (String) map.get("lastPk"),
                toLong(map.get("createdAt")),
                toLong(map.get("updatedAt")));
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
