package com.adminframe.core.action;

import com.adminframe.api.action.ActionTaskStatus;
import com.adminframe.api.action.TaskState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YamlTaskCheckpointStore 单元测试")
class YamlTaskCheckpointStoreTest {

    @TempDir
    Path tempDir;

    private static ActionTaskStatus status(String handle, TaskState state, long processed, String lastPk) {
        return new ActionTaskStatus(handle, "blog.post", "delete_selected", state, 250, processed, processed, 0,
                List.of("7: permission denied"), false, lastPk, 1_000L, 2_000L);
    }

    @Test
    @DisplayName("重新加载后保留检查点")
    void checkpointsSurviveReload() {
        Path file = tempDir.resolve("tasks/checkpoints.yml");
        YamlTaskCheckpointStore store = new YamlTaskCheckpointStore(file);
        store.save(status("t-1", TaskState.COMPLETED, 250, "250"));

        assertTrue(Files.exists(file));

        YamlTaskCheckpointStore reloaded = new YamlTaskCheckpointStore(file);
        ActionTaskStatus loaded = reloaded.find("t-1").orElseThrow();
        assertEquals(status("t-1", TaskState.COMPLETED, 250, "250"), loaded);
    }

    @Test
    @DisplayName("未结束的任务在重启后标记为失败")
    void runningTaskIsMarkedInterrupted() {
        Path file = tempDir.resolve("checkpoints.yml");
        new YamlTaskCheckpointStore(file).save(status("t-2", TaskState.RUNNING, 100, "100"));

        ActionTaskStatus loaded = new YamlTaskCheckpointStore(file).find("t-2").orElseThrow();

        assertEquals(TaskState.FAILED, loaded.state());
        assertEquals(100, loaded.processed());
        assertEquals("100", loaded.lastPk());
        assertTrue(loaded.errors().contains(YamlTaskCheckpointStore.INTERRUPTED));
    }

    @Test
    @DisplayName("损坏的文件不会阻止启动")
    void corruptFileIsIgnored() throws IOException {
        Path file = tempDir.resolve("checkpoints.yml");
        Files.writeString(file, "::: not yaml [");

        YamlTaskCheckpointStore store = new YamlTaskCheckpointStore(file);

        assertTrue(store.findAll().isEmpty());
    }
}
