package com.adminframe.core.action;

import com.adminframe.api.action.ActionTaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * 后台任务检查点存储，每个批次结束后写入一次
 */
public interface TaskCheckpointStore {

    void save(ActionTaskStatus status);

    Optional<ActionTaskStatus> find(String handle);

    List<ActionTaskStatus> findAll();
}
