package com.adminframe.core.action;

import com.adminframe.api.action.TaskState;
import com.adminframe.api.event.AdminEvent;

/**
 * 后台动作任务事件
 */
public sealed interface ActionTaskEvent extends AdminEvent {

    String handle();

    record Scheduled(String handle, String contentType, String action, long total) implements ActionTaskEvent {
    }

    record BatchCompleted(String handle, long processed, long affected) implements ActionTaskEvent {
    }

    record Finished(String handle, TaskState state, long affected, long skipped) implements ActionTaskEvent {
    }
}
