package com.adminframe.api.action;

/**
 * 后台动作任务状态
 */
public enum TaskState {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
