package com.adminframe.starter.web;

import com.adminframe.api.security.PermAction;
import lombok.Getter;

/**
 * 每个资源挂载的固定端点集合
 * <p>
 * gate 为 null 的端点由处理方法自行决定权限（表单描述按模式区分 add / change）。
 */
@Getter
public enum AdminEndpoint {

    LIST("/_list", "GET", "list", PermAction.VIEW),
    CREATE("", "POST", "create", PermAction.ADD),
    RETRIEVE("/{pk}", "GET", "retrieve", PermAction.VIEW),
    UPDATE("/{pk}", "PUT", "update", PermAction.CHANGE),
    PARTIAL_UPDATE("/{pk}", "PATCH", "partialUpdate", PermAction.CHANGE),
    DELETE("/{pk}", "DELETE", "delete", PermAction.DELETE),
    ACTIONS("/_actions", "GET", "actions", PermAction.VIEW),
    ACTION_TOKEN("/_actions/token", "POST", "actionToken", PermAction.VIEW),
    ACTION_PREVIEW("/_actions/preview", "POST", "actionPreview", PermAction.VIEW),
    ACTION_RUN("/_actions/{action}", "POST", "actionRun", PermAction.VIEW),
    TASK_STATUS("/_actions/tasks/{handle}", "GET", "taskStatus", PermAction.VIEW),
    TASK_CANCEL("/_actions/tasks/{handle}/cancel", "POST", "taskCancel", PermAction.CHANGE),
    SCHEMA("/_schema", "GET", "schema", null),
    FILTERS("/_filters", "GET", "filters", PermAction.VIEW);

    /**
     * 相对资源根路径的后缀
     */
    private final String suffix;
    private final String httpMethod;
    /**
     * {@link AdminDispatchController} 上的处理方法名
     */
    private final String handlerName;
    private final PermAction gate;

    AdminEndpoint(String suffix, String httpMethod, String handlerName, PermAction gate) {
        this.suffix = suffix;
        this.httpMethod = httpMethod;
        this.handlerName = handlerName;
        this.gate = gate;
    }
}
