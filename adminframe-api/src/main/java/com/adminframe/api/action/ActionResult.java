package com.adminframe.api.action;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 动作执行结果
 * <p>
 * 同步执行时返回 ok/affected/skipped/errors；转入后台时 background=true 并携带任务句柄。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResult(
        boolean ok,
        int affected,
        int skipped,
        List<String> errors,
        Boolean background,
        @JsonProperty("task_handle") String taskHandle
) {

    public ActionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ActionResult inline(int affected, int skipped, List<String> errors) {
        return new ActionResult(true, affected, skipped, errors, null, null);
    }

    public static ActionResult deferred(String taskHandle) {
        return new ActionResult(true, 0, 0, List.of(), Boolean.TRUE, taskHandle);
    }
}
