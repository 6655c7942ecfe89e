package com.adminframe.api.action;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 后台动作任务的状态快照
 *
 * @param handle          任务句柄
 * @param contentType     内容类型点分名
 * @param action          动作名
 * @param state           状态
 * @param total           入队时的范围大小
 * @param processed       已处理条数
 * @param affected        成功条数
 * @param skipped         跳过条数
 * @param errors          逐条错误
 * @param cancelRequested 是否已请求取消
 * @param lastPk          最后一个已处理批次的最大主键（检查点）
 * @param createdAt       创建时间（毫秒）
 * @param updatedAt       最近一次检查点时间（毫秒）
 */
public record ActionTaskStatus(
        String handle,
        @JsonProperty("content_type") String contentType,
        String action,
        TaskState state,
        long total,
        long processed,
        long affected,
        long skipped,
        List<String> errors,
        @JsonProperty("cancel_requested") boolean cancelRequested,
        @JsonProperty("last_pk") String lastPk,
        @JsonProperty("created_at") long createdAt,
        @JsonProperty("updated_at") long updatedAt
) {

    public ActionTaskStatus {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
