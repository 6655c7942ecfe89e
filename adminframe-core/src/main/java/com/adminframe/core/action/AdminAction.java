package com.adminframe.core.action;

import com.adminframe.api.action.ActionSpec;

import java.util.List;

/**
 * 批量动作
 * <p>
 * {@link #apply} 每次只收到一批对象；大范围动作会被分批多次调用，批与批之间没有回滚。
 * 逐条失败应记录在 {@link BatchOutcome} 中，而不是抛出。
 *
 * @param <T> 模型对象类型
 */
public interface AdminAction<T> {

    ActionSpec spec();

    BatchOutcome apply(ActionContext<T> context, List<T> batch);
}
