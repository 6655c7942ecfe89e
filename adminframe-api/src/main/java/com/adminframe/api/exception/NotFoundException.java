package com.adminframe.api.exception;

/**
 * 资源不存在（未知的内容类型、被行级安全过滤掉的对象、未知的动作或任务句柄），对外映射为 404。
 * <p>
 * 消息仅用于日志，不会回显给调用方。
 */
public class NotFoundException extends AdminException {

    public NotFoundException(String message) {
        super(message);
    }
}
