package com.adminframe.api.exception;

/**
 * 权限拒绝异常
 * 当主体尝试执行未经授权的操作时抛出此异常，对外映射为 403。
 *
 * @author AdminFrame
 */
public class PermissionDeniedException extends AdminException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
