package com.adminframe.api.exception;

/**
 * AdminFrame 基础异常
 *
 * @author AdminFrame
 */
public class AdminException extends RuntimeException {

    public AdminException(String message) {
        super(message);
    }

    public AdminException(String message, Throwable cause) {
        super(message, cause);
    }
}
