package com.adminframe.api.exception;

/**
 * 配置错误（注册冲突、描述符钩子返回非法结果、重复的动作名等）。
 * 启动阶段抛出即视为致命错误。
 */
public class ConfigurationException extends AdminException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
