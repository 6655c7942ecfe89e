package com.adminframe.api.security;

import com.adminframe.api.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 权限动作枚举
 * 定义了授权与鉴权时的操作类型：查看、新增、修改、删除。
 *
 * @author AdminFrame
 */
public enum PermAction {
    VIEW,
    ADD,
    CHANGE,
    DELETE;

    /**
     * 对外的小写编码，例如 "view"
     */
    @JsonValue
    public String codename() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PermAction fromCodename(String codename) {
        if (codename != null) {
            for (PermAction action : values()) {
                if (action.codename().equals(codename.trim().toLowerCase(Locale.ROOT))) {
                    return action;
                }
            }
        }
        throw new ValidationException("action", "Unknown permission action: " + codename);
    }
}
