package com.adminframe.api.event;

import lombok.Getter;

import java.io.Serializable;

/**
 * 框架事件基类
 */
@Getter
public abstract class AbstractAdminEvent implements AdminEvent, Serializable {
    private final long timestamp;

    protected AbstractAdminEvent() {
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "[timestamp=" + timestamp + "]";
    }
}
