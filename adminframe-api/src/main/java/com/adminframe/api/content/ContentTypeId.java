package com.adminframe.api.content;

/**
 * 内容类型的稳定标识
 */
public record ContentTypeId(long value) {

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
