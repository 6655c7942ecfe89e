package com.adminframe.core.query;

/**
 * 分页窗口，在流水线结果上截取
 */
public record PageRequest(int page, int perPage) {

    public int offset() {
        return Math.toIntExact(Math.multiplyExact((long) page - 1, perPage));
    }
}
