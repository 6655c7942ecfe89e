package com.adminframe.core.security;

/**
 * 授予 change / delete 时对 view 的处理策略
 * <p>
 * 无论哪种策略，鉴权本身都不会从 change 推断出 view。
 */
public enum GrantPolicy {
    /**
     * 同时授予 view（默认）
     */
    IMPLY_VIEW,
    /**
     * 未持有 view 时拒绝授予
     */
    STRICT,
    /**
     * 仅记录警告
     */
    ADVISORY
}
