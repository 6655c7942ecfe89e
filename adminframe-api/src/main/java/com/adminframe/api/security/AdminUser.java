package com.adminframe.api.security;

/**
 * 鉴权主体
 * <p>
 * 组成员关系不在此处保存，由 {@link GrantRepository} 维护，保证成员变更能立即被鉴权感知。
 *
 * @param id        主体唯一标识
 * @param username  登录名
 * @param active    是否启用
 * @param staff     是否允许进入管理后台
 * @param superuser 超级管理员，跳过所有授权查询
 */
public record AdminUser(String id, String username, boolean active, boolean staff, boolean superuser) {

    public static AdminUser staff(String id, String username) {
        return new AdminUser(id, username, true, true, false);
    }

    public static AdminUser superuser(String id, String username) {
        return new AdminUser(id, username, true, true, true);
    }
}
