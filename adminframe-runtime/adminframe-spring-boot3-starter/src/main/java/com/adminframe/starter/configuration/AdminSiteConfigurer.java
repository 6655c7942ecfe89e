package com.adminframe.starter.configuration;

import com.adminframe.core.site.AdminSite;

/**
 * 宿主注册资源的扩展点
 * <p>
 * 所有实现在上下文刷新后、路由挂载前被调用一次，之后站点即被冻结。
 */
@FunctionalInterface
public interface AdminSiteConfigurer {

    void configure(AdminSite site);
}
