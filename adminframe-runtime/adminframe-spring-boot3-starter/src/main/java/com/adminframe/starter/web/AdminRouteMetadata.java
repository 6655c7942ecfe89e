package com.adminframe.starter.web;

import com.adminframe.core.site.RegisteredModel;
import lombok.Builder;
import lombok.Data;

import java.lang.reflect.Method;

@Data
@Builder
public class AdminRouteMetadata {
    // 资源信息
    private RegisteredModel<?> model;
    private AdminEndpoint endpoint;

    // 路由信息
    private String urlPattern;      // 完整 URL，例如 /admin/api/orm/blog/post/{pk}
    private String httpMethod;      // GET, POST, etc.
    private Method handlerMethod;   // AdminDispatchController 上的处理方法
}
