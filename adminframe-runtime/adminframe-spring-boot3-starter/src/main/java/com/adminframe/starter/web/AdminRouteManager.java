package com.adminframe.starter.web;

import com.adminframe.api.exception.ConfigurationException;
import com.adminframe.core.site.AdminSite;
import com.adminframe.core.site.RegisteredModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 路由构建器
 * <p>
 * 为每个已注册资源把固定端点集合注册进宿主的 Spring MVC，并记录 "URL 模式 + 方法" 到资源的映射。
 * 这里不做任何业务判断；API 前缀下的兜底路由负责把未知资源映射为 404。
 */
@Slf4j
public class AdminRouteManager {

    static final String NOT_FOUND_HANDLER = "notFound";

    private final Map<String, AdminRouteMetadata> routeMap = new ConcurrentHashMap<>();
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    private RequestMappingHandlerMapping hostMapping;
    private AdminDispatchController controller;

    // 初始化方法，由 AutoConfiguration 调用
    public void init(RequestMappingHandlerMapping mapping, AdminDispatchController controller) {
        this.hostMapping = mapping;
        this.controller = controller;
    }

    /**
     * 挂载站点中的全部资源
     *
     * @return 注册的路由数
     */
    public int mount(AdminSite site, String apiPrefix, String settingsPrefix) {
        if (hostMapping == null) {
            throw new ConfigurationException("AdminRouteManager not initialized, cannot mount admin routes");
        }
        Map<String, Method> handlers = handlerMethods();
        String api = normalize(apiPrefix);
        String settings = normalize(settingsPrefix);

        int mounted = 0;
        for (RegisteredModel<?> model : site.models()) {
            String base = (model.settings() ? settings : api) + "/" + model.appLabel() + "/" + model.modelSlug();
            for (AdminEndpoint endpoint : AdminEndpoint.values()) {
                Method method = handlers.get(endpoint.getHandlerName());
                String url = base + endpoint.getSuffix();
                register(AdminRouteMetadata.builder()
                        .model(model)
                        .endpoint(endpoint)
                        .urlPattern(url)
                        .httpMethod(endpoint.getHttpMethod())
                        .handlerMethod(method)
                        .build());
                mounted++;
                if (endpoint == AdminEndpoint.CREATE) {
                    // 同时接受带尾斜杠的 POST .../
                    register(AdminRouteMetadata.builder()
                            .model(model)
                            .endpoint(endpoint)
                            .urlPattern(url + "/")
                            .httpMethod(endpoint.getHttpMethod())
                            .handlerMethod(method)
                            .build());
                }
            }
        }

        Method notFound = handlers.get(NOT_FOUND_HANDLER);
        for (String prefix : List.of(api, settings)) {
            RequestMappingInfo info = RequestMappingInfo.paths(prefix + "/**")
                    .options(hostMapping.getBuilderConfiguration())
                    .build();
            hostMapping.registerMapping(info, controller, notFound);
        }
        log.info("[AdminFrame] Mounted {} admin routes for {} resources", mounted, site.models().size());
        return mounted;
    }

    public void register(AdminRouteMetadata metadata) {
        String url = metadata.getUrlPattern();
        String key = key(metadata.getHttpMethod(), url);
        if (routeMap.putIfAbsent(key, metadata) != null) {
            throw new ConfigurationException("Admin route already mapped: " + metadata.getHttpMethod() + " " + url);
        }

        RequestMappingInfo info = RequestMappingInfo
                .paths(url)
                .methods(RequestMethod.valueOf(metadata.getHttpMethod()))
                .options(hostMapping.getBuilderConfiguration())
                .build();
        hostMapping.registerMapping(info, controller, metadata.getHandlerMethod());

        log.debug("[AdminFrame] Mapped: {} {} -> {}", metadata.getHttpMethod(), url, metadata.getEndpoint());
    }

    /**
     * 按匹配到的 URL 模式查找路由
     */
    public AdminRouteMetadata match(String httpMethod, String pattern) {
        AdminRouteMetadata exact = routeMap.get(key(httpMethod, pattern));
        if (exact != null) {
            return exact;
        }
        for (AdminRouteMetadata metadata : routeMap.values()) {
            if (metadata.getHttpMethod().equals(httpMethod) && pathMatcher.match(metadata.getUrlPattern(), pattern)) {
                return metadata;
            }
        }
        return null;
    }

    public int size() {
        return routeMap.size();
    }

    private static Map<String, Method> handlerMethods() {
        Map<String, Method> methods = new HashMap<>();
        for (Method method : AdminDispatchController.class.getMethods()) {
            if (method.getDeclaringClass() == AdminDispatchController.class) {
                methods.put(method.getName(), method);
            }
        }
        for (AdminEndpoint endpoint : AdminEndpoint.values()) {
            if (!methods.containsKey(endpoint.getHandlerName())) {
                throw new ConfigurationException("Missing admin handler method: " + endpoint.getHandlerName());
            }
        }
        return methods;
    }

    private static String key(String httpMethod, String url) {
        return httpMethod + " " + url;
    }

    private static String normalize(String prefix) {
        String value = prefix == null ? "" : prefix.trim();
        if (!value.startsWith("/")) {
            value = "/" + value;
        }
        while (value.endsWith("/") && value.length() > 1) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
