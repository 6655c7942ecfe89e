package com.adminframe.starter.web;

import com.adminframe.api.action.ActionResult;
import com.adminframe.api.action.ActionScope;
import com.adminframe.api.exception.AuthenticationRequiredException;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.PermAction;
import com.adminframe.api.security.PermissionChecker;
import com.adminframe.core.action.ActionRunner;
import com.adminframe.core.query.ListQuery;
import com.adminframe.core.query.ListQueryParser;
import com.adminframe.core.service.AdminService;
import com.adminframe.core.site.RegisteredModel;
import com.adminframe.starter.security.AdminSubjectResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * 资源端点的处理方法
 * <p>
 * 由 {@link AdminRouteManager} 动态映射，不使用注解路由。每个方法先解析主体、执行路由上预绑定的权限闸门，
 * 再交给 {@link AdminService} 或 {@link ActionRunner}。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class AdminDispatchController {

    private final AdminRouteManager routeManager;
    private final AdminSubjectResolver subjectResolver;
    private final PermissionChecker permissionChecker;
    private final ListQueryParser listQueryParser;
    private final AdminService adminService;
    private final ActionRunner actionRunner;

    // ==================== CRUD ====================

    public ResponseEntity<Object> list(HttpServletRequest request, @RequestParam Map<String, String> params) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        ListQuery query = listQueryParser.fromParams(params);
        return ResponseEntity.ok(adminService.list(route.getModel(), query, subject));
    }

    public ResponseEntity<Object> retrieve(HttpServletRequest request, @PathVariable("pk") String pk) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        return ResponseEntity.ok(adminService.retrieve(route.getModel(), pk, subject));
    }

    public ResponseEntity<Object> create(HttpServletRequest request,
                                         @RequestBody(required = false) Map<String, Object> payload) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        return ResponseEntity.status(HttpStatus.CREATED).body(adminService.create(route.getModel(), payload, subject));
    }

    public ResponseEntity<Object> update(HttpServletRequest request, @PathVariable("pk") String pk,
                                         @RequestBody(required = false) Map<String, Object> payload) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        return ResponseEntity.ok(adminService.update(route.getModel(), pk, payload, subject, false));
    }

    public ResponseEntity<Object> partialUpdate(HttpServletRequest request, @PathVariable("pk") String pk,
                                                @RequestBody(required = false) Map<String, Object> payload) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        return ResponseEntity.ok(adminService.update(route.getModel(), pk, payload, subject, true));
    }

    public ResponseEntity<Object> delete(HttpServletRequest request, @PathVariable("pk") String pk) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        adminService.delete(route.getModel(), pk, subject);
        return ResponseEntity.noContent().build();
    }

    // ==================== 元数据 ====================

    public ResponseEntity<Object> schema(HttpServletRequest request,
                                         @RequestParam(value = "mode", required = false) String mode,
                                         @RequestParam(value = "pk", required = false) String pk) {
        AdminRouteMetadata route = route(request);
        String effectiveMode = mode == null || mode.isBlank() ? (pk == null ? "add" : "edit") : mode.trim();
        AdminUser subject = switch (effectiveMode) {
            case "add" -> gate(request, route, PermAction.ADD);
            case "edit" -> {
                if (pk == null || pk.isBlank()) {
                    throw new ValidationException("pk", "Edit mode requires a primary key");
                }
                yield gate(request, route, PermAction.CHANGE);
            }
            default -> throw new ValidationException("mode", "Expected 'add' or 'edit'");
        };
        String target = "add".equals(effectiveMode) ? null : pk;
        return ResponseEntity.ok(adminService.schema(route.getModel(), target, subject));
    }

    public ResponseEntity<Object> filters(HttpServletRequest request) {
        AdminRouteMetadata route = route(request);
        gate(request, route);
        return ResponseEntity.ok(Map.of("filters", adminService.filters(route.getModel())));
    }

    // ==================== 动作 ====================

    public ResponseEntity<Object> actions(HttpServletRequest request) {
        AdminRouteMetadata route = route(request);
        gate(request, route);
        return ResponseEntity.ok(Map.of("actions", actionRunner.listActions(route.getModel())));
    }

    public ResponseEntity<Object> actionToken(HttpServletRequest request,
                                              @RequestBody(required = false) ActionRequest body) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        ActionScope scope = scopeOf(route.getModel(), body, subject);
        return ResponseEntity.ok(Map.of("scope_token", actionRunner.issueToken(route.getModel(), scope, subject)));
    }

    public ResponseEntity<Object> actionPreview(HttpServletRequest request,
                                                @RequestBody(required = false) ActionRequest body) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        ActionScope scope = scopeOf(route.getModel(), body, subject);
        return ResponseEntity.ok(Map.of("count", actionRunner.preview(route.getModel(), scope, subject)));
    }

    public ResponseEntity<Object> actionRun(HttpServletRequest request, @PathVariable("action") String action,
                                            @RequestBody(required = false) ActionRequest body) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        ActionScope scope = scopeOf(route.getModel(), body, subject);
        ActionResult result = actionRunner.run(route.getModel(), action, scope, body.getParams(), subject);
        HttpStatus status = Boolean.TRUE.equals(result.background()) ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    public ResponseEntity<Object> taskStatus(HttpServletRequest request, @PathVariable("handle") String handle) {
        AdminRouteMetadata route = route(request);
        gate(request, route);
        return ResponseEntity.ok(actionRunner.taskStatus(route.getModel(), handle));
    }

    public ResponseEntity<Object> taskCancel(HttpServletRequest request, @PathVariable("handle") String handle) {
        AdminRouteMetadata route = route(request);
        AdminUser subject = gate(request, route);
        boolean cancelled = actionRunner.cancelTask(route.getModel(), handle);
        log.info("[AdminFrame] {} requested cancel of task {}: {}", subject.id(), handle, cancelled);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    // ==================== 兜底 ====================

    /**
     * API 前缀下未匹配到任何资源端点
     */
    public ResponseEntity<Object> notFound(HttpServletRequest request) {
        throw new NotFoundException("No admin route for " + request.getMethod() + " " + request.getRequestURI());
    }

    // ==================== 内部方法 ====================

    private AdminRouteMetadata route(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        AdminRouteMetadata route = pattern == null ? null : routeManager.match(request.getMethod(), pattern.toString());
        if (route == null) {
            throw new NotFoundException("No admin route for " + request.getRequestURI());
        }
        return route;
    }

    private AdminUser gate(HttpServletRequest request, AdminRouteMetadata route) {
        return gate(request, route, route.getEndpoint().getGate());
    }

    private AdminUser gate(HttpServletRequest request, AdminRouteMetadata route, PermAction action) {
        AdminUser subject = subjectResolver.resolve(request);
        if (subject == null) {
            throw new AuthenticationRequiredException("No authenticated admin subject");
        }
        permissionChecker.require(subject, action, route.getModel().permissionTarget());
        log.debug("[AdminFrame] {} passed {} gate on {}", subject.id(), action.codename(),
                route.getModel().contentType().dottedName());
        return subject;
    }

    private ActionScope scopeOf(RegisteredModel<?> model, ActionRequest body, AdminUser subject) {
        if (body != null) {
            if (body.getScopeToken() != null && !body.getScopeToken().isBlank()) {
                return actionRunner.resolveToken(model, body.getScopeToken(), subject);
            }
            if (body.getScope() != null) {
                return body.getScope();
            }
            if (body.getIds() != null) {
                return ActionScope.ofIds(body.getIds());
            }
            if (body.getQuery() != null) {
                return ActionScope.ofQuery(body.getQuery());
            }
        }
        throw new ValidationException("scope", "One of scope_token, scope, ids or query is required");
    }
}
