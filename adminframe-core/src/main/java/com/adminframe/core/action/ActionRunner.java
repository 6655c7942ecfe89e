package com.adminframe.core.action;

import com.adminframe.api.action.ActionResult;
import com.adminframe.api.action.ActionScope;
import com.adminframe.api.action.ActionSpec;
import com.adminframe.api.action.ActionTaskStatus;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.exception.TokenException;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.model.FilterSpec;
import com.adminframe.api.model.ModelAdapter;
import com.adminframe.api.model.QuerySet;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.PermissionChecker;
import com.adminframe.core.descriptor.ModelDescriptor;
import com.adminframe.core.query.ListCriteria;
import com.adminframe.core.query.QuerySetPipeline;
import com.adminframe.core.query.ScopeQueryBuilder;
import com.adminframe.core.site.RegisteredModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 动作执行器
 * <p>
 * run 的检查顺序：动作存在(404) → 范围类型(422) → required_perm(403) → 参数(422) → 破坏性确认(422)
 * → 解析范围 → 计数。范围不超过阈值时同步执行，否则交给 {@link ActionTaskManager}。
 * <p>
 * ids 范围走对象形态并按主键收窄；query 范围按保存的条件重建列表形态，与浏览时的行级安全一致。
 *
 * @author AdminFrame
 */
@Slf4j
@RequiredArgsConstructor
public class ActionRunner {

    private final QuerySetPipeline pipeline;
    private final ScopeQueryBuilder scopeQueryBuilder;
    private final PermissionChecker permissionChecker;
    private final ScopeTokenService tokenService;
    private final ActionTaskManager taskManager;
    private final int batchThreshold;

    // ==================== 元数据 ====================

    public List<ActionSpec> listActions(RegisteredModel<?> model) {
        return model.descriptor().getActions().stream().map(AdminAction::spec).toList();
    }

    public <T> AdminAction<T> findAction(RegisteredModel<T> model, String name) {
        for (AdminAction<T> action : model.descriptor().getActions()) {
            if (action.spec().getName().equals(name)) {
                return action;
            }
        }
        throw new NotFoundException("Unknown action '" + name + "' on " + model.contentType().dottedName());
    }

    // ==================== 范围令牌 ====================

    /**
     * 签发范围令牌；签发前按当前描述符校验范围
     */
    public String issueToken(RegisteredModel<?> model, ActionScope scope, AdminUser subject) {
        resolveScope(model, scope, subject);
        return tokenService.issue(model.contentType(), scope, subject);
    }

    /**
     * 校验令牌并要求其内容类型与主体都与当前请求一致
     */
    public ActionScope resolveToken(RegisteredModel<?> model, String token, AdminUser subject) {
        ScopeTokenPayload payload = tokenService.verify(token);
        if (!payload.contentType().equals(model.contentType().dottedName())) {
            throw new TokenException("Scope token was issued for another resource");
        }
        if (!Objects.equals(payload.subject(), subject.id())) {
            throw new TokenException("Scope token was issued for another subject");
        }
        return payload.scope();
    }

    // ==================== 执行 ====================

    public long preview(RegisteredModel<?> model, ActionScope scope, AdminUser subject) {
        return resolveScope(model, scope, subject).count();
    }

    public <T> ActionResult run(RegisteredModel<T> model, String actionName, ActionScope scope,
                                Map<String, Object> params, AdminUser subject) {
        AdminAction<T> action = findAction(model, actionName);
        ActionSpec spec = action.spec();

        if (scope == null || scope.kind() == null) {
            throw new ValidationException("scope", "Scope is required");
        }
        if (!spec.acceptsScope(scope.kind())) {
            throw new ValidationException("scope", "Action '" + actionName + "' does not accept scope '"
                    + scope.kind().code() + "'");
        }

        permissionChecker.require(subject, spec.getRequiredPerm(), model.permissionTarget());

        Map<String, Object> validated = ActionParamsValidator.validate(spec, params);
        ActionParamsValidator.requireConfirmation(spec, validated);

        QuerySet<T> selection = resolveScope(model, scope, subject);
        long size = selection.count();
        ActionContext<T> context = new ActionContext<>(model.contentType(), model.descriptor(), subject, validated);

        if (size > batchThreshold) {
            String handle = taskManager.submit(context, action, selection, size);
            log.info("[AdminFrame] {} deferred {} on {} ({} objects) as task {}",
                    subject.id(), actionName, model.contentType().dottedName(), size, handle);
            return ActionResult.deferred(handle);
        }

        BatchOutcome outcome = action.apply(context, selection.fetch());
        log.info("[AdminFrame] {} ran {} on {}: affected={}, skipped={}",
                subject.id(), actionName, model.contentType().dottedName(), outcome.affected(), outcome.skipped());
        return ActionResult.inline(outcome.affected(), outcome.skipped(), outcome.errors());
    }

    // ==================== 后台任务 ====================

    public ActionTaskStatus taskStatus(RegisteredModel<?> model, String handle) {
        ActionTaskStatus status = taskManager.status(handle);
        if (!status.contentType().equals(model.contentType().dottedName())) {
            throw new NotFoundException("Task " + handle + " does not belong to " + model.contentType().dottedName());
        }
        return status;
    }

    public boolean cancelTask(RegisteredModel<?> model, String handle) {
        taskStatus(model, handle);
        return taskManager.cancel(handle);
    }

    // ==================== 范围解析 ====================

    <T> QuerySet<T> resolveScope(RegisteredModel<T> model, ActionScope scope, AdminUser subject) {
        if (scope == null || scope.kind() == null) {
            throw new ValidationException("scope", "Scope is required");
        }
        ModelDescriptor<T> descriptor = model.descriptor();
        return switch (scope.kind()) {
            case IDS -> {
                List<Object> keys = coerceIds(descriptor.getAdapter(), scope.ids());
                yield pipeline.object(descriptor, subject)
                        .filter(FilterSpec.in(descriptor.getMeta().pkField(), keys));
            }
            case QUERY -> {
                ListCriteria criteria = scopeQueryBuilder.build(descriptor, scope.query());
                yield pipeline.list(descriptor, criteria, subject);
            }
        };
    }

    private static List<Object> coerceIds(ModelAdapter<?> adapter, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new ValidationException("ids", "At least one id is required");
        }
        List<Object> keys = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                keys.add(adapter.coercePk(id));
            } catch (RuntimeException e) {
                throw new ValidationException("ids", "Invalid id: " + id);
            }
        }
        return keys;
    }
}
