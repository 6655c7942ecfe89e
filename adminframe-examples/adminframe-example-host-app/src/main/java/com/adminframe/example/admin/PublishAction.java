package com.adminframe.example.admin;

import com.adminframe.api.action.ActionSpec;
import com.adminframe.api.action.ParamType;
import com.adminframe.api.action.ScopeKind;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.action.ActionContext;
import com.adminframe.core.action.AdminAction;
import com.adminframe.core.action.BatchOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * 批量发布，可选 featured 参数同时设为精选
 */
@Slf4j
public class PublishAction implements AdminAction<Map<String, Object>> {

    private static final ActionSpec SPEC = ActionSpec.builder()
            .name("publish")
            .label("Publish")
            .description("Mark the selected posts as published")
            .paramsSchema(Map.of("featured", ParamType.BOOLEAN))
            .scopeKinds(EnumSet.of(ScopeKind.IDS, ScopeKind.QUERY))
            .requiredPerm(PermAction.CHANGE)
            .build();

    @Override
    public ActionSpec spec() {
        return SPEC;
    }

    @Override
    public BatchOutcome apply(ActionContext<Map<String, Object>> context, List<Map<String, Object>> batch) {
        boolean featured = Boolean.TRUE.equals(context.params().get("featured"));
        int affected = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        for (Map<String, Object> post : batch) {
            if ("published".equals(post.get("status")) && !featured) {
                skipped++;
                continue;
            }
            try {
                context.descriptor().saveUpdate(post, Map.of("status", "published", "featured", featured));
                affected++;
            } catch (RuntimeException e) {
                log.warn("[AdminFrame] Failed to publish post #{}: {}", post.get("id"), e.getMessage());
                skipped++;
                errors.add(post.get("id") + ": " + e.getMessage());
            }
        }
        return new BatchOutcome(affected, skipped, errors);
    }
}
