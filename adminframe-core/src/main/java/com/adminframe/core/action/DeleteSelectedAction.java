package com.adminframe.core.action;

import com.adminframe.api.action.ActionSpec;
import com.adminframe.api.action.ParamType;
import com.adminframe.api.action.ScopeKind;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.descriptor.ModelDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * 内置动作：删除所选对象
 */
@Slf4j
public class DeleteSelectedAction<T> implements AdminAction<T> {

    public static final String NAME = "delete_selected";

    private static final ActionSpec SPEC = ActionSpec.builder()
            .name(NAME)
            .label("Delete selected")
            .description("Delete all selected objects")
            .paramsSchema(Map.of("confirm", ParamType.BOOLEAN))
            .scopeKinds(EnumSet.of(ScopeKind.IDS, ScopeKind.QUERY))
            .destructive(true)
            .requiredPerm(PermAction.DELETE)
            .build();

    @Override
    public ActionSpec spec() {
        return SPEC;
    }

    @Override
    public BatchOutcome apply(ActionContext<T> context, List<T> batch) {
        ModelDescriptor<T> descriptor = context.descriptor();
        int affected = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();

        for (T obj : batch) {
            Object pk = descriptor.getAdapter().primaryKey(obj);
            if (!descriptor.allow(context.subject(), PermAction.DELETE, obj)) {
                skipped++;
                errors.add(pk + ": permission denied");
                continue;
            }
            try {
                descriptor.deleteObject(obj);
                affected++;
            } catch (RuntimeException e) {
                log.warn("[AdminFrame] Failed to delete {} #{}: {}",
                        context.contentType().dottedName(), pk, e.getMessage());
                skipped++;
                errors.add(pk + ": " + e.getMessage());
            }
        }
        return new BatchOutcome(affected, skipped, errors);
    }
}
