package com.adminframe.api.action;

import com.adminframe.api.security.PermAction;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 动作元数据
 *
 * @author AdminFrame
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ActionSpec {

    /**
     * 描述符内唯一
     */
    private final String name;

    private final String label;

    @Builder.Default
    private final String description = "";

    /**
     * 参数名 -> 参数类型
     */
    @Builder.Default
    @JsonProperty("params_schema")
    private final Map<String, ParamType> paramsSchema = Collections.emptyMap();

    @Builder.Default
    @JsonProperty("scope")
    private final Set<ScopeKind> scopeKinds = EnumSet.of(ScopeKind.IDS, ScopeKind.QUERY);

    /**
     * 破坏性动作需要显式 confirm=true
     */
    @Builder.Default
    @JsonProperty("danger")
    private final boolean destructive = false;

    @Builder.Default
    @JsonProperty("required_perm")
    private final PermAction requiredPerm = PermAction.CHANGE;

    public boolean acceptsScope(ScopeKind kind) {
        return scopeKinds.contains(kind);
    }
}
