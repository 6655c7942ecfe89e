package com.adminframe.starter.web;

import com.adminframe.api.action.ActionScope;
import com.adminframe.api.action.ScopeQuery;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 动作相关请求体
 * <p>
 * 范围按优先级取值：scope_token → scope → ids → query。
 */
@Data
public class ActionRequest {

    private ActionScope scope;

    private List<String> ids;

    private ScopeQuery query;

    @JsonProperty("scope_token")
    private String scopeToken;

    private Map<String, Object> params;
}
