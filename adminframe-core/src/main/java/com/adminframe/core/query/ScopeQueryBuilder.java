package com.adminframe.core.query;

import com.adminframe.api.action.ScopeQuery;
import com.adminframe.core.descriptor.ModelDescriptor;
import lombok.RequiredArgsConstructor;

/**
 * 将可重放的 {@link ScopeQuery} 转换为列表查询条件，按当前描述符严格校验
 */
@RequiredArgsConstructor
public class ScopeQueryBuilder {

    private final ListQueryParser parser;

    public ListCriteria build(ModelDescriptor<?> descriptor, ScopeQuery query) {
        ScopeQuery scope = query == null ? ScopeQuery.empty() : query;
        return parser.criteria(descriptor, scope.search(), scope.order(), scope.filters(), true);
    }
}
