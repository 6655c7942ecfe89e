package com.adminframe.core.query;

import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FieldKind;
import com.adminframe.api.model.FilterOp;
import com.adminframe.api.model.FilterSpec;
import com.adminframe.api.model.ModelMeta;
import com.adminframe.core.config.AdminFrameConfig;
import com.adminframe.core.descriptor.ModelDescriptor;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列表请求解析与校验
 * <p>
 * strict 模式用于可重放的动作范围：不合法的搜索和排序直接报错；浏览列表时则忽略搜索、回退到缺省排序。
 * 过滤条件在两种模式下都严格校验。
 */
@RequiredArgsConstructor
public class ListQueryParser {

    public static final String FILTER_PREFIX = "filter.";

    private final AdminFrameConfig config;

    /**
     * 从 HTTP 查询参数中提取列表请求
     */
    public ListQuery fromParams(Map<String, String> params) {
        Map<String, String> filters = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (key.startsWith(FILTER_PREFIX) && value != null && !value.isEmpty()) {
                filters.put(key.substring(FILTER_PREFIX.length()), value);
            }
        });
        return new ListQuery(
                params.get("search"),
                params.get("order"),
                filters,
                parseInt(params.get("page_num"), "page_num"),
                parseInt(params.get("per_page"), "per_page"));
    }

    public PageRequest page(ListQuery query) {
        int page = query.pageNum() == null ? 1 : query.pageNum();
        if (page < 1) {
            throw new ValidationException("page_num", "must be >= 1");
        }
        int perPage = query.perPage() == null ? config.getDefaultPerPage() : query.perPage();
        perPage = Math.max(1, Math.min(perPage, config.getMaxPerPage()));
        if ((long) (page - 1) * perPage > Integer.MAX_VALUE) {
            throw new ValidationException("page_num", "is out of range");
        }
        return new PageRequest(page, perPage);
    }

    public ListCriteria criteria(ModelDescriptor<?> descriptor, ListQuery query) {
        return criteria(descriptor, query.search(), query.order(), query.filters(), false);
    }

    public ListCriteria criteria(ModelDescriptor<?> descriptor, String search, String order,
                                 Map<String, String> filters, boolean strict) {
        List<FilterSpec> specs = parseFilters(descriptor, filters);

        String term = search == null || search.isBlank() ? null : search.trim();
        List<String> searchFields = descriptor.getSearchFields();
        if (term != null && searchFields.isEmpty()) {
            if (strict) {
                throw new ValidationException("search", "Search is not enabled for this resource");
            }
            term = null;
        }

        return new ListCriteria(specs, term, searchFields, resolveOrdering(descriptor, order, strict));
    }

    /**
     * 可排序的列：主键与列表列中的非多对多字段
     */
    public static List<String> sortableColumns(ModelDescriptor<?> descriptor) {
        ModelMeta meta = descriptor.getMeta();
        List<String> sortable = new ArrayList<>();
        sortable.add(meta.pkField());
        for (String column : descriptor.getListDisplay()) {
            boolean plain = meta.field(column).map(f -> f.getKind() != FieldKind.M2M).orElse(false);
            if (plain && !sortable.contains(column)) {
                sortable.add(column);
            }
        }
        return sortable;
    }

    private List<FilterSpec> parseFilters(ModelDescriptor<?> descriptor, Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) {
            return List.of();
        }
        List<String> allowed = descriptor.getListFilter();
        List<FilterSpec> specs = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (Map.Entry<String, String> entry : filters.entrySet()) {
            String key = entry.getKey();
            String param = FILTER_PREFIX + key;
            String[] parts = key.split("\\.", 2);
            String fieldName = parts[0];
            String opCode = parts.length > 1 ? parts[1] : FilterOp.EQ.code();

            FieldDescriptor field = allowed.contains(fieldName)
                    ? descriptor.getMeta().field(fieldName).orElse(null)
                    : null;
            if (field == null) {
                errors.put(param, "Unknown filter field: " + fieldName);
                continue;
            }
            FilterOp op = FilterOp.fromCode(opCode).orElse(null);
            if (op == null || !FilterCatalog.opsFor(field).contains(op)) {
                errors.put(param, "Operator '" + opCode + "' is not allowed for field '" + fieldName + "'");
                continue;
            }
            try {
                specs.add(FilterValueCoercer.coerce(field, op, entry.getValue(), param));
            } catch (ValidationException e) {
                errors.putAll(e.getErrors());
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return specs;
    }

    private List<String> resolveOrdering(ModelDescriptor<?> descriptor, String order, boolean strict) {
        if (order != null && !order.isBlank()) {
            String value = order.trim();
            String field = value.startsWith("-") ? value.substring(1) : value;
            if (sortableColumns(descriptor).contains(field)) {
                return List.of(value);
            }
            if (strict) {
                throw new ValidationException("order", "Field is not sortable: " + field);
            }
        }
        List<String> ordering = descriptor.getOrdering();
        if (!ordering.isEmpty()) {
            return List.of(ordering.get(0));
        }
        return List.of("-" + descriptor.getMeta().pkField());
    }

    private static Integer parseInt(String raw, String param) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(param, "must be an integer");
        }
    }
}
