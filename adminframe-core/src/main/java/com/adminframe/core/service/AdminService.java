package com.adminframe.core.service;

import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.exception.PermissionDeniedException;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FieldKind;
import com.adminframe.api.model.FilterSpec;
import com.adminframe.api.model.ModelAdapter;
import com.adminframe.api.model.ModelMeta;
import com.adminframe.api.model.QuerySet;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.PermAction;
import com.adminframe.api.security.PermissionChecker;
import com.adminframe.core.descriptor.ModelDescriptor;
import com.adminframe.core.query.FilterCatalog;
import com.adminframe.core.query.ListCriteria;
import com.adminframe.core.query.ListFilterSpec;
import com.adminframe.core.query.ListQuery;
import com.adminframe.core.query.ListQueryParser;
import com.adminframe.core.query.PageRequest;
import com.adminframe.core.query.QuerySetPipeline;
import com.adminframe.core.site.RegisteredModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CRUD 编排服务
 * <p>
 * RBAC 由路由层在调用前完成；这里负责流水线形态、载荷清洗与描述符的对象级否决。
 *
 * @author AdminFrame
 */
@Slf4j
@RequiredArgsConstructor
public class AdminService {

    private final QuerySetPipeline pipeline;
    private final ListQueryParser parser;
    private final FormSchemaBuilder formSchemaBuilder;
    private final PermissionChecker permissionChecker;

    // ==================== 列表 ====================

    public <T> ListPage list(RegisteredModel<T> model, ListQuery query, AdminUser subject) {
        ModelDescriptor<T> descriptor = model.descriptor();
        ModelAdapter<T> adapter = descriptor.getAdapter();

        ListCriteria criteria = parser.criteria(descriptor, query);
        PageRequest page = parser.page(query);
        QuerySet<T> qs = pipeline.list(descriptor, criteria, subject);

        long total = qs.count();
        int pages = (int) Math.max(1, (total + page.perPage() - 1) / page.perPage());
        List<T> rows = qs.slice(page.offset(), page.perPage()).fetch();

        boolean rbacChange = permissionChecker.check(subject, PermAction.CHANGE, model.permissionTarget());
        boolean rbacDelete = permissionChecker.check(subject, PermAction.DELETE, model.permissionTarget());

        List<String> columns = descriptor.getListDisplay();
        List<Map<String, Object>> items = new ArrayList<>(rows.size());
        for (T row : rows) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put(ListPage.ROW_PK, String.valueOf(adapter.primaryKey(row)));
            for (String column : columns) {
                item.put(column, WireValues.toWire(adapter.read(row, column)));
            }
            item.put("can_change", rbacChange && descriptor.allow(subject, PermAction.CHANGE, row));
            item.put("can_delete", rbacDelete && descriptor.allow(subject, PermAction.DELETE, row));
            items.add(item);
        }

        return new ListPage(columns, columnsMeta(descriptor), ListPage.ROW_PK, items,
                page.page(), pages, page.perPage(), total, criteria.orderToken());
    }

    public List<ColumnMeta> columnsMeta(ModelDescriptor<?> descriptor) {
        List<String> sortable = ListQueryParser.sortableColumns(descriptor);
        List<ColumnMeta> meta = new ArrayList<>();
        for (String column : descriptor.getListDisplay()) {
            FieldDescriptor field = descriptor.getMeta().field(column).orElse(null);
            if (field == null) {
                meta.add(new ColumnMeta(column, column, "string", sortable.contains(column), null));
                continue;
            }
            meta.add(new ColumnMeta(column, field.getLabel(), columnType(field), sortable.contains(column),
                    field.hasChoices() ? field.getChoices() : null));
        }
        return meta;
    }

    public List<ListFilterSpec> filters(RegisteredModel<?> model) {
        return FilterCatalog.describe(model.descriptor());
    }

    // ==================== 单对象 ====================

    public <T> Map<String, Object> retrieve(RegisteredModel<T> model, String pk, AdminUser subject) {
        T obj = loadObject(model, pk, subject);
        return serialize(model.descriptor(), obj);
    }

    public <T> Map<String, Object> create(RegisteredModel<T> model, Map<String, Object> payload, AdminUser subject) {
        ModelDescriptor<T> descriptor = model.descriptor();
        if (!descriptor.allow(subject, PermAction.ADD, null)) {
            throw new PermissionDeniedException("Creation vetoed by " + descriptor.getLabel());
        }
        Map<String, Object> values = cleanPayload(descriptor, payload, true);
        values = descriptor.clean(values, null);
        T created = descriptor.saveCreate(values);
        log.info("[AdminFrame] {} created {} #{}", subject.id(), model.contentType().dottedName(),
                descriptor.getAdapter().primaryKey(created));
        return serialize(descriptor, created);
    }

    /**
     * @param partial PATCH 为 true，PUT 需要提供全部必填字段
     */
    public <T> Map<String, Object> update(RegisteredModel<T> model, String pk, Map<String, Object> payload,
                                          AdminUser subject, boolean partial) {
        ModelDescriptor<T> descriptor = model.descriptor();
        T visible = loadObject(model, pk, subject);
        if (!descriptor.allow(subject, PermAction.CHANGE, visible)) {
            throw new PermissionDeniedException("Change vetoed by " + descriptor.getLabel());
        }

        Object key = descriptor.getAdapter().primaryKey(visible);
        T target = pipeline.formBase(descriptor)
                .filter(FilterSpec.eq(descriptor.getMeta().pkField(), key))
                .first()
                .orElseThrow(() -> new NotFoundException("Object vanished before update: " + key));

        Map<String, Object> values = cleanPayload(descriptor, payload, !partial);
        values = descriptor.clean(values, target);
        T updated = descriptor.saveUpdate(target, values);
        log.info("[AdminFrame] {} updated {} #{}", subject.id(), model.contentType().dottedName(), key);
        return serialize(descriptor, updated);
    }

    public <T> void delete(RegisteredModel<T> model, String pk, AdminUser subject) {
        ModelDescriptor<T> descriptor = model.descriptor();
        T obj = loadObject(model, pk, subject);
        if (!descriptor.allow(subject, PermAction.DELETE, obj)) {
            throw new PermissionDeniedException("Deletion vetoed by " + descriptor.getLabel());
        }
        descriptor.deleteObject(obj);
        log.info("[AdminFrame] {} deleted {} #{}", subject.id(), model.contentType().dottedName(), pk);
    }

    // ==================== 表单 ====================

    /**
     * @param pk 编辑模式的主键，新增模式为 null
     */
    public <T> FormSchema schema(RegisteredModel<T> model, String pk, AdminUser subject) {
        T obj = pk == null ? null : loadObject(model, pk, subject);
        return formSchemaBuilder.build(model.descriptor(), obj);
    }

    // ==================== 内部方法 ====================

    /**
     * 通过对象形态加载；被行级安全隐藏的对象与不存在的对象同样是 404
     */
    public <T> T loadObject(RegisteredModel<T> model, String pk, AdminUser subject) {
        ModelDescriptor<T> descriptor = model.descriptor();
        Object key;
        try {
            key = descriptor.getAdapter().coercePk(pk);
        } catch (RuntimeException e) {
            throw new NotFoundException("Malformed primary key: " + pk);
        }
        return pipeline.object(descriptor, subject)
                .filter(FilterSpec.eq(descriptor.getMeta().pkField(), key))
                .first()
                .orElseThrow(() -> new NotFoundException(model.contentType().dottedName() + " #" + pk));
    }

    private <T> Map<String, Object> serialize(ModelDescriptor<T> descriptor, T obj) {
        ModelAdapter<T> adapter = descriptor.getAdapter();
        ModelMeta meta = descriptor.getMeta();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(meta.pkField(), WireValues.toWire(adapter.primaryKey(obj)));
        for (String name : descriptor.getFields()) {
            data.put(name, WireValues.toWire(adapter.read(obj, name)));
        }
        for (String name : descriptor.getReadonlyFields()) {
            data.putIfAbsent(name, WireValues.toWire(adapter.read(obj, name)));
        }
        return data;
    }

    private Map<String, Object> cleanPayload(ModelDescriptor<?> descriptor, Map<String, Object> payload,
                                             boolean requireAll) {
        Map<String, Object> input = payload == null ? Map.of() : payload;
        List<String> fields = descriptor.getFields();
        List<String> readonly = descriptor.getReadonlyFields();
        String pkField = descriptor.getMeta().pkField();

        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            String name = entry.getKey();
            if (name.equals(pkField) || readonly.contains(name)) {
                continue;
            }
            if (!fields.contains(name)) {
                errors.put(name, "Unknown field");
                continue;
            }
            values.put(name, entry.getValue());
        }

        if (requireAll) {
            for (String name : fields) {
                FieldDescriptor field = descriptor.getMeta().field(name).orElseThrow();
                if (!readonly.contains(name) && FormSchemaBuilder.isRequired(field) && values.get(name) == null) {
                    errors.put(name, "This field is required");
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return values;
    }

    private static String columnType(FieldDescriptor field) {
        if (field.hasChoices()) {
            return "choice";
        }
        FieldKind kind = field.getKind();
        if (kind == FieldKind.BOOLEAN) {
            return "boolean";
        }
        if (kind.isNumeric()) {
            return "number";
        }
        if (kind.isTemporal()) {
            return "datetime";
        }
        if (kind.isRelation()) {
            return "relation";
        }
        return "string";
    }
}
