package com.adminframe.core.descriptor;

import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FieldKind;
import com.adminframe.api.model.ModelAdapter;
import com.adminframe.api.model.ModelMeta;
import com.adminframe.api.model.QuerySet;
import com.adminframe.api.security.AdminUser;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.action.AdminAction;
import com.adminframe.core.action.DeleteSelectedAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 资源描述符
 * <p>
 * 每个内容类型一个实例，启动时构造，之后不再变化。子类通过覆盖 getter 声明字段暴露、列表列、搜索与过滤，
 * 通过覆盖 apply* 钩子参与查询集流水线；钩子必须返回由 {@link #getAdapter()} 产生的查询集。
 * 钩子不会得知鉴权结果，也无法跳过或重排流水线阶段。
 *
 * @param <T> 模型对象类型
 * @author AdminFrame
 */
public class ModelDescriptor<T> {

    private final ModelAdapter<T> adapter;

    public ModelDescriptor(ModelAdapter<T> adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
    }

    public final ModelAdapter<T> getAdapter() {
        return adapter;
    }

    public final ModelMeta getMeta() {
        return adapter.describe();
    }

    // ==================== 声明式配置 ====================

    public String getLabel() {
        return getMeta().modelName();
    }

    /**
     * 列表列，缺省为主键加上全部非多对多字段
     */
    public List<String> getListDisplay() {
        List<String> columns = new ArrayList<>();
        ModelMeta meta = getMeta();
        columns.add(meta.pkField());
        for (FieldDescriptor field : meta.fields()) {
            if (!field.getName().equals(meta.pkField()) && field.getKind() != FieldKind.M2M) {
                columns.add(field.getName());
            }
        }
        return columns;
    }

    public List<String> getSearchFields() {
        return List.of();
    }

    public List<String> getListFilter() {
        return List.of();
    }

    /**
     * 缺省排序，"-" 前缀为降序
     */
    public List<String> getOrdering() {
        return List.of();
    }

    /**
     * 表单暴露的字段，缺省为除主键外的全部字段
     */
    public List<String> getFields() {
        ModelMeta meta = getMeta();
        return meta.fieldNames().stream().filter(name -> !name.equals(meta.pkField())).toList();
    }

    public List<String> getReadonlyFields() {
        return List.of();
    }

    /**
     * 为 true 时列表只加载列表列
     */
    public boolean isListUseOnly() {
        return false;
    }

    /**
     * 以 textarea 渲染的字段，缺省为 TEXT 类型字段
     */
    public List<String> getTextareaFields() {
        return getMeta().fields().stream()
                .filter(f -> f.getKind() == FieldKind.TEXT)
                .map(FieldDescriptor::getName)
                .toList();
    }

    /**
     * 注册的动作，名称在描述符内必须唯一
     */
    public List<AdminAction<T>> getActions() {
        return List.of(new DeleteSelectedAction<>());
    }

    // ==================== 查询集钩子 ====================

    public QuerySet<T> baseQuerySet() {
        return adapter.all();
    }

    /**
     * 缺省预取列表列中的外键
     */
    public QuerySet<T> applyRelationPrefetch(QuerySet<T> qs) {
        List<String> relations = getListDisplay().stream()
                .filter(name -> getMeta().field(name).map(f -> f.getKind() == FieldKind.FK).orElse(false))
                .toList();
        return relations.isEmpty() ? qs : qs.selectRelated(relations);
    }

    public QuerySet<T> applyProjection(QuerySet<T> qs) {
        if (!isListUseOnly()) {
            return qs;
        }
        List<String> columns = new ArrayList<>();
        columns.add(getMeta().pkField());
        for (String name : getListDisplay()) {
            if (!columns.contains(name)) {
                columns.add(name);
            }
        }
        return qs.only(columns);
    }

    /**
     * 行级安全，永远是流水线的最后一个阶段
     */
    public QuerySet<T> applyRowLevelSecurity(QuerySet<T> qs, AdminUser subject) {
        return qs;
    }

    public QuerySet<T> applyRelationPrefetchForWrites(QuerySet<T> qs) {
        return qs;
    }

    // ==================== 对象级钩子 ====================

    /**
     * 对象级否决，仅在 RBAC 放行后调用；返回值同时作为列表中 can_change / can_delete 的提示
     */
    public boolean allow(AdminUser subject, PermAction action, T obj) {
        return true;
    }

    /**
     * 保存前清洗载荷，可抛出 {@link com.adminframe.api.exception.ValidationException}
     *
     * @param existing 新增时为 null
     */
    public Map<String, Object> clean(Map<String, Object> payload, T existing) {
        return payload;
    }

    public T saveCreate(Map<String, Object> values) {
        return adapter.create(values);
    }

    public T saveUpdate(T obj, Map<String, Object> values) {
        return adapter.update(obj, values);
    }

    public void deleteObject(T obj) {
        adapter.delete(obj);
    }
}
