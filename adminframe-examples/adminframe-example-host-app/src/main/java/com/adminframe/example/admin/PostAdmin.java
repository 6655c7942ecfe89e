package com.adminframe.example.admin;

import com.adminframe.api.model.FilterSpec;
import com.adminframe.api.model.QuerySet;
import com.adminframe.api.security.AdminUser;
import com.adminframe.core.action.AdminAction;
import com.adminframe.core.action.DeleteSelectedAction;
import com.adminframe.core.adapter.memory.InMemoryModelAdapter;
import com.adminframe.core.descriptor.ModelDescriptor;

import java.util.List;
import java.util.Map;

/**
 * blog.post 的后台配置：非超级管理员只能看到自己写的文章
 */
public class PostAdmin extends ModelDescriptor<Map<String, Object>> {

    public PostAdmin(InMemoryModelAdapter adapter) {
        super(adapter);
    }

    @Override
    public List<String> getListDisplay() {
        return List.of("id", "title", "status", "author", "views");
    }

    @Override
    public List<String> getSearchFields() {
        return List.of("title", "body");
    }

    @Override
    public List<String> getListFilter() {
        return List.of("status", "author", "views");
    }

    @Override
    public List<String> getOrdering() {
        return List.of("-id");
    }

    @Override
    public List<String> getReadonlyFields() {
        return List.of("views");
    }

    @Override
    public List<String> getTextareaFields() {
        return List.of("body");
    }

    @Override
    public List<AdminAction<Map<String, Object>>> getActions() {
        return List.of(new DeleteSelectedAction<>(), new PublishAction());
    }

    @Override
    public QuerySet<Map<String, Object>> applyRowLevelSecurity(QuerySet<Map<String, Object>> qs, AdminUser subject) {
        if (subject.superuser()) {
            return qs;
        }
        return qs.filter(FilterSpec.eq("author", subject.id()));
    }
}
