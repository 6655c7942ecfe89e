package com.adminframe.api.model;

import java.util.List;
import java.util.Optional;

/**
 * 模型元数据
 *
 * @param modelName 模型名，注册内容类型时转为小写
 * @param pkField   主键字段名
 * @param fields    按声明顺序排列的字段
 */
public record ModelMeta(String modelName, String pkField, List<FieldDescriptor> fields) {

    public ModelMeta {
        fields = List.copyOf(fields);
    }

    public Optional<FieldDescriptor> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    public FieldDescriptor pkDescriptor() {
        return field(pkField).orElseGet(() -> FieldDescriptor.builder()
                .name(pkField).kind(FieldKind.BIGINT).primaryKey(true).build());
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldDescriptor::getName).toList();
    }
}
