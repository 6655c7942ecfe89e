package com.adminframe.api.model;

import java.util.Map;

/**
 * 持久化适配器 SPI
 * 负责某一类资源的 CRUD 原语和字段元数据，框架本身不执行任何存储访问。
 *
 * @param <T> 模型对象类型
 * @author AdminFrame
 */
public interface ModelAdapter<T> {

    ModelMeta describe();

    /**
     * 未过滤的根查询集
     */
    QuerySet<T> all();

    Object primaryKey(T obj);

    /**
     * 读取字段值，关联字段返回关联对象主键（多对多返回主键列表）
     */
    Object read(T obj, String field);

    T create(Map<String, Object> values);

    T update(T obj, Map<String, Object> values);

    void delete(T obj);

    /**
     * 将路径或令牌中的字符串主键转换为存储使用的类型
     */
    default Object coercePk(String raw) {
        FieldKind kind = describe().pkDescriptor().getKind();
        if (kind == FieldKind.INTEGER || kind == FieldKind.BIGINT) {
            return Long.valueOf(raw.trim());
        }
        return raw;
    }
}
