package com.adminframe.api.model;

import java.util.List;
import java.util.Optional;

/**
 * 惰性、不可变的查询集
 * <p>
 * 每个转换方法返回新的查询集，原查询集保持不变；只有 {@link #count()}、{@link #fetch()}
 * 和 {@link #first()} 会真正访问存储。
 *
 * @param <T> 模型对象类型
 */
public interface QuerySet<T> {

    /**
     * 产生该查询集的适配器，用于校验钩子返回的查询集归属
     */
    ModelAdapter<T> adapter();

    QuerySet<T> filter(FilterSpec spec);

    /**
     * 在给定字段上做不区分大小写的包含匹配（字段之间为 OR）
     */
    QuerySet<T> search(List<String> fields, String term);

    /**
     * 排序，字段名前缀 "-" 表示降序
     */
    QuerySet<T> orderBy(List<String> ordering);

    /**
     * 预取关联对象
     */
    QuerySet<T> selectRelated(List<String> relations);

    /**
     * 限定加载的列
     */
    QuerySet<T> only(List<String> fields);

    QuerySet<T> slice(int offset, int limit);

    long count();

    List<T> fetch();

    default Optional<T> first() {
        List<T> rows = slice(0, 1).fetch();
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
