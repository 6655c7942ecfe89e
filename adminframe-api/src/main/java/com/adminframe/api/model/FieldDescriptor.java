package com.adminframe.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

/**
 * 字段元数据，由适配器的 {@link ModelAdapter#describe()} 提供
 */
@Getter
@Builder
@ToString
public class FieldDescriptor {

    private final String name;

    @Builder.Default
    private final FieldKind kind = FieldKind.STRING;

    /**
     * 显示名，缺省时使用字段名
     */
    private final String verboseName;

    @Builder.Default
    private final boolean nullable = false;

    /**
     * 缺省值，null 表示无缺省值
     */
    private final Object defaultValue;

    /**
     * 可选值：值 -> 显示文本，保持声明顺序
     */
    @Builder.Default
    private final Map<String, String> choices = Collections.emptyMap();

    @Builder.Default
    private final boolean primaryKey = false;

    public boolean isRelation() {
        return kind.isRelation();
    }

    public boolean hasChoices() {
        return choices != null && !choices.isEmpty();
    }

    public String getLabel() {
        return verboseName != null ? verboseName : name;
    }

    public static FieldDescriptor of(String name, FieldKind kind) {
        return FieldDescriptor.builder().name(name).kind(kind).build();
    }
}
