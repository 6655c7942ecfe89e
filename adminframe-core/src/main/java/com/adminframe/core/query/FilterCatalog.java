package com.adminframe.core.query;

import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FilterOp;
import com.adminframe.core.descriptor.ModelDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 字段类型与可用过滤操作符的对应关系
 */
public final class FilterCatalog {

    private static final List<FilterOp> STRING_OPS = List.of(FilterOp.EQ, FilterOp.ICONTAINS, FilterOp.IN);
    private static final List<FilterOp> BOOLEAN_OPS = List.of(FilterOp.EQ);
    private static final List<FilterOp> NUMBER_OPS = List.of(
            FilterOp.EQ, FilterOp.GTE, FilterOp.LTE, FilterOp.GT, FilterOp.LT, FilterOp.IN);
    private static final List<FilterOp> TEMPORAL_OPS = List.of(FilterOp.GTE, FilterOp.LTE, FilterOp.GT, FilterOp.LT);
    private static final List<FilterOp> CHOICE_OPS = List.of(FilterOp.EQ, FilterOp.IN);
    private static final List<FilterOp> DEFAULT_OPS = List.of(FilterOp.EQ);

    private FilterCatalog() {
    }

    /**
     * 对外的字段类别
     */
    public static String kindOf(FieldDescriptor field) {
        if (field.hasChoices()) {
            return "choice";
        }
        return switch (field.getKind()) {
            case STRING, TEXT, UUID -> "string";
            case BOOLEAN -> "boolean";
            case INTEGER, BIGINT, FLOAT, DECIMAL -> "number";
            case DATE -> "date";
            case DATETIME -> "datetime";
            case FK, M2M -> "relation";
            case JSON -> "json";
        };
    }

    public static List<FilterOp> opsFor(FieldDescriptor field) {
        return switch (kindOf(field)) {
            case "choice" -> CHOICE_OPS;
            case "string" -> STRING_OPS;
            case "boolean" -> BOOLEAN_OPS;
            case "number" -> NUMBER_OPS;
            case "date", "datetime" -> TEMPORAL_OPS;
            default -> DEFAULT_OPS;
        };
    }

    /**
     * 描述符声明的过滤器；未知字段被忽略（启动时已校验）
     */
    public static List<ListFilterSpec> describe(ModelDescriptor<?> descriptor) {
        List<ListFilterSpec> specs = new ArrayList<>();
        for (String name : descriptor.getListFilter()) {
            Optional<FieldDescriptor> field = descriptor.getMeta().field(name);
            field.ifPresent(f -> specs.add(new ListFilterSpec(
                    f.getName(),
                    f.getLabel(),
                    kindOf(f),
                    opsFor(f).stream().map(FilterOp::code).toList(),
                    f.hasChoices() ? f.getChoices() : null)));
        }
        return specs;
    }
}
