package com.adminframe.core.service;

import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FieldKind;
import com.adminframe.api.model.ModelAdapter;
import com.adminframe.core.descriptor.ModelDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 根据描述符生成表单 JSON Schema
 */
public class FormSchemaBuilder {

    /**
     * @param obj 编辑模式下的对象（已经过对象形态流水线），新增模式为 null
     */
    public <T> FormSchema build(ModelDescriptor<T> descriptor, T obj) {
        List<String> fields = descriptor.getFields();
        List<String> readonly = descriptor.getReadonlyFields();
        List<String> textarea = descriptor.getTextareaFields();

        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        Map<String, Object> startval = new LinkedHashMap<>();
        Map<String, Object> ui = new LinkedHashMap<>();
        ui.put("ui:order", fields);

        ModelAdapter<T> adapter = descriptor.getAdapter();
        for (String name : fields) {
            FieldDescriptor field = descriptor.getMeta().field(name).orElseThrow();
            boolean isReadonly = readonly.contains(name);

            properties.put(name, property(field, isReadonly));
            if (isRequired(field) && !isReadonly) {
                required.add(name);
            }

            if (obj != null) {
                startval.put(name, WireValues.toWire(adapter.read(obj, name)));
            } else {
                startval.put(name, initialValue(field));
            }

            Map<String, Object> hints = new LinkedHashMap<>();
            if (isReadonly) {
                hints.put("ui:readonly", true);
            }
            if (textarea.contains(name)) {
                hints.put("ui:widget", "textarea");
            }
            if (!hints.isEmpty()) {
                ui.put(name, hints);
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("title", descriptor.getLabel());
        schema.put("properties", properties);
        schema.put("required", required);
        schema.put("defaultProperties", fields);
        schema.put("additionalProperties", false);
        return new FormSchema(schema, startval, ui);
    }

    /**
     * 非空、无缺省值、非多对多的字段为必填
     */
    static boolean isRequired(FieldDescriptor field) {
        return !field.isNullable() && field.getDefaultValue() == null && field.getKind() != FieldKind.M2M;
    }

    private static Map<String, Object> property(FieldDescriptor field, boolean readonly) {
        Map<String, Object> prop = new LinkedHashMap<>();
        prop.put("title", field.getLabel());

        String type = switch (field.getKind()) {
            case BOOLEAN -> "boolean";
            case INTEGER, BIGINT -> "integer";
            case FLOAT, DECIMAL -> "number";
            case JSON -> "object";
            case M2M -> "array";
            default -> "string";
        };
        prop.put("type", field.isNullable() && field.getKind() != FieldKind.M2M ? List.of(type, "null") : type);

        switch (field.getKind()) {
            case TEXT -> prop.put("format", "textarea");
            case DATE -> prop.put("format", "date");
            case DATETIME -> prop.put("format", "date-time");
            case UUID -> prop.put("format", "uuid");
            case M2M -> prop.put("items", Map.of("type", "string"));
            default -> {
            }
        }
        if (field.hasChoices()) {
            prop.put("enum", new ArrayList<>(field.getChoices().keySet()));
            prop.put("options", Map.of("enum_titles", new ArrayList<>(field.getChoices().values())));
        }
        if (field.getDefaultValue() != null) {
            prop.put("default", WireValues.toWire(field.getDefaultValue()));
        }
        if (readonly) {
            prop.put("readOnly", true);
        }
        return prop;
    }

    private static Object initialValue(FieldDescriptor field) {
        if (field.getDefaultValue() != null) {
            return WireValues.toWire(field.getDefaultValue());
        }
        return field.getKind() == FieldKind.M2M ? List.of() : null;
    }
}
