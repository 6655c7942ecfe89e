package com.adminframe.core.action;

import com.adminframe.api.action.ActionSpec;
import com.adminframe.api.action.ParamType;
import com.adminframe.api.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 动作参数校验：缺失、多余、类型不符均报 422
 * <p>
 * 破坏性动作隐含必填的布尔参数 confirm。
 */
public final class ActionParamsValidator {

    public static final String CONFIRM = "confirm";

    private ActionParamsValidator() {
    }

    public static Map<String, ParamType> effectiveSchema(ActionSpec spec) {
        Map<String, ParamType> schema = new LinkedHashMap<>(spec.getParamsSchema());
        if (spec.isDestructive()) {
            schema.putIfAbsent(CONFIRM, ParamType.BOOLEAN);
        }
        return schema;
    }

    public static Map<String, Object> validate(ActionSpec spec, Map<String, Object> params) {
        Map<String, Object> input = params == null ? Map.of() : params;
        Map<String, ParamType> schema = effectiveSchema(spec);
        Map<String, String> errors = new LinkedHashMap<>();

        for (String name : input.keySet()) {
            if (!schema.containsKey(name)) {
                errors.put(name, "Unexpected parameter");
            }
        }
        for (Map.Entry<String, ParamType> entry : schema.entrySet()) {
            String name = entry.getKey();
            Object value = input.get(name);
            if (value == null) {
                errors.put(name, "Missing parameter");
            } else if (!entry.getValue().accepts(value)) {
                errors.put(name, "Expected " + entry.getValue().code());
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return Map.copyOf(input);
    }

    /**
     * 破坏性动作必须显式 confirm=true，否则在接触任何对象之前拒绝
     */
    public static void requireConfirmation(ActionSpec spec, Map<String, Object> params) {
        if (spec.isDestructive() && !Boolean.TRUE.equals(params.get(CONFIRM))) {
            throw new ValidationException(CONFIRM, "Destructive action '" + spec.getName() + "' requires confirm=true");
        }
    }
}
