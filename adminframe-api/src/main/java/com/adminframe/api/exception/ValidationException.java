package com.adminframe.api.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 校验失败异常，携带以字段名为键的错误信息，对外映射为 422。
 */
public class ValidationException extends AdminException {

    private final Map<String, String> errors;

    public ValidationException(Map<String, String> errors) {
        super("Validation failed: " + errors);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public ValidationException(String field, String message) {
        this(Map.of(field, message));
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(field, message);
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
