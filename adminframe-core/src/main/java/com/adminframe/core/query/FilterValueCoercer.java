package com.adminframe.core.query;

import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FilterOp;
import com.adminframe.api.model.FilterSpec;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * 将原始字符串过滤值按字段类型转换为 {@link FilterSpec}
 */
public final class FilterValueCoercer {

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "on");
    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "off");

    private FilterValueCoercer() {
    }

    /**
     * @param param 原始参数名，用作错误键
     */
    public static FilterSpec coerce(FieldDescriptor field, FilterOp op, String raw, String param) {
        String value = raw == null ? "" : raw.trim();

        if (op == FilterOp.EQ && "null".equalsIgnoreCase(value)) {
            return new FilterSpec(field.getName(), FilterOp.IS_NULL, Boolean.TRUE);
        }
        if (op == FilterOp.IN) {
            List<Object> values = new ArrayList<>();
            for (String part : value.split(",")) {
                String item = part.trim();
                if (!item.isEmpty()) {
                    values.add(coerceScalar(field, item, param));
                }
            }
            if (values.isEmpty()) {
                throw new ValidationException(param, "At least one value is required");
            }
            return new FilterSpec(field.getName(), FilterOp.IN, values);
        }
        if (op == FilterOp.ICONTAINS) {
            return new FilterSpec(field.getName(), op, value);
        }
        return new FilterSpec(field.getName(), op, coerceScalar(field, value, param));
    }

    static Object coerceScalar(FieldDescriptor field, String value, String param) {
        if (field.hasChoices()) {
            if (!field.getChoices().containsKey(value)) {
                throw new ValidationException(param, "Invalid choice: " + value);
            }
            return value;
        }
        try {
            return switch (field.getKind()) {
                case BOOLEAN -> toBoolean(value, param);
                case INTEGER, BIGINT, FK -> Long.valueOf(value);
                case FLOAT -> Double.valueOf(value);
                case DECIMAL -> new BigDecimal(value);
                case DATE -> LocalDate.parse(value);
                case DATETIME -> toDateTime(value);
                case UUID -> UUID.fromString(value);
                default -> value;
            };
        } catch (NumberFormatException e) {
            throw new ValidationException(param, "Invalid number: " + value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(param, "Invalid date: " + value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(param, "Invalid value: " + value);
        }
    }

    private static Boolean toBoolean(String value, String param) {
        String normalized = value.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return Boolean.FALSE;
        }
        throw new ValidationException(param, "Invalid boolean: " + value);
    }

    private static LocalDateTime toDateTime(String value) {
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay();
        }
        return LocalDateTime.parse(value);
    }
}
