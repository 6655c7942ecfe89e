package com.adminframe.core.security;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.content.ContentTypeRegistry;

/**
 * 权限编码：按资源为 "{app}.{model}.{action}"，全局为单独的 "{action}"。
 * 虚拟资源的 model 部分本身带点，例如 "shop.cards.sales-total.view"。
 *
 * @param contentType 内容类型，全局权限为 null
 * @param action      动作
 */
public record PermissionCodename(ContentType contentType, PermAction action) {

    public static final String FIELD = "codename";

    public boolean isGlobal() {
        return contentType == null;
    }

    public String format() {
        return format(contentType, action);
    }

    public static String format(ContentType contentType, PermAction action) {
        return contentType == null ? action.codename() : contentType.dottedName() + "." + action.codename();
    }

    /**
     * 解析编码并在注册表中定位内容类型
     *
     * @throws ValidationException 格式错误、动作未知或内容类型未注册
     */
    public static PermissionCodename parse(String codename, ContentTypeRegistry registry) {
        if (codename == null || codename.isBlank()) {
            throw new ValidationException(FIELD, "Codename must not be blank");
        }
        String value = codename.trim();
        int dot = value.lastIndexOf('.');
        if (dot < 0) {
            return new PermissionCodename(null, toAction(value));
        }
        String dotted = value.substring(0, dot);
        PermAction action = toAction(value.substring(dot + 1));
        ContentType contentType = registry.getByDotted(dotted)
                .orElseThrow(() -> new ValidationException(FIELD, "Unknown content type: " + dotted));
        return new PermissionCodename(contentType, action);
    }

    private static PermAction toAction(String raw) {
        try {
            return PermAction.fromCodename(raw);
        } catch (ValidationException e) {
            throw new ValidationException(FIELD, "Unknown permission action: " + raw);
        }
    }
}
