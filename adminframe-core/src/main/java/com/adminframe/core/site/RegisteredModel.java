package com.adminframe.core.site;

import com.adminframe.api.content.ContentType;
import com.adminframe.core.descriptor.ModelDescriptor;

/**
 * 已完成注册的资源：内容类型与描述符的绑定
 *
 * @param contentType 内容类型
 * @param descriptor  描述符
 * @param settings    为 true 时使用全局权限鉴权
 */
public record RegisteredModel<T>(ContentType contentType, ModelDescriptor<T> descriptor, boolean settings) {

    /**
     * 鉴权目标：设置类资源返回 null（全局命名空间）
     */
    public ContentType permissionTarget() {
        return settings ? null : contentType;
    }

    public String appLabel() {
        return contentType.appLabel();
    }

    public String modelSlug() {
        return contentType.modelSlug();
    }
}
