package com.adminframe.core.site;

import com.adminframe.api.content.ContentType;

/**
 * 虚拟资源（卡片或视图）
 *
 * @param appLabel    应用标签
 * @param kind        cards / views
 * @param key         原始键
 * @param label       显示名
 * @param contentType finalize 之后才有值
 */
public record VirtualEntry(String appLabel, String kind, String key, String label, ContentType contentType) {

    VirtualEntry withContentType(ContentType contentType) {
        return new VirtualEntry(appLabel, kind, key, label, contentType);
    }
}
