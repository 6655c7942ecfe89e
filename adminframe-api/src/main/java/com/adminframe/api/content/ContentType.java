package com.adminframe.api.content;

/**
 * 内容类型：可寻址资源（数据模型、卡片、视图）的统一身份。
 *
 * @param id         稳定标识
 * @param appLabel   应用标签
 * @param modelSlug  模型名（小写），虚拟资源为 "kind.slug"
 * @param dottedName 点分名，模型为 "app.model"，虚拟资源为 "app.kind.slug"
 * @param virtual    是否为虚拟资源
 */
public record ContentType(ContentTypeId id, String appLabel, String modelSlug, String dottedName, boolean virtual) {
}
