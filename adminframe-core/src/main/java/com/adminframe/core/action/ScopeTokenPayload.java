package com.adminframe.core.action;

import com.adminframe.api.action.ActionScope;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 范围令牌载荷
 *
 * @param contentType 内容类型点分名
 * @param scope       作用范围
 * @param subject     签发对象的主体 ID
 * @param issuedAt    签发时间（epoch 秒）
 * @param expiresAt   过期时间（epoch 秒）
 */
public record ScopeTokenPayload(
        @JsonProperty("ct") String contentType,
        @JsonProperty("scope") ActionScope scope,
        @JsonProperty("sub") String subject,
        @JsonProperty("iat") long issuedAt,
        @JsonProperty("exp") long expiresAt
) {
}
