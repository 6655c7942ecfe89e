package com.adminframe.api.security;

import com.adminframe.api.content.ContentTypeId;

/**
 * 一条授权记录。contentType 为 null 表示全局授权。
 */
public record Grant(GranteeType granteeType, String granteeId, ContentTypeId contentType, PermAction action) {

    public enum GranteeType {
        USER,
        GROUP
    }

    public boolean isGlobal() {
        return contentType == null;
    }
}
