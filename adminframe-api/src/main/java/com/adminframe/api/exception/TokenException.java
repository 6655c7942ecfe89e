package com.adminframe.api.exception;

/**
 * 范围令牌无效：签名不符、已过期、格式损坏或与请求不匹配。
 * 所有情况都以失败关闭的方式处理。
 */
public class TokenException extends ValidationException {

    public static final String FIELD = "scope_token";

    public TokenException(String message) {
        super(FIELD, message);
    }
}
