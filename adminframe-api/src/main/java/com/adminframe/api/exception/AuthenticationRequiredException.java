package com.adminframe.api.exception;

/**
 * 请求未携带可识别的主体，对外映射为 401。
 */
public class AuthenticationRequiredException extends AdminException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
