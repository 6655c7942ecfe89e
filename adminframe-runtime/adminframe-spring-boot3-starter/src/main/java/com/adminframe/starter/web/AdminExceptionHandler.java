package com.adminframe.starter.web;

import com.adminframe.api.exception.AuthenticationRequiredException;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.exception.PermissionDeniedException;
import com.adminframe.api.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 资源端点的异常到 HTTP 状态映射
 * <p>
 * 404 与 403 不回显内部信息，避免泄露资源是否存在或被行级安全隐藏。
 */
@Slf4j
@RestControllerAdvice(assignableTypes = AdminDispatchController.class)
public class AdminExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<AdminErrorResponse> handleNotFound(NotFoundException e) {
        log.debug("[AdminFrame] 404: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(AdminErrorResponse.of("Not found"));
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<AdminErrorResponse> handleForbidden(PermissionDeniedException e) {
        log.debug("[AdminFrame] 403: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(AdminErrorResponse.of("Permission denied"));
    }

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ResponseEntity<AdminErrorResponse> handleUnauthorized(AuthenticationRequiredException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(AdminErrorResponse.of("Authentication required"));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<AdminErrorResponse> handleValidation(ValidationException e) {
        log.debug("[AdminFrame] 422: {}", e.getErrors());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new AdminErrorResponse("Validation failed", e.getErrors()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AdminErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new AdminErrorResponse("Validation failed", Map.of("body", "Malformed request body")));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<AdminErrorResponse> handleUnexpected(Exception e) {
        log.error("[AdminFrame] Unexpected error while handling admin request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(AdminErrorResponse.of("Internal server error"));
    }
}
