package com.adminframe.dashboard.controller;

import com.adminframe.api.exception.AuthenticationRequiredException;
import com.adminframe.api.exception.PermissionDeniedException;
import com.adminframe.api.exception.ValidationException;
import com.adminframe.api.security.AdminUser;
import com.adminframe.dashboard.dto.ApiResponse;
import com.adminframe.dashboard.dto.ContentTypeDTO;
import com.adminframe.dashboard.dto.GrantDTO;
import com.adminframe.dashboard.dto.MembershipDTO;
import com.adminframe.dashboard.service.DashboardService;
import com.adminframe.starter.security.AdminSubjectResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * RBAC 管理接口，仅超级管理员可用
 */
@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/adminframe/dashboard/rbac")
public class RbacController {

    private final DashboardService dashboardService;
    private final AdminSubjectResolver subjectResolver;

    @GetMapping("/content-types")
    public ApiResponse<List<ContentTypeDTO>> getContentTypes(HttpServletRequest request) {
        requireSuperuser(request);
        return ApiResponse.ok(dashboardService.listContentTypes());
    }

    @GetMapping("/grants")
    public ApiResponse<List<GrantDTO>> getGrants(HttpServletRequest request) {
        requireSuperuser(request);
        return ApiResponse.ok(dashboardService.listGrants());
    }

    @PostMapping("/grants")
    public ApiResponse<GrantDTO> grant(HttpServletRequest request, @RequestBody GrantDTO dto) {
        AdminUser operator = requireSuperuser(request);
        GrantDTO granted = dashboardService.grant(dto);
        log.info("[AdminFrame] {} granted {} to {} {}", operator.id(), granted.getCodename(),
                granted.getGranteeType(), granted.getGranteeId());
        return ApiResponse.ok("授权成功", granted);
    }

    /**
     * 撤销授权；用 POST 避免 DELETE 携带请求体
     */
    @PostMapping("/grants/revoke")
    public ApiResponse<GrantDTO> revoke(HttpServletRequest request, @RequestBody GrantDTO dto) {
        AdminUser operator = requireSuperuser(request);
        GrantDTO revoked = dashboardService.revoke(dto);
        log.info("[AdminFrame] {} revoked {} from {} {}", operator.id(), revoked.getCodename(),
                revoked.getGranteeType(), revoked.getGranteeId());
        return ApiResponse.ok("已撤销授权", revoked);
    }

    @GetMapping("/groups/{groupId}/members")
    public ApiResponse<MembershipDTO> getMembers(HttpServletRequest request, @PathVariable("groupId") String groupId) {
        requireSuperuser(request);
        return ApiResponse.ok(dashboardService.members(groupId));
    }

    @PostMapping("/groups/{groupId}/members/{userId}")
    public ApiResponse<MembershipDTO> addMember(HttpServletRequest request,
                                                @PathVariable("groupId") String groupId,
                                                @PathVariable("userId") String userId) {
        requireSuperuser(request);
        return ApiResponse.ok("成员已加入", dashboardService.addMember(groupId, userId));
    }

    @DeleteMapping("/groups/{groupId}/members/{userId}")
    public ApiResponse<MembershipDTO> removeMember(HttpServletRequest request,
                                                   @PathVariable("groupId") String groupId,
                                                   @PathVariable("userId") String userId) {
        requireSuperuser(request);
        return ApiResponse.ok("成员已移除", dashboardService.removeMember(groupId, userId));
    }

    // ==================== 异常处理 ====================

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnauthorized(AuthenticationRequiredException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiResponse.error("需要登录"));
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleForbidden(PermissionDeniedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ApiResponse.error("仅超级管理员可操作"));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ApiResponse.error("参数错误: " + e.getErrors()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        log.error("[AdminFrame] RBAC dashboard request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error("操作失败"));
    }

    private AdminUser requireSuperuser(HttpServletRequest request) {
        AdminUser subject = subjectResolver.resolve(request);
        if (subject == null) {
            throw new AuthenticationRequiredException("No authenticated admin subject");
        }
        if (!subject.active() || !subject.superuser()) {
            log.warn("[AdminFrame] Non-superuser {} attempted RBAC management", subject.id());
            throw new PermissionDeniedException("RBAC management requires a superuser");
        }
        return subject;
    }
}
