package com.adminframe.example.web;

import com.adminframe.api.security.AdminUser;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 演示用认证：从 X-Admin-User 头取用户名，"root" 视为超级管理员。
 * 真实宿主应在自己的认证层放置 {@link AdminUser}。
 */
@Slf4j
@Component
public class DemoSubjectFilter extends OncePerRequestFilter {

    static final String HEADER = "X-Admin-User";

    private final String subjectAttribute;

    public DemoSubjectFilter(@Value("${adminframe.security.subject-attribute:adminframe.subject}") String subjectAttribute) {
        this.subjectAttribute = subjectAttribute;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String username = request.getHeader(HEADER);
        if (username != null && !username.isBlank()) {
            String id = username.trim();
            AdminUser user = "root".equals(id) ? AdminUser.superuser(id, id) : AdminUser.staff(id, id);
            request.setAttribute(subjectAttribute, user);
            log.debug("[AdminFrame] Demo subject resolved: {}", id);
        }
        chain.doFilter(request, response);
    }
}
