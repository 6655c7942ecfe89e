package com.adminframe.dashboard.config;

import com.adminframe.core.content.ContentTypeRegistry;
import com.adminframe.core.security.GrantService;
import com.adminframe.dashboard.controller.RbacController;
import com.adminframe.dashboard.service.DashboardService;
import com.adminframe.starter.configuration.AdminFrameAutoConfiguration;
import com.adminframe.starter.security.AdminSubjectResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration(after = AdminFrameAutoConfiguration.class)
@ConditionalOnWebApplication
@ConditionalOnBean(GrantService.class)
@ConditionalOnProperty(prefix = "adminframe.dashboard", name = "enabled", havingValue = "true", matchIfMissing = false)
public class DashboardAutoConfiguration {

    public DashboardAutoConfiguration() {
        log.info("[AdminFrame] Dashboard module initializing...");
    }

    @Bean
    public DashboardService dashboardService(GrantService grantService, ContentTypeRegistry registry) {
        return new DashboardService(grantService, registry);
    }

    @Bean
    public RbacController rbacController(DashboardService dashboardService, AdminSubjectResolver subjectResolver) {
        return new RbacController(dashboardService, subjectResolver);
    }
}
