package com.adminframe.starter.configuration;

import com.adminframe.api.security.GrantRepository;
import com.adminframe.api.security.PermissionChecker;
import com.adminframe.core.action.ActionRunner;
import com.adminframe.core.action.ActionTaskManager;
import com.adminframe.core.action.InMemoryTaskCheckpointStore;
import com.adminframe.core.action.ScopeTokenService;
import com.adminframe.core.action.TaskCheckpointStore;
import com.adminframe.core.action.YamlTaskCheckpointStore;
import com.adminframe.core.config.AdminFrameConfig;
import com.adminframe.core.content.ContentTypeRegistry;
import com.adminframe.core.event.EventBus;
import com.adminframe.core.query.ListQueryParser;
import com.adminframe.core.query.QuerySetPipeline;
import com.adminframe.core.query.ScopeQueryBuilder;
import com.adminframe.core.security.CachingPermissionChecker;
import com.adminframe.core.security.DefaultPermissionChecker;
import com.adminframe.core.security.GrantService;
import com.adminframe.core.security.InMemoryGrantRepository;
import com.adminframe.core.service.AdminService;
import com.adminframe.core.service.FormSchemaBuilder;
import com.adminframe.core.site.AdminSite;
import com.adminframe.starter.config.AdminFrameProperties;
import com.adminframe.starter.security.AdminSubjectResolver;
import com.adminframe.starter.security.RequestAttributeSubjectResolver;
import com.adminframe.starter.web.AdminDispatchController;
import com.adminframe.starter.web.AdminExceptionHandler;
import com.adminframe.starter.web.AdminRouteManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.web.servlet.WebMvcAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

@Slf4j
@AutoConfiguration(after = WebMvcAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(AdminFrameProperties.class)
@ConditionalOnProperty(prefix = "adminframe", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AdminFrameAutoConfiguration {

    // 将外部配置转换为 Core 配置并设为全局实例
    @Bean
    public AdminFrameConfig adminFrameConfig(AdminFrameProperties properties) {
        String secret = properties.getScopeToken().getSecret();
        if (secret == null || secret.isBlank()) {
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            secret = Base64.getEncoder().encodeToString(random);
            log.warn("[AdminFrame] adminframe.scope-token.secret not set, using a random per-process secret");
        }
        AdminFrameConfig config = AdminFrameConfig.builder()
                .defaultPerPage(properties.getPagination().getDefaultPerPage())
                .maxPerPage(properties.getPagination().getMaxPerPage())
                .actionBatchSize(properties.getActions().getBatchSize())
                .batchThreshold(properties.getActions().getBatchThreshold())
                .actionWorkers(properties.getActions().getWorkers())
                .taskCheckpointFile(properties.getActions().getCheckpointFile())
                .taskRetention(properties.getActions().getTaskRetention())
                .scopeTokenTtl(properties.getScopeToken().getTtl())
                .scopeTokenSecret(secret)
                .permissionCacheEnabled(properties.getPermission().isCacheEnabled())
                .permissionCacheTtl(properties.getPermission().getCacheTtl())
                .permissionCacheMaxSize(properties.getPermission().getCacheMaxSize())
                .grantPolicy(properties.getPermission().getGrantPolicy())
                .build();
        log.info("[AdminFrame] Core config initialized: {}", config);
        return config;
    }

    // 将事件总线注册为 Bean (解耦)
    @Bean
    @ConditionalOnMissingBean
    public EventBus adminEventBus() {
        return new EventBus();
    }

    @Bean
    public ContentTypeRegistry contentTypeRegistry(EventBus eventBus) {
        return new ContentTypeRegistry(eventBus);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuerySetPipeline querySetPipeline() {
        return new QuerySetPipeline();
    }

    // 宿主可提供基于数据库的授权存储
    @Bean
    @ConditionalOnMissingBean(GrantRepository.class)
    public GrantRepository grantRepository() {
        return new InMemoryGrantRepository();
    }

    @Bean
    @ConditionalOnMissingBean(PermissionChecker.class)
    public PermissionChecker permissionChecker(AdminFrameConfig config, GrantRepository grantRepository,
                                               EventBus eventBus) {
        PermissionChecker checker = new DefaultPermissionChecker(grantRepository);
        if (!config.isPermissionCacheEnabled()) {
            return checker;
        }
        return new CachingPermissionChecker(checker, grantRepository, eventBus,
                config.getPermissionCacheTtl(), config.getPermissionCacheMaxSize());
    }

    @Bean
    public GrantService grantService(GrantRepository grantRepository, EventBus eventBus, AdminFrameConfig config) {
        return new GrantService(grantRepository, eventBus, config.getGrantPolicy());
    }

    @Bean
    public ListQueryParser listQueryParser(AdminFrameConfig config) {
        return new ListQueryParser(config);
    }

    @Bean
    public ScopeQueryBuilder scopeQueryBuilder(ListQueryParser parser) {
        return new ScopeQueryBuilder(parser);
    }

    @Bean
    public FormSchemaBuilder formSchemaBuilder() {
        return new FormSchemaBuilder();
    }

    @Bean
    public AdminService adminService(QuerySetPipeline pipeline, ListQueryParser parser,
                                     FormSchemaBuilder formSchemaBuilder, PermissionChecker permissionChecker) {
        return new AdminService(pipeline, parser, formSchemaBuilder, permissionChecker);
    }

    @Bean
    public ScopeTokenService scopeTokenService(AdminFrameConfig config, ObjectProvider<ObjectMapper> mapperProvider) {
        ObjectMapper mapper = mapperProvider.getIfAvailable(ObjectMapper::new);
        return new ScopeTokenService(config.getScopeTokenSecret(), config.getScopeTokenTtl(), Clock.systemUTC(), mapper);
    }

    @Bean
    @ConditionalOnMissingBean(TaskCheckpointStore.class)
    public TaskCheckpointStore taskCheckpointStore(AdminFrameConfig config) {
        String file = config.getTaskCheckpointFile();
        if (file == null || file.isBlank()) {
            return new InMemoryTaskCheckpointStore(config.getTaskRetention(),
                    InMemoryTaskCheckpointStore.DEFAULT_MAX_FINISHED);
        }
        return new YamlTaskCheckpointStore(Path.of(file));
    }

    @Bean(destroyMethod = "close")
    public ActionTaskManager actionTaskManager(AdminFrameConfig config, TaskCheckpointStore store, EventBus eventBus) {
        return new ActionTaskManager(config.getActionWorkers(), config.getActionBatchSize(), store, eventBus,
                Clock.systemUTC());
    }

    @Bean
    public ActionRunner actionRunner(QuerySetPipeline pipeline, ScopeQueryBuilder scopeQueryBuilder,
                                     PermissionChecker permissionChecker, ScopeTokenService tokenService,
                                     ActionTaskManager taskManager, AdminFrameConfig config) {
        return new ActionRunner(pipeline, scopeQueryBuilder, permissionChecker, tokenService, taskManager,
                config.getBatchThreshold());
    }

    @Bean
    public AdminSite adminSite(ContentTypeRegistry registry, QuerySetPipeline pipeline) {
        return new AdminSite(registry, pipeline);
    }

    @Bean
    @ConditionalOnMissingBean(AdminSubjectResolver.class)
    public AdminSubjectResolver adminSubjectResolver(AdminFrameProperties properties) {
        return new RequestAttributeSubjectResolver(properties.getSecurity().getSubjectAttribute());
    }

    @Bean
    public AdminRouteManager adminRouteManager() {
        return new AdminRouteManager();
    }

    @Bean
    public AdminDispatchController adminDispatchController(AdminRouteManager routeManager,
                                                           AdminSubjectResolver subjectResolver,
                                                           PermissionChecker permissionChecker,
                                                           ListQueryParser listQueryParser,
                                                           AdminService adminService,
                                                           ActionRunner actionRunner) {
        return new AdminDispatchController(routeManager, subjectResolver, permissionChecker, listQueryParser,
                adminService, actionRunner);
    }

    @Bean
    public AdminExceptionHandler adminExceptionHandler() {
        return new AdminExceptionHandler();
    }

    @Bean
    public ApplicationListener<ContextRefreshedEvent> adminSiteInitializer(
            AdminSite site,
            AdminRouteManager routeManager,
            AdminDispatchController controller,
            AdminFrameProperties properties,
            ObjectProvider<List<AdminSiteConfigurer>> configurersProvider,
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping hostMapping
    ) {
        return event -> {
            if (event.getApplicationContext().getParent() != null || site.isFrozen()) { // 仅 Host 容器执行一次
                return;
            }
            List<AdminSiteConfigurer> configurers = configurersProvider.getIfAvailable(Collections::emptyList);
            for (AdminSiteConfigurer configurer : configurers) {
                configurer.configure(site);
            }
            site.finalizeSite();

            routeManager.init(hostMapping, controller);
            routeManager.mount(site, properties.getApiPrefix(), properties.getSettingsPrefix());
            site.freeze();
            log.info("[AdminFrame] Admin site ready: {} resources, {} virtual entries",
                    site.models().size(), site.virtualEntries().size());
        };
    }
}
