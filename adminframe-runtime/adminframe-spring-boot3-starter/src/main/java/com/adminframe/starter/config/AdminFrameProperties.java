package com.adminframe.starter.config;

import com.adminframe.core.security.GrantPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * AdminFrame 配置
 * <p>
 * 示例：
 * <pre>
 * adminframe:
 *   api-prefix: /admin/api/orm
 *   actions:
 *     batch-threshold: 100
 *   scope-token:
 *     secret: ${ADMIN_SCOPE_SECRET}
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "adminframe")
public class AdminFrameProperties {

    /**
     * 总开关
     */
    private boolean enabled = true;

    /**
     * 资源接口前缀
     */
    private String apiPrefix = "/admin/api/orm";

    /**
     * 设置类资源（全局权限）的接口前缀
     */
    private String settingsPrefix = "/admin/api/settings";

    private Pagination pagination = new Pagination();

    private Actions actions = new Actions();

    private ScopeToken scopeToken = new ScopeToken();

    private Permission permission = new Permission();

    private Security security = new Security();

    private Dashboard dashboard = new Dashboard();

    @Data
    public static class Pagination {
        private int defaultPerPage = 20;
        private int maxPerPage = 100;
    }

    @Data
    public static class Actions {

        /**
         * 范围大小超过该值时转入后台执行
         */
        private int batchThreshold = 100;

        /**
         * 后台任务每批条数
         */
        private int batchSize = 100;

        private int workers = 2;

        /**
         * 检查点文件，为空时只保存在内存
         */
        private String checkpointFile;

        /**
         * 内存存储中已结束任务的保留时长
         */
        private Duration taskRetention = Duration.ofHours(1);
    }

    @Data
    public static class ScopeToken {

        /**
         * HMAC 密钥，未配置时每次启动随机生成（重启后旧令牌全部失效）
         */
        private String secret;

        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class Permission {

        private boolean cacheEnabled = true;

        private Duration cacheTtl = Duration.ofMinutes(5);

        private long cacheMaxSize = 10_000;

        private GrantPolicy grantPolicy = GrantPolicy.IMPLY_VIEW;
    }

    @Data
    public static class Security {

        /**
         * 宿主放置 {@link com.adminframe.api.security.AdminUser} 的请求属性名
         */
        private String subjectAttribute = "adminframe.subject";
    }

    @Data
    public static class Dashboard {

        /**
         * 是否启用 RBAC 管理接口
         */
        private boolean enabled = false;
    }
}
