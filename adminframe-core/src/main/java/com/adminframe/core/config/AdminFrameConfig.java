package com.adminframe.core.config;

import com.adminframe.core.security.GrantPolicy;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * AdminFrame Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽 Spring Boot 或其他外部环境的差异。
 */
@Data
@Builder
@ToString(exclude = "scopeTokenSecret")
public class AdminFrameConfig {

    // ================= 列表分页 =================

    @Builder.Default
    private int defaultPerPage = 20;

    @Builder.Default
    private int maxPerPage = 100;

    // ================= 批量动作 =================

    /**
     * 后台任务每批处理的条数
     */
    @Builder.Default
    private int actionBatchSize = 100;

    /**
     * 范围大小超过该值时转入后台执行（等于该值仍同步执行）
     */
    @Builder.Default
    private int batchThreshold = 100;

    /**
     * 后台动作工作线程数
     */
    @Builder.Default
    private int actionWorkers = 2;

    /**
     * 任务检查点文件，null 表示仅保存在内存
     */
    private String taskCheckpointFile;

    /**
     * 内存存储中已结束任务的保留时长
     */
    @Builder.Default
    private Duration taskRetention = Duration.ofHours(1);

    // ================= 范围令牌 =================

    @Builder.Default
    private Duration scopeTokenTtl = Duration.ofMinutes(5);

    /**
     * HMAC 密钥，为空时由 Starter 生成进程级随机密钥
     */
    private String scopeTokenSecret;

    // ================= 权限 =================

    @Builder.Default
    private boolean permissionCacheEnabled = true;

    @Builder.Default
    private Duration permissionCacheTtl = Duration.ofMinutes(5);

    @Builder.Default
    private long permissionCacheMaxSize = 10_000;

    /**
     * 授予 change/delete 时对 view 的处理方式
     */
    @Builder.Default
    private GrantPolicy grantPolicy = GrantPolicy.IMPLY_VIEW;
}
