package com.adminframe.core.site;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.exception.ConfigurationException;
import com.adminframe.api.exception.NotFoundException;
import com.adminframe.api.model.ModelMeta;
import com.adminframe.api.security.AdminUser;
import com.adminframe.core.action.AdminAction;
import com.adminframe.core.content.ContentTypeRegistry;
import com.adminframe.core.content.VirtualContentNamer;
import com.adminframe.core.descriptor.ModelDescriptor;
import com.adminframe.core.query.QuerySetPipeline;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 管理站点：资源注册的唯一入口
 * <p>
 * 启动阶段 register / registerCard / registerView，随后 finalizeSite 把它们写入内容类型注册表并探测流水线，
 * 最后 freeze。之后的查找都走不可变快照。
 *
 * @author AdminFrame
 */
@Slf4j
public class AdminSite {

    static final AdminUser PROBE_SUBJECT = new AdminUser("__probe__", "__probe__", true, true, false);

    private final ContentTypeRegistry registry;
    private final QuerySetPipeline pipeline;

    // ==================== 启动期状态（受 this 保护） ====================

    private final Map<String, PendingModel<?>> pendingModels = new LinkedHashMap<>();
    private final Map<String, VirtualEntry> pendingVirtuals = new LinkedHashMap<>();
    private boolean frozen = false;

    // ==================== 发布后的快照 ====================

    private volatile Map<String, RegisteredModel<?>> modelsByPath = Map.of();
    private volatile Map<ContentTypeId, RegisteredModel<?>> modelsById = Map.of();
    private volatile List<VirtualEntry> virtuals = List.of();

    public AdminSite(ContentTypeRegistry registry, QuerySetPipeline pipeline) {
        this.registry = registry;
        this.pipeline = pipeline;
    }

    // ==================== 注册 ====================

    public <T> void register(String appLabel, ModelDescriptor<T> descriptor) {
        register(appLabel, descriptor, false);
    }

    /**
     * 注册资源
     *
     * @param settings 为 true 时按全局权限鉴权，并挂载在设置前缀下
     * @throws ConfigurationException 重复注册、字段声明非法或动作名重复
     */
    public synchronized <T> void register(String appLabel, ModelDescriptor<T> descriptor, boolean settings) {
        checkNotFrozen();
        if (appLabel == null || appLabel.isBlank()) {
            throw new ConfigurationException("App label must not be blank");
        }
        ModelMeta meta = descriptor.getMeta();
        if (meta == null || meta.modelName() == null || meta.modelName().isBlank()) {
            throw new ConfigurationException("Adapter of " + descriptor.getClass().getName() + " has no model name");
        }
        String modelSlug = meta.modelName().toLowerCase(Locale.ROOT);
        String path = appLabel + "." + modelSlug;
        if (pendingModels.containsKey(path)) {
            throw new ConfigurationException("Resource already registered: " + path);
        }

        validateFields(path, descriptor);
        validateActions(path, descriptor);

        pendingModels.put(path, new PendingModel<>(appLabel, modelSlug, descriptor, settings));
        log.info("[AdminFrame] Registered resource: {} ({})", path, descriptor.getClass().getSimpleName());
    }

    public void registerCard(String appLabel, String key, String label) {
        registerVirtual(appLabel, VirtualContentNamer.KIND_CARDS, key, label);
    }

    public void registerView(String appLabel, String key, String label) {
        registerVirtual(appLabel, VirtualContentNamer.KIND_VIEWS, key, label);
    }

    public synchronized void registerVirtual(String appLabel, String kind, String key, String label) {
        checkNotFrozen();
        String dotted = VirtualContentNamer.makeDotted(appLabel, kind, key);
        if (pendingVirtuals.containsKey(dotted)) {
            throw new ConfigurationException("Virtual entry already registered: " + dotted);
        }
        pendingVirtuals.put(dotted, new VirtualEntry(appLabel, kind, key, label, null));
        log.info("[AdminFrame] Registered virtual entry: {}", dotted);
    }

    // ==================== 生命周期 ====================

    /**
     * 将已注册资源写入内容类型注册表、探测流水线并发布快照；可重复调用
     */
    public synchronized void finalizeSite() {
        for (PendingModel<?> pending : pendingModels.values()) {
            registry.register(pending.appLabel, pending.modelSlug, pending.appLabel + "." + pending.modelSlug, false);
        }
        for (Map.Entry<String, VirtualEntry> entry : pendingVirtuals.entrySet()) {
            VirtualEntry virtual = entry.getValue();
            registry.register(virtual.appLabel(), VirtualContentNamer.modelSlug(virtual.kind(), virtual.key()),
                    entry.getKey(), true);
        }
        registry.finalizeRegistry();

        Map<String, RegisteredModel<?>> byPath = new HashMap<>();
        Map<ContentTypeId, RegisteredModel<?>> byId = new HashMap<>();
        for (Map.Entry<String, PendingModel<?>> entry : pendingModels.entrySet()) {
            RegisteredModel<?> model = entry.getValue().bind(registry, pipeline);
            byPath.put(entry.getKey(), model);
            byId.put(model.contentType().id(), model);
        }
        List<VirtualEntry> boundVirtuals = new ArrayList<>();
        for (Map.Entry<String, VirtualEntry> entry : pendingVirtuals.entrySet()) {
            ContentType ct = registry.getByDotted(entry.getKey()).orElseThrow();
            boundVirtuals.add(entry.getValue().withContentType(ct));
        }

        this.modelsByPath = Collections.unmodifiableMap(byPath);
        this.modelsById = Collections.unmodifiableMap(byId);
        this.virtuals = List.copyOf(boundVirtuals);
        log.info("[AdminFrame] Admin site finalized: {} resources, {} virtual entries",
                byPath.size(), boundVirtuals.size());
    }

    /**
     * 冻结站点与注册表，之后不再接受注册
     */
    public synchronized void freeze() {
        frozen = true;
        registry.freeze();
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    // ==================== 查找 ====================

    /**
     * @throws NotFoundException 未知的 (app, model)
     */
    public RegisteredModel<?> find(String appLabel, String modelSlug) {
        RegisteredModel<?> model = modelsByPath.get(appLabel + "." + modelSlug);
        if (model == null) {
            throw new NotFoundException("Unknown resource: " + appLabel + "." + modelSlug);
        }
        return model;
    }

    public Optional<RegisteredModel<?>> lookup(ContentType contentType) {
        return Optional.ofNullable(modelsById.get(contentType.id()));
    }

    public List<RegisteredModel<?>> models() {
        return modelsById.values().stream()
                .sorted((a, b) -> Long.compare(a.contentType().id().value(), b.contentType().id().value()))
                .toList();
    }

    public List<VirtualEntry> virtualEntries() {
        return virtuals;
    }

    public ContentTypeRegistry getRegistry() {
        return registry;
    }

    // ==================== 校验 ====================

    private void checkNotFrozen() {
        if (frozen) {
            throw new ConfigurationException("Admin site is frozen, registrations are closed");
        }
    }

    private static void validateFields(String path, ModelDescriptor<?> descriptor) {
        ModelMeta meta = descriptor.getMeta();
        Map<String, List<String>> declared = new LinkedHashMap<>();
        declared.put("list_display", descriptor.getListDisplay());
        declared.put("search_fields", descriptor.getSearchFields());
        declared.put("list_filter", descriptor.getListFilter());
        declared.put("fields", descriptor.getFields());
        declared.put("readonly_fields", descriptor.getReadonlyFields());
        List<String> ordering = descriptor.getOrdering().stream()
                .map(o -> o.startsWith("-") ? o.substring(1) : o)
                .toList();
        declared.put("ordering", ordering);

        declared.forEach((option, names) -> {
            for (String name : names) {
                if (meta.field(name).isEmpty() && !name.equals(meta.pkField())) {
                    throw new ConfigurationException(path + ": " + option + " refers to unknown field '" + name + "'");
                }
            }
        });
    }

    private static <T> void validateActions(String path, ModelDescriptor<T> descriptor) {
        Set<String> names = new HashSet<>();
        for (AdminAction<T> action : descriptor.getActions()) {
            String name = action.spec().getName();
            if (name == null || name.isBlank()) {
                throw new ConfigurationException(path + ": action without a name");
            }
            if (!names.add(name)) {
                throw new ConfigurationException(path + ": duplicate action name '" + name + "'");
            }
        }
    }

    private record PendingModel<T>(String appLabel, String modelSlug, ModelDescriptor<T> descriptor,
                                   boolean settings) {

        RegisteredModel<T> bind(ContentTypeRegistry registry, QuerySetPipeline pipeline) {
            ContentType ct = registry.get(appLabel, modelSlug)
                    .orElseThrow(() -> new ConfigurationException("Content type not published: "
                            + appLabel + "." + modelSlug));
            pipeline.probe(descriptor, PROBE_SUBJECT);
            return new RegisteredModel<>(ct, descriptor, settings);
        }
    }
}
