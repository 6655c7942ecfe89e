package com.adminframe.core.content;

import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.event.content.ContentTypesFinalizedEvent;
import com.adminframe.api.exception.ConfigurationException;
import com.adminframe.core.event.EventBus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 内容类型注册表
 * <p>
 * 写入发生在启动阶段：register 只登记，finalizeRegistry 才对读取方可见；freeze 之后拒绝任何新登记。
 * 读取走 volatile 引用发布的不可变快照，无锁。
 *
 * @author AdminFrame
 */
@Slf4j
public class ContentTypeRegistry {

    private final EventBus eventBus;

    // 已登记（含未发布）的条目，受 this 保护
    private final Map<Key, ContentType> registered = new LinkedHashMap<>();
    private final Map<String, Key> dottedIndex = new HashMap<>();
    private long sequence = 0;
    private boolean frozen = false;

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public ContentTypeRegistry(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public ContentTypeRegistry() {
        this(null);
    }

    // ==================== 写入（启动阶段） ====================

    /**
     * 登记内容类型，相同输入重复登记为幂等操作。
     *
     * @throws ConfigurationException 同一 (appLabel, modelSlug) 数据冲突、点分名被占用或注册表已冻结
     */
    public synchronized ContentTypeId register(String appLabel, String modelSlug, String dottedName, boolean virtual) {
        requireText(appLabel, "appLabel");
        requireText(modelSlug, "modelSlug");
        requireText(dottedName, "dottedName");

        Key key = new Key(appLabel, modelSlug);
        ContentType existing = registered.get(key);
        if (existing != null) {
            if (existing.dottedName().equals(dottedName) && existing.virtual() == virtual) {
                return existing.id();
            }
            throw new ConfigurationException("Conflicting registration for " + appLabel + "." + modelSlug
                    + ": already registered as " + existing.dottedName() + " (virtual=" + existing.virtual() + ")");
        }

        Key owner = dottedIndex.get(dottedName);
        if (owner != null) {
            throw new ConfigurationException("Dotted name '" + dottedName + "' is already used by "
                    + owner.appLabel() + "." + owner.modelSlug());
        }

        if (frozen) {
            throw new ConfigurationException("Content type registry is frozen, cannot register " + dottedName);
        }

        ContentType contentType = new ContentType(
                new ContentTypeId(++sequence), appLabel, modelSlug, dottedName, virtual);
        registered.put(key, contentType);
        dottedIndex.put(dottedName, key);
        log.debug("[AdminFrame] Content type registered: {} (id={})", dottedName, contentType.id());
        return contentType.id();
    }

    /**
     * 发布所有已登记条目，幂等；已发布的条目不会被移除。
     *
     * @return 本次新发布的条目数
     */
    public synchronized int finalizeRegistry() {
        int before = snapshot.byKey.size();
        snapshot = Snapshot.of(registered.values());
        int published = snapshot.byKey.size() - before;

        if (published > 0) {
            log.info("[AdminFrame] Content types finalized: {} total, {} newly published",
                    snapshot.byKey.size(), published);
        }
        if (eventBus != null) {
            eventBus.publish(new ContentTypesFinalizedEvent(snapshot.byKey.size(), published));
        }
        return published;
    }

    /**
     * 冻结注册表。之后仅允许相同输入的幂等登记。
     */
    public synchronized void freeze() {
        if (!frozen) {
            frozen = true;
            log.info("[AdminFrame] Content type registry frozen with {} entries", registered.size());
        }
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    // ==================== 读取（无锁） ====================

    /**
     * 解析内容类型标识；finalizeRegistry 之前总是返回空。
     */
    public Optional<ContentTypeId> resolve(String appLabel, String modelSlug) {
        return get(appLabel, modelSlug).map(ContentType::id);
    }

    public Optional<ContentType> get(String appLabel, String modelSlug) {
        if (appLabel == null || modelSlug == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.byKey.get(new Key(appLabel, modelSlug)));
    }

    public Optional<ContentType> getByDotted(String dottedName) {
        return Optional.ofNullable(snapshot.byDotted.get(dottedName));
    }

    public Optional<ContentType> getById(ContentTypeId id) {
        return Optional.ofNullable(snapshot.byId.get(id));
    }

    public List<ContentType> all() {
        return snapshot.ordered;
    }

    public boolean isFinalized() {
        return snapshot != Snapshot.EMPTY;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Content type " + field + " must not be blank");
        }
    }

    // ===== 内部类 =====

    private record Key(String appLabel, String modelSlug) {
        Key {
            Objects.requireNonNull(appLabel);
            Objects.requireNonNull(modelSlug);
        }
    }

    private record Snapshot(
            Map<Key, ContentType> byKey,
            Map<String, ContentType> byDotted,
            Map<ContentTypeId, ContentType> byId,
            List<ContentType> ordered
    ) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), Map.of(), List.of());

        static Snapshot of(Iterable<ContentType> entries) {
            Map<Key, ContentType> byKey = new HashMap<>();
            Map<String, ContentType> byDotted = new HashMap<>();
            Map<ContentTypeId, ContentType> byId = new HashMap<>();
            List<ContentType> ordered = new ArrayList<>();
            for (ContentType ct : entries) {
                byKey.put(new Key(ct.appLabel(), ct.modelSlug()), ct);
                byDotted.put(ct.dottedName(), ct);
                byId.put(ct.id(), ct);
                ordered.add(ct);
            }
            return new Snapshot(Collections.unmodifiableMap(byKey), Collections.unmodifiableMap(byDotted),
                    Collections.unmodifiableMap(byId), Collections.unmodifiableList(ordered));
        }
    }
}
