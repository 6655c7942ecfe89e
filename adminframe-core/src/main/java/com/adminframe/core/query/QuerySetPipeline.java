package com.adminframe.core.query;

import com.adminframe.api.exception.ConfigurationException;
import com.adminframe.api.model.FilterSpec;
import com.adminframe.api.model.QuerySet;
import com.adminframe.api.security.AdminUser;
import com.adminframe.core.descriptor.ModelDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 查询集流水线
 * <p>
 * 三种形态都是对描述符钩子的固定折叠，调用方无法跳过或重排阶段：
 * <ul>
 *     <li>LIST：base(含请求条件) → 关联预取 → 列投影 → 行级安全</li>
 *     <li>OBJECT：base → 关联预取 → 行级安全</li>
 *     <li>FORM_BASE：base → 写入用关联预取</li>
 * </ul>
 * 行级安全总是最后一步；分页是在结果上截取的窗口，不属于流水线。
 *
 * @author AdminFrame
 */
@Slf4j
public class QuerySetPipeline {

    public enum Shape {
        LIST(List.of(Stage.BASE, Stage.RELATION_PREFETCH, Stage.PROJECTION, Stage.ROW_LEVEL_SECURITY)),
        OBJECT(List.of(Stage.BASE, Stage.RELATION_PREFETCH, Stage.ROW_LEVEL_SECURITY)),
        FORM_BASE(List.of(Stage.BASE, Stage.RELATION_PREFETCH_FOR_WRITES));

        private final List<Stage> stages;

        Shape(List<Stage> stages) {
            this.stages = stages;
        }

        public List<Stage> stages() {
            return stages;
        }
    }

    public enum Stage {
        BASE,
        RELATION_PREFETCH,
        PROJECTION,
        ROW_LEVEL_SECURITY,
        RELATION_PREFETCH_FOR_WRITES
    }

    public <T> QuerySet<T> list(ModelDescriptor<T> descriptor, ListCriteria criteria, AdminUser subject) {
        QuerySet<T> qs = base(descriptor, criteria);
        qs = checked(descriptor, Stage.RELATION_PREFETCH, descriptor.applyRelationPrefetch(qs));
        qs = checked(descriptor, Stage.PROJECTION, descriptor.applyProjection(qs));
        return checked(descriptor, Stage.ROW_LEVEL_SECURITY, descriptor.applyRowLevelSecurity(qs, subject));
    }

    public <T> QuerySet<T> object(ModelDescriptor<T> descriptor, AdminUser subject) {
        QuerySet<T> qs = base(descriptor, ListCriteria.none());
        qs = checked(descriptor, Stage.RELATION_PREFETCH, descriptor.applyRelationPrefetch(qs));
        return checked(descriptor, Stage.ROW_LEVEL_SECURITY, descriptor.applyRowLevelSecurity(qs, subject));
    }

    public <T> QuerySet<T> formBase(ModelDescriptor<T> descriptor) {
        QuerySet<T> qs = base(descriptor, ListCriteria.none());
        return checked(descriptor, Stage.RELATION_PREFETCH_FOR_WRITES, descriptor.applyRelationPrefetchForWrites(qs));
    }

    public <T> QuerySet<T> shape(Shape shape, ModelDescriptor<T> descriptor, AdminUser subject) {
        return switch (shape) {
            case LIST -> list(descriptor, ListCriteria.none(), subject);
            case OBJECT -> object(descriptor, subject);
            case FORM_BASE -> formBase(descriptor);
        };
    }

    /**
     * 启动探测：构造每种形态（不访问存储），让行为异常的钩子尽早失败
     */
    public <T> void probe(ModelDescriptor<T> descriptor, AdminUser probeSubject) {
        for (Shape shape : Shape.values()) {
            try {
                shape(shape, descriptor, probeSubject);
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConfigurationException("Descriptor " + descriptor.getClass().getName()
                        + " failed the " + shape + " pipeline probe: " + e.getMessage(), e);
            }
        }
    }

    private <T> QuerySet<T> base(ModelDescriptor<T> descriptor, ListCriteria criteria) {
        QuerySet<T> qs = checked(descriptor, Stage.BASE, descriptor.baseQuerySet());
        for (FilterSpec filter : criteria.filters()) {
            qs = qs.filter(filter);
        }
        if (criteria.hasSearch()) {
            qs = qs.search(criteria.searchFields(), criteria.search());
        }
        if (!criteria.ordering().isEmpty()) {
            qs = qs.orderBy(criteria.ordering());
        }
        return qs;
    }

    private <T> QuerySet<T> checked(ModelDescriptor<T> descriptor, Stage stage, QuerySet<T> qs) {
        if (qs == null) {
            throw new ConfigurationException("Descriptor " + descriptor.getClass().getName()
                    + " returned null from the " + stage + " stage");
        }
        if (qs.adapter() != descriptor.getAdapter()) {
            throw new ConfigurationException("Descriptor " + descriptor.getClass().getName()
                    + " returned a queryset of a different adapter from the " + stage + " stage");
        }
        log.trace("[AdminFrame] Pipeline stage {} applied for {}", stage, descriptor.getLabel());
        return qs;
    }
}
