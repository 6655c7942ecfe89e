package com.adminframe.starter.support;

import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FieldKind;
import com.adminframe.api.model.ModelMeta;
import com.adminframe.core.adapter.memory.InMemoryModelAdapter;
import com.adminframe.core.descriptor.ModelDescriptor;
import com.adminframe.starter.configuration.AdminSiteConfigurer;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试宿主：只注册 blog.post 一个资源，不做组件扫描
 */
@SpringBootConfiguration
@EnableAutoConfiguration
public class AdminFrameTestApplication {

    public static final int SEEDED_POSTS = 6;

    @Bean
    public InMemoryModelAdapter postAdapter() {
        ModelMeta meta = new ModelMeta("Post", "id", List.of(
                FieldDescriptor.builder().name("id").kind(FieldKind.BIGINT).primaryKey(true).build(),
                FieldDescriptor.builder().name("title").kind(FieldKind.STRING).build(),
                FieldDescriptor.builder().name("status").kind(FieldKind.STRING).defaultValue("draft").build(),
                FieldDescriptor.builder().name("author").kind(FieldKind.STRING).nullable(true).build()
        ));
        InMemoryModelAdapter adapter = new InMemoryModelAdapter(meta);
        for (int i = 1; i <= SEEDED_POSTS; i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("title", "Post " + i);
            values.put("author", i % 2 == 1 ? "alice" : "bob");
            adapter.create(values);
        }
        return adapter;
    }

    @Bean
    public AdminSiteConfigurer blogSite(InMemoryModelAdapter postAdapter) {
        return site -> site.register("blog", new PostDescriptor(postAdapter));
    }

    public static class PostDescriptor extends ModelDescriptor<Map<String, Object>> {

        public PostDescriptor(InMemoryModelAdapter adapter) {
            super(adapter);
        }

        @Override
        public List<String> getListDisplay() {
            return List.of("id", "title", "status", "author");
        }

        @Override
        public List<String> getSearchFields() {
            return List.of("title");
        }

        @Override
        public List<String> getListFilter() {
            return List.of("status", "author");
        }

        @Override
        public List<String> getOrdering() {
            return List.of("-id");
        }
    }
}
