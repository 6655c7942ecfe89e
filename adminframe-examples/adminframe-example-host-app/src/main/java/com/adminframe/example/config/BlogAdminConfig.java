package com.adminframe.example.config;

import com.adminframe.api.model.FieldDescriptor;
import com.adminframe.api.model.FieldKind;
import com.adminframe.api.model.ModelMeta;
import com.adminframe.api.security.PermAction;
import com.adminframe.core.adapter.memory.InMemoryModelAdapter;
import com.adminframe.core.security.GrantService;
import com.adminframe.core.site.AdminSite;
import com.adminframe.example.admin.PostAdmin;
import com.adminframe.example.admin.SiteSettingAdmin;
import com.adminframe.starter.configuration.AdminSiteConfigurer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 演示数据：blog.post、site.setting、一张看板卡片，以及 editors 组的授权
 */
@Slf4j
@Configuration
public class BlogAdminConfig {

    @Bean
    public InMemoryModelAdapter postAdapter() {
        Map<String, String> statuses = new LinkedHashMap<>();
        statuses.put("draft", "Draft");
        statuses.put("published", "Published");
        InMemoryModelAdapter adapter = new InMemoryModelAdapter(new ModelMeta("Post", "id", List.of(
                FieldDescriptor.builder().name("id").kind(FieldKind.BIGINT).primaryKey(true).build(),
                FieldDescriptor.builder().name("title").kind(FieldKind.STRING).verboseName("Title").build(),
                FieldDescriptor.builder().name("body").kind(FieldKind.TEXT).nullable(true).build(),
                FieldDescriptor.builder().name("status").kind(FieldKind.STRING).choices(statuses)
                        .defaultValue("draft").build(),
                FieldDescriptor.builder().name("author").kind(FieldKind.STRING).nullable(true).build(),
                FieldDescriptor.builder().name("views").kind(FieldKind.INTEGER).defaultValue(0).build(),
                FieldDescriptor.builder().name("featured").kind(FieldKind.BOOLEAN).defaultValue(false).build()
        )));
        String[] authors = {"alice", "bob", "carol"};
        for (int i = 1; i <= 30; i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("title", "Post " + i);
            values.put("body", "Body of post " + i);
            values.put("author", authors[i % authors.length]);
            values.put("views", i * 7);
            adapter.create(values);
        }
        return adapter;
    }

    @Bean
    public InMemoryModelAdapter settingAdapter() {
        InMemoryModelAdapter adapter = new InMemoryModelAdapter(new ModelMeta("Setting", "id", List.of(
                FieldDescriptor.builder().name("id").kind(FieldKind.BIGINT).primaryKey(true).build(),
                FieldDescriptor.builder().name("key").kind(FieldKind.STRING).build(),
                FieldDescriptor.builder().name("value").kind(FieldKind.STRING).nullable(true).build()
        )));
        adapter.create(Map.of("key", "site_name", "value", "AdminFrame Demo"));
        return adapter;
    }

    @Bean
    public AdminSiteConfigurer blogSiteConfigurer(InMemoryModelAdapter postAdapter,
                                                  InMemoryModelAdapter settingAdapter) {
        return site -> {
            site.register("blog", new PostAdmin(postAdapter));
            site.register("site", new SiteSettingAdmin(settingAdapter), true);
            site.registerCard("blog", "post-count", "Post count");
        };
    }

    // 站点在上下文刷新时完成注册，ApplicationRunner 在其后执行
    @Bean
    public ApplicationRunner demoGrants(AdminSite site, GrantService grantService) {
        return args -> {
            grantService.grantToGroup("editors", site.find("blog", "post").permissionTarget(), PermAction.CHANGE);
            grantService.addMember("editors", "alice");
            log.info("[AdminFrame] Demo grants ready: editors -> blog.post.change, alice in editors");
        };
    }
}
