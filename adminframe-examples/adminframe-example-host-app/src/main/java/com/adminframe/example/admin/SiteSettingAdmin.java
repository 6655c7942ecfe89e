package com.adminframe.example.admin;

import com.adminframe.core.adapter.memory.InMemoryModelAdapter;
import com.adminframe.core.descriptor.ModelDescriptor;

import java.util.List;
import java.util.Map;

/**
 * 站点设置，挂载在设置前缀下并按全局权限鉴权
 */
public class SiteSettingAdmin extends ModelDescriptor<Map<String, Object>> {

    public SiteSettingAdmin(InMemoryModelAdapter adapter) {
        super(adapter);
    }

    @Override
    public List<String> getListDisplay() {
        return List.of("id", "key", "value");
    }

    @Override
    public List<String> getSearchFields() {
        return List.of("key");
    }
}
