package com.afsun.columnlineage.catalog;

import com.afsun.columnlineage.core.exceptions.CatalogException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * 目录注册表：名称 → 目录工厂，启动时注册
 *
 * @author afsun
 */
@Slf4j
public class CatalogRegistry {

    private final Map<String, Supplier<Catalog>> factories = new TreeMap<>();

    public CatalogRegistry register(String name, Supplier<Catalog> factory) {
        String key = name.toLowerCase(Locale.ROOT);
        if (factories.put(key, factory) != null) {
            log.warn("目录 {} 被重复注册，后注册的生效", key);
        }
        return this;
    }

    /**
     * 创建并配置一个目录实例
     *
     * @throws CatalogException 未注册的目录名
     */
    public Catalog create(String name, Map<String, String> config) {
        Supplier<Catalog> factory = name == null ? null : factories.get(name.toLowerCase(Locale.ROOT));
        if (factory == null) {
            throw new CatalogException("未知的目录类型: " + name + "，可用: " + names());
        }
        Catalog catalog = factory.get();
        catalog.configure(config == null ? Collections.emptyMap() : config);
        return catalog;
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public List<String> names() {
        return new ArrayList<>(factories.keySet());
    }
}
