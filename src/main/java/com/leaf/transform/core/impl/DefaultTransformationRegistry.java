package com.leaf.transform.core.impl;

import com.leaf.transform.core.Transformation;
import com.leaf.transform.core.TransformationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 变换算子注册表默认实现。
 * 使用ConcurrentHashMap存储，支持并发运行中的查询。
 */
public class DefaultTransformationRegistry implements TransformationRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultTransformationRegistry.class);

    /** 算子注册表：transformationId -> Transformation实例 */
    private final ConcurrentHashMap<String, Transformation> registry = new ConcurrentHashMap<>();

    @Override
    public boolean register(Transformation transformation) {
        if (transformation == null) {
            log.error("Cannot register null transformation");
            return false;
        }
        String id = transformation.getTransformationId();
        if (id == null || id.isBlank()) {
            log.error("Cannot register transformation with null or blank id: {}",
                    transformation.getClass().getSimpleName());
            return false;
        }

        Transformation existing = registry.putIfAbsent(id, transformation);
        if (existing != null) {
            log.warn("Transformation '{}' is already registered, registration rejected.", id);
            return false;
        }

        log.info("Transformation '{}' registered. Version: {}", id, transformation.getMetadata().getVersion());
        return true;
    }

    @Override
    public boolean unregister(String transformationId) {
        if (transformationId == null || transformationId.isBlank()) {
            return false;
        }
        if (registry.remove(transformationId) == null) {
            log.warn("Transformation '{}' not found, nothing to unregister.", transformationId);
            return false;
        }
        log.info("Transformation '{}' unregistered.", transformationId);
        return true;
    }

    @Override
    public Transformation get(String transformationId) {
        return transformationId == null ? null : registry.get(transformationId);
    }

    @Override
    public List<Transformation> getAll() {
        return new ArrayList<>(registry.values());
    }
}
