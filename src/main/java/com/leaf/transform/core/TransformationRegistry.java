package com.leaf.transform.core;

import java.util.List;

/**
 * 变换算子注册表接口。
 *
 * 负责算子的注册、卸载和查询，管道按步骤配置中的算子标识在此查找算子。
 */
public interface TransformationRegistry {

    /**
     * 注册一个算子。
     * 注册时会检查标识唯一性，重复注册将返回false。
     *
     * @param transformation 算子实例，以其 {@link Transformation#getTransformationId()} 为键
     * @return 注册是否成功
     */
    boolean register(Transformation transformation);

    /**
     * 卸载指定算子
     *
     * @return 卸载是否成功；未注册返回false
     */
    boolean unregister(String transformationId);

    /**
     * 获取指定算子
     *
     * @return 算子实例；未找到返回null
     */
    Transformation get(String transformationId);

    /**
     * 获取所有已注册的算子
     */
    List<Transformation> getAll();
}
