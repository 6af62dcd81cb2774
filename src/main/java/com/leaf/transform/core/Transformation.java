package com.leaf.transform.core;

import com.leaf.transform.model.Batch;
import com.leaf.transform.model.StepConfig;
import com.leaf.transform.model.TransformationMetadata;
import com.leaf.transform.model.ValidationResult;

/**
 * 统一变换算子接口：所有列派生变换的基础契约。
 *
 * 算子读取输入批次中的一到两列和一份不可变配置，产出恰好一个新列，
 * 返回追加了该列的新批次。多个算子按请求中的顺序串联，前一步的输出批次是后一步的输入。
 *
 * 实现约定：
 * - 算子必须无状态且线程安全，同一实例可能被多次并发运行共享
 * - 不得修改输入批次；扫描过程中的可变状态只存在于单次调用的局部对象中
 * - 算子不持有数据源或产物写入器，所有输入均由管道传入
 */
public interface Transformation {

    /**
     * 算子唯一标识，与 {@link StepConfig#getTransformationId()} 对应
     */
    String getTransformationId();

    /**
     * 返回算子的元数据信息，用于注册日志和算子发现
     */
    TransformationMetadata getMetadata();

    /**
     * 校验步骤配置能否作用于给定批次。
     * 在应用之前调用，将配置错误拦截在计算开始之前。
     *
     * 校验内容包括：
     * - 配置类型是否与算子匹配
     * - 源列是否存在、类型是否适用
     * - 输出列名是否为空或与已有列重名
     * - 策略/窗口等参数是否合法
     *
     * @param config 步骤配置
     * @param batch  当前输入批次
     * @return 详细的验证结果
     */
    ValidationResult validate(StepConfig config, Batch batch);

    /**
     * 执行变换
     *
     * @param batch  输入批次，不会被修改
     * @param config 步骤配置
     * @return 追加了输出列的新批次
     * @throws TransformException 任何失败都使整个管道中止
     */
    Batch apply(Batch batch, StepConfig config) throws TransformException;
}
