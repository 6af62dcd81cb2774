package com.leaf.transform.model;

/**
 * 管道中单个变换步骤的配置。
 * 由界面根据用户输入创建，校验一次、被一次管道运行消费后丢弃，引擎不会修改它。
 */
public interface StepConfig {

    /**
     * 执行该步骤的变换算子标识，用于在注册表中查找算子
     */
    String getTransformationId();

    /**
     * 该步骤追加到批次中的输出列名
     */
    String getOutputColumnName();

    /**
     * 自动生成产物名称时该步骤贡献的短标记
     */
    String artifactToken();
}
