package com.leaf.transform.core;

import com.leaf.transform.model.PipelineResult;
import com.leaf.transform.model.TransformRequest;

/**
 * 变换管道接口：驱动一次请求从加载、逐步变换到产物写入的完整流程。
 *
 * 流程：
 *   加载源表 → 依次校验并应用每个步骤 → 生成产物名称 → 写入产物
 *
 * 任一步骤失败时立即中止，丢弃所有中间结果，并返回携带原始源表名的失败结果，
 * 不做部分应用也不重试。
 */
public interface TransformationPipeline {

    /**
     * 运行一次请求。不抛出异常，所有错误以结构化结果返回。
     */
    PipelineResult run(TransformRequest request);
}
