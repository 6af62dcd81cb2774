package com.leaf.transform.core;

import com.leaf.transform.model.Batch;

/**
 * 产物写入器：将最终批次持久化为自描述的列存文件。
 */
public interface ArtifactWriter {

    /**
     * 写入 {@code <name>.arrow}
     *
     * @param batch 最终批次
     * @param name  产物名称，不含扩展名
     * @return 产物名称（即新表的逻辑名）
     * @throws TransformException IO_FAILURE 写入失败
     */
    String write(Batch batch, String name) throws TransformException;
}
