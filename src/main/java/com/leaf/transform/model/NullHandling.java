package com.leaf.transform.model;

/**
 * 空值输入的处理策略。
 * 仅影响可以容忍替代值的计算（累计和、移动平均）；
 * 差分、占比、比值和Z分数始终传播空值。
 */
public enum NullHandling {
    /** 空值位置输出空值，空值不参与累计/窗口 */
    SKIP_NULLS,
    /** 空值使其后的结果不可定义 */
    PROPAGATE_NULLS,
    /** 空值按0参与计算并照常输出 */
    FILL_WITH_ZERO
}
