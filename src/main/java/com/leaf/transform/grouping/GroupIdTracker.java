package com.leaf.transform.grouping;

/**
 * 分组编号状态机：按表中顺序逐行喂入字符串化后的单元格，返回该行的编号。
 * 一个实例只服务一次扫描。
 */
public interface GroupIdTracker {

    /** ValueEquals 规则中不属于任何匹配段的行的编号 */
    long SENTINEL = -1L;

    /**
     * @param value  字符串化的单元格，空值为 ""
     * @param isNull 原始单元格是否为空值
     * @return 该行的编号
     */
    long next(String value, boolean isNull);
}
