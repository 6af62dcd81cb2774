package com.leaf.transform.core;

/**
 * 变换失败的错误类别，供调用层（界面）渲染面向用户的提示
 */
public enum ErrorKind {
    /** 配置的源列或第二列不在批次schema中 */
    COLUMN_NOT_FOUND,
    /** 规则或计算作用于不支持的物理类型 */
    UNSUPPORTED_TYPE,
    /** 单元格无法解析为时间戳或时长 */
    PARSE_FAILURE,
    /** 输出列名与已有列冲突 */
    DUPLICATE_OUTPUT_NAME,
    /** 源批次为零行，无法计算分箱或统计量 */
    EMPTY_INPUT,
    /** 产物写出失败 */
    IO_FAILURE,
    /** 配置本身不合法（缺少第二列、窗口非正、边界为空等） */
    INVALID_CONFIGURATION,
    /** 表数据源无法物化指定的表 */
    SOURCE_FAILURE,
    /** 整数运算溢出64位范围 */
    NUMERIC_OVERFLOW,
    /** 处理过程中出现的未预期运行时错误 */
    INTERNAL_ERROR
}
