package com.leaf.transform.grouping;

/**
 * 值变化规则：与上一行的字符串值不同则编号加一（重置模式下置零）。
 * 重置模式下编号恒为0。
 */
public class ValueChangeTracker implements GroupIdTracker {

    private final boolean resetOnChange;
    private long currentId;
    private String previous;

    public ValueChangeTracker(boolean resetOnChange) {
        this.resetOnChange = resetOnChange;
    }

    @Override
    public long next(String value, boolean isNull) {
        if (previous != null && !previous.equals(value)) {
            currentId = resetOnChange ? 0 : currentId + 1;
        }
        previous = value;
        return currentId;
    }
}
