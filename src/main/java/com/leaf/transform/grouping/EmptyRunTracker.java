package com.leaf.transform.grouping;

/**
 * 为空规则：空值或空字符串视为空。
 * 每进入一段连续的空行编号加一（重置模式下置零），第一段除外；
 * 非空行沿用最近一次确定的编号。
 */
public class EmptyRunTracker implements GroupIdTracker {

    private final boolean resetOnChange;
    private long currentId;
    private boolean inRun;
    private boolean seenRun;

    public EmptyRunTracker(boolean resetOnChange) {
        this.resetOnChange = resetOnChange;
    }

    @Override
    public long next(String value, boolean isNull) {
        boolean empty = isNull || value.isEmpty();
        if (empty && !inRun) {
            if (seenRun) {
                currentId = resetOnChange ? 0 : currentId + 1;
            }
            seenRun = true;
            inRun = true;
        } else if (!empty) {
            inRun = false;
        }
        return currentId;
    }
}
