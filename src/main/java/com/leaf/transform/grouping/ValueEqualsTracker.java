package com.leaf.transform.grouping;

/**
 * 值等于规则：进入一段等于目标值的连续行时编号加一（重置模式下置零），
 * 段内各行使用该编号，段外行为 {@link #SENTINEL}。
 */
public class ValueEqualsTracker implements GroupIdTracker {

    private final String target;
    private final boolean resetOnChange;
    private long currentId;
    private boolean inRun;

    public ValueEqualsTracker(String target, boolean resetOnChange) {
        this.target = target != null ? target : "";
        this.resetOnChange = resetOnChange;
    }

    @Override
    public long next(String value, boolean isNull) {
        boolean matches = target.equals(value);
        if (matches && !inRun) {
            currentId = resetOnChange ? 0 : currentId + 1;
            inRun = true;
        } else if (!matches) {
            inRun = false;
        }
        return inRun ? currentId : SENTINEL;
    }
}
