package com.leaf.transform.grouping;

import com.leaf.transform.core.TransformException;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.GroupingRule;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.PhysicalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * 分组编号分配器。输出与输入等长、不含空值的INT64列。
 */
public class GroupIdAssigner {

    private static final Logger log = LoggerFactory.getLogger(GroupIdAssigner.class);

    public LongColumn assign(Column column, GroupingRule rule, boolean resetOnChange, String outputName)
            throws TransformException {
        if (column.length() == 0) {
            throw TransformException.emptyInput("group ids for column '" + column.getName() + "'");
        }

        GroupIdTracker tracker = newTracker(rule, resetOnChange);
        LongColumn.Builder builder = new LongColumn.Builder(outputName, PhysicalType.INT64, column.length());
        for (int i = 0; i < column.length(); i++) {
            builder.append(tracker.next(ValueFormatter.format(column, i), column.isNull(i)));
        }

        log.debug("Assigned group ids for '{}' ({}{})", column.getName(), rule, resetOnChange ? ", reset" : "");
        return builder.build();
    }

    /**
     * 统计编号列中互不相同的编号个数，不计哨兵值
     */
    public static long distinctGroups(LongColumn ids) {
        return IntStream.range(0, ids.length())
                .mapToLong(ids::getLong)
                .filter(id -> id != GroupIdTracker.SENTINEL)
                .distinct()
                .count();
    }

    private GroupIdTracker newTracker(GroupingRule rule, boolean resetOnChange) {
        switch (rule.getType()) {
            case VALUE_CHANGE:
                return new ValueChangeTracker(resetOnChange);
            case VALUE_EQUALS:
                return new ValueEqualsTracker(rule.getValue(), resetOnChange);
            case IS_EMPTY:
                return new EmptyRunTracker(resetOnChange);
            default:
                throw new IllegalArgumentException("Unknown grouping rule: " + rule.getType());
        }
    }
}
