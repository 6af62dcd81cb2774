package com.leaf.transform.operators;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.core.Transformation;
import com.leaf.transform.grouping.GroupIdAssigner;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.GroupingConfig;
import com.leaf.transform.model.GroupingRule;
import com.leaf.transform.model.LongColumn;
import com.leaf.transform.model.StepConfig;
import com.leaf.transform.model.TransformationMetadata;
import com.leaf.transform.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 分组编号算子。
 * 按值变化 / 值等于 / 为空三种规则为每行分配顺序编号，追加为不含空值的INT64列。
 *
 * 配置：{@link GroupingConfig}
 * - rule: VALUE_CHANGE(column) / VALUE_EQUALS(column, value) / IS_EMPTY(column)
 * - resetOnChange: 分组边界处编号置零而非加一
 * - outputColumnName: 输出列名
 *
 * 规则读取其指定的列，该列可以是同一请求中前序步骤追加的列。
 */
public class GroupIdTransformation implements Transformation {

    private static final Logger log = LoggerFactory.getLogger(GroupIdTransformation.class);

    // 所有物理类型均可字符串化
    private static final TransformationMetadata METADATA = new TransformationMetadata(
            GroupingConfig.TRANSFORMATION_ID, "Group ID", "1.0.0",
            "Assigns sequential group ids on value change, value match or empty runs", null);

    private final GroupIdAssigner assigner;

    public GroupIdTransformation(GroupIdAssigner assigner) {
        this.assigner = assigner;
    }

    public GroupIdTransformation() {
        this(new GroupIdAssigner());
    }

    @Override
    public String getTransformationId() {
        return GroupingConfig.TRANSFORMATION_ID;
    }

    @Override
    public TransformationMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public ValidationResult validate(StepConfig config, Batch batch) {
        if (!(config instanceof GroupingConfig)) {
            return StepChecks.wrongConfig(getTransformationId(), config);
        }
        GroupingConfig groupingConfig = (GroupingConfig) config;
        ValidationResult result = new ValidationResult();
        StepChecks.checkOutputName(groupingConfig.getOutputColumnName(), batch, result);

        GroupingRule rule = groupingConfig.getRule();
        if (rule == null) {
            return result.addError(ErrorKind.INVALID_CONFIGURATION, "Grouping rule must be specified");
        }
        StepChecks.checkColumnExists(rule.getColumn(), batch, result);
        if (rule.getType() == GroupingRule.RuleType.VALUE_EQUALS
                && (rule.getValue() == null || rule.getValue().isEmpty())) {
            result.addWarning("Value match on '" + rule.getColumn()
                    + "' has an empty target; only empty cells will match");
        }
        return result;
    }

    @Override
    public Batch apply(Batch batch, StepConfig config) throws TransformException {
        GroupingConfig groupingConfig = (GroupingConfig) config;
        GroupingRule rule = groupingConfig.getRule();
        LongColumn ids = assigner.assign(batch.column(rule.getColumn()), rule,
                groupingConfig.isResetOnChange(), groupingConfig.getOutputColumnName());
        log.debug("{} produced {} distinct group(s) in '{}'", rule.displayName(),
                GroupIdAssigner.distinctGroups(ids), ids.getName());
        return batch.withColumn(ids);
    }
}
