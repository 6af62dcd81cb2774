package com.leaf.transform.operators;

import com.leaf.transform.compute.ColumnComputer;
import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.core.Transformation;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.ComputedColumnConfig;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StepConfig;
import com.leaf.transform.model.TransformationMetadata;
import com.leaf.transform.model.ValidationResult;

import java.util.List;

/**
 * 计算列算子。
 *
 * 配置：{@link ComputedColumnConfig}
 * - computationType: DELTA / CUMULATIVE_SUM / PERCENTAGE / RATIO / MOVING_AVERAGE / Z_SCORE
 * - sourceColumn: 数值源列
 * - secondColumn: 分母列 (RATIO 必选)
 * - windowSize: 窗口大小 (MOVING_AVERAGE, >= 1, 默认5)
 * - nullHandling: SKIP_NULLS / PROPAGATE_NULLS / FILL_WITH_ZERO (CUMULATIVE_SUM、MOVING_AVERAGE 使用)
 */
public class ComputedColumnTransformation implements Transformation {

    private static final TransformationMetadata METADATA = new TransformationMetadata(
            ComputedColumnConfig.TRANSFORMATION_ID, "Computed Column", "1.0.0",
            "Derives delta, cumulative sum, percentage, ratio, moving average or z-score columns",
            List.of(PhysicalType.INT32, PhysicalType.INT64, PhysicalType.FLOAT32, PhysicalType.FLOAT64));

    private final ColumnComputer computer;

    public ComputedColumnTransformation(ColumnComputer computer) {
        this.computer = computer;
    }

    public ComputedColumnTransformation() {
        this(new ColumnComputer());
    }

    @Override
    public String getTransformationId() {
        return ComputedColumnConfig.TRANSFORMATION_ID;
    }

    @Override
    public TransformationMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public ValidationResult validate(StepConfig config, Batch batch) {
        if (!(config instanceof ComputedColumnConfig)) {
            return StepChecks.wrongConfig(getTransformationId(), config);
        }
        ComputedColumnConfig computed = (ComputedColumnConfig) config;
        ValidationResult result = new ValidationResult();
        if (computed.getComputationType() == null) {
            return result.addError(ErrorKind.INVALID_CONFIGURATION, "Computation type must be specified");
        }

        StepChecks.checkOutputName(computed.getOutputName(), batch, result);
        checkNumeric(computed.getSourceColumn(), batch, result);

        if (computed.getComputationType().requiresSecondColumn()) {
            if (computed.getSecondColumn() == null || computed.getSecondColumn().isBlank()) {
                result.addError(ErrorKind.INVALID_CONFIGURATION,
                        computed.getComputationType().getDisplayName() + " requires a second column");
            } else {
                checkNumeric(computed.getSecondColumn(), batch, result);
            }
        }
        if (computed.getComputationType().supportsWindowSize() && computed.getWindowSize() < 1) {
            result.addError(ErrorKind.INVALID_CONFIGURATION,
                    "Window size must be at least 1, got " + computed.getWindowSize());
        }
        return result;
    }

    @Override
    public Batch apply(Batch batch, StepConfig config) throws TransformException {
        return batch.withColumn(computer.compute(batch, (ComputedColumnConfig) config));
    }

    private void checkNumeric(String name, Batch batch, ValidationResult result) {
        if (!StepChecks.checkColumnExists(name, batch, result)) {
            return;
        }
        Column column = batch.getColumn(name);
        if (!METADATA.isApplicableTo(column.getType())) {
            result.addError(ErrorKind.UNSUPPORTED_TYPE, "Column '" + name + "' has type "
                    + column.getType() + "; a numeric column is required");
        }
    }
}
