package com.leaf.transform.operators;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.core.TransformException;
import com.leaf.transform.core.Transformation;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.Column;
import com.leaf.transform.model.PhysicalType;
import com.leaf.transform.model.StepConfig;
import com.leaf.transform.model.TimeBinConfig;
import com.leaf.transform.model.TimeBinStrategy;
import com.leaf.transform.model.TransformationMetadata;
import com.leaf.transform.model.ValidationResult;
import com.leaf.transform.time.TimeBinner;

import java.util.List;

/**
 * 时间分箱算子。
 * 读取一列时间值，按固定间隔、手动边界或间隔阈值为每行分配箱编号，追加为INT64列。
 *
 * 配置：{@link TimeBinConfig}
 * - sourceColumn: 时间列，字符串/整数（纪元秒）/日期/时间戳类型
 * - strategy: FIXED_INTERVAL(intervalSeconds > 0) / MANUAL_INTERVALS(boundaries) / THRESHOLD_BASED(thresholdSeconds >= 0)
 * - outputColumnName: 输出列名，不得与已有列重名
 */
public class TimeBinTransformation implements Transformation {

    private static final TransformationMetadata METADATA = new TransformationMetadata(
            TimeBinConfig.TRANSFORMATION_ID, "Time Bin", "1.0.0",
            "Assigns each row a time bin id by fixed interval, manual boundaries or gap threshold",
            List.of(PhysicalType.UTF8, PhysicalType.INT32, PhysicalType.INT64, PhysicalType.DATE,
                    PhysicalType.TIMESTAMP_SECOND, PhysicalType.TIMESTAMP_MILLISECOND,
                    PhysicalType.TIMESTAMP_MICROSECOND, PhysicalType.TIMESTAMP_NANOSECOND));

    private final TimeBinner binner;
    private final int validationSampleSize;

    public TimeBinTransformation(TimeBinner binner, int validationSampleSize) {
        this.binner = binner;
        this.validationSampleSize = validationSampleSize;
    }

    public TimeBinTransformation() {
        this(new TimeBinner(), 100);
    }

    @Override
    public String getTransformationId() {
        return TimeBinConfig.TRANSFORMATION_ID;
    }

    @Override
    public TransformationMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public ValidationResult validate(StepConfig config, Batch batch) {
        if (!(config instanceof TimeBinConfig)) {
            return StepChecks.wrongConfig(getTransformationId(), config);
        }
        TimeBinConfig binConfig = (TimeBinConfig) config;
        ValidationResult result = new ValidationResult();

        StepChecks.checkOutputName(binConfig.getOutputColumnName(), batch, result);
        checkStrategy(binConfig.getStrategy(), result);

        if (StepChecks.checkColumnExists(binConfig.getSourceColumn(), batch, result)) {
            Column column = batch.getColumn(binConfig.getSourceColumn());
            if (!METADATA.isApplicableTo(column.getType())) {
                result.addError(ErrorKind.UNSUPPORTED_TYPE, "Column '" + column.getName() + "' of type "
                        + column.getType() + " cannot be used as a time column");
            } else if (!batch.isEmpty()) {
                ValidationResult sample = binner.validateTimeColumn(column, validationSampleSize);
                sample.getErrors().forEach(e -> result.addError(sample.getErrorKind(), e));
                sample.getWarnings().forEach(result::addWarning);
            }
        }
        return result;
    }

    @Override
    public Batch apply(Batch batch, StepConfig config) throws TransformException {
        TimeBinConfig binConfig = (TimeBinConfig) config;
        Column source = batch.column(binConfig.getSourceColumn());
        return batch.withColumn(binner.bin(source, binConfig.getStrategy(), binConfig.getOutputColumnName()));
    }

    private void checkStrategy(TimeBinStrategy strategy, ValidationResult result) {
        if (strategy == null) {
            result.addError(ErrorKind.INVALID_CONFIGURATION, "Time bin strategy must be specified");
            return;
        }
        switch (strategy.getType()) {
            case FIXED_INTERVAL:
                if (strategy.getIntervalSeconds() <= 0) {
                    result.addError(ErrorKind.INVALID_CONFIGURATION,
                            "Interval must be positive: " + strategy.getIntervalSeconds());
                }
                break;
            case THRESHOLD_BASED:
                if (strategy.getThresholdSeconds() < 0) {
                    result.addError(ErrorKind.INVALID_CONFIGURATION,
                            "Threshold must not be negative: " + strategy.getThresholdSeconds());
                }
                break;
            case MANUAL_INTERVALS:
                if (strategy.getBoundaries() == null || strategy.getBoundaries().isEmpty()) {
                    result.addError(ErrorKind.INVALID_CONFIGURATION,
                            "Manual intervals require at least one boundary");
                }
                break;
            default:
                result.addError(ErrorKind.INVALID_CONFIGURATION, "Unknown strategy: " + strategy.getType());
        }
    }
}
