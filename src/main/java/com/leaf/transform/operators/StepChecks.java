package com.leaf.transform.operators;

import com.leaf.transform.core.ErrorKind;
import com.leaf.transform.model.Batch;
import com.leaf.transform.model.ValidationResult;

/**
 * 各算子共用的配置校验
 */
final class StepChecks {

    private StepChecks() {}

    static void checkOutputName(String outputName, Batch batch, ValidationResult result) {
        if (outputName == null || outputName.isBlank()) {
            result.addError(ErrorKind.INVALID_CONFIGURATION, "Output column name must not be empty");
        } else if (batch.hasColumn(outputName)) {
            result.addError(ErrorKind.DUPLICATE_OUTPUT_NAME,
                    "Output column '" + outputName + "' already exists in the table");
        }
    }

    static boolean checkColumnExists(String column, Batch batch, ValidationResult result) {
        if (column == null || column.isBlank()) {
            result.addError(ErrorKind.INVALID_CONFIGURATION, "Source column must be specified");
            return false;
        }
        if (!batch.hasColumn(column)) {
            result.addError(ErrorKind.COLUMN_NOT_FOUND, "Column '" + column + "' not found");
            return false;
        }
        return true;
    }

    static ValidationResult wrongConfig(String transformationId, Object config) {
        return ValidationResult.failure(ErrorKind.INVALID_CONFIGURATION,
                "Transformation '" + transformationId + "' cannot handle "
                        + (config == null ? "null" : config.getClass().getSimpleName()));
    }
}
