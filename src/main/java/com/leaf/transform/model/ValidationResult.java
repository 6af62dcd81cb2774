package com.leaf.transform.model;

import com.leaf.transform.core.ErrorKind;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 步骤配置校验结果。
 * 错误使结果无效并记录首个错误的类别；警告仅记录日志，不阻止执行。
 */
public class ValidationResult implements Serializable {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private ErrorKind firstErrorKind;

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult failure(ErrorKind kind, String error) {
        ValidationResult result = new ValidationResult();
        result.addError(kind, error);
        return result;
    }

    public ValidationResult addError(ErrorKind kind, String error) {
        if (firstErrorKind == null) {
            firstErrorKind = kind;
        }
        errors.add(error);
        return this;
    }

    public ValidationResult addWarning(String warning) {
        warnings.add(warning);
        return this;
    }

    public boolean isValid() { return errors.isEmpty(); }

    /** 首个错误的类别；校验通过时为null */
    public ErrorKind getErrorKind() { return firstErrorKind; }

    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    @Override
    public String toString() {
        return isValid()
                ? "ValidationResult{valid, warnings=" + warnings + "}"
                : "ValidationResult{" + firstErrorKind + ", errors=" + errors + "}";
    }
}
