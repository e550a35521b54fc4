package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 管道配置校验结果。错误会使管道无效，警告仅记录。
 */
public class ValidationResult implements Serializable {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static ValidationResult success() {
        return new ValidationResult();
    }

    /** 记录字段级错误，格式为 "字段: 说明" */
    public void addError(String field, String message) {
        errors.add(field + ": " + message);
    }

    public void addWarning(String field, String message) {
        warnings.add(field + ": " + message);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : String.join("; ", errors);
    }
}
