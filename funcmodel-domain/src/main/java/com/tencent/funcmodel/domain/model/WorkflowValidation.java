package com.tencent.funcmodel.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * WorkflowValidation - 工作流结构校验结果
 * <p>
 * errors 会阻止发布；warnings 仅提示。
 * </p>
 */
@Getter
@ToString
public final class WorkflowValidation {

    private final List<String> errors;
    private final List<String> warnings;

    public WorkflowValidation(List<String> errors, List<String> warnings) {
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
