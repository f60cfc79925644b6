package com.tencent.funcmodel.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * ValidationReportDTO - 工作流校验报告，errors 为空时可发布
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReportDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean valid;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
