package com.tencent.funcmodel.domain.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ContextValidationResult - 访问校验结果
 * <p>
 * 拒绝访问不是错误，以 granted=false 和 denialReason 表达。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextValidationResult {

    private boolean granted;

    /**
     * 实际可用的访问级别，拒绝时为 null
     */
    private ContextAccessLevel level;

    private ContextRelationship relationship;

    @Builder.Default
    private List<String> accessibleProperties = new ArrayList<>();

    @Builder.Default
    private List<String> restrictedProperties = new ArrayList<>();

    private boolean inheritanceAllowed;

    private String denialReason;
}
