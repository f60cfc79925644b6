package com.tencent.funcmodel.domain.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ContextInheritanceRule - 单个属性的继承规则
 * <p>
 * inherit 决定属性是否向下传递；override 为 false 时，子上下文不能遮蔽继承来的值。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextInheritanceRule {

    private String property;

    @Builder.Default
    private boolean inherit = true;

    @Builder.Default
    private boolean override = true;

    public static ContextInheritanceRule of(String property, boolean inherit, boolean override) {
        return new ContextInheritanceRule(property, inherit, override);
    }
}
