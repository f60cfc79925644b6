package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.RaciAssignment;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * ActionAttributes - 动作节点特有的构造属性
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionAttributes {

    /**
     * 所属容器节点
     */
    private NodeId parentNodeId;

    /**
     * 容器内的执行顺序（从 1 开始）
     */
    private int executionOrder;

    /**
     * 优先级 1..10，数值越大越优先
     */
    private int priority;

    private Long estimatedDurationMs;

    private RetryPolicy retryPolicy;

    private RaciAssignment raci;

    /**
     * 动作类型相关的数据，由具体子类解释
     */
    private Map<String, Object> actionSpecificData;

    /**
     * 守卫表达式（SpEL），条件执行时必填
     */
    private String condition;

    /**
     * 失败时是否中止所在的顺序链
     */
    private boolean required;

    @Builder.Default
    private ActionStatus actionStatus = ActionStatus.DRAFT;
}
