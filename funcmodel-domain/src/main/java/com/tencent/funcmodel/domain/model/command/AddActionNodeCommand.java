package com.tencent.funcmodel.domain.model.command;

import com.tencent.funcmodel.domain.node.ExecutionMode;
import com.tencent.funcmodel.domain.node.NodeType;
import com.tencent.funcmodel.domain.valueobject.RaciAssignment;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * AddActionNodeCommand - 向容器添加动作节点命令
 *
 * @author funcmodel
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddActionNodeCommand {

    @NotBlank(message = "父节点ID不能为空")
    private String parentNodeId;

    /**
     * 动作类型: tetherNode / kbNode / functionModelContainer
     */
    @NotNull(message = "动作类型不能为空")
    private NodeType actionType;

    @NotBlank(message = "动作名称不能为空")
    private String name;

    private String description;

    private ExecutionMode executionMode;

    /**
     * 为空时取容器内已有最大值 + 1
     */
    @Min(value = 1, message = "执行顺序必须大于0")
    private Integer executionOrder;

    @Min(value = 1, message = "优先级必须在1到10之间")
    @Max(value = 10, message = "优先级必须在1到10之间")
    private Integer priority;

    @PositiveOrZero(message = "预计耗时不能为负数")
    private Long estimatedDurationMs;

    private RetryPolicy retryPolicy;

    private RaciAssignment raci;

    /**
     * 守卫表达式（SpEL）
     */
    private String condition;

    private boolean required;

    private Double x;

    private Double y;

    private Long timeoutMs;

    private Map<String, Object> metadata;

    private Map<String, Object> visualProperties;

    private Map<String, Object> actionSpecificData;
}
