package com.tencent.funcmodel.domain.model.command;

import com.tencent.funcmodel.domain.node.ExecutionMode;
import com.tencent.funcmodel.domain.node.IOData;
import com.tencent.funcmodel.domain.node.NodeType;
import com.tencent.funcmodel.domain.node.StageData;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * AddNodeCommand - 添加节点命令
 * <p>
 * 按 nodeType 分发：容器类型直接创建，动作类型转为 {@link AddActionNodeCommand}
 * （此时 parentNodeId 必填）。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddNodeCommand {

    @NotNull(message = "节点类型不能为空")
    private NodeType nodeType;

    @NotBlank(message = "节点名称不能为空")
    private String name;

    private String description;

    private Double x;

    private Double y;

    private ExecutionMode executionType;

    @Positive(message = "超时时间必须为正数")
    private Long timeoutMs;

    private Map<String, Object> metadata;

    private Map<String, Object> visualProperties;

    /**
     * IO 节点
     */
    private IOData ioData;

    /**
     * Stage 节点
     */
    private StageData stageData;

    private boolean parallelExecution;

    private Map<String, Object> configuration;

    /**
     * 动作节点
     */
    private String parentNodeId;

    private Integer priority;

    private Map<String, Object> actionSpecificData;
}
