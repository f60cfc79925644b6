package com.tencent.funcmodel.domain.model.command;

import com.tencent.funcmodel.domain.node.LinkType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * CreateEdgeCommand - 创建连线命令
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateEdgeCommand {

    @NotBlank(message = "源节点ID不能为空")
    private String sourceNodeId;

    @NotBlank(message = "目标节点ID不能为空")
    private String targetNodeId;

    @NotNull(message = "连线类型不能为空")
    private LinkType linkType;

    /**
     * 连线强度 0..1，为空时为 1.0
     */
    @DecimalMin(value = "0.0", message = "连线强度必须在0到1之间")
    @DecimalMax(value = "1.0", message = "连线强度必须在0到1之间")
    private Double linkStrength;

    private boolean bidirectional;

    private Map<String, Object> context;

    private Map<String, Object> metadata;
}
