package com.tencent.funcmodel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * ModelStatistics - 模型结构统计
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelStatistics {

    /**
     * 容器节点数
     */
    private int totalNodes;

    /**
     * 动作节点数
     */
    private int totalActions;

    private int totalLinks;

    /**
     * 每个容器平均拥有的动作数
     */
    private double averageComplexity;

    private Map<String, Integer> nodeTypeBreakdown;

    private Map<String, Integer> actionTypeBreakdown;

    /**
     * 容器之间最长依赖链的深度
     */
    private int maxDependencyDepth;
}
