package com.tencent.funcmodel.domain.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * StageData - 阶段节点的业务描述
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageData {

    /**
     * 阶段类型，如 "process"、"review"
     */
    private String stageType;

    /**
     * 完成条件
     */
    private List<String> completionCriteria;

    /**
     * 阶段目标
     */
    private List<String> stageGoals;

    /**
     * 资源需求
     */
    private Map<String, Object> resourceRequirements;
}
