package com.tencent.funcmodel.app.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 容器节点。id 只在 YAML 内部用于连线引用，真正的节点 ID 在导入时生成。
 */
@Data
public class NodeYamlDto {
    private String id;
    private String type; // ioNode / stageNode
    private String name;
    private String description;
    private Double x;
    private Double y;
    private String executionType;
    private Long timeoutMs;
    private Map<String, Object> metadata;

    // ioNode
    private String boundaryType;
    private String dataType;
    private boolean required;

    // stageNode
    private String stageType;
    private boolean parallel;
    private List<String> stageGoals;
    private List<String> completionCriteria;

    private List<ActionYamlDto> actions;
}
