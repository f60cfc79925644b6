package com.tencent.funcmodel.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * NodeDTO - 节点视图，容器和动作共用；动作专有字段在容器上为空
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String nodeId;
    private String nodeType;
    private String name;
    private String description;
    private double x;
    private double y;
    private String status;
    private String executionType;
    private Long timeoutMs;
    private List<String> dependencies;
    private Map<String, Object> metadata;

    private String parentNodeId;
    private String actionStatus;
    private Integer executionOrder;
    private Integer priority;
    private String condition;
    private Boolean required;
}
