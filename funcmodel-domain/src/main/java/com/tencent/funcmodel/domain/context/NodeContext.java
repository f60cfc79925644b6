package com.tencent.funcmodel.domain.context;

import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * NodeContext - 节点在上下文树中的登记信息
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NodeContext {

    private NodeId nodeId;

    private String nodeType;

    /**
     * 根节点为 null
     */
    private NodeId parentNodeId;

    @Builder.Default
    private Map<String, Object> contextData = new LinkedHashMap<>();

    private ContextAccessLevel accessLevel;

    /**
     * 容器嵌套深度，容器为 0，其动作为 1
     */
    private int hierarchyLevel;
}
