package com.tencent.funcmodel.domain.model;

import com.tencent.funcmodel.domain.node.LinkType;
import com.tencent.funcmodel.domain.valueobject.LinkStrength;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * NodeLink - 节点之间的连线
 * <p>
 * 只能由 {@link FunctionModel} 创建和删除。
 * </p>
 *
 * @author funcmodel
 */
@Getter
public final class NodeLink {

    private final String linkId;
    private final NodeId sourceNodeId;
    private final NodeId targetNodeId;
    private final LinkType linkType;
    private final LinkStrength linkStrength;
    private final boolean bidirectional;
    private final Map<String, Object> context;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    NodeLink(String linkId, NodeId sourceNodeId, NodeId targetNodeId, LinkType linkType, LinkStrength linkStrength,
             boolean bidirectional, Map<String, Object> context, Map<String, Object> metadata, Instant createdAt) {
        this.linkId = linkId;
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
        this.linkType = linkType;
        this.linkStrength = linkStrength;
        this.bidirectional = bidirectional;
        this.context = context == null
                ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.metadata = metadata == null
                ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.createdAt = createdAt;
    }

    public boolean touches(NodeId nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    public boolean connects(NodeId source, NodeId target, LinkType type) {
        return sourceNodeId.equals(source) && targetNodeId.equals(target) && linkType == type;
    }

    public boolean isOrdering() {
        return linkType.isOrdering();
    }

    @Override
    public String toString() {
        return "NodeLink[" + sourceNodeId + " -" + linkType.getValue() + "-> " + targetNodeId + "]";
    }
}
