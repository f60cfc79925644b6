package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.valueobject.ModelName;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.Position;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Node - 节点（模型中的基本元素）
 * <p>
 * 节点种类是封闭集合，由 {@link #getNodeType()} 区分：
 * 容器节点（{@link IONode}、{@link StageNode}）和动作节点（{@link ActionNode} 的子类）。
 * 节点只能由 FunctionModel 聚合根创建和修改，不会在聚合之间共享。
 * </p>
 *
 * @author funcmodel
 */
@Getter
public abstract class Node {

    private final NodeId nodeId;

    /**
     * 所属模型 ID
     */
    private final String modelId;

    private final ModelName name;

    private final String description;

    private final Position position;

    /**
     * 前置依赖节点（由排序类连线维护）
     */
    private final Set<NodeId> dependencies = new LinkedHashSet<>();

    private final ExecutionMode executionType;

    private final NodeStatus status;

    private final Long timeoutMs;

    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private final Map<String, Object> visualProperties = new LinkedHashMap<>();

    private final Instant createdAt;

    private Instant updatedAt;

    /**
     * 注册序号，排序时作为最后的平局裁决
     */
    private final long sequence;

    protected Node(NodeAttributes attributes) {
        this.nodeId = Objects.requireNonNull(attributes.getNodeId(), "nodeId");
        this.modelId = attributes.getModelId();
        this.name = Objects.requireNonNull(attributes.getName(), "name");
        this.description = attributes.getDescription();
        this.position = attributes.getPosition() == null ? Position.origin() : attributes.getPosition();
        this.executionType = attributes.getExecutionType() == null
                ? ExecutionMode.SEQUENTIAL : attributes.getExecutionType();
        this.status = attributes.getStatus() == null ? NodeStatus.DRAFT : attributes.getStatus();
        this.timeoutMs = attributes.getTimeoutMs();
        if (attributes.getMetadata() != null) {
            this.metadata.putAll(attributes.getMetadata());
        }
        if (attributes.getVisualProperties() != null) {
            this.visualProperties.putAll(attributes.getVisualProperties());
        }
        this.createdAt = Objects.requireNonNull(attributes.getCreatedAt(), "createdAt");
        this.updatedAt = this.createdAt;
        this.sequence = attributes.getSequence();
    }

    protected Node(Node source) {
        this.nodeId = source.nodeId;
        this.modelId = source.modelId;
        this.name = source.name;
        this.description = source.description;
        this.position = source.position;
        this.dependencies.addAll(source.dependencies);
        this.executionType = source.executionType;
        this.status = source.status;
        this.timeoutMs = source.timeoutMs;
        this.metadata.putAll(source.metadata);
        this.visualProperties.putAll(source.visualProperties);
        this.createdAt = source.createdAt;
        this.updatedAt = source.updatedAt;
        this.sequence = source.sequence;
    }

    public abstract NodeType getNodeType();

    /**
     * 复制节点，用于派生新版本的模型
     */
    public abstract Node copy();

    public boolean isContainer() {
        return getNodeType().isContainer();
    }

    public Set<NodeId> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Map<String, Object> getVisualProperties() {
        return Collections.unmodifiableMap(visualProperties);
    }

    /**
     * @return 依赖是否为新增
     */
    public boolean addDependency(NodeId dependency, Instant now) {
        boolean added = dependencies.add(dependency);
        if (added) {
            touch(now);
        }
        return added;
    }

    public boolean removeDependency(NodeId dependency, Instant now) {
        boolean removed = dependencies.remove(dependency);
        if (removed) {
            touch(now);
        }
        return removed;
    }

    protected void touch(Instant now) {
        if (now != null) {
            this.updatedAt = now;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node)) {
            return false;
        }
        return nodeId.equals(((Node) o).nodeId);
    }

    @Override
    public int hashCode() {
        return nodeId.hashCode();
    }

    @Override
    public String toString() {
        return getNodeType().getValue() + "[" + nodeId + ", " + name + "]";
    }
}
