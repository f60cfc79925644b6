package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * StageNode - 阶段容器
 * <p>
 * 拥有一组有序的动作节点 ID；parallelExecution 为 true 时其动作可以并发调度。
 * </p>
 *
 * @author funcmodel
 */
public class StageNode extends Node {

    private final StageData stageData;

    private final boolean parallelExecution;

    private final List<NodeId> actionNodeIds = new ArrayList<>();

    private final Map<String, Object> configuration = new LinkedHashMap<>();

    private StageNode(NodeAttributes attributes, StageData stageData, boolean parallelExecution,
                      Map<String, Object> configuration) {
        super(attributes);
        this.stageData = stageData;
        this.parallelExecution = parallelExecution;
        if (configuration != null) {
            this.configuration.putAll(configuration);
        }
    }

    private StageNode(StageNode source) {
        super(source);
        this.stageData = source.stageData;
        this.parallelExecution = source.parallelExecution;
        this.actionNodeIds.addAll(source.actionNodeIds);
        this.configuration.putAll(source.configuration);
    }

    public static Result<StageNode> create(NodeAttributes attributes, StageData stageData, boolean parallelExecution,
                                           Map<String, Object> configuration) {
        StageData data = stageData == null ? new StageData() : stageData;
        if (data.getStageType() == null || data.getStageType().isBlank()) {
            data.setStageType("process");
        }
        return Result.ok(new StageNode(attributes, data, parallelExecution, configuration));
    }

    @Override
    public StageNode copy() {
        return new StageNode(this);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.STAGE;
    }

    public StageData getStageData() {
        return stageData;
    }

    public boolean isParallelExecution() {
        return parallelExecution;
    }

    public List<NodeId> getActionNodeIds() {
        return Collections.unmodifiableList(actionNodeIds);
    }

    public Map<String, Object> getConfiguration() {
        return Collections.unmodifiableMap(configuration);
    }

    public void attachAction(NodeId actionId, Instant now) {
        if (!actionNodeIds.contains(actionId)) {
            actionNodeIds.add(actionId);
            touch(now);
        }
    }

    public void detachAction(NodeId actionId, Instant now) {
        if (actionNodeIds.remove(actionId)) {
            touch(now);
        }
    }
}
