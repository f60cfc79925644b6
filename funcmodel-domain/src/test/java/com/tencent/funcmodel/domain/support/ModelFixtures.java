package com.tencent.funcmodel.domain.support;

import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.model.command.AddActionNodeCommand;
import com.tencent.funcmodel.domain.model.command.AddNodeCommand;
import com.tencent.funcmodel.domain.model.command.CreateEdgeCommand;
import com.tencent.funcmodel.domain.model.command.CreateModelCommand;
import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.node.BoundaryType;
import com.tencent.funcmodel.domain.node.ExecutionMode;
import com.tencent.funcmodel.domain.node.IOData;
import com.tencent.funcmodel.domain.node.LinkType;
import com.tencent.funcmodel.domain.node.NodeType;
import com.tencent.funcmodel.domain.node.TetherNode;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 测试用的模型构造辅助方法，失败时直接让测试失败
 */
public final class ModelFixtures {

    public static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private ModelFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static FunctionModel newModel(Clock clock, IdGenerator idGenerator) {
        return require(FunctionModel.create(CreateModelCommand.builder()
                .name("Order Fulfilment")
                .owner("alice")
                .build(), clock, idGenerator));
    }

    public static NodeId input(FunctionModel model, String name) {
        return require(model.addNode(AddNodeCommand.builder()
                .nodeType(NodeType.IO)
                .name(name)
                .ioData(IOData.builder().boundaryType(BoundaryType.INPUT).build())
                .build())).getNodeId();
    }

    public static NodeId stage(FunctionModel model, String name, boolean parallel) {
        return require(model.addNode(AddNodeCommand.builder()
                .nodeType(NodeType.STAGE)
                .name(name)
                .parallelExecution(parallel)
                .build())).getNodeId();
    }

    public static NodeId stage(FunctionModel model, String name, ExecutionMode mode) {
        return require(model.addNode(AddNodeCommand.builder()
                .nodeType(NodeType.STAGE)
                .name(name)
                .executionType(mode)
                .build())).getNodeId();
    }

    public static AddActionNodeCommand.AddActionNodeCommandBuilder tether(NodeId parent, String name) {
        Map<String, Object> data = new HashMap<>();
        data.put(TetherNode.TETHER_REFERENCE_ID, "tether-" + name);
        return AddActionNodeCommand.builder()
                .parentNodeId(parent.getValue())
                .actionType(NodeType.TETHER)
                .name(name)
                .actionSpecificData(data);
    }

    public static NodeId action(FunctionModel model, AddActionNodeCommand command) {
        ActionNode action = require(model.addActionNode(command));
        return action.getNodeId();
    }

    public static NodeId action(FunctionModel model, NodeId parent, String name, int order) {
        return action(model, tether(parent, name).executionOrder(order).build());
    }

    public static NodeId retrying(FunctionModel model, NodeId parent, String name, int maxRetries) {
        RetryPolicy policy = require(RetryPolicy.of(maxRetries, null));
        return action(model, tether(parent, name).retryPolicy(policy).build());
    }

    public static void depends(FunctionModel model, NodeId upstream, NodeId downstream) {
        require(model.createEdge(CreateEdgeCommand.builder()
                .sourceNodeId(upstream.getValue())
                .targetNodeId(downstream.getValue())
                .linkType(LinkType.DEPENDENCY)
                .build()));
    }

    public static <T> T require(Result<T> result) {
        assertTrue(result.isSuccess(), () -> "Expected success but got: " + result.getError());
        return result.getValue();
    }
}
