package com.tencent.funcmodel.domain.model;

import com.tencent.funcmodel.domain.model.command.AddNodeCommand;
import com.tencent.funcmodel.domain.model.command.CreateEdgeCommand;
import com.tencent.funcmodel.domain.model.command.CreateModelCommand;
import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.node.ActionStatus;
import com.tencent.funcmodel.domain.node.BoundaryType;
import com.tencent.funcmodel.domain.node.FunctionModelContainerNode;
import com.tencent.funcmodel.domain.node.LinkType;
import com.tencent.funcmodel.domain.node.Node;
import com.tencent.funcmodel.domain.node.NodeStatus;
import com.tencent.funcmodel.domain.node.NodeType;
import com.tencent.funcmodel.domain.node.StageNode;
import com.tencent.funcmodel.domain.node.TetherNode;
import com.tencent.funcmodel.domain.shared.ErrorType;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.support.SequentialIdGenerator;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

import static com.tencent.funcmodel.domain.support.ModelFixtures.NOW;
import static com.tencent.funcmodel.domain.support.ModelFixtures.action;
import static com.tencent.funcmodel.domain.support.ModelFixtures.depends;
import static com.tencent.funcmodel.domain.support.ModelFixtures.fixedClock;
import static com.tencent.funcmodel.domain.support.ModelFixtures.input;
import static com.tencent.funcmodel.domain.support.ModelFixtures.newModel;
import static com.tencent.funcmodel.domain.support.ModelFixtures.require;
import static com.tencent.funcmodel.domain.support.ModelFixtures.stage;
import static com.tencent.funcmodel.domain.support.ModelFixtures.tether;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionModelTest {

    private Clock clock;
    private SequentialIdGenerator idGenerator;
    private FunctionModel model;

    @BeforeEach
    void setUp() {
        clock = fixedClock();
        idGenerator = new SequentialIdGenerator();
        model = newModel(clock, idGenerator);
    }

    @Test
    void testCreate_StartsAsDraftWithInitialVersion() {
        assertEquals(ModelStatus.DRAFT, model.getStatus());
        assertEquals("1.0.0", model.getVersion().toString());
        assertEquals("alice", model.getPermissions().getOwner());
        assertTrue(NodeId.isValid(model.getModelId()));
        assertFalse(model.isDeleted());
    }

    @Test
    void testCreate_RejectsInvalidInput() {
        Result<FunctionModel> blankName = FunctionModel.create(CreateModelCommand.builder()
                .name("  ").owner("alice").build(), clock, idGenerator);
        assertTrue(blankName.isFailure());
        assertEquals(ErrorType.VALIDATION, blankName.getErrorType());

        Result<FunctionModel> badVersion = FunctionModel.create(CreateModelCommand.builder()
                .name("M").owner("alice").version("1.0").build(), clock, idGenerator);
        assertTrue(badVersion.isFailure());

        Result<FunctionModel> badId = FunctionModel.create(CreateModelCommand.builder()
                .modelId("not-a-uuid").name("M").owner("alice").build(), clock, idGenerator);
        assertTrue(badId.isFailure());
    }

    @Test
    void testPublishThenArchive_FreezesStructure() {
        NodeId in = input(model, "input");
        NodeId process = stage(model, "process", false);
        action(model, tether(process, "Ship").priority(5).build());
        depends(model, in, process);

        assertTrue(model.publish().isSuccess());
        assertEquals(ModelStatus.PUBLISHED, model.getStatus());

        assertTrue(model.archive().isSuccess());
        assertEquals(ModelStatus.ARCHIVED, model.getStatus());

        Result<?> added = model.addNode(AddNodeCommand.builder().nodeType(NodeType.STAGE).name("late").build());
        assertTrue(added.isFailure());
        assertEquals(ErrorType.CONFLICT, added.getErrorType());
    }

    @Test
    void testQueriedNodes_DoNotWriteThroughToModel() {
        NodeId first = stage(model, "first", false);
        NodeId second = stage(model, "second", false);
        NodeId ship = action(model, tether(second, "Ship").build());
        depends(model, first, second);
        require(model.publish());

        model.getNodes().get(first).addDependency(second, NOW);
        model.findNode(first).get().addDependency(second, NOW);
        model.getContainerNodes().get(0).addDependency(second, NOW);
        assertTrue(model.getNodes().get(first).getDependencies().isEmpty());
        assertFalse(DependencyGraph.hasCycle(model.getContainerDependencies()));

        require(model.archive());
        require(model.getActionNodes().get(ship).transitionTo(ActionStatus.ACTIVE, NOW));
        model.getActionsOf(second).get(0).transitionTo(ActionStatus.ACTIVE, NOW);

        assertEquals(ActionStatus.DRAFT, model.getActionNodes().get(ship).getActionStatus());
        assertEquals(ModelStatus.ARCHIVED, model.getStatus());
        assertEquals(ErrorType.CONFLICT, model.updateActionStatus(ship, ActionStatus.ACTIVE).getErrorType());
    }

    @Test
    void testAddNode_ActionKeepsVisualProperties() {
        NodeId process = stage(model, "process", false);
        Map<String, Object> visual = new HashMap<>();
        visual.put("color", "#ff8800");
        Map<String, Object> data = new HashMap<>();
        data.put(TetherNode.TETHER_REFERENCE_ID, "tether-label");

        Node label = require(model.addNode(AddNodeCommand.builder()
                .nodeType(NodeType.TETHER)
                .parentNodeId(process.getValue())
                .name("Label")
                .actionSpecificData(data)
                .visualProperties(visual)
                .build()));

        assertEquals("#ff8800", label.getVisualProperties().get("color"));
        assertEquals("#ff8800", model.getActionNodes().get(label.getNodeId()).getVisualProperties().get("color"));
    }

    @Test
    void testArchive_IsTerminal() {
        stage(model, "process", false);
        assertTrue(model.archive().isSuccess());

        Result<Void> publish = model.publish();
        assertEquals(ErrorType.CONFLICT, publish.getErrorType());
        assertEquals(ErrorType.CONFLICT, model.archive().getErrorType());
        assertEquals(ModelStatus.ARCHIVED, model.getStatus());
    }

    @Test
    void testPublish_RequiresAtLeastOneContainer() {
        Result<Void> published = model.publish();

        assertTrue(published.isFailure());
        assertEquals(ModelStatus.DRAFT, model.getStatus());
    }

    @Test
    void testPublish_OnlyMetadataEditableAfterwards() {
        NodeId process = stage(model, "process", false);
        action(model, process, "Pack", 1);
        require(model.publish());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("team", "logistics");
        assertTrue(model.updateMetadata(metadata).isSuccess());
        assertEquals("logistics", model.getMetadata().get("team"));

        assertEquals(ErrorType.CONFLICT, model.updateName("renamed").getErrorType());
        assertEquals(ErrorType.CONFLICT, model.removeNode(process).getErrorType());
    }

    @Test
    void testConvenienceNodesAndDescriptiveUpdates() {
        Node in = require(model.addIONode("Order In", BoundaryType.INPUT, Position.create(10, 20).getValue()));
        Node pick = require(model.addStageNode("Pick", true, null));

        assertEquals(NodeType.IO, in.getNodeType());
        assertEquals(20.0, in.getPosition().getY());
        assertTrue(((StageNode) pick).isParallelExecution());

        StringBuilder tooLong = new StringBuilder();
        for (int i = 0; i <= FunctionModel.MAX_DESCRIPTION_LENGTH; i++) {
            tooLong.append('d');
        }
        assertEquals(ErrorType.VALIDATION, model.updateDescription(tooLong.toString()).getErrorType());
        require(model.updateDescription("  Warehouse flow "));
        assertEquals("Warehouse flow", model.getDescription());

        require(model.publish());
        require(model.updatePermissions(require(ModelPermissions.create("carol", null, null))));
        assertEquals("carol", model.getPermissions().getOwner());
        assertEquals(ErrorType.CONFLICT, model.updateDescription("late").getErrorType());
    }

    @Test
    void testCreateEdge_SelfLinkAndDuplicateLeaveLinksUnchanged() {
        NodeId a = stage(model, "a", false);
        NodeId b = stage(model, "b", false);
        depends(model, a, b);
        int before = model.getLinks().size();

        Result<NodeLink> self = model.createEdge(CreateEdgeCommand.builder()
                .sourceNodeId(a.getValue()).targetNodeId(a.getValue()).linkType(LinkType.DEPENDENCY).build());
        Result<NodeLink> duplicate = model.createEdge(CreateEdgeCommand.builder()
                .sourceNodeId(a.getValue()).targetNodeId(b.getValue()).linkType(LinkType.DEPENDENCY).build());

        assertEquals(ErrorType.VALIDATION, self.getErrorType());
        assertEquals(ErrorType.VALIDATION, duplicate.getErrorType());
        assertEquals(before, model.getLinks().size());
    }

    @Test
    void testCreateEdge_DefaultsStrengthAndRejectsCycles() {
        NodeId a = stage(model, "a", false);
        NodeId b = stage(model, "b", false);
        NodeId c = stage(model, "c", false);

        NodeLink link = require(model.createEdge(CreateEdgeCommand.builder()
                .sourceNodeId(a.getValue()).targetNodeId(b.getValue()).linkType(LinkType.DEPENDENCY).build()));
        assertEquals(1.0, link.getLinkStrength().getValue());
        depends(model, b, c);

        Result<NodeLink> cycle = model.createEdge(CreateEdgeCommand.builder()
                .sourceNodeId(c.getValue()).targetNodeId(a.getValue()).linkType(LinkType.DEPENDENCY).build());
        assertTrue(cycle.isFailure());
        assertEquals(2, model.getLinks().size());
        assertFalse(model.getNodes().get(a).getDependencies().contains(c));
    }

    @Test
    void testCreateEdge_UnknownNodeIsNotFound() {
        NodeId a = stage(model, "a", false);

        Result<NodeLink> link = model.createEdge(CreateEdgeCommand.builder()
                .sourceNodeId(a.getValue())
                .targetNodeId("00000000-0000-4000-8000-999999999999")
                .linkType(LinkType.REFERENCES)
                .build());

        assertEquals(ErrorType.NOT_FOUND, link.getErrorType());
    }

    @Test
    void testRemoveContainer_CascadesActionsLinksAndDependencies() {
        NodeId a = stage(model, "a", false);
        NodeId b = stage(model, "b", false);
        NodeId pack = action(model, a, "Pack", 1);
        depends(model, a, b);

        assertTrue(model.removeNode(a).isSuccess());

        assertFalse(model.getNodes().containsKey(a));
        assertFalse(model.getActionNodes().containsKey(pack));
        assertTrue(model.getLinks().isEmpty());
        assertTrue(model.getNodes().get(b).getDependencies().isEmpty());
    }

    @Test
    void testRemoveAction_DetachesFromStage() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);

        assertTrue(model.removeNode(pack).isSuccess());

        StageNode stageNode = (StageNode) model.getNodes().get(process);
        assertFalse(stageNode.getActionNodeIds().contains(pack));
        assertEquals(ErrorType.NOT_FOUND, model.removeNode(pack).getErrorType());
    }

    @Test
    void testAddActionNode_DefaultsAndParentChecks() {
        NodeId process = stage(model, "process", false);
        ActionNode first = require(model.addActionNode(tether(process, "First").build()));
        ActionNode second = require(model.addActionNode(tether(process, "Second").build()));

        assertEquals(ActionStatus.DRAFT, first.getActionStatus());
        assertEquals(NodeStatus.DRAFT, first.getStatus());
        assertEquals(FunctionModel.DEFAULT_ACTION_PRIORITY, first.getPriority());
        assertEquals(1, first.getExecutionOrder());
        assertEquals(2, second.getExecutionOrder());

        Result<ActionNode> underAction = model.addActionNode(tether(first.getNodeId(), "Nested").build());
        assertTrue(underAction.isFailure());

        Result<ActionNode> badPriority = model.addActionNode(tether(process, "Loud").priority(11).build());
        assertTrue(badPriority.isFailure());

        Result<ActionNode> missingReference = model.addActionNode(tether(process, "Bare")
                .actionSpecificData(new HashMap<>()).build());
        assertTrue(missingReference.isFailure());
    }

    @Test
    void testUpdateActionStatus_FollowsStateMachine() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);

        assertTrue(model.updateActionStatus(pack, ActionStatus.ACTIVE).isSuccess());
        assertEquals(NodeStatus.ACTIVE, model.getActionNodes().get(pack).getStatus());

        Result<Void> illegal = model.updateActionStatus(pack, ActionStatus.COMPLETED);
        assertEquals(ErrorType.CONFLICT, illegal.getErrorType());
        assertEquals(ActionStatus.ACTIVE, model.getActionNodes().get(pack).getActionStatus());
    }

    @Test
    void testValidateWorkflow_FlagsSelfNestingAndWarnings() {
        NodeId process = stage(model, "process", false);
        Map<String, Object> data = new HashMap<>();
        data.put(FunctionModelContainerNode.NESTED_MODEL_ID, model.getModelId());
        require(model.addActionNode(tether(process, "Recurse")
                .actionType(NodeType.FUNCTION_MODEL_CONTAINER)
                .actionSpecificData(data)
                .build()));

        WorkflowValidation validation = model.validateWorkflow();

        assertFalse(validation.isValid());
        assertTrue(validation.getErrors().stream().anyMatch(error -> error.contains("itself")));
        assertTrue(validation.getWarnings().contains("Workflow has no input node"));
        assertTrue(model.publish().isFailure());
    }

    @Test
    void testSoftDeleteAndRestore() {
        stage(model, "process", false);

        assertTrue(model.softDelete(" bob ").isSuccess());
        assertTrue(model.isDeleted());
        assertEquals("bob", model.getDeletedBy());
        assertEquals(ErrorType.CONFLICT, model.softDelete("bob").getErrorType());
        assertEquals(ErrorType.CONFLICT, model.publish().getErrorType());

        assertTrue(model.restore().isSuccess());
        assertFalse(model.isDeleted());
        assertEquals(ErrorType.CONFLICT, model.restore().getErrorType());
    }

    @Test
    void testCreateVersion_CopiesStructureIntoNewDraft() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);

        assertEquals(ErrorType.CONFLICT, model.createVersion("1.1.0").getErrorType());
        require(model.publish());
        assertTrue(model.createVersion("1.0.0").isFailure());

        FunctionModel next = require(model.createVersion("1.1.0"));

        assertEquals(model.getModelId(), next.getModelId());
        assertEquals(ModelStatus.DRAFT, next.getStatus());
        assertEquals("1.1.0", next.getVersion().toString());
        assertTrue(next.getActionNodes().containsKey(pack));
        assertNotSame(model.getActionNodes().get(pack), next.getActionNodes().get(pack));

        require(next.removeNode(pack));
        assertTrue(model.getActionNodes().containsKey(pack));
    }

    @Test
    void testCalculateStatistics() {
        NodeId a = stage(model, "a", false);
        NodeId b = stage(model, "b", false);
        action(model, a, "Pack", 1);
        action(model, a, "Label", 2);
        depends(model, a, b);

        ModelStatistics statistics = model.calculateStatistics();

        assertEquals(2, statistics.getTotalNodes());
        assertEquals(2, statistics.getTotalActions());
        assertEquals(1, statistics.getTotalLinks());
        assertEquals(1.0, statistics.getAverageComplexity());
        assertEquals(2, statistics.getNodeTypeBreakdown().get("stageNode"));
    }
}
