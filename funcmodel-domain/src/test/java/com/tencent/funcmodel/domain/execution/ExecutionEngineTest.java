package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.event.ExecutionEvent;
import com.tencent.funcmodel.domain.execution.impl.ExecutionEngineImpl;
import com.tencent.funcmodel.domain.execution.impl.SpelGuardEvaluator;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.node.ActionStatus;
import com.tencent.funcmodel.domain.node.ExecutionMode;
import com.tencent.funcmodel.domain.shared.ErrorType;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.support.RecordingEventPublisher;
import com.tencent.funcmodel.domain.support.SequentialIdGenerator;
import com.tencent.funcmodel.domain.valueobject.BackoffStrategy;
import com.tencent.funcmodel.domain.valueobject.FailureEscalation;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static com.tencent.funcmodel.domain.support.ModelFixtures.action;
import static com.tencent.funcmodel.domain.support.ModelFixtures.depends;
import static com.tencent.funcmodel.domain.support.ModelFixtures.fixedClock;
import static com.tencent.funcmodel.domain.support.ModelFixtures.newModel;
import static com.tencent.funcmodel.domain.support.ModelFixtures.require;
import static com.tencent.funcmodel.domain.support.ModelFixtures.retrying;
import static com.tencent.funcmodel.domain.support.ModelFixtures.stage;
import static com.tencent.funcmodel.domain.support.ModelFixtures.tether;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionEngineTest {

    private RecordingEventPublisher publisher;
    private ExecutionEngine engine;
    private FunctionModel model;

    @BeforeEach
    void setUp() {
        Clock clock = fixedClock();
        SequentialIdGenerator idGenerator = new SequentialIdGenerator();
        publisher = new RecordingEventPublisher();
        engine = new ExecutionEngineImpl(new SpelGuardEvaluator(), publisher, FunctionModelProperties.defaults(),
                clock, idGenerator);
        model = newModel(clock, idGenerator);
    }

    @Test
    void testPlan_OrdersActionsByExecutionOrderThenPriority() {
        NodeId process = stage(model, "process", false);
        NodeId second = action(model, process, "second", 2);
        NodeId first = action(model, process, "first", 1);
        NodeId third = action(model, process, "third", 3);
        NodeId urgent = action(model, tether(process, "urgent").executionOrder(3).priority(9).build());
        require(model.publish());

        ExecutionPlan plan = require(engine.planExecution(model));

        assertEquals(Arrays.asList(first, second, urgent, third), plan.getActionOrder());
        assertEquals(RunStatus.READY, status(plan, first));
        assertEquals(RunStatus.PENDING, status(plan, second));
    }

    @Test
    void testPlan_RequiresPublishedModel() {
        NodeId process = stage(model, "process", false);
        action(model, process, "Pack", 1);

        Result<ExecutionPlan> plan = engine.planExecution(model);

        assertEquals(ErrorType.CONFLICT, plan.getErrorType());
    }

    @Test
    void testSequential_CompletingActionReadiesNext() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);
        NodeId ship = action(model, process, "Ship", 2);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        require(engine.advance(plan, pack, ExecutionOutcome.STARTED));
        assertEquals(RunStatus.EXECUTING, status(plan, pack));
        assertEquals(PlanStatus.RUNNING, plan.getStatus());

        require(engine.advance(plan, pack, ExecutionOutcome.COMPLETED));
        assertEquals(RunStatus.READY, status(plan, ship));

        require(engine.advance(plan, ship, ExecutionOutcome.COMPLETED));
        assertEquals(PlanStatus.COMPLETED, plan.getStatus());
        assertEquals(RunStatus.COMPLETED, plan.getContainerStatus(process));
    }

    @Test
    void testParallel_FailedSiblingDoesNotBlockOther() {
        NodeId parallel = stage(model, "fan-out", true);
        NodeId left = action(model, parallel, "left", 1);
        NodeId right = action(model, parallel, "right", 2);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));
        assertEquals(RunStatus.READY, status(plan, left));
        assertEquals(RunStatus.READY, status(plan, right));

        require(engine.advance(plan, left, ExecutionOutcome.FAILED));

        assertEquals(RunStatus.FAILED, status(plan, left));
        assertEquals(RunStatus.EXECUTING, plan.getContainerStatus(parallel));
        assertFalse(plan.isTerminal());

        require(engine.advance(plan, right, ExecutionOutcome.COMPLETED));

        assertEquals(RunStatus.COMPLETED, status(plan, right));
        assertEquals(RunStatus.FAILED, plan.getContainerStatus(parallel));
        assertEquals(PlanStatus.PARTIALLY_FAILED, plan.getStatus());
        ExecutionSummary summary = engine.summarize(plan);
        assertEquals(1, summary.getFailed());
        assertEquals(1, summary.getCompleted());
        assertTrue(summary.isPartialFailure());
    }

    @Test
    void testRetries_UntilPolicyExhausted() {
        NodeId process = stage(model, "process", false);
        NodeId flaky = retrying(model, process, "Flaky", 2);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        require(engine.advance(plan, flaky, ExecutionOutcome.FAILED));
        ActionRun run = plan.getRuns().get(flaky);
        assertEquals(RunStatus.RETRYING, run.getStatus());
        assertEquals(1, run.getRetryCount());
        assertEquals(1000L, run.getNextRetryDelayMs());

        require(engine.advance(plan, flaky, ExecutionOutcome.STARTED));
        require(engine.advance(plan, flaky, ExecutionOutcome.TIMEOUT));
        assertEquals(RunStatus.RETRYING, run.getStatus());
        assertEquals(2, run.getRetryCount());

        require(engine.advance(plan, flaky, ExecutionOutcome.FAILED));
        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(PlanStatus.PARTIALLY_FAILED, plan.getStatus());
    }

    @Test
    void testRetries_EscalateToError() {
        NodeId process = stage(model, "process", false);
        RetryPolicy policy = require(RetryPolicy.create(0, BackoffStrategy.CONSTANT, 0, 0, FailureEscalation.ERROR));
        NodeId strict = action(model, tether(process, "Strict").retryPolicy(policy).build());
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        require(engine.advance(plan, strict, ExecutionOutcome.FAILED));

        assertEquals(RunStatus.ERROR, status(plan, strict));
    }

    @Test
    void testErrorOutcome_IsNotRetried() {
        NodeId process = stage(model, "process", false);
        NodeId flaky = retrying(model, process, "Flaky", 3);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        require(engine.advance(plan, flaky, ExecutionOutcome.ERROR));

        assertEquals(RunStatus.ERROR, status(plan, flaky));
        assertEquals(0, plan.getRuns().get(flaky).getRetryCount());
    }

    @Test
    void testAdvance_RejectsInvalidOutcomes() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);
        NodeId ship = action(model, process, "Ship", 2);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        assertEquals(ErrorType.CONFLICT, engine.advance(plan, ship, ExecutionOutcome.COMPLETED).getErrorType());
        NodeId unknown = require(NodeId.create("00000000-0000-4000-8000-999999999999"));
        assertEquals(ErrorType.NOT_FOUND, engine.advance(plan, unknown, ExecutionOutcome.COMPLETED).getErrorType());

        require(engine.advance(plan, pack, ExecutionOutcome.COMPLETED));
        assertEquals(ErrorType.CONFLICT, engine.advance(plan, pack, ExecutionOutcome.FAILED).getErrorType());
    }

    @Test
    void testAdvance_DoesNotMutateModel() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        require(engine.advance(plan, pack, ExecutionOutcome.COMPLETED));

        assertEquals(ActionStatus.DRAFT, model.getActionNodes().get(pack).getActionStatus());
        assertEquals(ActionStatus.COMPLETED, plan.getRuns().get(pack).getStatus().toActionStatus());
    }

    @Test
    void testDownstreamContainer_WaitsForUpstream() {
        NodeId upstream = stage(model, "prepare", false);
        NodeId downstream = stage(model, "deliver", false);
        NodeId pack = action(model, upstream, "Pack", 1);
        NodeId ship = action(model, downstream, "Ship", 1);
        depends(model, upstream, downstream);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        assertEquals(RunStatus.PENDING, status(plan, ship));
        assertEquals(RunStatus.PENDING, plan.getContainerStatus(downstream));

        require(engine.advance(plan, pack, ExecutionOutcome.COMPLETED));

        assertEquals(RunStatus.READY, status(plan, ship));
        assertEquals(RunStatus.COMPLETED, plan.getContainerStatus(upstream));
    }

    @Test
    void testRequiredFailure_AbortsRemainingActions() {
        NodeId process = stage(model, "process", false);
        NodeId check = action(model, tether(process, "Check").executionOrder(1).required(true).build());
        NodeId ship = action(model, process, "Ship", 2);
        NodeId later = stage(model, "later", false);
        NodeId archive = action(model, later, "Archive", 1);
        depends(model, process, later);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));

        require(engine.advance(plan, check, ExecutionOutcome.FAILED));

        assertEquals(PlanStatus.FAILED, plan.getStatus());
        assertEquals(RunStatus.SKIPPED, status(plan, ship));
        assertEquals(RunStatus.SKIPPED, status(plan, archive));
        assertEquals(ErrorType.CONFLICT, engine.advance(plan, ship, ExecutionOutcome.COMPLETED).getErrorType());
        assertEquals(1, publisher.ofType(ExecutionEvent.PLAN_FINISHED).size());
    }

    @Test
    void testConditionalGuards() {
        NodeId review = stage(model, "review", false);
        NodeId approve = action(model, review, "Approve", 1);
        NodeId notify = action(model, tether(review, "Notify").executionOrder(2)
                .executionMode(ExecutionMode.CONDITIONAL)
                .condition("#statuses['Approve'] == 'completed'")
                .build());
        NodeId gated = stage(model, "gated", ExecutionMode.CONDITIONAL);
        NodeId big = action(model, tether(gated, "Big").executionOrder(1)
                .condition("#variables['amount'] > 100").build());
        NodeId small = action(model, tether(gated, "Small").executionOrder(2)
                .condition("#variables['amount'] <= 100").build());
        require(model.publish());

        Map<String, Object> variables = new HashMap<>();
        variables.put("amount", 50);
        ExecutionPlan plan = require(engine.planExecution(model, ExecutionRequest.builder()
                .variables(variables).build()));

        assertEquals(RunStatus.SKIPPED, status(plan, big));
        assertEquals("Guard evaluated to false", plan.getRuns().get(big).getMessage());
        assertEquals(RunStatus.READY, status(plan, small));
        assertEquals(RunStatus.PENDING, status(plan, notify));

        require(engine.advance(plan, approve, ExecutionOutcome.COMPLETED));
        assertEquals(RunStatus.READY, status(plan, notify));
    }

    @Test
    void testGuards_UseVariablesCapturedAtPlanning() {
        NodeId review = stage(model, "review", false);
        NodeId approve = action(model, review, "Approve", 1);
        NodeId escalate = action(model, tether(review, "Escalate").executionOrder(2)
                .executionMode(ExecutionMode.CONDITIONAL)
                .condition("#variables['amount'] > 100")
                .build());
        require(model.publish());

        Map<String, Object> variables = new HashMap<>();
        variables.put("amount", 50);
        ExecutionPlan plan = require(engine.planExecution(model, ExecutionRequest.builder()
                .variables(variables).build()));
        variables.put("amount", 500);

        require(engine.advance(plan, approve, ExecutionOutcome.COMPLETED));

        assertEquals(50, plan.getVariables().get("amount"));
        assertEquals(RunStatus.SKIPPED, status(plan, escalate));
    }

    @Test
    void testConditionalAction_RequiresValidGuard() {
        NodeId gated = stage(model, "gated", ExecutionMode.CONDITIONAL);
        action(model, gated, "Unguarded", 1);
        require(model.publish());

        assertTrue(engine.planExecution(model).isFailure());
    }

    @Test
    void testConditionalAction_RejectsUnparseableGuard() {
        NodeId gated = stage(model, "gated", ExecutionMode.CONDITIONAL);
        action(model, tether(gated, "Broken").condition("#variables[").build());
        require(model.publish());

        Result<ExecutionPlan> plan = engine.planExecution(model);

        assertEquals(ErrorType.VALIDATION, plan.getErrorType());
    }

    @Test
    void testStopExecution_CancelsPendingWork() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);
        NodeId ship = action(model, process, "Ship", 2);
        require(model.publish());
        ExecutionPlan plan = require(engine.planExecution(model));
        require(engine.advance(plan, pack, ExecutionOutcome.COMPLETED));

        require(engine.stopExecution(plan, "operator request"));

        assertEquals(PlanStatus.CANCELLED, plan.getStatus());
        assertEquals("operator request", plan.getCancelReason());
        assertEquals(RunStatus.COMPLETED, status(plan, pack));
        assertEquals(RunStatus.CANCELLED, status(plan, ship));
        assertEquals(ErrorType.CONFLICT, engine.advance(plan, ship, ExecutionOutcome.COMPLETED).getErrorType());
        assertEquals(ErrorType.CONFLICT, engine.stopExecution(plan, null).getErrorType());
        assertEquals(1, publisher.ofType(ExecutionEvent.PLAN_CANCELLED).size());
    }

    @Test
    void testLiveExecution_PublishesTransitions() {
        NodeId process = stage(model, "process", false);
        NodeId pack = action(model, process, "Pack", 1);
        require(model.publish());

        ExecutionPlan plan = require(engine.planExecution(model));
        require(engine.advance(plan, pack, ExecutionOutcome.COMPLETED));

        assertEquals(ExecutionEvent.PLAN_CREATED, publisher.getEvents().get(0).getType());
        assertEquals(3, publisher.ofType(ExecutionEvent.ACTION_TRANSITIONED).size());
        ExecutionEvent finished = publisher.ofType(ExecutionEvent.PLAN_FINISHED).get(0);
        assertEquals(PlanStatus.COMPLETED.getValue(), finished.getStatus());
    }

    @Test
    void testDryRun_SimulatesWithoutEvents() {
        NodeId fanOut = stage(model, "fan-out", true);
        NodeId fast = action(model, tether(fanOut, "Fast").estimatedDurationMs(100L).build());
        action(model, tether(fanOut, "Slow").estimatedDurationMs(300L).build());
        NodeId finish = stage(model, "finish", false);
        action(model, tether(finish, "Report").estimatedDurationMs(50L).build());
        action(model, tether(finish, "Archive").estimatedDurationMs(50L).build());
        depends(model, fanOut, finish);
        require(model.publish());

        Map<String, ExecutionOutcome> outcomes = new HashMap<>();
        outcomes.put(fast.getValue(), ExecutionOutcome.FAILED);
        ExecutionSummary summary = require(engine.dryRun(model, ExecutionRequest.builder()
                .simulatedOutcomes(outcomes).build()));

        assertTrue(summary.isDryRun());
        assertEquals(PlanStatus.PARTIALLY_FAILED, summary.getPlanStatus());
        assertEquals(4, summary.getTotalActions());
        assertEquals(3, summary.getCompleted());
        assertEquals(1, summary.getFailed());
        assertEquals(0, summary.getPending());
        assertEquals(400L, summary.getEstimatedDurationMs());
        assertTrue(publisher.getEvents().isEmpty());
    }

    @Test
    void testEmptyModel_CompletesImmediately() {
        stage(model, "empty", false);
        require(model.publish());

        ExecutionPlan plan = require(engine.planExecution(model));

        assertEquals(PlanStatus.COMPLETED, plan.getStatus());
        assertEquals(0, engine.summarize(plan).getTotalActions());
    }

    private static RunStatus status(ExecutionPlan plan, NodeId nodeId) {
        return plan.getRuns().get(nodeId).getStatus();
    }
}
