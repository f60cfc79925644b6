package com.tencent.funcmodel.domain.execution.impl;

import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.event.ExecutionEvent;
import com.tencent.funcmodel.domain.event.ExecutionEventPublisher;
import com.tencent.funcmodel.domain.execution.ActionRun;
import com.tencent.funcmodel.domain.execution.ContainerSchedule;
import com.tencent.funcmodel.domain.execution.ExecutionEngine;
import com.tencent.funcmodel.domain.execution.ExecutionOutcome;
import com.tencent.funcmodel.domain.execution.ExecutionPlan;
import com.tencent.funcmodel.domain.execution.ExecutionRequest;
import com.tencent.funcmodel.domain.execution.ExecutionSummary;
import com.tencent.funcmodel.domain.execution.GuardEvaluator;
import com.tencent.funcmodel.domain.execution.PlanStatus;
import com.tencent.funcmodel.domain.execution.RunStatus;
import com.tencent.funcmodel.domain.model.DependencyGraph;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.model.ModelStatus;
import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.node.ActionStatus;
import com.tencent.funcmodel.domain.node.ExecutionMode;
import com.tencent.funcmodel.domain.node.Node;
import com.tencent.funcmodel.domain.node.StageNode;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.FailureEscalation;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionEngineImpl implements ExecutionEngine {

    /**
     * 容器内动作顺序: executionOrder 升序，priority 降序，创建时间升序，注册序号升序
     */
    private static final Comparator<ActionNode> ACTION_ORDER = Comparator
            .comparingInt(ActionNode::getExecutionOrder)
            .thenComparing(Comparator.comparingInt(ActionNode::getPriority).reversed())
            .thenComparing(ActionNode::getCreatedAt)
            .thenComparingLong(ActionNode::getSequence);

    private final GuardEvaluator guardEvaluator;
    private final ExecutionEventPublisher eventPublisher;
    private final FunctionModelProperties properties;
    private final Clock clock;
    private final IdGenerator idGenerator;

    @Override
    public Result<ExecutionPlan> planExecution(FunctionModel model) {
        return planExecution(model, ExecutionRequest.empty());
    }

    @Override
    public Result<ExecutionPlan> planExecution(FunctionModel model, ExecutionRequest request) {
        return plan(model, request, false);
    }

    @Override
    public Result<ExecutionPlan> advance(ExecutionPlan plan, NodeId nodeId, ExecutionOutcome outcome) {
        if (plan == null || nodeId == null || outcome == null) {
            return Result.fail("Plan, node id and outcome are required");
        }
        if (plan.getStatus() == PlanStatus.CANCELLED) {
            return Result.conflict("Execution plan " + plan.getPlanId() + " was cancelled");
        }
        if (plan.isTerminal()) {
            return Result.conflict("Execution plan " + plan.getPlanId() + " has already finished as "
                    + plan.getStatus().getValue());
        }
        ActionRun run = plan.getRuns().get(nodeId);
        if (run == null) {
            return Result.notFound("Action " + nodeId + " is not part of execution plan " + plan.getPlanId());
        }

        RunStatus current = run.getStatus();
        switch (outcome) {
            case STARTED:
                if (current != RunStatus.READY && current != RunStatus.RETRYING) {
                    return rejectOutcome(run, outcome);
                }
                plan.markRunning();
                transition(plan, run, RunStatus.EXECUTING, null);
                return Result.ok(plan);
            case SKIPPED:
                if (current != RunStatus.PENDING && current != RunStatus.READY) {
                    return rejectOutcome(run, outcome);
                }
                transition(plan, run, RunStatus.SKIPPED, "Skipped by executor");
                break;
            case COMPLETED:
                if (!current.isActive()) {
                    return rejectOutcome(run, outcome);
                }
                startIfNeeded(plan, run);
                transition(plan, run, RunStatus.COMPLETED, null);
                break;
            case FAILED:
            case TIMEOUT:
                if (!current.isActive()) {
                    return rejectOutcome(run, outcome);
                }
                startIfNeeded(plan, run);
                handleRetryableFailure(plan, run, outcome);
                break;
            case ERROR:
                if (!current.isActive()) {
                    return rejectOutcome(run, outcome);
                }
                startIfNeeded(plan, run);
                transition(plan, run, RunStatus.ERROR, "Action reported a non-retryable error");
                break;
            default:
                return Result.fail("Unsupported outcome: " + outcome.getValue());
        }
        plan.markRunning();

        ContainerSchedule container = plan.getContainer(run.getContainerId());
        if (run.getStatus().isFailure() && run.isRequired() && hasPendingSuccessors(plan, container, run)) {
            abort(plan, run);
            return Result.ok(plan);
        }
        if (run.isTerminal()) {
            schedule(plan, container);
        }
        finishIfDone(plan);
        return Result.ok(plan);
    }

    @Override
    public Result<ExecutionPlan> stopExecution(ExecutionPlan plan, String reason) {
        if (plan == null) {
            return Result.fail("Plan cannot be null");
        }
        if (plan.isTerminal()) {
            return Result.conflict("Execution plan " + plan.getPlanId() + " has already finished as "
                    + plan.getStatus().getValue());
        }
        String cancelReason = reason == null || reason.isBlank() ? "Stopped by caller" : reason;
        for (ActionRun run : plan.getOrderedRuns()) {
            if (!run.isTerminal()) {
                transition(plan, run, RunStatus.CANCELLED, cancelReason);
            }
        }
        plan.cancel(cancelReason, clock.instant());
        publishPlanEvent(plan, ExecutionEvent.PLAN_CANCELLED, cancelReason);
        log.info("Execution plan [{}] of model [{}] cancelled: {}", plan.getPlanId(), plan.getModelId(), cancelReason);
        return Result.ok(plan);
    }

    @Override
    public ExecutionSummary summarize(ExecutionPlan plan) {
        Map<RunStatus, Integer> counts = new HashMap<>();
        Map<String, String> statuses = new LinkedHashMap<>();
        for (ActionRun run : plan.getOrderedRuns()) {
            counts.merge(run.getStatus(), 1, Integer::sum);
            statuses.put(run.getNodeId().getValue(), run.getStatus().getValue());
        }
        int pending = 0;
        for (Map.Entry<RunStatus, Integer> entry : counts.entrySet()) {
            if (!entry.getKey().isTerminal()) {
                pending += entry.getValue();
            }
        }
        return ExecutionSummary.builder()
                .planId(plan.getPlanId())
                .modelId(plan.getModelId())
                .planStatus(plan.getStatus())
                .dryRun(plan.isDryRun())
                .totalActions(plan.getRuns().size())
                .completed(counts.getOrDefault(RunStatus.COMPLETED, 0))
                .failed(counts.getOrDefault(RunStatus.FAILED, 0))
                .errored(counts.getOrDefault(RunStatus.ERROR, 0))
                .skipped(counts.getOrDefault(RunStatus.SKIPPED, 0))
                .cancelled(counts.getOrDefault(RunStatus.CANCELLED, 0))
                .pending(pending)
                .estimatedDurationMs(criticalPathDuration(plan))
                .executionOrder(plan.getActionOrder().stream().map(NodeId::getValue).collect(Collectors.toList()))
                .actionStatuses(statuses)
                .build();
    }

    @Override
    public Result<ExecutionSummary> dryRun(FunctionModel model, ExecutionRequest request) {
        ExecutionRequest effective = request == null ? ExecutionRequest.empty() : request;
        Result<ExecutionPlan> planned = plan(model, effective, true);
        if (planned.isFailure()) {
            return planned.propagate();
        }
        ExecutionPlan plan = planned.getValue();
        Map<String, ExecutionOutcome> simulated = effective.getSimulatedOutcomes() == null
                ? new HashMap<>() : effective.getSimulatedOutcomes();

        int remainingSteps = plan.getRuns().size() * (RetryPolicy.MAX_RETRIES_LIMIT + 2) + 1;
        while (!plan.isTerminal() && remainingSteps-- > 0) {
            Optional<ActionRun> next = plan.getOrderedRuns().stream()
                    .filter(run -> run.getStatus().isActive())
                    .findFirst();
            if (next.isEmpty()) {
                break;
            }
            ExecutionOutcome outcome = simulated.getOrDefault(next.get().getNodeId().getValue(),
                    ExecutionOutcome.COMPLETED);
            if (outcome == ExecutionOutcome.STARTED) {
                outcome = ExecutionOutcome.COMPLETED;
            }
            Result<ExecutionPlan> advanced = advance(plan, next.get().getNodeId(), outcome);
            if (advanced.isFailure()) {
                return advanced.propagate();
            }
        }

        ExecutionSummary summary = summarize(plan);
        log.info("Dry run of model [{}] finished as {}: {} completed, {} failed, {} skipped",
                plan.getModelId(), plan.getStatus().getValue(), summary.getCompleted(),
                summary.getFailed() + summary.getErrored(), summary.getSkipped());
        return Result.ok(summary);
    }

    // ---------------------------------------------------------------- planning

    private Result<ExecutionPlan> plan(FunctionModel model, ExecutionRequest request, boolean dryRun) {
        if (model == null) {
            return Result.fail("Model cannot be null");
        }
        if (model.isDeleted()) {
            return Result.conflict("Cannot execute deleted model " + model.getModelId());
        }
        if (model.getStatus() != ModelStatus.PUBLISHED) {
            return Result.conflict("Only published models can be executed, model " + model.getModelId()
                    + " is " + model.getStatus().getValue());
        }
        ExecutionRequest effective = request == null ? ExecutionRequest.empty() : request;

        List<NodeId> registrationOrder = model.getContainerNodes().stream()
                .sorted(Comparator.comparingLong(Node::getSequence))
                .map(Node::getNodeId)
                .collect(Collectors.toList());
        Map<NodeId, Set<NodeId>> dependencies = model.getContainerDependencies();
        Result<List<NodeId>> topological = DependencyGraph.topologicalSort(registrationOrder, dependencies);
        if (topological.isFailure()) {
            return topological.propagate();
        }

        List<ContainerSchedule> schedules = new ArrayList<>();
        List<ActionRun> runs = new ArrayList<>();
        for (NodeId containerId : topological.getValue()) {
            Node container = model.getNodes().get(containerId);
            ExecutionMode mode = resolveMode(container);
            List<ActionNode> actions = model.getActionsOf(containerId).stream()
                    .filter(this::isSchedulable)
                    .sorted(ACTION_ORDER)
                    .collect(Collectors.toList());
            List<NodeId> actionOrder = new ArrayList<>(actions.size());
            for (ActionNode action : actions) {
                boolean guarded = mode == ExecutionMode.CONDITIONAL
                        || action.getExecutionMode() == ExecutionMode.CONDITIONAL;
                if (guarded) {
                    if (!action.hasCondition()) {
                        return Result.fail("Conditional action \"" + action.getName() + "\" requires a guard condition");
                    }
                    Result<Void> valid = guardEvaluator.validate(action.getCondition());
                    if (valid.isFailure()) {
                        return valid.propagate();
                    }
                }
                runs.add(new ActionRun(action, guarded, estimateDuration(action)));
                actionOrder.add(action.getNodeId());
            }
            schedules.add(new ContainerSchedule(containerId, container.getName().getValue(), mode, actionOrder,
                    dependencies.get(containerId)));
        }

        ExecutionPlan plan = new ExecutionPlan(idGenerator.nextId(), model.getModelId(),
                model.getVersion().toString(), dryRun, schedules, runs, effective.getVariables(), clock.instant());
        log.info("Planned {}execution [{}] of model [{}]: {} containers, {} actions",
                dryRun ? "dry-run " : "", plan.getPlanId(), model.getModelId(), schedules.size(), runs.size());
        publishPlanEvent(plan, ExecutionEvent.PLAN_CREATED, null);

        for (ContainerSchedule container : schedules) {
            if (container.getUpstream().isEmpty()) {
                release(plan, container);
            }
        }
        finishIfDone(plan);
        return Result.ok(plan);
    }

    private ExecutionMode resolveMode(Node container) {
        if (container instanceof StageNode && ((StageNode) container).isParallelExecution()) {
            return ExecutionMode.PARALLEL;
        }
        return container.getExecutionType();
    }

    private boolean isSchedulable(ActionNode action) {
        return action.getActionStatus() != ActionStatus.ARCHIVED
                && action.getActionStatus() != ActionStatus.INACTIVE;
    }

    private long estimateDuration(ActionNode action) {
        Long estimate = action.getEstimatedDurationMs();
        return estimate == null ? properties.getSimulatedActionDurationMs() : estimate;
    }

    // ---------------------------------------------------------------- scheduling

    private void release(ExecutionPlan plan, ContainerSchedule container) {
        if (container.isReleased()) {
            return;
        }
        container.markReleased();
        log.debug("Plan [{}] released container [{}]", plan.getPlanId(), container.getName());
        schedule(plan, container);
    }

    /**
     * 推进容器内可执行的动作: 并行模式一次全部就绪，顺序与条件模式一次只就绪一个
     */
    private void schedule(ExecutionPlan plan, ContainerSchedule container) {
        if (!container.isReleased() || plan.isTerminal()) {
            return;
        }
        if (container.getMode() == ExecutionMode.PARALLEL) {
            for (NodeId actionId : container.getActionOrder()) {
                ActionRun run = plan.getRuns().get(actionId);
                if (run.getStatus() == RunStatus.PENDING) {
                    activate(plan, run);
                }
            }
        } else {
            for (NodeId actionId : container.getActionOrder()) {
                ActionRun run = plan.getRuns().get(actionId);
                if (run.isTerminal()) {
                    continue;
                }
                if (run.getStatus() == RunStatus.PENDING) {
                    activate(plan, run);
                    if (run.isTerminal()) {
                        continue;
                    }
                }
                break;
            }
        }
        finishContainerIfDone(plan, container);
    }

    private void activate(ExecutionPlan plan, ActionRun run) {
        if (run.isGuarded()) {
            boolean pass = guardEvaluator.evaluate(run.getCondition(), run.getAction(), plan.getVariables(),
                    statusesByName(plan));
            if (!pass) {
                transition(plan, run, RunStatus.SKIPPED, "Guard evaluated to false");
                return;
            }
        }
        transition(plan, run, RunStatus.READY, null);
    }

    private void finishContainerIfDone(ExecutionPlan plan, ContainerSchedule container) {
        if (container.isFinished() || !container.isReleased()) {
            return;
        }
        for (NodeId actionId : container.getActionOrder()) {
            if (!plan.getRuns().get(actionId).isTerminal()) {
                return;
            }
        }
        container.markFinished();
        log.debug("Plan [{}] container [{}] finished", plan.getPlanId(), container.getName());
        for (ContainerSchedule downstream : plan.getContainers().values()) {
            if (!downstream.isReleased() && downstream.getUpstream().contains(container.getContainerId())
                    && allUpstreamFinished(plan, downstream)) {
                release(plan, downstream);
            }
        }
    }

    private boolean allUpstreamFinished(ExecutionPlan plan, ContainerSchedule container) {
        for (NodeId upstream : container.getUpstream()) {
            ContainerSchedule schedule = plan.getContainer(upstream);
            if (schedule != null && !schedule.isFinished()) {
                return false;
            }
        }
        return true;
    }

    private void startIfNeeded(ExecutionPlan plan, ActionRun run) {
        if (run.getStatus() == RunStatus.READY || run.getStatus() == RunStatus.RETRYING) {
            transition(plan, run, RunStatus.EXECUTING, "Implicitly started");
        }
    }

    private void handleRetryableFailure(ExecutionPlan plan, ActionRun run, ExecutionOutcome outcome) {
        RetryPolicy policy = run.getRetryPolicy();
        if (policy.allowsRetry(run.getRetryCount())) {
            int attempt = run.recordRetry();
            transition(plan, run, RunStatus.RETRYING, outcome.getValue() + ", retry " + attempt + "/"
                    + policy.getMaxRetries() + " after " + run.getNextRetryDelayMs() + "ms");
            return;
        }
        RunStatus terminal = policy.getEscalation() == FailureEscalation.ERROR ? RunStatus.ERROR : RunStatus.FAILED;
        transition(plan, run, terminal, outcome.getValue() + " after " + run.getRetryCount() + " retries");
    }

    /**
     * 顺序链上还有待执行的后继动作，或下游容器尚未释放
     */
    private boolean hasPendingSuccessors(ExecutionPlan plan, ContainerSchedule container, ActionRun failed) {
        if (container.getMode() != ExecutionMode.PARALLEL) {
            List<NodeId> order = container.getActionOrder();
            for (int i = order.indexOf(failed.getNodeId()) + 1; i < order.size(); i++) {
                if (!plan.getRuns().get(order.get(i)).isTerminal()) {
                    return true;
                }
            }
        }
        for (ContainerSchedule downstream : plan.getContainers().values()) {
            if (!downstream.isReleased() && downstream.getUpstream().contains(container.getContainerId())) {
                return true;
            }
        }
        return false;
    }

    private void abort(ExecutionPlan plan, ActionRun failed) {
        String reason = "Required action \"" + failed.getName() + "\" " + failed.getStatus().getValue();
        for (ActionRun run : plan.getOrderedRuns()) {
            if (!run.isTerminal()) {
                transition(plan, run, RunStatus.SKIPPED, reason);
            }
        }
        plan.finish(PlanStatus.FAILED, clock.instant());
        publishPlanEvent(plan, ExecutionEvent.PLAN_FINISHED, reason);
        log.warn("Execution plan [{}] of model [{}] aborted: {}", plan.getPlanId(), plan.getModelId(), reason);
    }

    private void finishIfDone(ExecutionPlan plan) {
        if (plan.isTerminal()) {
            return;
        }
        boolean anyFailure = false;
        for (ActionRun run : plan.getRuns().values()) {
            if (!run.isTerminal()) {
                return;
            }
            anyFailure |= run.getStatus().isFailure();
        }
        for (ContainerSchedule container : plan.getContainers().values()) {
            if (!container.isFinished()) {
                return;
            }
        }
        plan.finish(anyFailure ? PlanStatus.PARTIALLY_FAILED : PlanStatus.COMPLETED, clock.instant());
        publishPlanEvent(plan, ExecutionEvent.PLAN_FINISHED, null);
        log.info("Execution plan [{}] of model [{}] finished as {}", plan.getPlanId(), plan.getModelId(),
                plan.getStatus().getValue());
    }

    private Result<ExecutionPlan> rejectOutcome(ActionRun run, ExecutionOutcome outcome) {
        return Result.conflict("Action \"" + run.getName() + "\" cannot accept outcome " + outcome.getValue()
                + " while " + run.getStatus().getValue());
    }

    // ---------------------------------------------------------------- helpers

    private void transition(ExecutionPlan plan, ActionRun run, RunStatus target, String message) {
        RunStatus previous = run.getStatus();
        run.moveTo(target, clock.instant(), message);
        log.debug("Plan [{}] action [{}] {} -> {}", plan.getPlanId(), run.getName(), previous.getValue(),
                target.getValue());
        if (plan.isDryRun()) {
            return;
        }
        eventPublisher.publish(ExecutionEvent.builder()
                .type(ExecutionEvent.ACTION_TRANSITIONED)
                .planId(plan.getPlanId())
                .modelId(plan.getModelId())
                .nodeId(run.getNodeId().getValue())
                .previousStatus(previous.getValue())
                .status(target.getValue())
                .retryCount(run.getRetryCount())
                .message(message)
                .time(run.getLastTransitionAt())
                .build());
    }

    private void publishPlanEvent(ExecutionPlan plan, String type, String message) {
        if (plan.isDryRun()) {
            return;
        }
        eventPublisher.publish(ExecutionEvent.builder()
                .type(type)
                .planId(plan.getPlanId())
                .modelId(plan.getModelId())
                .status(plan.getStatus().getValue())
                .message(message)
                .time(clock.instant())
                .build());
    }

    private Map<String, String> statusesByName(ExecutionPlan plan) {
        Map<String, String> statuses = new LinkedHashMap<>();
        for (ActionRun run : plan.getOrderedRuns()) {
            statuses.put(run.getName(), run.getStatus().getValue());
        }
        return statuses;
    }

    /**
     * 关键路径耗时: 并行容器取最长动作，其余容器累加；跳过和取消的动作不计
     */
    private long criticalPathDuration(ExecutionPlan plan) {
        Map<NodeId, Long> finishTimes = new HashMap<>();
        long longest = 0;
        for (ContainerSchedule container : plan.getContainers().values()) {
            long start = 0;
            for (NodeId upstream : container.getUpstream()) {
                start = Math.max(start, finishTimes.getOrDefault(upstream, 0L));
            }
            long duration = 0;
            for (NodeId actionId : container.getActionOrder()) {
                ActionRun run = plan.getRuns().get(actionId);
                if (run.getStatus() == RunStatus.SKIPPED || run.getStatus() == RunStatus.CANCELLED) {
                    continue;
                }
                duration = container.getMode() == ExecutionMode.PARALLEL
                        ? Math.max(duration, run.getEstimatedDurationMs())
                        : duration + run.getEstimatedDurationMs();
            }
            finishTimes.put(container.getContainerId(), start + duration);
            longest = Math.max(longest, start + duration);
        }
        return longest;
    }
}
