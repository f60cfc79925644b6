package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ExecutionPlan - 执行计划
 * <p>
 * 容器按拓扑序排列，容器内动作已排好序。每个动作的运行状态保存在并发 Map 中，
 * 调用方可以并发推进互不相关的动作；同一动作及其直接后继的推进需要调用方串行化。
 * </p>
 *
 * @author funcmodel
 */
@Getter
public class ExecutionPlan {

    private final String planId;

    private final String modelId;

    private final String modelVersion;

    private final boolean dryRun;

    /**
     * 按拓扑序排列的容器
     */
    private final Map<NodeId, ContainerSchedule> containers;

    private final Map<NodeId, ActionRun> runs = new ConcurrentHashMap<>();

    private final Map<String, Object> variables;

    private final Instant createdAt;

    private volatile PlanStatus status = PlanStatus.PLANNED;

    private volatile Instant finishedAt;

    private volatile String cancelReason;

    public ExecutionPlan(String planId, String modelId, String modelVersion, boolean dryRun,
                         List<ContainerSchedule> orderedContainers, List<ActionRun> actionRuns,
                         Map<String, Object> variables, Instant createdAt) {
        this.planId = planId;
        this.modelId = modelId;
        this.modelVersion = modelVersion;
        this.dryRun = dryRun;
        Map<NodeId, ContainerSchedule> ordered = new LinkedHashMap<>();
        for (ContainerSchedule container : orderedContainers) {
            ordered.put(container.getContainerId(), container);
        }
        this.containers = Collections.unmodifiableMap(ordered);
        for (ActionRun run : actionRuns) {
            runs.put(run.getNodeId(), run);
        }
        this.variables = variables == null
                ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.createdAt = createdAt;
    }

    public Optional<ActionRun> findRun(NodeId nodeId) {
        return Optional.ofNullable(runs.get(nodeId));
    }

    public Map<NodeId, ActionRun> getRuns() {
        return Collections.unmodifiableMap(runs);
    }

    public ContainerSchedule getContainer(NodeId containerId) {
        return containers.get(containerId);
    }

    /**
     * 计划中的动作顺序：容器拓扑序，容器内按排序后的顺序
     */
    public List<NodeId> getActionOrder() {
        List<NodeId> order = new ArrayList<>(runs.size());
        for (ContainerSchedule container : containers.values()) {
            order.addAll(container.getActionOrder());
        }
        return order;
    }

    public List<ActionRun> getOrderedRuns() {
        List<ActionRun> ordered = new ArrayList<>(runs.size());
        for (NodeId nodeId : getActionOrder()) {
            ordered.add(runs.get(nodeId));
        }
        return ordered;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isContainerTerminal(NodeId containerId) {
        ContainerSchedule container = containers.get(containerId);
        if (container == null) {
            return false;
        }
        for (NodeId actionId : container.getActionOrder()) {
            if (!runs.get(actionId).isTerminal()) {
                return false;
            }
        }
        return container.isReleased() || status.isTerminal();
    }

    /**
     * 容器的聚合状态:
     * 未释放为 pending；有未终结的动作为 executing；全部终结后按是否有失败给出 failed、cancelled 或 completed
     */
    public RunStatus getContainerStatus(NodeId containerId) {
        ContainerSchedule container = containers.get(containerId);
        if (container == null) {
            return null;
        }
        boolean anyFailure = false;
        boolean anyCancelled = false;
        for (NodeId actionId : container.getActionOrder()) {
            RunStatus runStatus = runs.get(actionId).getStatus();
            if (!runStatus.isTerminal()) {
                return container.isReleased() ? RunStatus.EXECUTING : RunStatus.PENDING;
            }
            anyFailure |= runStatus.isFailure();
            anyCancelled |= runStatus == RunStatus.CANCELLED;
        }
        if (!container.isReleased() && !status.isTerminal()) {
            return RunStatus.PENDING;
        }
        if (anyFailure) {
            return RunStatus.FAILED;
        }
        return anyCancelled ? RunStatus.CANCELLED : RunStatus.COMPLETED;
    }

    public void markRunning() {
        if (status == PlanStatus.PLANNED) {
            this.status = PlanStatus.RUNNING;
        }
    }

    public void finish(PlanStatus finalStatus, Instant now) {
        this.status = finalStatus;
        this.finishedAt = now;
    }

    public void cancel(String reason, Instant now) {
        this.cancelReason = reason;
        finish(PlanStatus.CANCELLED, now);
    }
}
