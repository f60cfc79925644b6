package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.node.ExecutionMode;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * ContainerSchedule - 容器在执行计划中的调度信息
 * <p>
 * 上游容器全部终结后容器被释放（released），其动作才会被调度；
 * 所有动作终结后容器完成（finished），继续释放下游容器。
 * </p>
 */
@Getter
@ToString
public class ContainerSchedule {

    private final NodeId containerId;

    private final String name;

    private final ExecutionMode mode;

    /**
     * 已排序的动作 ID
     */
    private final List<NodeId> actionOrder;

    private final Set<NodeId> upstream;

    private volatile boolean released;

    private volatile boolean finished;

    public ContainerSchedule(NodeId containerId, String name, ExecutionMode mode, List<NodeId> actionOrder,
                             Set<NodeId> upstream) {
        this.containerId = containerId;
        this.name = name;
        this.mode = mode;
        this.actionOrder = Collections.unmodifiableList(actionOrder);
        this.upstream = Collections.unmodifiableSet(upstream);
    }

    public void markReleased() {
        this.released = true;
    }

    public void markFinished() {
        this.finished = true;
    }
}
