package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;

/**
 * ExecutionEngine - 执行引擎
 * <p>
 * 根据已发布模型计算执行计划并驱动动作的运行状态迁移；不执行动作本身，
 * 动作的实际执行由外部协作者完成并通过 {@link #advance} 上报结果。
 * </p>
 */
public interface ExecutionEngine {

    /**
     * 使用空请求规划执行
     */
    Result<ExecutionPlan> planExecution(FunctionModel model);

    /**
     * 计算执行计划：容器按依赖拓扑排序，容器内动作按执行顺序、优先级、创建时间排序
     */
    Result<ExecutionPlan> planExecution(FunctionModel model, ExecutionRequest request);

    /**
     * 上报一个动作的执行结果，这是运行状态变化的唯一入口
     */
    Result<ExecutionPlan> advance(ExecutionPlan plan, NodeId nodeId, ExecutionOutcome outcome);

    /**
     * 停止执行：所有未终结的动作变为 cancelled，之后的 advance 返回 CONFLICT
     */
    Result<ExecutionPlan> stopExecution(ExecutionPlan plan, String reason);

    ExecutionSummary summarize(ExecutionPlan plan);

    /**
     * 试运行：与实时执行相同的规划与推进逻辑，使用模拟结果，不发布事件
     */
    Result<ExecutionSummary> dryRun(FunctionModel model, ExecutionRequest request);
}
