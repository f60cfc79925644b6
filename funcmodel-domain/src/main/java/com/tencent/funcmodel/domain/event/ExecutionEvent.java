package com.tencent.funcmodel.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * ExecutionEvent - 执行状态变更事件
 * <p>
 * 实时执行时每次状态迁移发布一个事件；试运行不发布。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionEvent {

    public static final String PLAN_CREATED = "execution.plan.created";
    public static final String PLAN_FINISHED = "execution.plan.finished";
    public static final String PLAN_CANCELLED = "execution.plan.cancelled";
    public static final String ACTION_TRANSITIONED = "execution.action.transitioned";

    /**
     * 事件类型
     * <p>
     * 格式: execution.{entity}.{action}
     * </p>
     */
    private String type;

    private String planId;

    private String modelId;

    /**
     * 发生迁移的动作节点，计划级事件为空
     */
    private String nodeId;

    private String previousStatus;

    private String status;

    private int retryCount;

    private String message;

    private Instant time;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();
}
