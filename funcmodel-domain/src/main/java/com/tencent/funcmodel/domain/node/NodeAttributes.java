package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.valueobject.ModelName;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * NodeAttributes - 所有节点共享的构造属性
 * <p>
 * 由聚合根在校验完命令后组装，再交给具体节点类型的工厂方法。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeAttributes {

    private NodeId nodeId;

    /**
     * 所属模型 ID
     */
    private String modelId;

    private ModelName name;

    private String description;

    private Position position;

    /**
     * 执行方式，未指定时为 sequential
     */
    private ExecutionMode executionType;

    /**
     * 初始状态，仅对容器节点有意义
     */
    private NodeStatus status;

    /**
     * 声明式超时（毫秒），由调用方负责实际执行
     */
    private Long timeoutMs;

    private Map<String, Object> metadata;

    private Map<String, Object> visualProperties;

    private Instant createdAt;

    /**
     * 在模型内的注册序号，用于稳定排序
     */
    private long sequence;
}
