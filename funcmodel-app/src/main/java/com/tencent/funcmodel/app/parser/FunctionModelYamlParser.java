package com.tencent.funcmodel.app.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tencent.funcmodel.app.dto.ActionYamlDto;
import com.tencent.funcmodel.app.dto.EdgeYamlDto;
import com.tencent.funcmodel.app.dto.FunctionModelYamlDto;
import com.tencent.funcmodel.app.dto.NodeYamlDto;
import com.tencent.funcmodel.app.dto.RetryYamlDto;
import com.tencent.funcmodel.app.service.ActionDefaults;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.model.command.AddActionNodeCommand;
import com.tencent.funcmodel.domain.model.command.AddNodeCommand;
import com.tencent.funcmodel.domain.model.command.CreateEdgeCommand;
import com.tencent.funcmodel.domain.model.command.CreateModelCommand;
import com.tencent.funcmodel.domain.node.BoundaryType;
import com.tencent.funcmodel.domain.node.ExecutionMode;
import com.tencent.funcmodel.domain.node.IOData;
import com.tencent.funcmodel.domain.node.LinkType;
import com.tencent.funcmodel.domain.node.Node;
import com.tencent.funcmodel.domain.node.NodeType;
import com.tencent.funcmodel.domain.node.StageData;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.BackoffStrategy;
import com.tencent.funcmodel.domain.valueobject.FailureEscalation;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 YAML 定义转换为 draft 状态的 {@link FunctionModel}
 * <p>
 * YAML 中节点和动作的 id 只用于连线引用；publish: true 时导入后立即发布。
 * YAML 语法错误抛出 {@link IllegalArgumentException}，模型规则错误以失败的 {@link Result} 返回。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FunctionModelYamlParser {

    private static final long DEFAULT_INITIAL_DELAY_MS = 1000L;

    private static final long DEFAULT_MAX_DELAY_MS = 30_000L;

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    private final Clock clock;
    private final IdGenerator idGenerator;
    private final ActionDefaults actionDefaults;

    public Result<FunctionModel> parse(String yamlContent) {
        FunctionModelYamlDto dto;
        try {
            dto = mapper.readValue(yamlContent, FunctionModelYamlDto.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse function model YAML", e);
        }
        if (dto == null) {
            throw new IllegalArgumentException("Function model YAML is empty");
        }
        return convert(dto);
    }

    private Result<FunctionModel> convert(FunctionModelYamlDto dto) {
        CreateModelCommand command = CreateModelCommand.builder()
                .modelId(dto.getModelId())
                .name(dto.getName())
                .description(dto.getDescription())
                .version(dto.getVersion())
                .owner(dto.getOwner())
                .editors(dto.getEditors())
                .viewers(dto.getViewers())
                .metadata(dto.getMetadata())
                .build();
        Result<FunctionModel> created = FunctionModel.create(command, clock, idGenerator);
        if (created.isFailure()) {
            return created;
        }
        FunctionModel model = created.getValue();
        Map<String, NodeId> localIds = new HashMap<>();

        for (NodeYamlDto nodeDto : nullToEmpty(dto.getNodes())) {
            Result<Node> container = toNodeCommand(nodeDto).flatMap(model::addNode);
            if (container.isFailure()) {
                return Result.fail(container.getErrorType(), "Node '" + localKey(nodeDto.getId(), nodeDto.getName())
                        + "': " + container.getError());
            }
            NodeId containerId = container.getValue().getNodeId();
            localIds.put(localKey(nodeDto.getId(), nodeDto.getName()), containerId);

            for (ActionYamlDto actionDto : nullToEmpty(nodeDto.getActions())) {
                Result<NodeId> action = toActionCommand(actionDto, containerId)
                        .flatMap(actionDefaults::apply)
                        .flatMap(model::addActionNode)
                        .map(Node::getNodeId);
                if (action.isFailure()) {
                    return Result.fail(action.getErrorType(), "Action '"
                            + localKey(actionDto.getId(), actionDto.getName()) + "': " + action.getError());
                }
                localIds.put(localKey(actionDto.getId(), actionDto.getName()), action.getValue());
            }
        }

        for (EdgeYamlDto edgeDto : nullToEmpty(dto.getEdges())) {
            Result<Void> edge = createEdge(model, edgeDto, localIds);
            if (edge.isFailure()) {
                return edge.propagate();
            }
        }

        if (dto.isPublish()) {
            Result<Void> published = model.publish();
            if (published.isFailure()) {
                return published.propagate();
            }
        }
        log.info("Imported function model [{}] from YAML: {} containers, {} actions, {} links",
                model.getModelId(), model.getNodes().size(), model.getActionNodes().size(), model.getLinks().size());
        return Result.ok(model);
    }

    private Result<AddNodeCommand> toNodeCommand(NodeYamlDto nodeDto) {
        Result<NodeType> type = NodeType.fromValue(nodeDto.getType());
        if (type.isFailure()) {
            return type.propagate();
        }
        if (!type.getValue().isContainer()) {
            return Result.fail("Top-level nodes must be containers (ioNode or stageNode), got " + nodeDto.getType());
        }
        Result<ExecutionMode> mode = parseMode(nodeDto.getExecutionType());
        if (mode.isFailure()) {
            return mode.propagate();
        }
        AddNodeCommand.AddNodeCommandBuilder builder = AddNodeCommand.builder()
                .nodeType(type.getValue())
                .name(nodeDto.getName())
                .description(nodeDto.getDescription())
                .x(nodeDto.getX())
                .y(nodeDto.getY())
                .executionType(mode.getValue())
                .timeoutMs(nodeDto.getTimeoutMs())
                .metadata(nodeDto.getMetadata());
        if (type.getValue() == NodeType.IO) {
            Result<BoundaryType> boundary = BoundaryType.fromValue(nodeDto.getBoundaryType());
            if (boundary.isFailure()) {
                return boundary.propagate();
            }
            builder.ioData(IOData.builder()
                    .boundaryType(boundary.getValue())
                    .dataType(nodeDto.getDataType())
                    .required(nodeDto.isRequired())
                    .build());
        } else {
            builder.stageData(StageData.builder()
                            .stageType(nodeDto.getStageType())
                            .stageGoals(nodeDto.getStageGoals())
                            .completionCriteria(nodeDto.getCompletionCriteria())
                            .build())
                    .parallelExecution(nodeDto.isParallel());
        }
        return Result.ok(builder.build());
    }

    private Result<AddActionNodeCommand> toActionCommand(ActionYamlDto actionDto, NodeId containerId) {
        Result<NodeType> type = NodeType.fromValue(actionDto.getType());
        if (type.isFailure()) {
            return type.propagate();
        }
        Result<ExecutionMode> mode = parseMode(actionDto.getExecutionMode());
        if (mode.isFailure()) {
            return mode.propagate();
        }
        Result<RetryPolicy> retry = toRetryPolicy(actionDto.getRetry());
        if (retry.isFailure()) {
            return retry.propagate();
        }
        return Result.ok(AddActionNodeCommand.builder()
                .parentNodeId(containerId.getValue())
                .actionType(type.getValue())
                .name(actionDto.getName())
                .description(actionDto.getDescription())
                .executionMode(mode.getValue())
                .executionOrder(actionDto.getExecutionOrder())
                .priority(actionDto.getPriority())
                .estimatedDurationMs(actionDto.getEstimatedDurationMs())
                .timeoutMs(actionDto.getTimeoutMs())
                .retryPolicy(retry.getValue())
                .condition(actionDto.getCondition())
                .required(actionDto.isRequired())
                .actionSpecificData(actionDto.getData())
                .build());
    }

    /**
     * 未配置重试时返回 null，由 {@link ActionDefaults} 决定默认策略
     */
    private Result<RetryPolicy> toRetryPolicy(RetryYamlDto retry) {
        if (retry == null) {
            return Result.ok(null);
        }
        BackoffStrategy backoff = BackoffStrategy.CONSTANT;
        if (retry.getBackoff() != null) {
            Result<BackoffStrategy> parsed = BackoffStrategy.fromValue(retry.getBackoff());
            if (parsed.isFailure()) {
                return parsed.propagate();
            }
            backoff = parsed.getValue();
        }
        FailureEscalation escalation = FailureEscalation.FAILED;
        if (retry.getEscalation() != null) {
            Result<FailureEscalation> parsed = FailureEscalation.fromValue(retry.getEscalation());
            if (parsed.isFailure()) {
                return parsed.propagate();
            }
            escalation = parsed.getValue();
        }
        return RetryPolicy.create(retry.getMaxRetries(), backoff,
                retry.getInitialDelayMs() == null ? DEFAULT_INITIAL_DELAY_MS : retry.getInitialDelayMs(),
                retry.getMaxDelayMs() == null ? DEFAULT_MAX_DELAY_MS : retry.getMaxDelayMs(),
                escalation);
    }

    private Result<Void> createEdge(FunctionModel model, EdgeYamlDto edgeDto, Map<String, NodeId> localIds) {
        NodeId source = localIds.get(edgeDto.getSource());
        if (source == null) {
            return Result.notFound("Unknown edge source: " + edgeDto.getSource());
        }
        NodeId target = localIds.get(edgeDto.getTarget());
        if (target == null) {
            return Result.notFound("Unknown edge target: " + edgeDto.getTarget());
        }
        Result<LinkType> linkType = LinkType.fromValue(edgeDto.getType() == null ? "dependency" : edgeDto.getType());
        if (linkType.isFailure()) {
            return linkType.propagate();
        }
        return model.createEdge(CreateEdgeCommand.builder()
                        .sourceNodeId(source.getValue())
                        .targetNodeId(target.getValue())
                        .linkType(linkType.getValue())
                        .linkStrength(edgeDto.getStrength())
                        .bidirectional(edgeDto.isBidirectional())
                        .build())
                .toVoid();
    }

    private Result<ExecutionMode> parseMode(String value) {
        return value == null ? Result.ok(null) : ExecutionMode.fromValue(value);
    }

    private static String localKey(String id, String name) {
        return id != null ? id : name;
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? Collections.emptyList() : values;
    }
}
