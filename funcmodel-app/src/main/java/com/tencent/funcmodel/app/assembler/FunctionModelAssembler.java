package com.tencent.funcmodel.app.assembler;

import com.tencent.funcmodel.client.dto.data.ExecutionSummaryDTO;
import com.tencent.funcmodel.client.dto.data.FunctionModelDTO;
import com.tencent.funcmodel.client.dto.data.LinkDTO;
import com.tencent.funcmodel.client.dto.data.NodeDTO;
import com.tencent.funcmodel.client.dto.data.ValidationReportDTO;
import com.tencent.funcmodel.domain.execution.ExecutionSummary;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.model.NodeLink;
import com.tencent.funcmodel.domain.model.WorkflowValidation;
import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.node.Node;
import com.tencent.funcmodel.domain.valueobject.NodeId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 领域对象 -> client DTO
 */
public final class FunctionModelAssembler {

    private FunctionModelAssembler() {
    }

    public static FunctionModelDTO toDTO(FunctionModel model) {
        List<NodeDTO> nodes = new ArrayList<>();
        for (Node node : model.getNodes().values()) {
            nodes.add(toDTO(node));
        }
        for (ActionNode action : model.getActionNodes().values()) {
            nodes.add(toDTO(action));
        }
        return FunctionModelDTO.builder()
                .modelId(model.getModelId())
                .name(model.getName().getValue())
                .description(model.getDescription())
                .version(model.getVersion().toString())
                .currentVersion(model.getCurrentVersion().toString())
                .versionCount(model.getVersionCount())
                .status(model.getStatus().getValue())
                .owner(model.getPermissions().getOwner())
                .editors(new ArrayList<>(model.getPermissions().getEditors()))
                .viewers(new ArrayList<>(model.getPermissions().getViewers()))
                .deleted(model.isDeleted())
                .nodes(nodes)
                .links(model.getLinks().stream().map(FunctionModelAssembler::toDTO).collect(Collectors.toList()))
                .metadata(new LinkedHashMap<>(model.getMetadata()))
                .createdAt(format(model.getCreatedAt()))
                .updatedAt(format(model.getUpdatedAt()))
                .build();
    }

    public static NodeDTO toDTO(Node node) {
        NodeDTO dto = NodeDTO.builder()
                .nodeId(node.getNodeId().getValue())
                .nodeType(node.getNodeType().getValue())
                .name(node.getName().getValue())
                .description(node.getDescription())
                .x(node.getPosition().getX())
                .y(node.getPosition().getY())
                .status(node.getStatus().getValue())
                .executionType(node.getExecutionType().getValue())
                .timeoutMs(node.getTimeoutMs())
                .dependencies(node.getDependencies().stream().map(NodeId::getValue).collect(Collectors.toList()))
                .metadata(new LinkedHashMap<>(node.getMetadata()))
                .build();
        if (node instanceof ActionNode) {
            ActionNode action = (ActionNode) node;
            dto.setParentNodeId(action.getParentNodeId().getValue());
            dto.setActionStatus(action.getActionStatus().getValue());
            dto.setExecutionOrder(action.getExecutionOrder());
            dto.setPriority(action.getPriority());
            dto.setCondition(action.getCondition());
            dto.setRequired(action.isRequired());
        }
        return dto;
    }

    public static LinkDTO toDTO(NodeLink link) {
        return LinkDTO.builder()
                .linkId(link.getLinkId())
                .sourceNodeId(link.getSourceNodeId().getValue())
                .targetNodeId(link.getTargetNodeId().getValue())
                .linkType(link.getLinkType().getValue())
                .linkStrength(link.getLinkStrength().getValue())
                .bidirectional(link.isBidirectional())
                .build();
    }

    public static ValidationReportDTO toDTO(WorkflowValidation validation) {
        return ValidationReportDTO.builder()
                .valid(validation.isValid())
                .errors(new ArrayList<>(validation.getErrors()))
                .warnings(new ArrayList<>(validation.getWarnings()))
                .build();
    }

    public static ExecutionSummaryDTO toDTO(ExecutionSummary summary) {
        return ExecutionSummaryDTO.builder()
                .planId(summary.getPlanId())
                .modelId(summary.getModelId())
                .planStatus(summary.getPlanStatus().getValue())
                .dryRun(summary.isDryRun())
                .totalActions(summary.getTotalActions())
                .completed(summary.getCompleted())
                .failed(summary.getFailed())
                .errored(summary.getErrored())
                .skipped(summary.getSkipped())
                .cancelled(summary.getCancelled())
                .pending(summary.getPending())
                .estimatedDurationMs(summary.getEstimatedDurationMs())
                .executionOrder(new ArrayList<>(summary.getExecutionOrder()))
                .actionStatuses(new LinkedHashMap<>(summary.getActionStatuses()))
                .build();
    }

    private static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
