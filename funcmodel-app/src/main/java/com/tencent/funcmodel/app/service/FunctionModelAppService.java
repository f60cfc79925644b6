package com.tencent.funcmodel.app.service;

import com.tencent.funcmodel.app.assembler.FunctionModelAssembler;
import com.tencent.funcmodel.app.parser.FunctionModelYamlParser;
import com.tencent.funcmodel.client.dto.MultiResponse;
import com.tencent.funcmodel.client.dto.Response;
import com.tencent.funcmodel.client.dto.SingleResponse;
import com.tencent.funcmodel.client.dto.data.ExecutionSummaryDTO;
import com.tencent.funcmodel.client.dto.data.FunctionModelDTO;
import com.tencent.funcmodel.client.dto.data.LinkDTO;
import com.tencent.funcmodel.client.dto.data.NodeDTO;
import com.tencent.funcmodel.client.dto.data.ValidationReportDTO;
import com.tencent.funcmodel.domain.execution.ExecutionEngine;
import com.tencent.funcmodel.domain.execution.ExecutionOutcome;
import com.tencent.funcmodel.domain.execution.ExecutionPlan;
import com.tencent.funcmodel.domain.execution.ExecutionRequest;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.model.command.AddActionNodeCommand;
import com.tencent.funcmodel.domain.model.command.AddNodeCommand;
import com.tencent.funcmodel.domain.model.command.CreateEdgeCommand;
import com.tencent.funcmodel.domain.model.command.CreateModelCommand;
import com.tencent.funcmodel.domain.model.repository.FunctionModelRepository;
import com.tencent.funcmodel.domain.node.ActionStatus;
import com.tencent.funcmodel.domain.shared.ErrorType;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static com.tencent.funcmodel.app.assembler.ResponseAssembler.toResponse;
import static com.tencent.funcmodel.app.assembler.ResponseAssembler.toSingle;

/**
 * FunctionModelAppService - 功能模型应用服务
 * <p>
 * 校验命令、加载聚合、调用领域操作、保存，并把 {@link Result} 转换为 client 响应。
 * 执行中的计划按 planId 保存在内存中。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunctionModelAppService {

    private final FunctionModelRepository repository;
    private final FunctionModelYamlParser parser;
    private final ExecutionEngine executionEngine;
    private final CommandValidator commandValidator;
    private final ActionDefaults actionDefaults;
    private final Clock clock;
    private final IdGenerator idGenerator;

    private final Map<String, ExecutionPlan> plans = new ConcurrentHashMap<>();

    // ---------------------------------------------------------------- models

    public SingleResponse<FunctionModelDTO> createModel(CreateModelCommand command) {
        Result<FunctionModel> created = commandValidator.validate(command)
                .flatMap(valid -> FunctionModel.create(valid, clock, idGenerator))
                .flatMap(this::saveNew);
        return toSingle(created, FunctionModelAssembler::toDTO);
    }

    public SingleResponse<FunctionModelDTO> importModel(String yamlContent) {
        Result<FunctionModel> parsed;
        try {
            parsed = parser.parse(yamlContent);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected function model YAML: {}", e.getMessage());
            return SingleResponse.buildFailureWith(ErrorType.VALIDATION.getCode(), e.getMessage());
        }
        return toSingle(parsed.flatMap(this::saveNew), FunctionModelAssembler::toDTO);
    }

    public SingleResponse<FunctionModelDTO> getModel(String modelId) {
        return toSingle(load(modelId), FunctionModelAssembler::toDTO);
    }

    public MultiResponse<FunctionModelDTO> listModels() {
        List<FunctionModelDTO> models = new ArrayList<>();
        for (FunctionModel model : repository.findAll()) {
            models.add(FunctionModelAssembler.toDTO(model));
        }
        return MultiResponse.of(models);
    }

    public Response publishModel(String modelId) {
        return toResponse(mutate(modelId, FunctionModel::publish));
    }

    public Response archiveModel(String modelId) {
        return toResponse(mutate(modelId, FunctionModel::archive));
    }

    public Response deleteModel(String modelId, String deletedBy) {
        return toResponse(mutate(modelId, model -> model.softDelete(deletedBy)));
    }

    public Response restoreModel(String modelId) {
        return toResponse(mutate(modelId, FunctionModel::restore));
    }

    /**
     * 从已发布模型派生新的 draft 版本，新版本取代仓储中的旧版本
     */
    public SingleResponse<FunctionModelDTO> createVersion(String modelId, String newVersion) {
        Result<FunctionModel> next = load(modelId)
                .flatMap(model -> model.createVersion(newVersion))
                .onSuccess(repository::save);
        return toSingle(next, FunctionModelAssembler::toDTO);
    }

    public SingleResponse<ValidationReportDTO> validateWorkflow(String modelId) {
        return toSingle(load(modelId).map(FunctionModel::validateWorkflow), FunctionModelAssembler::toDTO);
    }

    // ---------------------------------------------------------------- nodes and edges

    public SingleResponse<NodeDTO> addNode(String modelId, AddNodeCommand command) {
        Result<AddNodeCommand> valid = commandValidator.validate(command);
        if (valid.isFailure()) {
            return toSingle(valid, c -> null);
        }
        return toSingle(mutate(modelId, model -> model.addNode(valid.getValue())), FunctionModelAssembler::toDTO);
    }

    public SingleResponse<NodeDTO> addActionNode(String modelId, AddActionNodeCommand command) {
        Result<AddActionNodeCommand> prepared = commandValidator.validate(command).flatMap(actionDefaults::apply);
        if (prepared.isFailure()) {
            return toSingle(prepared, c -> null);
        }
        return toSingle(mutate(modelId, model -> model.addActionNode(prepared.getValue())),
                FunctionModelAssembler::toDTO);
    }

    public Response removeNode(String modelId, String nodeId) {
        return toResponse(NodeId.create(nodeId)
                .flatMap(id -> mutate(modelId, model -> model.removeNode(id))));
    }

    public Response updateActionStatus(String modelId, String nodeId, String status) {
        Result<ActionStatus> target = ActionStatus.fromValue(status);
        if (target.isFailure()) {
            return toResponse(target);
        }
        return toResponse(NodeId.create(nodeId)
                .flatMap(id -> mutate(modelId, model -> model.updateActionStatus(id, target.getValue()))));
    }

    public SingleResponse<LinkDTO> createEdge(String modelId, CreateEdgeCommand command) {
        Result<CreateEdgeCommand> valid = commandValidator.validate(command);
        if (valid.isFailure()) {
            return toSingle(valid, c -> null);
        }
        return toSingle(mutate(modelId, model -> model.createEdge(valid.getValue())), FunctionModelAssembler::toDTO);
    }

    public Response removeEdge(String modelId, String linkId) {
        return toResponse(mutate(modelId, model -> model.removeEdge(linkId)));
    }

    // ---------------------------------------------------------------- execution

    public SingleResponse<ExecutionSummaryDTO> dryRun(String modelId, ExecutionRequest request) {
        return toSingle(load(modelId).flatMap(model -> executionEngine.dryRun(model, request)),
                FunctionModelAssembler::toDTO);
    }

    public SingleResponse<ExecutionSummaryDTO> startExecution(String modelId, ExecutionRequest request) {
        Result<ExecutionPlan> planned = load(modelId)
                .flatMap(model -> executionEngine.planExecution(model, request))
                .onSuccess(plan -> plans.put(plan.getPlanId(), plan));
        return toSingle(planned, this::summarize);
    }

    public SingleResponse<ExecutionSummaryDTO> advanceExecution(String planId, String nodeId, String outcome) {
        Result<ExecutionOutcome> parsedOutcome = ExecutionOutcome.fromValue(outcome);
        if (parsedOutcome.isFailure()) {
            return toSingle(parsedOutcome, o -> null);
        }
        Result<ExecutionPlan> advanced = findPlan(planId)
                .flatMap(plan -> NodeId.create(nodeId)
                        .flatMap(id -> executionEngine.advance(plan, id, parsedOutcome.getValue())));
        return toSingle(advanced, this::summarize);
    }

    public SingleResponse<ExecutionSummaryDTO> stopExecution(String planId, String reason) {
        Result<ExecutionPlan> stopped = findPlan(planId)
                .flatMap(plan -> executionEngine.stopExecution(plan, reason));
        return toSingle(stopped, this::summarize);
    }

    public SingleResponse<ExecutionSummaryDTO> getExecution(String planId) {
        return toSingle(findPlan(planId), this::summarize);
    }

    /**
     * 释放已结束的执行计划；运行中的计划需先停止
     */
    public Response releaseExecution(String planId) {
        Result<Void> released = findPlan(planId).<Void>flatMap(plan -> {
            if (!plan.getStatus().isTerminal()) {
                return Result.conflict("Execution plan " + planId + " is still " + plan.getStatus().getValue());
            }
            plans.remove(planId);
            log.info("Released execution plan [{}] of model [{}]", planId, plan.getModelId());
            return Result.ok();
        });
        return toResponse(released);
    }

    // ---------------------------------------------------------------- helpers

    private Result<FunctionModel> load(String modelId) {
        Optional<FunctionModel> model = modelId == null ? Optional.empty() : repository.findById(modelId);
        if (!model.isPresent()) {
            return Result.notFound("Function model not found: " + modelId);
        }
        return Result.ok(model.get());
    }

    private Result<FunctionModel> saveNew(FunctionModel model) {
        if (repository.exists(model.getModelId())) {
            return Result.conflict("Function model already exists: " + model.getModelId());
        }
        repository.save(model);
        return Result.ok(model);
    }

    /**
     * 加载模型并执行修改，成功后保存
     */
    private <T> Result<T> mutate(String modelId, Function<FunctionModel, Result<T>> operation) {
        Result<FunctionModel> loaded = load(modelId);
        if (loaded.isFailure()) {
            return loaded.propagate();
        }
        FunctionModel model = loaded.getValue();
        Result<T> result = operation.apply(model);
        if (result.isSuccess()) {
            repository.save(model);
        } else {
            log.debug("Operation on model [{}] rejected: {}", modelId, result.getError());
        }
        return result;
    }

    private Result<ExecutionPlan> findPlan(String planId) {
        ExecutionPlan plan = planId == null ? null : plans.get(planId);
        if (plan == null) {
            return Result.notFound("Execution plan not found: " + planId);
        }
        return Result.ok(plan);
    }

    private ExecutionSummaryDTO summarize(ExecutionPlan plan) {
        return FunctionModelAssembler.toDTO(executionEngine.summarize(plan));
    }
}
