package com.tencent.funcmodel.app.service;

import com.tencent.funcmodel.app.assembler.ContextAssembler;
import com.tencent.funcmodel.client.dto.Response;
import com.tencent.funcmodel.client.dto.SingleResponse;
import com.tencent.funcmodel.client.dto.data.AccessCheckDTO;
import com.tencent.funcmodel.client.dto.data.ContextDTO;
import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.context.ContextAccessLevel;
import com.tencent.funcmodel.domain.context.ContextAccessService;
import com.tencent.funcmodel.domain.context.ContextScope;
import com.tencent.funcmodel.domain.context.MergeOptions;
import com.tencent.funcmodel.domain.context.impl.ContextAccessServiceImpl;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.model.repository.FunctionModelRepository;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static com.tencent.funcmodel.app.assembler.ResponseAssembler.toResponse;
import static com.tencent.funcmodel.app.assembler.ResponseAssembler.toSingle;

/**
 * ModelContextAppService - 模型上下文应用服务
 * <p>
 * 每个打开的模型持有一个独立的 {@link ContextAccessService}，同一模型上的调用串行执行。
 * 节点 ID、作用域和访问级别以字符串传入，在这里转换为领域类型。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelContextAppService {

    private final FunctionModelRepository repository;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final FunctionModelProperties properties;

    private final Map<String, ContextAccessService> services = new ConcurrentHashMap<>();

    /**
     * 为模型创建上下文服务并登记全部节点；已打开的模型返回 CONFLICT
     */
    public Response openContext(String modelId) {
        FunctionModel model = modelId == null ? null : repository.findById(modelId).orElse(null);
        if (model == null) {
            return toResponse(Result.notFound("Function model not found: " + modelId));
        }
        ContextAccessService service = new ContextAccessServiceImpl(idGenerator, clock, properties);
        Result<Void> registered = service.registerModel(model);
        if (registered.isFailure()) {
            return toResponse(registered);
        }
        if (services.putIfAbsent(modelId, service) != null) {
            return toResponse(Result.conflict("Context already open for model: " + modelId));
        }
        log.info("Opened context for model [{}] with {} nodes", modelId,
                model.getNodes().size() + model.getActionNodes().size());
        return Response.buildSuccess();
    }

    public Response closeContext(String modelId) {
        if (modelId == null || services.remove(modelId) == null) {
            return toResponse(Result.notFound("No open context for model: " + modelId));
        }
        log.info("Closed context for model [{}]", modelId);
        return Response.buildSuccess();
    }

    public SingleResponse<ContextDTO> buildContext(String modelId, String nodeId, Map<String, Object> data,
                                                   String scope, String parentContextId) {
        Result<ContextScope> parsedScope = ContextScope.fromValue(scope);
        if (parsedScope.isFailure()) {
            return toSingle(parsedScope, s -> null);
        }
        Map<String, Object> contextData = data == null ? Collections.<String, Object>emptyMap() : data;
        Result<ContextDTO> built = onNode(modelId, nodeId, (service, id) -> service
                .buildContext(id, contextData, parsedScope.getValue(), parentContextId)
                .map(ContextAssembler::toDTO));
        return toSingle(built, Function.identity());
    }

    public SingleResponse<ContextDTO> getNodeContext(String modelId, String nodeId) {
        Result<ContextDTO> context = onNode(modelId, nodeId, (service, id) -> service.getNodeContext(id)
                .map(ContextAssembler::toDTO));
        return toSingle(context, Function.identity());
    }

    public SingleResponse<ContextDTO> getHierarchicalContext(String modelId, String nodeId) {
        Result<ContextDTO> context = onNode(modelId, nodeId, (service, id) -> service.getHierarchicalContext(id)
                .map(ContextAssembler::toDTO));
        return toSingle(context, Function.identity());
    }

    public Response updateNodeContext(String modelId, String updatingNodeId, String targetNodeId,
                                      Map<String, Object> data) {
        Result<NodeId> updating = NodeId.create(updatingNodeId);
        if (updating.isFailure()) {
            return toResponse(updating);
        }
        Result<Void> updated = onNode(modelId, targetNodeId,
                (service, target) -> service.updateNodeContext(updating.getValue(), target, data));
        return toResponse(updated);
    }

    public SingleResponse<AccessCheckDTO> validateAccess(String modelId, String contextNodeId, String requestingNodeId,
                                                         String accessLevel, List<String> properties) {
        Result<ContextAccessLevel> level = ContextAccessLevel.fromValue(accessLevel);
        Result<NodeId> requesting = NodeId.create(requestingNodeId);
        Result<Void> arguments = Result.combine(level, requesting);
        if (arguments.isFailure()) {
            return toSingle(arguments, v -> null);
        }
        List<String> requested = properties == null ? new ArrayList<>() : properties;
        Result<AccessCheckDTO> checked = onNode(modelId, contextNodeId, (service, contextNode) -> service
                .validateContextAccess(contextNode, requesting.getValue(), level.getValue(), requested)
                .map(ContextAssembler::toDTO));
        return toSingle(checked, Function.identity());
    }

    public SingleResponse<String> mergeContexts(String modelId, List<String> sourceContextIds, String targetNodeId,
                                                String scope) {
        Result<ContextScope> parsedScope = ContextScope.fromValue(scope);
        if (parsedScope.isFailure()) {
            return toSingle(parsedScope, s -> null);
        }
        Result<String> merged = onNode(modelId, targetNodeId, (service, target) -> service
                .mergeContextScopes(sourceContextIds, target, parsedScope.getValue(), MergeOptions.defaults()));
        return toSingle(merged, Function.identity());
    }

    public Response clearNodeContext(String modelId, String nodeId) {
        Result<Void> cleared = onNode(modelId, nodeId, ContextAccessService::clearNodeContext);
        return toResponse(cleared);
    }

    private <T> Result<T> onNode(String modelId, String nodeId, NodeOperation<T> operation) {
        ContextAccessService service = modelId == null ? null : services.get(modelId);
        if (service == null) {
            return Result.notFound("No open context for model: " + modelId);
        }
        Result<NodeId> id = NodeId.create(nodeId);
        if (id.isFailure()) {
            return id.propagate();
        }
        synchronized (service) {
            return operation.apply(service, id.getValue());
        }
    }

    @FunctionalInterface
    private interface NodeOperation<T> {
        Result<T> apply(ContextAccessService service, NodeId nodeId);
    }
}
