package com.tencent.funcmodel.domain.model;

import com.tencent.funcmodel.domain.model.command.AddActionNodeCommand;
import com.tencent.funcmodel.domain.model.command.AddNodeCommand;
import com.tencent.funcmodel.domain.model.command.CreateEdgeCommand;
import com.tencent.funcmodel.domain.model.command.CreateModelCommand;
import com.tencent.funcmodel.domain.node.ActionAttributes;
import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.node.ActionStatus;
import com.tencent.funcmodel.domain.node.BoundaryType;
import com.tencent.funcmodel.domain.node.FunctionModelContainerNode;
import com.tencent.funcmodel.domain.node.IOData;
import com.tencent.funcmodel.domain.node.IONode;
import com.tencent.funcmodel.domain.node.KBNode;
import com.tencent.funcmodel.domain.node.Node;
import com.tencent.funcmodel.domain.node.NodeAttributes;
import com.tencent.funcmodel.domain.node.NodeType;
import com.tencent.funcmodel.domain.node.StageData;
import com.tencent.funcmodel.domain.node.StageNode;
import com.tencent.funcmodel.domain.node.TetherNode;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.LinkStrength;
import com.tencent.funcmodel.domain.valueobject.ModelName;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.Position;
import com.tencent.funcmodel.domain.valueobject.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * FunctionModel - 功能模型（聚合根）
 * <p>
 * 独占其容器节点、动作节点和连线，所有修改都通过本类完成并返回 {@link Result}。
 * 可变性约束:
 * <ul>
 *     <li>draft: 允许所有修改</li>
 *     <li>published: 只允许修改元数据和权限</li>
 *     <li>archived: 不允许任何修改（终态）</li>
 *     <li>已软删除: 只允许 restore</li>
 * </ul>
 * 状态不允许时返回 CONFLICT。
 * </p>
 *
 * @author funcmodel
 */
@Slf4j
@Getter
public class FunctionModel {

    public static final int MAX_DESCRIPTION_LENGTH = 5000;

    public static final int DEFAULT_ACTION_PRIORITY = 5;

    private final String modelId;

    private ModelName name;

    private String description;

    private Version version;

    private Version currentVersion;

    private int versionCount;

    private ModelStatus status;

    /**
     * 容器节点
     */
    private final Map<NodeId, Node> nodes = new LinkedHashMap<>();

    private final Map<NodeId, ActionNode> actionNodes = new LinkedHashMap<>();

    private final Map<String, NodeLink> links = new LinkedHashMap<>();

    private ModelPermissions permissions;

    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private final Instant createdAt;

    private Instant updatedAt;

    private Instant lastSavedAt;

    private Instant deletedAt;

    private String deletedBy;

    @Getter(AccessLevel.NONE)
    private long nodeSequence;

    @Getter(AccessLevel.NONE)
    private final Clock clock;

    @Getter(AccessLevel.NONE)
    private final IdGenerator idGenerator;

    private FunctionModel(String modelId, ModelName name, String description, Version version,
                          ModelPermissions permissions, Clock clock, IdGenerator idGenerator) {
        this.modelId = modelId;
        this.name = name;
        this.description = description;
        this.version = version;
        this.currentVersion = version;
        this.versionCount = 1;
        this.status = ModelStatus.DRAFT;
        this.permissions = permissions;
        this.clock = clock;
        this.idGenerator = idGenerator;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
        this.lastSavedAt = createdAt;
    }

    /**
     * 派生新版本：复制全部节点与连线，回到 draft 状态
     */
    private FunctionModel(FunctionModel source, Version newVersion) {
        this(source.modelId, source.name, source.description, newVersion, source.permissions,
                source.clock, source.idGenerator);
        this.versionCount = source.versionCount + 1;
        this.nodeSequence = source.nodeSequence;
        this.metadata.putAll(source.metadata);
        for (Node node : source.nodes.values()) {
            nodes.put(node.getNodeId(), node.copy());
        }
        for (ActionNode action : source.actionNodes.values()) {
            actionNodes.put(action.getNodeId(), action.copy());
        }
        links.putAll(source.links);
    }

    /**
     * 创建新的功能模型（draft 状态）
     */
    public static Result<FunctionModel> create(CreateModelCommand command, Clock clock, IdGenerator idGenerator) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(idGenerator, "idGenerator");
        if (command == null) {
            return Result.fail("Create model command cannot be null");
        }
        Result<ModelName> name = ModelName.create(command.getName());
        if (name.isFailure()) {
            return name.propagate();
        }
        Result<Void> description = validateDescription(command.getDescription());
        if (description.isFailure()) {
            return description.propagate();
        }
        Result<Version> version = command.getVersion() == null
                ? Result.ok(Version.initial())
                : Version.create(command.getVersion());
        if (version.isFailure()) {
            return version.propagate();
        }
        Result<ModelPermissions> permissions =
                ModelPermissions.create(command.getOwner(), command.getEditors(), command.getViewers());
        if (permissions.isFailure()) {
            return permissions.propagate();
        }

        String modelId;
        if (command.getModelId() != null) {
            Result<NodeId> parsed = NodeId.create(command.getModelId());
            if (parsed.isFailure()) {
                return Result.fail("Invalid model id format, expected UUID v4: " + command.getModelId());
            }
            modelId = parsed.getValue().getValue();
        } else {
            modelId = NodeId.generate(idGenerator).getValue();
        }

        FunctionModel model = new FunctionModel(modelId, name.getValue(), command.getDescription(),
                version.getValue(), permissions.getValue(), clock, idGenerator);
        if (command.getMetadata() != null) {
            model.metadata.putAll(command.getMetadata());
        }
        log.info("Created function model [{}] '{}'", modelId, model.name);
        return Result.ok(model);
    }

    // ---------------------------------------------------------------- queries

    /**
     * 节点只能经由聚合修改，查询方法返回的都是副本
     */
    public Map<NodeId, Node> getNodes() {
        Map<NodeId, Node> copies = new LinkedHashMap<>();
        for (Node node : nodes.values()) {
            copies.put(node.getNodeId(), node.copy());
        }
        return Collections.unmodifiableMap(copies);
    }

    public Map<NodeId, ActionNode> getActionNodes() {
        Map<NodeId, ActionNode> copies = new LinkedHashMap<>();
        for (ActionNode action : actionNodes.values()) {
            copies.put(action.getNodeId(), action.copy());
        }
        return Collections.unmodifiableMap(copies);
    }

    public Collection<NodeLink> getLinks() {
        return Collections.unmodifiableCollection(links.values());
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * 在容器与动作节点中查找
     */
    public Optional<Node> findNode(NodeId nodeId) {
        return lookup(nodeId).map(Node::copy);
    }

    private Optional<Node> lookup(NodeId nodeId) {
        Node node = nodes.get(nodeId);
        if (node != null) {
            return Optional.of(node);
        }
        return Optional.ofNullable(actionNodes.get(nodeId));
    }

    public Optional<NodeLink> findLink(String linkId) {
        return Optional.ofNullable(links.get(linkId));
    }

    public List<Node> getContainerNodes() {
        return nodes.values().stream().map(Node::copy).collect(Collectors.toList());
    }

    /**
     * 某容器拥有的动作，按注册顺序
     */
    public List<ActionNode> getActionsOf(NodeId parentNodeId) {
        return ownedActions(parentNodeId).stream().map(ActionNode::copy).collect(Collectors.toList());
    }

    private List<ActionNode> ownedActions(NodeId parentNodeId) {
        return actionNodes.values().stream()
                .filter(action -> action.getParentNodeId().equals(parentNodeId))
                .collect(Collectors.toList());
    }

    /**
     * 容器 -> 上游容器依赖
     */
    public Map<NodeId, Set<NodeId>> getContainerDependencies() {
        Map<NodeId, Set<NodeId>> dependencies = new LinkedHashMap<>();
        for (Node node : nodes.values()) {
            dependencies.put(node.getNodeId(), new LinkedHashSet<>(node.getDependencies()));
        }
        return dependencies;
    }

    // ---------------------------------------------------------------- nodes

    /**
     * 按节点类型分发创建；动作类型委托给 {@link #addActionNode(AddActionNodeCommand)}
     */
    public Result<Node> addNode(AddNodeCommand command) {
        Result<Void> mutable = ensureDraft("add nodes to");
        if (mutable.isFailure()) {
            return mutable.propagate();
        }
        if (command == null || command.getNodeType() == null) {
            return Result.fail("Node type is required");
        }
        if (command.getNodeType().isAction()) {
            return addActionNode(toActionCommand(command)).map(action -> action);
        }

        Result<NodeAttributes> attributes = buildAttributes(command.getName(), command.getDescription(),
                command.getX(), command.getY(), command.getTimeoutMs(), command.getMetadata());
        if (attributes.isFailure()) {
            return attributes.propagate();
        }
        NodeAttributes attrs = attributes.getValue();
        attrs.setExecutionType(command.getExecutionType());
        attrs.setVisualProperties(command.getVisualProperties());

        Result<Node> created;
        switch (command.getNodeType()) {
            case IO:
                created = IONode.create(attrs, command.getIoData()).map(node -> node);
                break;
            case STAGE:
                created = StageNode.create(attrs, command.getStageData(), command.isParallelExecution(),
                        command.getConfiguration()).map(node -> node);
                break;
            default:
                return Result.fail("Unsupported node type: " + command.getNodeType().getValue());
        }
        return created.onSuccess(this::registerContainer).map(Node::copy);
    }

    public Result<Node> addIONode(String nodeName, BoundaryType boundaryType, Position position) {
        return addNode(AddNodeCommand.builder()
                .nodeType(NodeType.IO)
                .name(nodeName)
                .x(position == null ? null : position.getX())
                .y(position == null ? null : position.getY())
                .ioData(IOData.builder().boundaryType(boundaryType).build())
                .build());
    }

    public Result<Node> addStageNode(String nodeName, boolean parallelExecution, Position position) {
        return addNode(AddNodeCommand.builder()
                .nodeType(NodeType.STAGE)
                .name(nodeName)
                .x(position == null ? null : position.getX())
                .y(position == null ? null : position.getY())
                .stageData(StageData.builder().stageType("process").build())
                .parallelExecution(parallelExecution)
                .build());
    }

    /**
     * 向容器添加动作节点；父节点必须存在且为容器
     */
    public Result<ActionNode> addActionNode(AddActionNodeCommand command) {
        Result<Void> mutable = ensureDraft("add action nodes to");
        if (mutable.isFailure()) {
            return mutable.propagate();
        }
        if (command == null || command.getActionType() == null || !command.getActionType().isAction()) {
            return Result.fail("Action type must be one of tetherNode, kbNode, functionModelContainer");
        }
        Result<NodeId> parentId = NodeId.create(command.getParentNodeId());
        if (parentId.isFailure()) {
            return parentId.propagate();
        }
        Node parent = nodes.get(parentId.getValue());
        if (parent == null) {
            if (actionNodes.containsKey(parentId.getValue())) {
                return Result.fail("Parent node " + parentId.getValue() + " is not a container node");
            }
            return Result.notFound("Parent node not found: " + parentId.getValue());
        }

        int priority = command.getPriority() == null ? DEFAULT_ACTION_PRIORITY : command.getPriority();
        if (priority < ActionNode.MIN_PRIORITY || priority > ActionNode.MAX_PRIORITY) {
            return Result.fail("Priority must be between " + ActionNode.MIN_PRIORITY + " and " + ActionNode.MAX_PRIORITY);
        }
        int executionOrder = command.getExecutionOrder() == null
                ? nextExecutionOrder(parent.getNodeId())
                : command.getExecutionOrder();
        if (executionOrder < 1) {
            return Result.fail("Execution order must be greater than 0");
        }
        if (command.getEstimatedDurationMs() != null && command.getEstimatedDurationMs() < 0) {
            return Result.fail("Estimated duration cannot be negative");
        }

        Result<NodeAttributes> attributes = buildAttributes(command.getName(), command.getDescription(),
                command.getX(), command.getY(), command.getTimeoutMs(), command.getMetadata());
        if (attributes.isFailure()) {
            return attributes.propagate();
        }
        NodeAttributes attrs = attributes.getValue();
        attrs.setExecutionType(command.getExecutionMode());
        attrs.setVisualProperties(command.getVisualProperties());

        ActionAttributes action = ActionAttributes.builder()
                .parentNodeId(parent.getNodeId())
                .executionOrder(executionOrder)
                .priority(priority)
                .estimatedDurationMs(command.getEstimatedDurationMs())
                .retryPolicy(command.getRetryPolicy())
                .raci(command.getRaci())
                .actionSpecificData(command.getActionSpecificData())
                .condition(command.getCondition())
                .required(command.isRequired())
                .actionStatus(ActionStatus.DRAFT)
                .build();

        Result<ActionNode> created;
        switch (command.getActionType()) {
            case TETHER:
                created = TetherNode.create(attrs, action).map(node -> node);
                break;
            case KB:
                created = KBNode.create(attrs, action).map(node -> node);
                break;
            case FUNCTION_MODEL_CONTAINER:
                created = FunctionModelContainerNode.create(attrs, action).map(node -> node);
                break;
            default:
                return Result.fail("Unsupported action type: " + command.getActionType().getValue());
        }
        return created.onSuccess(node -> registerAction(node, parent)).map(ActionNode::copy);
    }

    /**
     * 删除节点，级联删除相关连线、依赖引用；容器节点同时删除其拥有的动作
     */
    public Result<Void> removeNode(NodeId nodeId) {
        Result<Void> mutable = ensureDraft("remove nodes from");
        if (mutable.isFailure()) {
            return mutable;
        }
        if (nodeId == null) {
            return Result.fail("Node id cannot be null");
        }
        Instant now = now();
        if (actionNodes.containsKey(nodeId)) {
            detachAction(nodeId, now);
        } else if (nodes.containsKey(nodeId)) {
            for (ActionNode owned : ownedActions(nodeId)) {
                detachAction(owned.getNodeId(), now);
            }
            detachReferences(nodeId, now);
            nodes.remove(nodeId);
        } else {
            return Result.notFound("Node not found: " + nodeId);
        }
        touch(now);
        log.debug("Removed node [{}] from model [{}]", nodeId, modelId);
        return Result.ok();
    }

    public Result<Void> updateActionStatus(NodeId actionId, ActionStatus target) {
        Result<Void> mutable = ensureDraft("change action status in");
        if (mutable.isFailure()) {
            return mutable;
        }
        ActionNode action = actionNodes.get(actionId);
        if (action == null) {
            return Result.notFound("Action node not found: " + actionId);
        }
        Instant now = now();
        return action.transitionTo(target, now).onSuccess(v -> touch(now));
    }

    // ---------------------------------------------------------------- links

    /**
     * 创建连线。容器之间的排序类连线会把源节点加入目标节点的依赖，并拒绝产生循环。
     */
    public Result<NodeLink> createEdge(CreateEdgeCommand command) {
        Result<Void> mutable = ensureDraft("create links in");
        if (mutable.isFailure()) {
            return mutable.propagate();
        }
        if (command == null || command.getLinkType() == null) {
            return Result.fail("Link type is required");
        }
        Result<NodeId> sourceId = NodeId.create(command.getSourceNodeId());
        Result<NodeId> targetId = NodeId.create(command.getTargetNodeId());
        Result<Void> ids = Result.combine(sourceId, targetId);
        if (ids.isFailure()) {
            return ids.propagate();
        }
        NodeId source = sourceId.getValue();
        NodeId target = targetId.getValue();
        if (source.equals(target)) {
            return Result.fail("Cannot link a node to itself");
        }
        Optional<Node> sourceNode = lookup(source);
        if (sourceNode.isEmpty()) {
            return Result.notFound("Source node not found: " + source);
        }
        Optional<Node> targetNode = lookup(target);
        if (targetNode.isEmpty()) {
            return Result.notFound("Target node not found: " + target);
        }
        Result<LinkStrength> strength = command.getLinkStrength() == null
                ? Result.ok(LinkStrength.full())
                : LinkStrength.create(command.getLinkStrength());
        if (strength.isFailure()) {
            return strength.propagate();
        }
        for (NodeLink existing : links.values()) {
            if (existing.connects(source, target, command.getLinkType())) {
                return Result.fail("A " + command.getLinkType().getValue() + " link from " + source
                        + " to " + target + " already exists");
            }
        }

        boolean containerOrdering = command.getLinkType().isOrdering()
                && sourceNode.get().isContainer() && targetNode.get().isContainer();
        if (containerOrdering) {
            if (command.isBidirectional()) {
                return Result.fail("Ordering links between containers cannot be bidirectional");
            }
            Map<NodeId, Set<NodeId>> dependencies = getContainerDependencies();
            dependencies.get(target).add(source);
            if (DependencyGraph.hasCycle(dependencies)) {
                return Result.fail("Link from " + source + " to " + target + " would create a cycle");
            }
        }

        Instant now = now();
        NodeLink link = new NodeLink(idGenerator.nextId(), source, target, command.getLinkType(),
                strength.getValue(), command.isBidirectional(), command.getContext(), command.getMetadata(), now);
        links.put(link.getLinkId(), link);
        if (containerOrdering) {
            targetNode.get().addDependency(source, now);
        }
        touch(now);
        log.debug("Created link {} in model [{}]", link, modelId);
        return Result.ok(link);
    }

    public Result<Void> removeEdge(String linkId) {
        Result<Void> mutable = ensureDraft("remove links from");
        if (mutable.isFailure()) {
            return mutable;
        }
        NodeLink link = linkId == null ? null : links.remove(linkId);
        if (link == null) {
            return Result.notFound("Link not found: " + linkId);
        }
        Instant now = now();
        Node target = nodes.get(link.getTargetNodeId());
        boolean stillOrdered = links.values().stream()
                .anyMatch(other -> other.isOrdering()
                        && other.getSourceNodeId().equals(link.getSourceNodeId())
                        && other.getTargetNodeId().equals(link.getTargetNodeId()));
        if (target != null && link.isOrdering() && !stillOrdered) {
            target.removeDependency(link.getSourceNodeId(), now);
        }
        touch(now);
        return Result.ok();
    }

    // ---------------------------------------------------------------- model properties

    public Result<Void> updateName(String newName) {
        Result<Void> mutable = ensureDraft("rename");
        if (mutable.isFailure()) {
            return mutable;
        }
        return ModelName.create(newName).map(valid -> {
            this.name = valid;
            touch(now());
            return (Void) null;
        });
    }

    public Result<Void> updateDescription(String newDescription) {
        Result<Void> mutable = ensureDraft("update the description of");
        if (mutable.isFailure()) {
            return mutable;
        }
        Result<Void> valid = validateDescription(newDescription);
        if (valid.isFailure()) {
            return valid;
        }
        this.description = newDescription == null ? null : newDescription.trim();
        touch(now());
        return Result.ok();
    }

    /**
     * 替换元数据，draft 与 published 均可
     */
    public Result<Void> updateMetadata(Map<String, Object> newMetadata) {
        Result<Void> mutable = ensureMetadataMutable();
        if (mutable.isFailure()) {
            return mutable;
        }
        metadata.clear();
        if (newMetadata != null) {
            metadata.putAll(newMetadata);
        }
        touch(now());
        return Result.ok();
    }

    public Result<Void> updatePermissions(ModelPermissions newPermissions) {
        Result<Void> mutable = ensureMetadataMutable();
        if (mutable.isFailure()) {
            return mutable;
        }
        if (newPermissions == null) {
            return Result.fail("Permissions cannot be null");
        }
        this.permissions = newPermissions;
        touch(now());
        return Result.ok();
    }

    public void markSaved() {
        this.lastSavedAt = now();
    }

    // ---------------------------------------------------------------- lifecycle

    public Result<Void> publish() {
        if (isDeleted()) {
            return Result.conflict("Cannot publish a deleted model");
        }
        if (!status.canTransitionTo(ModelStatus.PUBLISHED)) {
            return Result.conflict("Cannot publish a model in status " + status.getValue());
        }
        WorkflowValidation validation = validateWorkflow();
        if (!validation.isValid()) {
            return Result.fail("Cannot publish invalid workflow: " + String.join("; ", validation.getErrors()));
        }
        for (String warning : validation.getWarnings()) {
            log.warn("Model [{}] published with warning: {}", modelId, warning);
        }
        this.status = ModelStatus.PUBLISHED;
        Instant now = now();
        touch(now);
        this.lastSavedAt = now;
        log.info("Published function model [{}] version {}", modelId, version);
        return Result.ok();
    }

    public Result<Void> archive() {
        if (isDeleted()) {
            return Result.conflict("Cannot archive a deleted model");
        }
        if (!status.canTransitionTo(ModelStatus.ARCHIVED)) {
            return Result.conflict("Model is already archived");
        }
        this.status = ModelStatus.ARCHIVED;
        touch(now());
        log.info("Archived function model [{}]", modelId);
        return Result.ok();
    }

    public Result<Void> softDelete(String deletedByUser) {
        if (isDeleted()) {
            return Result.conflict("Model is already deleted");
        }
        if (status == ModelStatus.ARCHIVED) {
            return Result.conflict("Cannot soft delete an archived model");
        }
        Instant now = now();
        this.deletedAt = now;
        this.deletedBy = deletedByUser == null ? null : deletedByUser.trim();
        touch(now);
        log.info("Soft deleted function model [{}] by {}", modelId, deletedBy);
        return Result.ok();
    }

    public Result<Void> restore() {
        if (!isDeleted()) {
            return Result.conflict("Model is not deleted and cannot be restored");
        }
        this.deletedAt = null;
        this.deletedBy = null;
        touch(now());
        log.info("Restored function model [{}]", modelId);
        return Result.ok();
    }

    /**
     * 从已发布模型派生一个新的 draft 版本，新版本号必须大于当前版本
     */
    public Result<FunctionModel> createVersion(String newVersion) {
        if (isDeleted()) {
            return Result.conflict("Cannot create a version of a deleted model");
        }
        if (status != ModelStatus.PUBLISHED) {
            return Result.conflict("Can only create a version from a published model");
        }
        Result<Version> parsed = Version.create(newVersion);
        if (parsed.isFailure()) {
            return parsed.propagate();
        }
        if (!parsed.getValue().isGreaterThan(version)) {
            return Result.fail("New version " + parsed.getValue() + " must be greater than current version " + version);
        }
        FunctionModel next = new FunctionModel(this, parsed.getValue());
        log.info("Created version {} of function model [{}]", next.version, modelId);
        return Result.ok(next);
    }

    // ---------------------------------------------------------------- validation & statistics

    /**
     * 结构校验。errors 阻止发布，warnings 仅提示。
     */
    public WorkflowValidation validateWorkflow() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (nodes.isEmpty()) {
            errors.add("Workflow must have at least one container node");
        }
        for (ActionNode action : actionNodes.values()) {
            if (!nodes.containsKey(action.getParentNodeId())) {
                errors.add("Action node \"" + action.getName() + "\" has no parent container");
            }
            if (action instanceof FunctionModelContainerNode
                    && ((FunctionModelContainerNode) action).nestsModel(modelId)) {
                errors.add("Function model cannot contain itself as a nested model");
            }
        }
        if (DependencyGraph.hasCycle(getContainerDependencies())) {
            errors.add("Cycle detected among container dependencies");
        }

        List<IONode> ioNodes = nodes.values().stream()
                .filter(node -> node instanceof IONode)
                .map(node -> (IONode) node)
                .collect(Collectors.toList());
        if (ioNodes.stream().noneMatch(IONode::isInput)) {
            warnings.add("Workflow has no input node");
        }
        if (ioNodes.stream().noneMatch(IONode::isOutput)) {
            warnings.add("Workflow has no output node");
        }

        Map<NodeId, Set<Integer>> ordersByContainer = new LinkedHashMap<>();
        for (ActionNode action : actionNodes.values()) {
            Set<Integer> orders = ordersByContainer.computeIfAbsent(action.getParentNodeId(), k -> new LinkedHashSet<>());
            if (!orders.add(action.getExecutionOrder())) {
                warnings.add("Container " + action.getParentNodeId() + " has duplicate execution order "
                        + action.getExecutionOrder());
            }
        }

        for (Node node : nodes.values()) {
            boolean hasActions = ordersByContainer.containsKey(node.getNodeId());
            if (node instanceof StageNode && !hasActions) {
                warnings.add("Stage node \"" + node.getName() + "\" has no actions");
            }
            boolean connected = links.values().stream().anyMatch(link -> link.touches(node.getNodeId()));
            if (!(node instanceof IONode) && !connected && !hasActions) {
                warnings.add("Node \"" + node.getName() + "\" has no connections");
            }
        }
        return new WorkflowValidation(errors, warnings);
    }

    public ModelStatistics calculateStatistics() {
        Map<String, Integer> nodeTypes = new TreeMap<>();
        for (Node node : nodes.values()) {
            nodeTypes.merge(node.getNodeType().getValue(), 1, Integer::sum);
        }
        Map<String, Integer> actionTypes = new TreeMap<>();
        for (ActionNode action : actionNodes.values()) {
            actionTypes.merge(action.getNodeType().getValue(), 1, Integer::sum);
        }
        return ModelStatistics.builder()
                .totalNodes(nodes.size())
                .totalActions(actionNodes.size())
                .totalLinks(links.size())
                .averageComplexity(nodes.isEmpty() ? 0 : (double) actionNodes.size() / nodes.size())
                .nodeTypeBreakdown(nodeTypes)
                .actionTypeBreakdown(actionTypes)
                .maxDependencyDepth(DependencyGraph.maxDepth(getContainerDependencies()))
                .build();
    }

    // ---------------------------------------------------------------- internals

    private Result<Void> ensureDraft(String operation) {
        if (isDeleted()) {
            return Result.conflict("Cannot " + operation + " a deleted model");
        }
        if (status != ModelStatus.DRAFT) {
            return Result.conflict("Cannot " + operation + " a " + status.getValue() + " model");
        }
        return Result.ok();
    }

    private Result<Void> ensureMetadataMutable() {
        if (isDeleted()) {
            return Result.conflict("Cannot modify a deleted model");
        }
        if (status == ModelStatus.ARCHIVED) {
            return Result.conflict("Cannot modify an archived model");
        }
        return Result.ok();
    }

    private static Result<Void> validateDescription(String value) {
        if (value != null && value.trim().length() > MAX_DESCRIPTION_LENGTH) {
            return Result.fail("Description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return Result.ok();
    }

    private Result<NodeAttributes> buildAttributes(String nodeName, String nodeDescription, Double x, Double y,
                                                   Long timeoutMs, Map<String, Object> nodeMetadata) {
        Result<ModelName> validName = ModelName.create(nodeName);
        if (validName.isFailure()) {
            return validName.propagate();
        }
        Result<Void> validDescription = validateDescription(nodeDescription);
        if (validDescription.isFailure()) {
            return validDescription.propagate();
        }
        Result<Position> position = Position.create(x == null ? 0 : x, y == null ? 0 : y);
        if (position.isFailure()) {
            return position.propagate();
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            return Result.fail("Timeout must be positive");
        }
        return Result.ok(NodeAttributes.builder()
                .nodeId(NodeId.generate(idGenerator))
                .modelId(modelId)
                .name(validName.getValue())
                .description(nodeDescription)
                .position(position.getValue())
                .timeoutMs(timeoutMs)
                .metadata(nodeMetadata)
                .createdAt(now())
                .sequence(++nodeSequence)
                .build());
    }

    private AddActionNodeCommand toActionCommand(AddNodeCommand command) {
        return AddActionNodeCommand.builder()
                .parentNodeId(command.getParentNodeId())
                .actionType(command.getNodeType())
                .name(command.getName())
                .description(command.getDescription())
                .executionMode(command.getExecutionType())
                .priority(command.getPriority())
                .x(command.getX())
                .y(command.getY())
                .timeoutMs(command.getTimeoutMs())
                .metadata(command.getMetadata())
                .visualProperties(command.getVisualProperties())
                .actionSpecificData(command.getActionSpecificData())
                .build();
    }

    private int nextExecutionOrder(NodeId parentNodeId) {
        int max = 0;
        for (ActionNode action : actionNodes.values()) {
            if (action.getParentNodeId().equals(parentNodeId)) {
                max = Math.max(max, action.getExecutionOrder());
            }
        }
        return max + 1;
    }

    private void registerContainer(Node node) {
        nodes.put(node.getNodeId(), node);
        touch(node.getCreatedAt());
        log.debug("Added {} to model [{}]", node, modelId);
    }

    private void registerAction(ActionNode action, Node parent) {
        actionNodes.put(action.getNodeId(), action);
        if (parent instanceof StageNode) {
            ((StageNode) parent).attachAction(action.getNodeId(), action.getCreatedAt());
        }
        touch(action.getCreatedAt());
        log.debug("Added {} under [{}] in model [{}]", action, parent.getNodeId(), modelId);
    }

    private void detachAction(NodeId actionId, Instant now) {
        ActionNode action = actionNodes.remove(actionId);
        if (action == null) {
            return;
        }
        Node parent = nodes.get(action.getParentNodeId());
        if (parent instanceof StageNode) {
            ((StageNode) parent).detachAction(actionId, now);
        }
        detachReferences(actionId, now);
    }

    private void detachReferences(NodeId nodeId, Instant now) {
        links.values().removeIf(link -> link.touches(nodeId));
        for (Node node : nodes.values()) {
            node.removeDependency(nodeId, now);
        }
        for (ActionNode action : actionNodes.values()) {
            action.removeDependency(nodeId, now);
        }
    }

    private Instant now() {
        return clock.instant();
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }
}
