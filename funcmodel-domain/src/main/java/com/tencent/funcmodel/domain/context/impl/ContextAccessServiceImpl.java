package com.tencent.funcmodel.domain.context.impl;

import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.context.CloneOptions;
import com.tencent.funcmodel.domain.context.ConflictResolution;
import com.tencent.funcmodel.domain.context.ContextAccessLevel;
import com.tencent.funcmodel.domain.context.ContextAccessResult;
import com.tencent.funcmodel.domain.context.ContextAccessService;
import com.tencent.funcmodel.domain.context.ContextInheritanceRule;
import com.tencent.funcmodel.domain.context.ContextRelationship;
import com.tencent.funcmodel.domain.context.ContextScope;
import com.tencent.funcmodel.domain.context.ContextValidationResult;
import com.tencent.funcmodel.domain.context.HierarchicalContext;
import com.tencent.funcmodel.domain.context.MergeOptions;
import com.tencent.funcmodel.domain.context.NodeContext;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.node.Node;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * 内存实现，每个模型一个实例
 */
@Slf4j
@RequiredArgsConstructor
public class ContextAccessServiceImpl implements ContextAccessService {

    private static final String CONTEXT_ID_PREFIX = "ctx-";

    private static final String AUTO_REGISTERED_TYPE = "context";

    private final IdGenerator idGenerator;
    private final Clock clock;
    private final FunctionModelProperties properties;

    private final Map<NodeId, NodeContext> nodes = new LinkedHashMap<>();

    private final Map<NodeId, List<NodeId>> children = new HashMap<>();

    /**
     * owner -> 被显式共享的兄弟节点
     */
    private final Map<NodeId, Set<NodeId>> shares = new HashMap<>();

    private final Map<String, ContextEntry> contexts = new LinkedHashMap<>();

    /**
     * 节点 -> 当前生效的上下文 ID（最近创建的一个）
     */
    private final Map<NodeId, String> nodeContexts = new HashMap<>();

    // ---------------------------------------------------------------- registration

    @Override
    public Result<Void> registerNode(NodeId nodeId, String nodeType, NodeId parentNodeId,
                                     Map<String, Object> contextData, int hierarchyLevel) {
        if (nodeId == null) {
            return Result.fail("Node id is required");
        }
        if (hierarchyLevel < 0) {
            return Result.fail("Hierarchy level cannot be negative");
        }
        if (parentNodeId != null) {
            if (parentNodeId.equals(nodeId)) {
                return Result.fail("Node cannot be its own parent");
            }
            if (!nodes.containsKey(parentNodeId)) {
                return Result.notFound("Parent node not registered: " + parentNodeId);
            }
            if (ancestorsOf(parentNodeId).contains(nodeId)) {
                return Result.fail("Circular reference detected in node hierarchy at " + nodeId);
            }
        }

        NodeContext previous = nodes.get(nodeId);
        if (previous != null && previous.getParentNodeId() != null) {
            List<NodeId> siblings = children.get(previous.getParentNodeId());
            if (siblings != null) {
                siblings.remove(nodeId);
            }
        }
        nodes.put(nodeId, NodeContext.builder()
                .nodeId(nodeId)
                .nodeType(nodeType)
                .parentNodeId(parentNodeId)
                .contextData(ContextValues.copyMap(contextData))
                .accessLevel(ContextAccessLevel.READ)
                .hierarchyLevel(hierarchyLevel)
                .build());
        if (parentNodeId != null) {
            children.computeIfAbsent(parentNodeId, k -> new ArrayList<>()).add(nodeId);
        }
        log.debug("Registered node [{}] of type [{}] under [{}] at level {}", nodeId, nodeType, parentNodeId,
                hierarchyLevel);
        return Result.ok();
    }

    @Override
    public Result<Void> registerModel(FunctionModel model) {
        if (model == null) {
            return Result.fail("Model cannot be null");
        }
        List<Node> containers = new ArrayList<>(model.getNodes().values());
        containers.sort(Comparator.comparingLong(Node::getSequence));
        for (Node container : containers) {
            Result<Void> registered = registerNode(container.getNodeId(), container.getNodeType().getValue(), null,
                    containerData(container), 0);
            if (registered.isFailure()) {
                return registered;
            }
        }
        List<ActionNode> actions = new ArrayList<>(model.getActionNodes().values());
        actions.sort(Comparator.comparingLong(Node::getSequence));
        for (ActionNode action : actions) {
            Result<Void> registered = registerNode(action.getNodeId(), action.getNodeType().getValue(),
                    action.getParentNodeId(), actionData(action), 1);
            if (registered.isFailure()) {
                return registered;
            }
        }
        log.info("Registered model [{}] in context tree: {} containers, {} actions", model.getModelId(),
                containers.size(), actions.size());
        return Result.ok();
    }

    @Override
    public Result<Void> shareContext(NodeId ownerNodeId, NodeId siblingNodeId) {
        if (ownerNodeId == null || siblingNodeId == null) {
            return Result.fail("Owner and sibling node ids are required");
        }
        if (!nodes.containsKey(ownerNodeId)) {
            return Result.notFound("Node not registered: " + ownerNodeId);
        }
        if (!nodes.containsKey(siblingNodeId)) {
            return Result.notFound("Node not registered: " + siblingNodeId);
        }
        if (relationshipOf(siblingNodeId, ownerNodeId) != ContextRelationship.SIBLING) {
            return Result.fail("Context can only be shared between sibling nodes");
        }
        shares.computeIfAbsent(ownerNodeId, k -> new LinkedHashSet<>()).add(siblingNodeId);
        log.debug("Node [{}] shared its context with sibling [{}]", ownerNodeId, siblingNodeId);
        return Result.ok();
    }

    // ---------------------------------------------------------------- building and reading

    @Override
    public Result<HierarchicalContext> buildContext(NodeId nodeId, Map<String, Object> data, ContextScope scope) {
        return buildContext(nodeId, data, scope, null, Collections.emptyList());
    }

    @Override
    public Result<HierarchicalContext> buildContext(NodeId nodeId, Map<String, Object> data, ContextScope scope,
                                                    String parentContextId) {
        return buildContext(nodeId, data, scope, parentContextId, Collections.emptyList());
    }

    @Override
    public Result<HierarchicalContext> buildContext(NodeId nodeId, Map<String, Object> data, ContextScope scope,
                                                    String parentContextId, List<ContextInheritanceRule> rules) {
        if (nodeId == null) {
            return Result.fail("Node id is required");
        }
        if (data == null) {
            return Result.fail("Invalid context data: data cannot be null");
        }
        if (scope == null) {
            return Result.fail("Context scope is required");
        }

        ContextEntry parent = null;
        Map<String, Object> inherited = new LinkedHashMap<>();
        Set<String> locked = new LinkedHashSet<>();
        if (parentContextId != null) {
            parent = contexts.get(parentContextId);
            if (parent == null) {
                return Result.notFound("Parent context not found: " + parentContextId);
            }
            if (chainContainsNode(parent, nodeId)) {
                return Result.fail("Circular reference detected: node cannot inherit from its own context chain");
            }
            if (parent.getScope() != ContextScope.ISOLATED) {
                Map<String, ContextInheritanceRule> ruleIndex = indexRules(rules);
                for (Map.Entry<String, Object> property : parent.effectiveData().entrySet()) {
                    ContextInheritanceRule rule = ruleIndex.get(property.getKey());
                    if (rule != null && !rule.isInherit()) {
                        continue;
                    }
                    inherited.put(property.getKey(), property.getValue());
                    if ((rule != null && !rule.isOverride()) || parent.isLocked(property.getKey())) {
                        locked.add(property.getKey());
                    }
                }
            }
            for (String property : locked) {
                if (data.containsKey(property)) {
                    return Result.fail("Property '" + property
                            + "' is inherited with override disabled and cannot be redefined");
                }
            }
        }

        ensureRegistered(nodeId, parent);
        ContextEntry entry = createEntry(nodeId, data, scope, inherited, locked, parentContextId);
        return Result.ok(snapshot(entry));
    }

    @Override
    public Result<HierarchicalContext> getNodeContext(NodeId nodeId) {
        ContextEntry entry = contextOf(nodeId);
        if (entry == null) {
            return Result.notFound("No context found for node " + nodeId);
        }
        return Result.ok(snapshot(entry));
    }

    @Override
    public Result<Void> updateNodeContext(NodeId updatingNodeId, NodeId targetNodeId, Map<String, Object> data) {
        if (updatingNodeId == null || targetNodeId == null) {
            return Result.fail("Updating and target node ids are required");
        }
        if (data == null) {
            return Result.fail("Invalid context data: data cannot be null");
        }
        if (!nodes.containsKey(updatingNodeId)) {
            return Result.notFound("Node not registered: " + updatingNodeId);
        }
        ContextEntry entry = contextOf(targetNodeId);
        if (entry == null) {
            return Result.notFound("No context found for node " + targetNodeId);
        }
        AccessGrant grant = resolveGrant(updatingNodeId, targetNodeId);
        if (!grant.allows(ContextAccessLevel.WRITE)) {
            return Result.accessDenied("Node " + updatingNodeId + " cannot write the context of node "
                    + targetNodeId + ": " + grant.describe());
        }
        for (String property : data.keySet()) {
            if (entry.isLocked(property)) {
                return Result.fail("Property '" + property
                        + "' is inherited with override disabled and cannot be overwritten");
            }
        }
        entry.putAll(data, clock.instant());
        log.debug("Node [{}] updated context [{}] of node [{}]: {}", updatingNodeId, entry.getContextId(),
                targetNodeId, data.keySet());
        return Result.ok();
    }

    @Override
    public Result<HierarchicalContext> getHierarchicalContext(NodeId nodeId) {
        ContextEntry entry = contextOf(nodeId);
        if (entry == null) {
            return Result.notFound("No context found for node " + nodeId);
        }
        int maxDepth = Math.max(1, properties.getMaxHierarchyDepth());
        List<HierarchicalContext> levels = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        boolean maxDepthReached = false;
        ContextEntry current = entry;
        while (current != null && visited.add(current.getContextId())) {
            if (levels.size() >= maxDepth) {
                maxDepthReached = true;
                break;
            }
            levels.add(snapshot(current));
            current = current.getParentContextId() == null ? null : contexts.get(current.getParentContextId());
        }
        if (maxDepthReached) {
            log.warn("Context chain of node [{}] exceeds max depth {}", nodeId, maxDepth);
        }
        return Result.ok(levels.get(0).toBuilder()
                .levels(Collections.unmodifiableList(levels))
                .totalLevels(levels.size())
                .maxDepthReached(maxDepthReached)
                .build());
    }

    @Override
    public Result<Void> propagateContext(String sourceContextId, NodeId targetNodeId,
                                         List<ContextInheritanceRule> rules) {
        if (targetNodeId == null) {
            return Result.fail("Target node id is required");
        }
        ContextEntry source = sourceContextId == null ? null : contexts.get(sourceContextId);
        if (source == null) {
            return Result.notFound("Source context not found: " + sourceContextId);
        }
        if (chainContainsNode(source, targetNodeId)) {
            return Result.fail("Circular reference detected: cannot propagate a context into its own chain");
        }

        ContextEntry target = contextOf(targetNodeId);
        if (target == null) {
            ensureRegistered(targetNodeId, source);
            target = createEntry(targetNodeId, Collections.emptyMap(), source.getScope(), Collections.emptyMap(),
                    Collections.emptySet(), sourceContextId);
        }

        Map<String, Object> sourceData = source.effectiveData();
        int copied = 0;
        for (ContextInheritanceRule rule : rules == null ? Collections.<ContextInheritanceRule>emptyList() : rules) {
            String property = rule.getProperty();
            if (!rule.isInherit() || property == null || !sourceData.containsKey(property)) {
                continue;
            }
            if (!rule.isOverride() && target.hasProperty(property)) {
                continue;
            }
            target.inherit(property, sourceData.get(property), !rule.isOverride(), clock.instant());
            copied++;
        }
        target.attachTo(sourceContextId);
        log.debug("Propagated {} properties from context [{}] to node [{}]", copied, sourceContextId, targetNodeId);
        return Result.ok();
    }

    // ---------------------------------------------------------------- access control

    @Override
    public Result<ContextValidationResult> validateContextAccess(NodeId contextNodeId, NodeId requestingNodeId,
                                                                 ContextAccessLevel accessLevel,
                                                                 List<String> requestedProperties) {
        if (contextNodeId == null || requestingNodeId == null) {
            return Result.fail("Context node and requesting node ids are required");
        }
        if (!nodes.containsKey(contextNodeId)) {
            return Result.notFound("Context node not found: " + contextNodeId);
        }
        if (!nodes.containsKey(requestingNodeId)) {
            return Result.notFound("Requesting node not found: " + requestingNodeId);
        }
        ContextAccessLevel requested = accessLevel == null ? ContextAccessLevel.READ : accessLevel;
        List<String> propertyNames = requestedProperties == null
                ? new ArrayList<>() : new ArrayList<>(requestedProperties);

        AccessGrant grant = resolveGrant(requestingNodeId, contextNodeId);
        if (!grant.allows(requested)) {
            return Result.ok(ContextValidationResult.builder()
                    .granted(false)
                    .level(grant.level)
                    .relationship(grant.relationship)
                    .restrictedProperties(propertyNames)
                    .inheritanceAllowed(false)
                    .denialReason(grant.level == null ? grant.reason
                            : "Insufficient permissions: " + grant.relationship.getValue()
                            + " access is limited to " + grant.level.getValue())
                    .build());
        }

        ContextEntry entry = contextOf(contextNodeId);
        List<String> accessible = new ArrayList<>();
        List<String> restricted = new ArrayList<>();
        for (String property : propertyNames) {
            if (requested.requiresWrite() && entry != null && entry.isLocked(property)) {
                restricted.add(property);
            } else {
                accessible.add(property);
            }
        }
        boolean inheritanceAllowed = (grant.relationship == ContextRelationship.SELF
                || grant.relationship == ContextRelationship.DESCENDANT)
                && (entry == null || entry.getScope() != ContextScope.ISOLATED);
        return Result.ok(ContextValidationResult.builder()
                .granted(true)
                .level(grant.level)
                .relationship(grant.relationship)
                .accessibleProperties(accessible)
                .restrictedProperties(restricted)
                .inheritanceAllowed(inheritanceAllowed)
                .build());
    }

    @Override
    public Result<NodeContext> getNodeContextWithAccess(NodeId requestingNodeId, NodeId targetNodeId,
                                                        ContextAccessLevel accessLevel) {
        if (requestingNodeId == null || targetNodeId == null) {
            return Result.fail("Requesting and target node ids are required");
        }
        if (!nodes.containsKey(targetNodeId)) {
            return Result.notFound("Target node not found: " + targetNodeId);
        }
        if (!nodes.containsKey(requestingNodeId)) {
            return Result.notFound("Requesting node not found: " + requestingNodeId);
        }
        ContextAccessLevel requested = accessLevel == null ? ContextAccessLevel.READ : accessLevel;
        AccessGrant grant = resolveGrant(requestingNodeId, targetNodeId);
        if (!grant.allows(requested)) {
            return Result.accessDenied("Access denied: " + grant.describe());
        }
        return Result.ok(viewOf(nodes.get(targetNodeId), grant.level));
    }

    @Override
    public Result<List<ContextAccessResult>> getAccessibleContexts(NodeId requestingNodeId) {
        if (requestingNodeId == null || !nodes.containsKey(requestingNodeId)) {
            return Result.notFound("Node not found in context system: " + requestingNodeId);
        }
        List<ContextAccessResult> accessible = new ArrayList<>();
        for (NodeContext node : nodes.values()) {
            AccessGrant grant = resolveGrant(requestingNodeId, node.getNodeId());
            if (grant.level == null) {
                continue;
            }
            accessible.add(ContextAccessResult.builder()
                    .context(viewOf(node, grant.level))
                    .relationship(grant.relationship)
                    .accessLevel(grant.level)
                    .accessReason(grant.reason)
                    .build());
        }
        return Result.ok(accessible);
    }

    // ---------------------------------------------------------------- clone, merge, clear

    @Override
    public Result<String> cloneContextScope(String sourceContextId, NodeId targetNodeId, ContextScope newScope,
                                            CloneOptions options) {
        if (targetNodeId == null || newScope == null) {
            return Result.fail("Target node id and scope are required");
        }
        ContextEntry source = sourceContextId == null ? null : contexts.get(sourceContextId);
        if (source == null) {
            return Result.notFound("Source context not found: " + sourceContextId);
        }
        CloneOptions effective = options == null ? CloneOptions.none() : options;

        Map<String, Object> cloned = ContextValues.copyMap(source.effectiveData());
        if (effective.getExcludeProperties() != null) {
            cloned.keySet().removeAll(effective.getExcludeProperties());
        }
        if (effective.getTransformProperties() != null) {
            for (Map.Entry<String, UnaryOperator<Object>> transform : effective.getTransformProperties().entrySet()) {
                String property = transform.getKey();
                if (!cloned.containsKey(property)) {
                    continue;
                }
                try {
                    cloned.put(property, transform.getValue().apply(cloned.get(property)));
                } catch (RuntimeException e) {
                    log.warn("Transformation of property [{}] failed while cloning context [{}]", property,
                            sourceContextId, e);
                    return Result.fail("Transformation failed for property " + property + ": " + e.getMessage());
                }
            }
        }

        ensureRegistered(targetNodeId, null);
        ContextEntry clone = createEntry(targetNodeId, cloned, newScope, Collections.emptyMap(),
                Collections.emptySet(), null);
        log.info("Cloned context [{}] to node [{}] as [{}] with scope {}", sourceContextId, targetNodeId,
                clone.getContextId(), newScope.getValue());
        return Result.ok(clone.getContextId());
    }

    @Override
    public Result<String> mergeContextScopes(List<String> sourceContextIds, NodeId targetNodeId,
                                             ContextScope targetScope, MergeOptions options) {
        if (targetNodeId == null || targetScope == null) {
            return Result.fail("Target node id and scope are required");
        }
        MergeOptions effective = options == null ? MergeOptions.defaults() : options;
        ConflictResolution resolution = effective.getConflictResolution() == null
                ? properties.getDefaultConflictResolution() : effective.getConflictResolution();

        List<String> sourceIds = sourceContextIds == null ? Collections.emptyList() : sourceContextIds;
        List<ContextEntry> sources = new ArrayList<>(sourceIds.size());
        for (String sourceId : sourceIds) {
            ContextEntry source = contexts.get(sourceId);
            if (source == null) {
                return Result.notFound("Source context not found: " + sourceId);
            }
            sources.add(source);
        }

        Map<String, Object> merged = new LinkedHashMap<>();
        for (ContextEntry source : sources) {
            for (Map.Entry<String, Object> property : source.effectiveData().entrySet()) {
                if (resolution == ConflictResolution.FIRST_WINS && merged.containsKey(property.getKey())) {
                    continue;
                }
                merged.put(property.getKey(), ContextValues.copyValue(property.getValue()));
            }
        }
        if (effective.isPreserveSourceMetadata()) {
            merged.put(MergeOptions.SOURCE_CONTEXTS_KEY, new ArrayList<>(sourceIds));
            merged.put(MergeOptions.MERGED_AT_KEY, clock.instant().toString());
        }

        ensureRegistered(targetNodeId, null);
        ContextEntry target = createEntry(targetNodeId, merged, targetScope, Collections.emptyMap(),
                Collections.emptySet(), null);
        log.info("Merged {} contexts into [{}] for node [{}] using {}", sources.size(), target.getContextId(),
                targetNodeId, resolution.getValue());
        return Result.ok(target.getContextId());
    }

    @Override
    public Result<Void> clearNodeContext(NodeId nodeId) {
        if (nodeId == null) {
            return Result.fail("Node id is required");
        }
        Set<NodeId> owners = new HashSet<>(descendantsOf(nodeId));
        owners.add(nodeId);

        Set<String> removed = new LinkedHashSet<>();
        for (ContextEntry entry : contexts.values()) {
            if (owners.contains(entry.getNodeId())) {
                removed.add(entry.getContextId());
            }
        }
        boolean grew = !removed.isEmpty();
        while (grew) {
            grew = false;
            for (ContextEntry entry : contexts.values()) {
                if (!removed.contains(entry.getContextId()) && entry.getParentContextId() != null
                        && removed.contains(entry.getParentContextId())) {
                    removed.add(entry.getContextId());
                    grew = true;
                }
            }
        }
        if (removed.isEmpty()) {
            return Result.ok();
        }

        contexts.keySet().removeAll(removed);
        reindexNodeContexts();
        log.info("Cleared {} contexts rooted at node [{}]", removed.size(), nodeId);
        return Result.ok();
    }

    // ---------------------------------------------------------------- access rules

    /**
     * 计算 requesting 对 owner 上下文可获得的最高访问级别
     */
    private AccessGrant resolveGrant(NodeId requesting, NodeId owner) {
        if (requesting.equals(owner)) {
            return AccessGrant.granted(ContextAccessLevel.EXECUTE, ContextRelationship.SELF, "Self access");
        }
        ContextRelationship relationship = relationshipOf(requesting, owner);
        ContextEntry entry = contextOf(owner);
        ContextScope scope = entry == null ? ContextScope.EXECUTION : entry.getScope();
        if (scope == ContextScope.GLOBAL) {
            return AccessGrant.granted(ContextAccessLevel.EXECUTE, relationship,
                    "Global context is visible to every node");
        }
        ContextAccessLevel related = scope == ContextScope.SHARED
                ? ContextAccessLevel.READ_WRITE : ContextAccessLevel.READ;

        switch (relationship) {
            case ANCESTOR:
                return AccessGrant.granted(related, relationship, "Ancestor access");
            case DESCENDANT:
                if (isolatedOnPath(owner, requesting)) {
                    return AccessGrant.denied(relationship, "An isolated context blocks access from descendants");
                }
                return AccessGrant.granted(related, relationship, "Descendant access");
            case SIBLING:
                if (scope == ContextScope.SHARED) {
                    return AccessGrant.granted(related, relationship, "Shared scope");
                }
                if (shares.getOrDefault(owner, Collections.emptySet()).contains(requesting)) {
                    return AccessGrant.granted(ContextAccessLevel.READ, relationship, "Explicitly shared with sibling");
                }
                return AccessGrant.denied(relationship, "Sibling context is not shared");
            default:
                return AccessGrant.denied(relationship, "No hierarchical relationship between nodes");
        }
    }

    /**
     * requesting 相对 owner 的位置
     */
    private ContextRelationship relationshipOf(NodeId requesting, NodeId owner) {
        if (requesting.equals(owner)) {
            return ContextRelationship.SELF;
        }
        if (ancestorsOf(owner).contains(requesting)) {
            return ContextRelationship.ANCESTOR;
        }
        if (ancestorsOf(requesting).contains(owner)) {
            return ContextRelationship.DESCENDANT;
        }
        NodeContext requestingNode = nodes.get(requesting);
        NodeContext ownerNode = nodes.get(owner);
        if (requestingNode != null && ownerNode != null && requestingNode.getParentNodeId() != null
                && requestingNode.getParentNodeId().equals(ownerNode.getParentNodeId())) {
            return ContextRelationship.SIBLING;
        }
        return ContextRelationship.UNRELATED;
    }

    /**
     * owner 到 descendant（不含）之间是否有 isolated 上下文
     */
    private boolean isolatedOnPath(NodeId owner, NodeId descendant) {
        if (isIsolated(owner)) {
            return true;
        }
        for (NodeId ancestor : ancestorsOf(descendant)) {
            if (ancestor.equals(owner)) {
                return false;
            }
            if (isIsolated(ancestor)) {
                return true;
            }
        }
        return false;
    }

    private boolean isIsolated(NodeId nodeId) {
        ContextEntry entry = contextOf(nodeId);
        return entry != null && entry.getScope() == ContextScope.ISOLATED;
    }

    /**
     * 父 -> 祖父 -> ... 顺序的祖先列表
     */
    private List<NodeId> ancestorsOf(NodeId nodeId) {
        List<NodeId> ancestors = new ArrayList<>();
        Set<NodeId> visited = new HashSet<>();
        visited.add(nodeId);
        NodeContext current = nodes.get(nodeId);
        while (current != null && current.getParentNodeId() != null && visited.add(current.getParentNodeId())) {
            ancestors.add(current.getParentNodeId());
            current = nodes.get(current.getParentNodeId());
        }
        return ancestors;
    }

    private Set<NodeId> descendantsOf(NodeId nodeId) {
        Set<NodeId> descendants = new LinkedHashSet<>();
        List<NodeId> frontier = new ArrayList<>(children.getOrDefault(nodeId, Collections.emptyList()));
        while (!frontier.isEmpty()) {
            NodeId next = frontier.remove(0);
            if (descendants.add(next)) {
                frontier.addAll(children.getOrDefault(next, Collections.emptyList()));
            }
        }
        return descendants;
    }

    // ---------------------------------------------------------------- helpers

    private ContextEntry createEntry(NodeId nodeId, Map<String, Object> data, ContextScope scope,
                                     Map<String, Object> inherited, Set<String> locked, String parentContextId) {
        String contextId = CONTEXT_ID_PREFIX + idGenerator.nextId();
        ContextEntry entry = new ContextEntry(contextId, nodeId, scope, data, inherited, locked, parentContextId,
                clock.instant());
        contexts.put(contextId, entry);
        nodeContexts.put(nodeId, contextId);
        log.debug("Built context [{}] for node [{}] with scope {} and parent [{}]", contextId, nodeId,
                scope.getValue(), parentContextId);
        return entry;
    }

    /**
     * 未登记的节点在首次创建上下文时自动登记，父节点取父上下文的所有者
     */
    private void ensureRegistered(NodeId nodeId, ContextEntry parent) {
        if (nodes.containsKey(nodeId)) {
            return;
        }
        NodeId parentNodeId = parent == null ? null : parent.getNodeId();
        NodeContext parentNode = parentNodeId == null ? null : nodes.get(parentNodeId);
        int level = parentNode == null ? 0 : parentNode.getHierarchyLevel() + 1;
        registerNode(nodeId, AUTO_REGISTERED_TYPE, parentNode == null ? null : parentNodeId,
                Collections.emptyMap(), level);
    }

    private ContextEntry contextOf(NodeId nodeId) {
        if (nodeId == null) {
            return null;
        }
        String contextId = nodeContexts.get(nodeId);
        return contextId == null ? null : contexts.get(contextId);
    }

    private void reindexNodeContexts() {
        nodeContexts.clear();
        for (ContextEntry entry : contexts.values()) {
            nodeContexts.put(entry.getNodeId(), entry.getContextId());
        }
    }

    private boolean chainContainsNode(ContextEntry start, NodeId nodeId) {
        Set<String> visited = new HashSet<>();
        ContextEntry current = start;
        while (current != null && visited.add(current.getContextId())) {
            if (current.getNodeId().equals(nodeId)) {
                return true;
            }
            current = current.getParentContextId() == null ? null : contexts.get(current.getParentContextId());
        }
        return false;
    }

    private Map<String, ContextInheritanceRule> indexRules(List<ContextInheritanceRule> rules) {
        Map<String, ContextInheritanceRule> index = new HashMap<>();
        if (rules != null) {
            for (ContextInheritanceRule rule : rules) {
                if (rule != null && rule.getProperty() != null) {
                    index.put(rule.getProperty(), rule);
                }
            }
        }
        return index;
    }

    private HierarchicalContext snapshot(ContextEntry entry) {
        List<String> childIds = new ArrayList<>();
        for (ContextEntry candidate : contexts.values()) {
            if (entry.getContextId().equals(candidate.getParentContextId())) {
                childIds.add(candidate.getContextId());
            }
        }
        return entry.snapshot(childIds);
    }

    private NodeContext viewOf(NodeContext node, ContextAccessLevel level) {
        ContextEntry entry = contextOf(node.getNodeId());
        Map<String, Object> data = entry != null
                ? ContextValues.copyMap(entry.effectiveData())
                : ContextValues.copyMap(node.getContextData());
        return node.toBuilder()
                .contextData(data)
                .accessLevel(level)
                .build();
    }

    private Map<String, Object> containerData(Node container) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", container.getName().getValue());
        data.put("nodeType", container.getNodeType().getValue());
        data.put("executionType", container.getExecutionType().getValue());
        if (container.getDescription() != null) {
            data.put("description", container.getDescription());
        }
        return data;
    }

    private Map<String, Object> actionData(ActionNode action) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", action.getName().getValue());
        data.put("nodeType", action.getNodeType().getValue());
        data.put("executionMode", action.getExecutionMode().getValue());
        data.put("executionOrder", action.getExecutionOrder());
        data.put("priority", action.getPriority());
        data.put("actionStatus", action.getActionStatus().getValue());
        data.put("actionSpecificData", ContextValues.copyMap(action.getActionSpecificData()));
        return data;
    }

    private static final class AccessGrant {

        private final ContextAccessLevel level;

        private final ContextRelationship relationship;

        private final String reason;

        private AccessGrant(ContextAccessLevel level, ContextRelationship relationship, String reason) {
            this.level = level;
            this.relationship = relationship;
            this.reason = reason;
        }

        static AccessGrant granted(ContextAccessLevel level, ContextRelationship relationship, String reason) {
            return new AccessGrant(level, relationship, reason);
        }

        static AccessGrant denied(ContextRelationship relationship, String reason) {
            return new AccessGrant(null, relationship, reason);
        }

        boolean allows(ContextAccessLevel requested) {
            return level != null && level.covers(requested);
        }

        String describe() {
            if (level == null) {
                return reason;
            }
            return relationship.getValue() + " access is limited to " + level.getValue();
        }
    }
}
