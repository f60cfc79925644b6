package com.tencent.funcmodel.domain.context;

import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.context.impl.ContextAccessServiceImpl;
import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.shared.ErrorType;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.support.SequentialIdGenerator;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static com.tencent.funcmodel.domain.support.ModelFixtures.NOW;
import static com.tencent.funcmodel.domain.support.ModelFixtures.action;
import static com.tencent.funcmodel.domain.support.ModelFixtures.fixedClock;
import static com.tencent.funcmodel.domain.support.ModelFixtures.newModel;
import static com.tencent.funcmodel.domain.support.ModelFixtures.require;
import static com.tencent.funcmodel.domain.support.ModelFixtures.stage;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextAccessServiceTest {

    private SequentialIdGenerator ids;

    private Clock clock;

    private ContextAccessService service;

    @BeforeEach
    void setUp() {
        ids = new SequentialIdGenerator();
        clock = fixedClock();
        service = new ContextAccessServiceImpl(ids, clock, FunctionModelProperties.defaults());
    }

    private NodeId newNode() {
        return NodeId.generate(ids);
    }

    private static Map<String, Object> data(String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        return data;
    }

    // ---------------------------------------------------------------- inheritance

    @Test
    void testInheritedPropertyCannotBeOverridden() {
        NodeId a = newNode();
        NodeId b = newNode();
        HierarchicalContext ctxA = require(service.buildContext(a, data("x", 1), ContextScope.EXECUTION));

        List<ContextInheritanceRule> rules = Collections.singletonList(ContextInheritanceRule.of("x", true, false));
        require(service.buildContext(b, data("y", 2), ContextScope.EXECUTION, ctxA.getContextId(), rules));

        HierarchicalContext ctxB = require(service.getNodeContext(b));
        assertEquals(1, ctxB.getEffectiveData().get("x"));
        assertEquals(2, ctxB.getEffectiveData().get("y"));
        assertTrue(ctxB.isInherited("x"));
        assertFalse(ctxB.isInherited("y"));
        assertTrue(ctxB.getLockedProperties().contains("x"));
        assertEquals(ctxA.getContextId(), ctxB.getParentContextId());

        Result<Void> overwrite = service.updateNodeContext(b, b, data("x", 5));
        assertTrue(overwrite.isFailure());
        assertEquals(ErrorType.VALIDATION, overwrite.getErrorType());
        assertEquals(1, require(service.getNodeContext(b)).getEffectiveData().get("x"));

        Result<HierarchicalContext> redefine = service.buildContext(b, data("x", 7), ContextScope.EXECUTION,
                ctxA.getContextId(), rules);
        assertTrue(redefine.isFailure());
        assertEquals(ErrorType.VALIDATION, redefine.getErrorType());
    }

    @Test
    void testInheritanceRulesFilterProperties() {
        NodeId a = newNode();
        NodeId b = newNode();
        Map<String, Object> parentData = data("shared", "s");
        parentData.put("secret", "hidden");
        HierarchicalContext ctxA = require(service.buildContext(a, parentData, ContextScope.SESSION));

        HierarchicalContext ctxB = require(service.buildContext(b, data("shared", "own"), ContextScope.SESSION,
                ctxA.getContextId(), Collections.singletonList(ContextInheritanceRule.of("secret", false, true))));

        assertFalse(ctxB.getEffectiveData().containsKey("secret"));
        assertEquals("own", ctxB.getEffectiveData().get("shared"));
        assertFalse(ctxB.isInherited("shared"));
    }

    @Test
    void testIsolatedParentIsNotInherited() {
        NodeId a = newNode();
        NodeId b = newNode();
        HierarchicalContext ctxA = require(service.buildContext(a, data("x", 1), ContextScope.ISOLATED));

        HierarchicalContext ctxB = require(service.buildContext(b, data("y", 2), ContextScope.EXECUTION,
                ctxA.getContextId()));

        assertTrue(ctxB.getInheritedData().isEmpty());
        assertEquals(ContextAccessLevel.READ, ctxA.getAccessLevel());
    }

    @Test
    void testBuildContext_RejectsInvalidInput() {
        NodeId a = newNode();

        assertEquals(ErrorType.VALIDATION, service.buildContext(a, null, ContextScope.EXECUTION).getErrorType());
        assertEquals(ErrorType.NOT_FOUND,
                service.buildContext(a, data("x", 1), ContextScope.EXECUTION, "ctx-missing").getErrorType());

        HierarchicalContext ctxA = require(service.buildContext(a, data("x", 1), ContextScope.EXECUTION));
        Result<HierarchicalContext> loop = service.buildContext(a, data("x", 2), ContextScope.EXECUTION,
                ctxA.getContextId());
        assertTrue(loop.isFailure());
        assertTrue(loop.getError().contains("Circular reference"));
    }

    @Test
    void testBuildContext_CopiesCallerData() {
        NodeId a = newNode();
        List<Object> items = new ArrayList<>(Arrays.asList(1, 2));
        require(service.buildContext(a, data("items", items), ContextScope.EXECUTION));

        items.add(3);

        assertEquals(Arrays.asList(1, 2), require(service.getNodeContext(a)).getData().get("items"));
    }

    // ---------------------------------------------------------------- hierarchy

    @Test
    void testHierarchicalContextListsLevelsFromSelfToRoot() {
        NodeId a = newNode();
        NodeId b = newNode();
        NodeId c = newNode();
        HierarchicalContext ctxA = require(service.buildContext(a, data("level", "a"), ContextScope.EXECUTION));
        HierarchicalContext ctxB = require(service.buildContext(b, data("level", "b"), ContextScope.EXECUTION,
                ctxA.getContextId()));
        require(service.buildContext(c, data("level", "c"), ContextScope.EXECUTION, ctxB.getContextId()));

        HierarchicalContext chain = require(service.getHierarchicalContext(c));

        assertEquals(3, chain.getTotalLevels());
        assertFalse(chain.isMaxDepthReached());
        assertEquals(c, chain.getLevels().get(0).getNodeId());
        assertEquals(a, chain.getLevels().get(2).getNodeId());
        assertEquals(Collections.singletonList(ctxB.getContextId()),
                require(service.getNodeContext(a)).getChildContextIds());
    }

    @Test
    void testHierarchicalContextStopsAtMaxDepth() {
        service = new ContextAccessServiceImpl(ids, clock,
                FunctionModelProperties.builder().maxHierarchyDepth(2).build());
        NodeId a = newNode();
        NodeId b = newNode();
        NodeId c = newNode();
        HierarchicalContext ctxA = require(service.buildContext(a, data("x", 1), ContextScope.EXECUTION));
        HierarchicalContext ctxB = require(service.buildContext(b, data("y", 2), ContextScope.EXECUTION,
                ctxA.getContextId()));
        require(service.buildContext(c, data("z", 3), ContextScope.EXECUTION, ctxB.getContextId()));

        HierarchicalContext chain = require(service.getHierarchicalContext(c));

        assertEquals(2, chain.getTotalLevels());
        assertTrue(chain.isMaxDepthReached());
    }

    @Test
    void testGetNodeContext_NotFound() {
        assertEquals(ErrorType.NOT_FOUND, service.getNodeContext(newNode()).getErrorType());
        assertEquals(ErrorType.NOT_FOUND, service.getHierarchicalContext(newNode()).getErrorType());
    }

    @Test
    void testRegisterNode_RejectsBrokenHierarchy() {
        NodeId root = newNode();
        NodeId child = newNode();
        require(service.registerNode(root, "stage", null, Collections.emptyMap(), 0));
        require(service.registerNode(child, "tether", root, Collections.emptyMap(), 1));

        assertEquals(ErrorType.VALIDATION,
                service.registerNode(root, "stage", root, Collections.emptyMap(), 0).getErrorType());
        assertEquals(ErrorType.NOT_FOUND,
                service.registerNode(newNode(), "tether", newNode(), Collections.emptyMap(), 1).getErrorType());
        Result<Void> circular = service.registerNode(root, "stage", child, Collections.emptyMap(), 2);
        assertTrue(circular.isFailure());
        assertTrue(circular.getError().contains("Circular reference"));
    }

    @Test
    void testRegisterModel_ActionsAreChildrenOfTheirContainer() {
        FunctionModel model = newModel(clock, ids);
        NodeId pick = stage(model, "Pick", false);
        NodeId scan = action(model, pick, "Scan", 1);
        service = new ContextAccessServiceImpl(ids, clock, FunctionModelProperties.defaults());

        require(service.registerModel(model));

        ContextValidationResult access = require(service.validateContextAccess(pick, scan,
                ContextAccessLevel.READ, Collections.emptyList()));
        assertTrue(access.isGranted());
        assertEquals(ContextRelationship.DESCENDANT, access.getRelationship());

        NodeContext view = require(service.getNodeContextWithAccess(scan, scan, ContextAccessLevel.READ));
        assertEquals("Scan", view.getContextData().get("name"));
        assertEquals(1, view.getHierarchyLevel());
    }

    // ---------------------------------------------------------------- access rules

    /**
     * root
     * ├── left
     * │   └── leaf
     * └── right
     * loner
     */
    private NodeId root;
    private NodeId left;
    private NodeId right;
    private NodeId leaf;
    private NodeId loner;

    private void registerTree() {
        root = newNode();
        left = newNode();
        right = newNode();
        leaf = newNode();
        loner = newNode();
        require(service.registerNode(root, "stage", null, Collections.emptyMap(), 0));
        require(service.registerNode(left, "stage", root, Collections.emptyMap(), 1));
        require(service.registerNode(right, "stage", root, Collections.emptyMap(), 1));
        require(service.registerNode(leaf, "tether", left, Collections.emptyMap(), 2));
        require(service.registerNode(loner, "stage", null, Collections.emptyMap(), 0));
    }

    private ContextValidationResult check(NodeId owner, NodeId requesting, ContextAccessLevel level) {
        return require(service.validateContextAccess(owner, requesting, level, Arrays.asList("a", "b")));
    }

    @Test
    void testSelfAccessIsUnrestricted() {
        registerTree();

        ContextValidationResult self = check(left, left, ContextAccessLevel.EXECUTE);

        assertTrue(self.isGranted());
        assertEquals(ContextAccessLevel.EXECUTE, self.getLevel());
        assertEquals(ContextRelationship.SELF, self.getRelationship());
        assertEquals(Arrays.asList("a", "b"), self.getAccessibleProperties());
        assertTrue(self.isInheritanceAllowed());
    }

    @Test
    void testAncestorAccessIsReadOnly() {
        registerTree();

        assertTrue(check(left, root, ContextAccessLevel.READ).isGranted());

        ContextValidationResult write = check(left, root, ContextAccessLevel.WRITE);
        assertFalse(write.isGranted());
        assertEquals(ContextRelationship.ANCESTOR, write.getRelationship());
        assertEquals(ContextAccessLevel.READ, write.getLevel());
        assertEquals("Insufficient permissions: ancestor access is limited to read", write.getDenialReason());
        assertEquals(Arrays.asList("a", "b"), write.getRestrictedProperties());
    }

    @Test
    void testDescendantReadsAncestorContext() {
        registerTree();

        ContextValidationResult read = check(root, leaf, ContextAccessLevel.READ);

        assertTrue(read.isGranted());
        assertEquals(ContextRelationship.DESCENDANT, read.getRelationship());
        assertFalse(check(root, leaf, ContextAccessLevel.WRITE).isGranted());
    }

    @Test
    void testIsolatedContextBlocksDescendants() {
        registerTree();
        require(service.buildContext(root, data("a", 1), ContextScope.ISOLATED));

        ContextValidationResult read = check(root, leaf, ContextAccessLevel.READ);

        assertFalse(read.isGranted());
        assertNull(read.getLevel());
        assertEquals("An isolated context blocks access from descendants", read.getDenialReason());
    }

    @Test
    void testSiblingNeedsSharing() {
        registerTree();

        ContextValidationResult denied = check(left, right, ContextAccessLevel.READ);
        assertFalse(denied.isGranted());
        assertEquals(ContextRelationship.SIBLING, denied.getRelationship());

        require(service.shareContext(left, right));

        assertTrue(check(left, right, ContextAccessLevel.READ).isGranted());
        assertFalse(check(left, right, ContextAccessLevel.WRITE).isGranted());
        assertFalse(check(right, left, ContextAccessLevel.READ).isGranted());
        assertEquals(ErrorType.VALIDATION, service.shareContext(left, loner).getErrorType());
    }

    @Test
    void testSharedScopeAllowsRelatedWrites() {
        registerTree();
        require(service.buildContext(left, data("a", 1), ContextScope.SHARED));

        ContextValidationResult sibling = check(left, right, ContextAccessLevel.READ_WRITE);
        assertTrue(sibling.isGranted());
        assertEquals(ContextAccessLevel.READ_WRITE, sibling.getLevel());

        require(service.updateNodeContext(right, left, data("b", 2)));
        assertEquals(2, require(service.getNodeContext(left)).getData().get("b"));
        assertFalse(check(left, loner, ContextAccessLevel.READ).isGranted());
    }

    @Test
    void testGlobalScopeIsVisibleToUnrelatedNodes() {
        registerTree();

        assertFalse(check(left, loner, ContextAccessLevel.READ).isGranted());

        require(service.buildContext(left, data("a", 1), ContextScope.GLOBAL));

        ContextValidationResult global = check(left, loner, ContextAccessLevel.EXECUTE);
        assertTrue(global.isGranted());
        assertEquals(ContextRelationship.UNRELATED, global.getRelationship());
    }

    @Test
    void testWriteToLockedPropertyIsRestricted() {
        registerTree();
        HierarchicalContext parent = require(service.buildContext(root, data("a", 1), ContextScope.EXECUTION));
        require(service.buildContext(left, data("b", 2), ContextScope.EXECUTION, parent.getContextId(),
                Collections.singletonList(ContextInheritanceRule.of("a", true, false))));

        ContextValidationResult write = check(left, left, ContextAccessLevel.WRITE);

        assertTrue(write.isGranted());
        assertEquals(Collections.singletonList("b"), write.getAccessibleProperties());
        assertEquals(Collections.singletonList("a"), write.getRestrictedProperties());
    }

    @Test
    void testMissingNodesAreNotFoundAndDeniedAccessIsAccessDenied() {
        registerTree();
        require(service.buildContext(left, data("a", 1), ContextScope.EXECUTION));

        assertEquals(ErrorType.NOT_FOUND,
                service.validateContextAccess(newNode(), left, ContextAccessLevel.READ, null).getErrorType());
        assertEquals(ErrorType.NOT_FOUND,
                service.getNodeContextWithAccess(left, newNode(), ContextAccessLevel.READ).getErrorType());
        assertEquals(ErrorType.ACCESS_DENIED,
                service.getNodeContextWithAccess(loner, left, ContextAccessLevel.READ).getErrorType());
        assertEquals(ErrorType.ACCESS_DENIED, service.updateNodeContext(root, left, data("a", 2)).getErrorType());
        assertEquals(ErrorType.NOT_FOUND, service.updateNodeContext(newNode(), left, data("a", 2)).getErrorType());
    }

    @Test
    void testAccessibleContexts() {
        registerTree();

        List<ContextAccessResult> accessible = require(service.getAccessibleContexts(right));

        assertEquals(2, accessible.size());
        assertTrue(accessible.stream().anyMatch(r -> r.getRelationship() == ContextRelationship.SELF));
        assertTrue(accessible.stream().anyMatch(r -> r.getContext().getNodeId().equals(root)
                && r.getAccessLevel() == ContextAccessLevel.READ));
        assertEquals(ErrorType.NOT_FOUND, service.getAccessibleContexts(newNode()).getErrorType());
    }

    // ---------------------------------------------------------------- propagate, clone, merge, clear

    @Test
    void testPropagateContextCopiesRuledProperties() {
        NodeId source = newNode();
        NodeId target = newNode();
        Map<String, Object> sourceData = data("x", 1);
        sourceData.put("y", 2);
        HierarchicalContext ctx = require(service.buildContext(source, sourceData, ContextScope.EXECUTION));

        require(service.propagateContext(ctx.getContextId(), target, Arrays.asList(
                ContextInheritanceRule.of("x", true, false),
                ContextInheritanceRule.of("y", false, true),
                ContextInheritanceRule.of("missing", true, true))));

        HierarchicalContext propagated = require(service.getNodeContext(target));
        assertEquals(Collections.singletonMap("x", 1), propagated.getInheritedData());
        assertEquals(ctx.getContextId(), propagated.getParentContextId());
        assertEquals(ErrorType.VALIDATION, service.updateNodeContext(target, target, data("x", 9)).getErrorType());
        assertEquals(ErrorType.NOT_FOUND,
                service.propagateContext("ctx-missing", target, Collections.emptyList()).getErrorType());
    }

    @Test
    void testPropagateContextOverridesExistingOwnProperty() {
        NodeId source = newNode();
        NodeId target = newNode();
        Map<String, Object> sourceData = data("x", 1);
        sourceData.put("y", 2);
        HierarchicalContext ctx = require(service.buildContext(source, sourceData, ContextScope.EXECUTION));
        Map<String, Object> own = data("x", 5);
        own.put("y", 7);
        require(service.buildContext(target, own, ContextScope.EXECUTION));

        require(service.propagateContext(ctx.getContextId(), target, Arrays.asList(
                ContextInheritanceRule.of("x", true, true),
                ContextInheritanceRule.of("y", true, false))));

        HierarchicalContext propagated = require(service.getNodeContext(target));
        assertEquals(1, propagated.getEffectiveData().get("x"));
        assertFalse(propagated.getData().containsKey("x"));
        assertEquals(7, propagated.getEffectiveData().get("y"));
    }

    @Test
    void testCloneContextScope() {
        NodeId source = newNode();
        NodeId target = newNode();
        Map<String, Object> sourceData = data("count", 3);
        sourceData.put("secret", "s3cr3t");
        sourceData.put("nested", data("items", new ArrayList<>(Arrays.asList("a", "b"))));
        HierarchicalContext ctx = require(service.buildContext(source, sourceData, ContextScope.EXECUTION));

        Map<String, UnaryOperator<Object>> transforms = new HashMap<>();
        transforms.put("count", value -> ((Integer) value) * 2);
        String cloneId = require(service.cloneContextScope(ctx.getContextId(), target, ContextScope.SESSION,
                CloneOptions.builder()
                        .excludeProperties(Collections.singleton("secret"))
                        .transformProperties(transforms)
                        .build()));

        HierarchicalContext clone = require(service.getNodeContext(target));
        assertNotEquals(ctx.getContextId(), cloneId);
        assertEquals(cloneId, clone.getContextId());
        assertEquals(ContextScope.SESSION, clone.getScope());
        assertEquals(6, clone.getData().get("count"));
        assertFalse(clone.getData().containsKey("secret"));
        assertEquals(sourceData.get("nested"), clone.getData().get("nested"));
        assertFalse(clone.hasParent());

        require(service.updateNodeContext(source, source, data("count", 100)));
        assertEquals(6, require(service.getNodeContext(target)).getData().get("count"));
    }

    @Test
    void testCloneContextScope_TransformFailure() {
        NodeId source = newNode();
        HierarchicalContext ctx = require(service.buildContext(source, data("count", "three"), ContextScope.EXECUTION));
        Map<String, UnaryOperator<Object>> transforms = new HashMap<>();
        transforms.put("count", value -> ((Integer) value) * 2);

        Result<String> clone = service.cloneContextScope(ctx.getContextId(), newNode(), ContextScope.EXECUTION,
                CloneOptions.builder().transformProperties(transforms).build());

        assertTrue(clone.isFailure());
        assertTrue(clone.getError().startsWith("Transformation failed for property count"));
        assertEquals(ErrorType.NOT_FOUND,
                service.cloneContextScope("ctx-missing", newNode(), ContextScope.EXECUTION, null).getErrorType());
    }

    @Test
    void testMergeContextScopes() {
        Map<String, Object> first = data("a", 1);
        first.put("b", 1);
        Map<String, Object> second = data("b", 2);
        second.put("c", 2);
        String ctx1 = require(service.buildContext(newNode(), first, ContextScope.EXECUTION)).getContextId();
        String ctx2 = require(service.buildContext(newNode(), second, ContextScope.EXECUTION)).getContextId();
        List<String> sources = Arrays.asList(ctx1, ctx2);

        NodeId firstTarget = newNode();
        require(service.mergeContextScopes(sources, firstTarget, ContextScope.EXECUTION, MergeOptions.defaults()));
        Map<String, Object> firstWins = require(service.getNodeContext(firstTarget)).getData();
        assertEquals(1, firstWins.get("a"));
        assertEquals(1, firstWins.get("b"));
        assertEquals(2, firstWins.get("c"));
        assertFalse(firstWins.containsKey(MergeOptions.SOURCE_CONTEXTS_KEY));

        NodeId lastTarget = newNode();
        require(service.mergeContextScopes(sources, lastTarget, ContextScope.SESSION, MergeOptions.builder()
                .conflictResolution(ConflictResolution.LAST_WINS)
                .preserveSourceMetadata(true)
                .build()));
        Map<String, Object> lastWins = require(service.getNodeContext(lastTarget)).getData();
        assertEquals(2, lastWins.get("b"));
        assertEquals(sources, lastWins.get(MergeOptions.SOURCE_CONTEXTS_KEY));
        assertEquals(NOW.toString(), lastWins.get(MergeOptions.MERGED_AT_KEY));
    }

    @Test
    void testMergeContextScopes_MissingSource() {
        String ctx = require(service.buildContext(newNode(), data("a", 1), ContextScope.EXECUTION)).getContextId();

        Result<String> merged = service.mergeContextScopes(Arrays.asList(ctx, "ctx-missing"), newNode(),
                ContextScope.EXECUTION, null);

        assertEquals(ErrorType.NOT_FOUND, merged.getErrorType());
    }

    @Test
    void testClearNodeContextRemovesDescendantChain() {
        NodeId a = newNode();
        NodeId b = newNode();
        HierarchicalContext ctxA = require(service.buildContext(a, data("x", 1), ContextScope.EXECUTION));
        require(service.buildContext(b, data("y", 2), ContextScope.EXECUTION, ctxA.getContextId()));

        require(service.clearNodeContext(a));

        assertEquals(ErrorType.NOT_FOUND, service.getNodeContext(a).getErrorType());
        assertEquals(ErrorType.NOT_FOUND, service.getNodeContext(b).getErrorType());
        assertTrue(service.clearNodeContext(a).isSuccess());
        assertTrue(service.clearNodeContext(newNode()).isSuccess());
    }
}
