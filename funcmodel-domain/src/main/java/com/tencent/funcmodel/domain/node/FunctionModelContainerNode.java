package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * FunctionModelContainerNode - 嵌套功能模型动作
 * <p>
 * actionSpecificData 必须包含 nestedModelId；嵌套自身所在模型会在发布校验时被拒绝。
 * </p>
 */
public class FunctionModelContainerNode extends ActionNode {

    public static final String NESTED_MODEL_ID = "nestedModelId";
    public static final String ORCHESTRATION_MODE = "orchestrationMode";

    private FunctionModelContainerNode(NodeAttributes attributes, ActionAttributes action) {
        super(attributes, action);
    }

    public static Result<FunctionModelContainerNode> create(NodeAttributes attributes, ActionAttributes action) {
        return requireText(action.getActionSpecificData(), NESTED_MODEL_ID, "Nested model ID is required")
                .map(ref -> new FunctionModelContainerNode(attributes, action));
    }

    private FunctionModelContainerNode(FunctionModelContainerNode source) {
        super(source);
    }

    @Override
    public FunctionModelContainerNode copy() {
        return new FunctionModelContainerNode(this);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.FUNCTION_MODEL_CONTAINER;
    }

    public String getNestedModelId() {
        return ((String) getActionSpecificData().get(NESTED_MODEL_ID)).trim();
    }

    /**
     * embedded / parallel / sequential，默认 embedded
     */
    public String getOrchestrationMode() {
        Object mode = getActionSpecificData().get(ORCHESTRATION_MODE);
        return mode instanceof String ? (String) mode : "embedded";
    }

    public boolean nestsModel(String modelId) {
        return modelId != null && getNestedModelId().equalsIgnoreCase(modelId);
    }
}
