package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * TetherNode - 外部执行引用动作
 * <p>
 * actionSpecificData 必须包含 tetherReferenceId。
 * </p>
 */
public class TetherNode extends ActionNode {

    public static final String TETHER_REFERENCE_ID = "tetherReferenceId";

    private TetherNode(NodeAttributes attributes, ActionAttributes action) {
        super(attributes, action);
    }

    public static Result<TetherNode> create(NodeAttributes attributes, ActionAttributes action) {
        return requireText(action.getActionSpecificData(), TETHER_REFERENCE_ID, "Tether reference ID is required")
                .map(ref -> new TetherNode(attributes, action));
    }

    private TetherNode(TetherNode source) {
        super(source);
    }

    @Override
    public TetherNode copy() {
        return new TetherNode(this);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.TETHER;
    }

    public String getTetherReferenceId() {
        return ((String) getActionSpecificData().get(TETHER_REFERENCE_ID)).trim();
    }
}
