package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * KBNode - 知识库引用动作
 * <p>
 * actionSpecificData 字段:
 * <ul>
 *     <li>kbReferenceId: 必填</li>
 *     <li>shortDescription: 必填，最长 500 字符</li>
 *     <li>searchKeywords: 可选字符串列表</li>
 *     <li>accessPermissions: 可选 {view: [...], edit: [...]}，有编辑权限的人必须也有查看权限</li>
 * </ul>
 * </p>
 */
public class KBNode extends ActionNode {

    public static final String KB_REFERENCE_ID = "kbReferenceId";
    public static final String SHORT_DESCRIPTION = "shortDescription";
    public static final String SEARCH_KEYWORDS = "searchKeywords";
    public static final String ACCESS_PERMISSIONS = "accessPermissions";

    private static final int MAX_SHORT_DESCRIPTION = 500;

    private KBNode(NodeAttributes attributes, ActionAttributes action) {
        super(attributes, action);
    }

    public static Result<KBNode> create(NodeAttributes attributes, ActionAttributes action) {
        Map<String, Object> data = action.getActionSpecificData();
        Result<String> reference = requireText(data, KB_REFERENCE_ID, "KB reference ID is required");
        Result<String> shortDescription = requireText(data, SHORT_DESCRIPTION, "Short description is required");
        Result<Void> combined = Result.combine(reference, shortDescription,
                optionalStringList(data, SEARCH_KEYWORDS), validatePermissions(data));
        if (combined.isFailure()) {
            return combined.propagate();
        }
        if (shortDescription.getValue().length() > MAX_SHORT_DESCRIPTION) {
            return Result.fail("Short description cannot exceed " + MAX_SHORT_DESCRIPTION + " characters");
        }
        return Result.ok(new KBNode(attributes, action));
    }

    private KBNode(KBNode source) {
        super(source);
    }

    @Override
    public KBNode copy() {
        return new KBNode(this);
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.KB;
    }

    public String getKbReferenceId() {
        return ((String) getActionSpecificData().get(KB_REFERENCE_ID)).trim();
    }

    public String getShortDescription() {
        return ((String) getActionSpecificData().get(SHORT_DESCRIPTION)).trim();
    }

    public List<String> getSearchKeywords() {
        return optionalStringList(getActionSpecificData(), SEARCH_KEYWORDS).orElse(Collections.emptyList());
    }

    private static Result<Void> validatePermissions(Map<String, Object> data) {
        Object value = data == null ? null : data.get(ACCESS_PERMISSIONS);
        if (value == null) {
            return Result.ok();
        }
        if (!(value instanceof Map)) {
            return Result.fail("Access permissions must contain view and edit lists");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> permissions = (Map<String, Object>) value;
        Result<List<String>> view = optionalStringList(permissions, "view");
        Result<List<String>> edit = optionalStringList(permissions, "edit");
        if (view.isFailure() || edit.isFailure()) {
            return Result.fail("Access permissions must contain view and edit lists");
        }
        for (String user : edit.getValue()) {
            if (!view.getValue().contains(user)) {
                return Result.fail("Users with edit permissions must also have view permissions");
            }
        }
        return Result.ok();
    }
}
