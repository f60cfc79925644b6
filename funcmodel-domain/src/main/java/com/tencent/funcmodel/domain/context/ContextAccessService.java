package com.tencent.funcmodel.domain.context;

import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;

import java.util.List;
import java.util.Map;

/**
 * ContextAccessService - 层级上下文访问服务
 * <p>
 * 维护节点在容器层级中的位置和每个节点的上下文，决定一个节点能读写哪些上下文。
 * 未登记的节点返回 NOT_FOUND，无权访问返回 ACCESS_DENIED 或 granted=false 的校验结果，两者可以区分。
 * </p>
 * <p>
 * 每个模型使用一个实例，实例内部不加锁。
 * </p>
 */
public interface ContextAccessService {

    /**
     * 登记节点在上下文树中的位置
     *
     * @param nodeId         节点 ID
     * @param nodeType       节点类型
     * @param parentNodeId   父节点 ID，根节点传 null；父节点必须已登记
     * @param contextData    节点的初始数据
     * @param hierarchyLevel 容器嵌套深度
     */
    Result<Void> registerNode(NodeId nodeId, String nodeType, NodeId parentNodeId,
                              Map<String, Object> contextData, int hierarchyLevel);

    /**
     * 一次登记模型中的所有容器（层级 0）和动作（层级 1）
     */
    Result<Void> registerModel(FunctionModel model);

    /**
     * 把 owner 的上下文显式共享给兄弟节点（只读）
     */
    Result<Void> shareContext(NodeId ownerNodeId, NodeId siblingNodeId);

    Result<HierarchicalContext> buildContext(NodeId nodeId, Map<String, Object> data, ContextScope scope);

    Result<HierarchicalContext> buildContext(NodeId nodeId, Map<String, Object> data, ContextScope scope,
                                             String parentContextId);

    /**
     * 创建上下文
     * <p>
     * 指定父上下文时默认继承父上下文的全部可见属性并允许遮蔽；rules 中 inherit:false 的属性不继承，
     * override:false 的属性被锁定，data 中出现同名属性时创建失败。isolated 父上下文不向下继承。
     * </p>
     */
    Result<HierarchicalContext> buildContext(NodeId nodeId, Map<String, Object> data, ContextScope scope,
                                             String parentContextId, List<ContextInheritanceRule> rules);

    Result<HierarchicalContext> getNodeContext(NodeId nodeId);

    /**
     * 以 updatingNodeId 的身份合并写入 targetNodeId 的上下文
     */
    Result<Void> updateNodeContext(NodeId updatingNodeId, NodeId targetNodeId, Map<String, Object> data);

    /**
     * 返回 自身 -> 父 -> ... -> 根 的上下文链，最多遍历 maxHierarchyDepth 层
     */
    Result<HierarchicalContext> getHierarchicalContext(NodeId nodeId);

    /**
     * 按规则把源上下文的属性复制到目标节点；目标没有上下文时以源为父新建
     */
    Result<Void> propagateContext(String sourceContextId, NodeId targetNodeId, List<ContextInheritanceRule> rules);

    Result<ContextValidationResult> validateContextAccess(NodeId contextNodeId, NodeId requestingNodeId,
                                                          ContextAccessLevel accessLevel, List<String> properties);

    Result<NodeContext> getNodeContextWithAccess(NodeId requestingNodeId, NodeId targetNodeId,
                                                 ContextAccessLevel accessLevel);

    Result<List<ContextAccessResult>> getAccessibleContexts(NodeId requestingNodeId);

    /**
     * 深拷贝源上下文到目标节点，返回新上下文 ID；源上下文不变
     */
    Result<String> cloneContextScope(String sourceContextId, NodeId targetNodeId, ContextScope newScope,
                                     CloneOptions options);

    /**
     * 按顺序合并多个上下文到目标节点，返回新上下文 ID；源上下文不变
     */
    Result<String> mergeContextScopes(List<String> sourceContextIds, NodeId targetNodeId, ContextScope targetScope,
                                      MergeOptions options);

    /**
     * 删除节点的上下文及其派生的后代上下文，可重复调用
     */
    Result<Void> clearNodeContext(NodeId nodeId);
}
