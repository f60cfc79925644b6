package com.tencent.funcmodel.domain.context;

import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * HierarchicalContext - 节点上下文的只读快照
 * <p>
 * data 为节点自身的属性，inheritedData 为从父上下文继承的属性，
 * 读取时自身属性遮蔽继承属性。父子关系只通过 parentContextId 引用。
 * 由 getHierarchicalContext 返回时，levels 按 自身 -> 父 -> ... -> 根 排列。
 * </p>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class HierarchicalContext {

    private final String contextId;

    private final NodeId nodeId;

    private final ContextScope scope;

    @Builder.Default
    private final Map<String, Object> data = Collections.emptyMap();

    @Builder.Default
    private final Map<String, Object> inheritedData = Collections.emptyMap();

    /**
     * 以 override:false 继承、不允许在本上下文改写的属性
     */
    @Builder.Default
    private final Set<String> lockedProperties = Collections.emptySet();

    private final ContextAccessLevel accessLevel;

    private final String parentContextId;

    @Builder.Default
    private final List<String> childContextIds = Collections.emptyList();

    private final Instant createdAt;

    private final Instant updatedAt;

    @Builder.Default
    private final List<HierarchicalContext> levels = Collections.emptyList();

    private final int totalLevels;

    private final boolean maxDepthReached;

    /**
     * 合并后的可见属性: 继承属性在前，自身属性覆盖同名项
     */
    public Map<String, Object> getEffectiveData() {
        Map<String, Object> effective = new LinkedHashMap<>(inheritedData);
        effective.putAll(data);
        return Collections.unmodifiableMap(effective);
    }

    public Optional<Object> get(String property) {
        if (data.containsKey(property)) {
            return Optional.ofNullable(data.get(property));
        }
        return Optional.ofNullable(inheritedData.get(property));
    }

    public boolean isInherited(String property) {
        return !data.containsKey(property) && inheritedData.containsKey(property);
    }

    public boolean hasParent() {
        return parentContextId != null;
    }
}
