package com.tencent.funcmodel.domain.context.impl;

import com.tencent.funcmodel.domain.context.ContextAccessLevel;
import com.tencent.funcmodel.domain.context.ContextScope;
import com.tencent.funcmodel.domain.context.HierarchicalContext;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 服务内部持有的可变上下文，对外只暴露 {@link HierarchicalContext} 快照
 */
@Getter
class ContextEntry {

    private final String contextId;

    private final NodeId nodeId;

    private final ContextScope scope;

    private final Map<String, Object> data;

    private final Map<String, Object> inheritedData;

    private final Set<String> lockedProperties;

    private String parentContextId;

    private final Instant createdAt;

    private Instant updatedAt;

    ContextEntry(String contextId, NodeId nodeId, ContextScope scope, Map<String, Object> data,
                 Map<String, Object> inheritedData, Set<String> lockedProperties, String parentContextId,
                 Instant createdAt) {
        this.contextId = contextId;
        this.nodeId = nodeId;
        this.scope = scope;
        this.data = ContextValues.copyMap(data);
        this.inheritedData = ContextValues.copyMap(inheritedData);
        this.lockedProperties = new LinkedHashSet<>(lockedProperties);
        this.parentContextId = parentContextId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    Map<String, Object> effectiveData() {
        Map<String, Object> effective = new LinkedHashMap<>(inheritedData);
        effective.putAll(data);
        return effective;
    }

    boolean hasProperty(String property) {
        return data.containsKey(property) || inheritedData.containsKey(property);
    }

    boolean isLocked(String property) {
        return lockedProperties.contains(property);
    }

    void putAll(Map<String, Object> values, Instant now) {
        data.putAll(ContextValues.copyMap(values));
        updatedAt = now;
    }

    /**
     * 继承值取代同名的自有值
     */
    void inherit(String property, Object value, boolean locked, Instant now) {
        data.remove(property);
        inheritedData.put(property, ContextValues.copyValue(value));
        if (locked) {
            lockedProperties.add(property);
        }
        updatedAt = now;
    }

    void attachTo(String newParentContextId) {
        if (parentContextId == null) {
            parentContextId = newParentContextId;
        }
    }

    ContextAccessLevel defaultAccessLevel() {
        return scope == ContextScope.ISOLATED ? ContextAccessLevel.READ : ContextAccessLevel.READ_WRITE;
    }

    HierarchicalContext snapshot(List<String> childContextIds) {
        return HierarchicalContext.builder()
                .contextId(contextId)
                .nodeId(nodeId)
                .scope(scope)
                .data(Collections.unmodifiableMap(ContextValues.copyMap(data)))
                .inheritedData(Collections.unmodifiableMap(ContextValues.copyMap(inheritedData)))
                .lockedProperties(Collections.unmodifiableSet(new LinkedHashSet<>(lockedProperties)))
                .accessLevel(defaultAccessLevel())
                .parentContextId(parentContextId)
                .childContextIds(Collections.unmodifiableList(childContextIds))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .totalLevels(1)
                .build();
    }
}
