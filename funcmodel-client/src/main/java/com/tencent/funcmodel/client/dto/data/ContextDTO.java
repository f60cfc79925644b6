package com.tencent.funcmodel.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 节点上下文视图，data 为合并继承属性后的可见数据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String contextId;
    private String nodeId;
    private String scope;
    private String accessLevel;
    private String parentContextId;

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @Builder.Default
    private List<String> inheritedProperties = new ArrayList<>();

    @Builder.Default
    private List<String> lockedProperties = new ArrayList<>();

    /**
     * 层级链上的上下文 ID，自身在前
     */
    @Builder.Default
    private List<String> chain = new ArrayList<>();

    private boolean maxDepthReached;
}
