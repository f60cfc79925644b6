package com.tencent.funcmodel.domain.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ContextAccessResult - 某节点可访问的一个上下文
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextAccessResult {

    private NodeContext context;

    private ContextRelationship relationship;

    private ContextAccessLevel accessLevel;

    private String accessReason;
}
