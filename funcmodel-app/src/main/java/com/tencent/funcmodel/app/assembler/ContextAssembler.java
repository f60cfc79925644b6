package com.tencent.funcmodel.app.assembler;

import com.tencent.funcmodel.client.dto.data.AccessCheckDTO;
import com.tencent.funcmodel.client.dto.data.ContextDTO;
import com.tencent.funcmodel.domain.context.ContextValidationResult;
import com.tencent.funcmodel.domain.context.HierarchicalContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 上下文领域对象 -> client DTO
 */
public final class ContextAssembler {

    private ContextAssembler() {
    }

    public static ContextDTO toDTO(HierarchicalContext context) {
        List<String> inherited = new ArrayList<>();
        for (String property : context.getInheritedData().keySet()) {
            if (context.isInherited(property)) {
                inherited.add(property);
            }
        }
        List<String> chain = new ArrayList<>();
        for (HierarchicalContext level : context.getLevels()) {
            chain.add(level.getContextId());
        }
        return ContextDTO.builder()
                .contextId(context.getContextId())
                .nodeId(context.getNodeId().getValue())
                .scope(context.getScope().getValue())
                .accessLevel(context.getAccessLevel() == null ? null : context.getAccessLevel().getValue())
                .parentContextId(context.getParentContextId())
                .data(new LinkedHashMap<>(context.getEffectiveData()))
                .inheritedProperties(inherited)
                .lockedProperties(new ArrayList<>(context.getLockedProperties()))
                .chain(chain)
                .maxDepthReached(context.isMaxDepthReached())
                .build();
    }

    public static AccessCheckDTO toDTO(ContextValidationResult result) {
        return AccessCheckDTO.builder()
                .granted(result.isGranted())
                .level(result.getLevel() == null ? null : result.getLevel().getValue())
                .relationship(result.getRelationship() == null ? null : result.getRelationship().getValue())
                .accessibleProperties(new ArrayList<>(result.getAccessibleProperties()))
                .restrictedProperties(new ArrayList<>(result.getRestrictedProperties()))
                .denialReason(result.getDenialReason())
                .build();
    }
}
