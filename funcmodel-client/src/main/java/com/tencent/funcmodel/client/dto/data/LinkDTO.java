package com.tencent.funcmodel.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String linkId;
    private String sourceNodeId;
    private String targetNodeId;
    private String linkType;
    private double linkStrength;
    private boolean bidirectional;
}
