package com.tencent.funcmodel.app.dto;

import lombok.Data;

@Data
public class EdgeYamlDto {
    private String source;
    private String target;
    private String type; // linkType
    private Double strength;
    private boolean bidirectional;
}
