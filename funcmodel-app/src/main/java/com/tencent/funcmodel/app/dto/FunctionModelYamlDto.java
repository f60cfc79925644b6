package com.tencent.funcmodel.app.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class FunctionModelYamlDto {
    private String modelId;
    private String name;
    private String description;
    private String version;
    private String owner;
    private List<String> editors;
    private List<String> viewers;
    private Map<String, Object> metadata;
    private List<NodeYamlDto> nodes;
    private List<EdgeYamlDto> edges;
    private boolean publish;
}
