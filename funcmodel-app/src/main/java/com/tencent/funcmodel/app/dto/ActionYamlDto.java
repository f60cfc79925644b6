package com.tencent.funcmodel.app.dto;

import lombok.Data;

import java.util.Map;

@Data
public class ActionYamlDto {
    private String id;
    private String type; // tetherNode / kbNode / functionModelContainer
    private String name;
    private String description;
    private String executionMode;
    private Integer executionOrder;
    private Integer priority;
    private Long estimatedDurationMs;
    private Long timeoutMs;
    private String condition;
    private boolean required;
    private RetryYamlDto retry;
    private Map<String, Object> data; // actionSpecificData
}
