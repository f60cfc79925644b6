package com.tencent.funcmodel.app.dto;

import lombok.Data;

@Data
public class RetryYamlDto {
    private int maxRetries;
    private String backoff;
    private Long initialDelayMs;
    private Long maxDelayMs;
    private String escalation;
}
