package com.tencent.funcmodel.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FunctionModelDTO - 功能模型视图
 * <p>
 * ID 为字符串，枚举为字符串字面量，时间为 ISO-8601 字符串。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionModelDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String modelId;
    private String name;
    private String description;
    private String version;
    private String currentVersion;
    private int versionCount;
    private String status;
    private String owner;
    private List<String> editors;
    private List<String> viewers;
    private boolean deleted;

    @Builder.Default
    private List<NodeDTO> nodes = new ArrayList<>();

    @Builder.Default
    private List<LinkDTO> links = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private String createdAt;
    private String updatedAt;
}
