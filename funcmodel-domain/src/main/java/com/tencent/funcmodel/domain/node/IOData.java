package com.tencent.funcmodel.domain.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * IOData - IO 节点的数据契约
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IOData {

    /**
     * 边界方向: input / output / input-output
     */
    private BoundaryType boundaryType;

    /**
     * 数据类型，如 "json"、"csv"
     */
    private String dataType;

    /**
     * 数据结构描述
     */
    private Map<String, Object> schema;

    /**
     * 是否必填
     */
    private boolean required;

    /**
     * 校验规则
     */
    private List<String> validationRules;

    /**
     * 默认值
     */
    private Object defaultValue;
}
