package com.tencent.funcmodel.domain.model.command;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * CreateModelCommand - 创建功能模型命令
 * <p>
 * 模型创建后处于 draft 状态。
 * </p>
 *
 * @author funcmodel
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateModelCommand {

    /**
     * 可选的模型 ID（UUID v4），为空时自动生成
     */
    private String modelId;

    @NotBlank(message = "模型名称不能为空")
    @Size(max = 200, message = "模型名称不能超过200个字符")
    private String name;

    @Size(max = 5000, message = "模型描述不能超过5000个字符")
    private String description;

    /**
     * 初始版本号，为空时为 1.0.0
     */
    private String version;

    @NotBlank(message = "模型所有者不能为空")
    private String owner;

    private List<String> editors;

    private List<String> viewers;

    private Map<String, Object> metadata;
}
