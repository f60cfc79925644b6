package com.tencent.funcmodel.domain.model.repository;

import com.tencent.funcmodel.domain.model.FunctionModel;

import java.util.List;
import java.util.Optional;

/**
 * FunctionModelRepository - 功能模型仓储接口
 * <p>
 * 存储映射不属于领域层，实现放在应用层或基础设施层。
 * </p>
 */
public interface FunctionModelRepository {

    /**
     * 保存模型（新增或覆盖）
     */
    void save(FunctionModel model);

    /**
     * 根据模型 ID 查找
     */
    Optional<FunctionModel> findById(String modelId);

    /**
     * 查找所有未软删除的模型
     */
    List<FunctionModel> findAll();

    boolean exists(String modelId);
}
