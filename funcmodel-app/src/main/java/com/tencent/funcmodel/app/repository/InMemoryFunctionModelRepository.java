package com.tencent.funcmodel.app.repository;

import com.tencent.funcmodel.domain.model.FunctionModel;
import com.tencent.funcmodel.domain.model.repository.FunctionModelRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 进程内仓储，按模型 ID 保存最新版本
 */
@Repository
public class InMemoryFunctionModelRepository implements FunctionModelRepository {

    private final Map<String, FunctionModel> modelStore;

    public InMemoryFunctionModelRepository() {
        this(new ConcurrentHashMap<>());
    }

    public InMemoryFunctionModelRepository(Map<String, FunctionModel> modelStore) {
        this.modelStore = modelStore;
    }

    @Override
    public void save(FunctionModel model) {
        model.markSaved();
        modelStore.put(model.getModelId(), model);
    }

    @Override
    public Optional<FunctionModel> findById(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(modelStore.get(modelId.toLowerCase()));
    }

    @Override
    public List<FunctionModel> findAll() {
        return modelStore.values().stream()
                .filter(model -> !model.isDeleted())
                .collect(Collectors.toList());
    }

    @Override
    public boolean exists(String modelId) {
        return findById(modelId).isPresent();
    }
}
