package com.tencent.funcmodel.app.service;

import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.model.command.AddActionNodeCommand;
import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.BackoffStrategy;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 为未指定优先级和重试策略的动作命令补上配置中的默认值
 */
@Component
@RequiredArgsConstructor
public class ActionDefaults {

    private final FunctionModelProperties properties;

    public Result<AddActionNodeCommand> apply(AddActionNodeCommand command) {
        if (command.getPriority() == null) {
            command.setPriority(properties.getDefaultActionPriority());
        }
        if (command.getRetryPolicy() == null && properties.getDefaultMaxRetries() > 0) {
            Result<RetryPolicy> policy = RetryPolicy.of(properties.getDefaultMaxRetries(), BackoffStrategy.CONSTANT);
            if (policy.isFailure()) {
                return policy.propagate();
            }
            command.setRetryPolicy(policy.getValue());
        }
        return Result.ok(command);
    }
}
