package com.tencent.funcmodel.app.event;

import com.tencent.funcmodel.domain.event.ExecutionEvent;
import com.tencent.funcmodel.domain.event.ExecutionEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 记录日志并转发给已注册的监听者
 */
@Slf4j
@Component
public class LoggingExecutionEventPublisher implements ExecutionEventPublisher {

    private final List<Consumer<ExecutionEvent>> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Consumer<ExecutionEvent> listener) {
        listeners.add(listener);
    }

    @Override
    public void publish(ExecutionEvent event) {
        if (event.getNodeId() == null) {
            log.info("[{}] plan={} model={} status={} {}", event.getType(), event.getPlanId(), event.getModelId(),
                    event.getStatus(), event.getMessage() == null ? "" : event.getMessage());
        } else {
            log.debug("[{}] plan={} node={} {} -> {} retries={}", event.getType(), event.getPlanId(),
                    event.getNodeId(), event.getPreviousStatus(), event.getStatus(), event.getRetryCount());
        }
        for (Consumer<ExecutionEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Execution event listener failed for event {}", event.getType(), e);
            }
        }
    }
}
