package com.tencent.funcmodel.domain.event;

/**
 * ExecutionEventPublisher - 执行事件发布接口
 * <p>
 * 执行引擎通过它通知外部协作者（真正执行动作的一方）。
 * </p>
 */
public interface ExecutionEventPublisher {

    /**
     * 发布一个事件
     * @param event 事件对象
     */
    void publish(ExecutionEvent event);

    /**
     * 不发布任何事件的实现，用于试运行
     */
    static ExecutionEventPublisher noop() {
        return event -> {
        };
    }
}
