package xyz.firestige.netops.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 编排引擎只依赖此接口，具体传输（Spring 本地事件、消息队列）由适配器决定。
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件对象
     */
    void publish(Object event);

    /**
     * 批量发布领域事件
     *
     * @param events 领域事件列表
     */
    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }

    /**
     * 不做任何事的发布器，测试与无 Spring 环境使用
     */
    static DomainEventPublisher noop() {
        return event -> { };
    }
}
