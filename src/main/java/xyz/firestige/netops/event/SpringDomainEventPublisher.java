package xyz.firestige.netops.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * 运行事件转发到 Spring 本地事件总线
 * <p>
 * 监听方（通知、审计）通过 {@code @EventListener} 订阅 {@link RunEvent} 子类。
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringDomainEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        if (event instanceof RunEvent && log.isDebugEnabled()) {
            RunEvent runEvent = (RunEvent) event;
            log.debug("发布事件: {}, runId: {}", runEvent.getEventName(), runEvent.getRunId());
        }
        applicationEventPublisher.publishEvent(event);
    }
}
