package fpt.com.ehraccess.common.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * In-process event bus (Spring events). A broker relay can listen to the same payloads.
 */
@Slf4j
@Component
public class EventPublisher {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public EventPublisher(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    public void publish(EventType type, String operator, String description, Map<String, Object> data) {
        publish(EventPayload.builder()
                .type(type)
                .operator(operator)
                .description(description)
                .timestamp(clock.instant())
                .data(data)
                .build());
    }

    public void publish(EventPayload payload) {
        log.info("[EVENT] {} by {} - {}",
                payload.getType(),
                payload.getOperator(),
                payload.getDescription());
        publisher.publishEvent(payload);
    }
}
