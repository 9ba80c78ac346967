package fpt.com.ehraccess.common.event;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class EventListenerComponent {

    private final MeterRegistry meterRegistry;

    public EventListenerComponent(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    public void handleEvent(EventPayload payload) {
        log.debug("Received event: {} ({}) | {}",
                payload.getType(), payload.getEventCode(), payload.getData());
        meterRegistry.counter("ehr.events", "type", String.valueOf(payload.getType())).increment();
    }
}
