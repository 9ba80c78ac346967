package fpt.com.ehraccess.common.event;

import lombok.*;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventPayload {
    private EventType type;
    private String description;
    private String operator;
    private Instant timestamp;
    private Map<String, Object> data;

    public String getEventCode() {
        return type == null ? null : type.getCode();
    }
}
