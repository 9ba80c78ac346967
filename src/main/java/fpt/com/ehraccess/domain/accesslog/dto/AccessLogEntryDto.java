package fpt.com.ehraccess.domain.accesslog.dto;

import fpt.com.ehraccess.domain.accesslog.entity.AccessAction;
import fpt.com.ehraccess.domain.accesslog.entity.AccessLogEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccessLogEntryDto {
    private Long recordId;
    private int sequenceNo;
    private String accessorAddress;
    private AccessAction action;
    private String context;
    private Instant occurredAt;
    private Instant timestamp;
    private String entryHash;

    public static AccessLogEntryDto from(AccessLogEntry entry) {
        return AccessLogEntryDto.builder()
                .recordId(entry.getRecordId())
                .sequenceNo(entry.getSequenceNo())
                .accessorAddress(entry.getAccessorAddress())
                .action(entry.getAction())
                .context(entry.getContext())
                .occurredAt(entry.getOccurredAt())
                .timestamp(entry.getTimestamp())
                .entryHash(entry.getEntryHash())
                .build();
    }
}
