package fpt.com.ehraccess.domain.access.dto;

import fpt.com.ehraccess.domain.record.entity.RecordEntry;
import fpt.com.ehraccess.domain.record.entity.RecordType;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecordEntryDto {
    private Long recordId;
    private String patientAddress;
    private String uploaderAddress;
    private RecordType recordType;
    private String description;
    private String contentHash;
    private Instant createdAt;
    private boolean active;
    private Instant archivedAt;
    private String archivedBy;
    // only set on submission
    private Boolean auditPending;

    public static RecordEntryDto from(RecordEntry entry) {
        return RecordEntryDto.builder()
                .recordId(entry.getRecordId())
                .patientAddress(entry.getPatientAddress())
                .uploaderAddress(entry.getUploaderAddress())
                .recordType(entry.getRecordType())
                .description(entry.getDescription())
                .contentHash(entry.getContentHash())
                .createdAt(entry.getCreatedAt())
                .active(entry.isActive())
                .archivedAt(entry.getArchivedAt())
                .archivedBy(entry.getArchivedBy())
                .build();
    }

    public static RecordEntryDto from(SubmissionResult result) {
        RecordEntryDto dto = from(result.getRecord());
        dto.setAuditPending(result.isAuditPending());
        return dto;
    }
}
