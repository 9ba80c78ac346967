package fpt.com.ehraccess.domain.record.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Reference to an externally stored document. Everything except the archive fields is write-once.
 */
@Entity
@Table(name = "record_entries", indexes = {
        @Index(name = "idx_records_patient_created", columnList = "patient_address, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecordEntry {

    // allocationSize 1: ids stay strictly increasing across instances; rolled-back inserts leave gaps
    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "record_entry_seq")
    @SequenceGenerator(name = "record_entry_seq", sequenceName = "record_entry_seq", allocationSize = 1)
    @Column(name = "record_id", nullable = false, updatable = false)
    private Long recordId;

    @Column(name = "patient_address", length = 128, nullable = false, updatable = false)
    private String patientAddress;

    @Column(name = "uploader_address", length = 128, nullable = false, updatable = false)
    private String uploaderAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", length = 32, nullable = false, updatable = false)
    private RecordType recordType;

    @Column(name = "description", length = 2000, updatable = false)
    private String description;

    @Column(name = "content_hash", length = 255, nullable = false, updatable = false)
    private String contentHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @Column(name = "archived_by", length = 128)
    private String archivedBy;

    @Version
    private Long version;

    public void archive(String by, Instant at) {
        this.active = false;
        this.archivedBy = by;
        this.archivedAt = at;
    }
}
