package fpt.com.ehraccess.domain.accesslog.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One access event on one record. Rows are insert-only and chained per record through
 * {@code previousHash} so any later edit is detectable.
 */
@Entity
@Immutable
@Table(name = "access_log_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_access_log_record_seq", columnNames = {"record_id", "sequence_no"}),
        indexes = @Index(name = "idx_access_log_record_ts", columnList = "record_id, log_timestamp"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class AccessLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "access_log_seq")
    @SequenceGenerator(name = "access_log_seq", sequenceName = "access_log_seq", allocationSize = 1)
    @Column(name = "log_id", nullable = false, updatable = false)
    private Long logId;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(name = "sequence_no", nullable = false)
    private int sequenceNo;

    @Column(name = "accessor_address", length = 128, nullable = false)
    private String accessorAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", length = 16, nullable = false)
    private AccessAction action;

    @Column(name = "caller_context", length = 255)
    private String context;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "log_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "previous_hash", length = 64, nullable = false)
    private String previousHash;

    @Column(name = "entry_hash", length = 64, nullable = false)
    private String entryHash;
}
