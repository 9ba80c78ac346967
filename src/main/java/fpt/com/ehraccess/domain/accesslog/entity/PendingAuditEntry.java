package fpt.com.ehraccess.domain.accesslog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit entry accepted for a committed access but not yet written to the access log.
 */
@Entity
@Table(name = "pending_audit_entries", indexes = {
        @Index(name = "idx_pending_audit_status_created", columnList = "status, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingAuditEntry {

    @Id
    @GeneratedValue
    @Column(name = "pending_id", nullable = false, updatable = false)
    private UUID pendingId;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(name = "accessor_address", length = 128, nullable = false)
    private String accessorAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", length = 16, nullable = false)
    private AccessAction action;

    @Column(name = "caller_context", length = 255)
    private String context;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private PendingAuditStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "applied_at")
    private Instant appliedAt;
}
