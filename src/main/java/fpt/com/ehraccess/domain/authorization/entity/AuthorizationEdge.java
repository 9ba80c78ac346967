package fpt.com.ehraccess.domain.authorization.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A patient's standing grant to one provider. Revocation flips {@code active}; rows are never deleted.
 */
@Entity
@Table(name = "authorization_edges",
        uniqueConstraints = @UniqueConstraint(name = "uk_edge_patient_provider", columnNames = {"patient_address", "provider_address"}),
        indexes = @Index(name = "idx_edges_patient_active", columnList = "patient_address, is_active"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthorizationEdge {

    @Id
    @GeneratedValue
    @Column(name = "edge_id", nullable = false, updatable = false)
    private UUID edgeId;

    @Column(name = "patient_address", length = 128, nullable = false, updatable = false)
    private String patientAddress;

    @Column(name = "provider_address", length = 128, nullable = false, updatable = false)
    private String providerAddress;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "granted_at")
    private Instant grantedAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Version
    private Long version;
}
