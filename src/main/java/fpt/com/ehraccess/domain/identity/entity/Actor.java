package fpt.com.ehraccess.domain.identity.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

@Entity
@Table(name = "actors", indexes = {
        @Index(name = "idx_actors_role", columnList = "role")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Actor implements Persistable<String> {

    @Id
    @Column(name = "address", length = 128, nullable = false, updatable = false)
    private String address;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", length = 20, nullable = false, updatable = false)
    private ActorRole role;

    @Column(name = "is_registered", nullable = false)
    private boolean registered;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    // Addresses are assigned by the caller, so save() must persist rather than merge
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public String getId() {
        return address;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    public boolean hasRole(ActorRole expected) {
        return registered && role == expected;
    }
}
