package fpt.com.ehraccess.domain.identity.dto;

import fpt.com.ehraccess.domain.identity.entity.Actor;
import fpt.com.ehraccess.domain.identity.entity.ActorRole;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActorResponse {

    private String address;
    private String name;
    private ActorRole role;
    private boolean registered;
    private Instant registeredAt;

    public static ActorResponse from(Actor actor) {
        return ActorResponse.builder()
                .address(actor.getAddress())
                .name(actor.getName())
                .role(actor.getRole())
                .registered(actor.isRegistered())
                .registeredAt(actor.getRegisteredAt())
                .build();
    }

    /**
     * Rebuilds a detached actor, e.g. from a cache entry. Never meant to be saved.
     */
    public Actor toActor() {
        return Actor.builder()
                .address(address)
                .name(name)
                .role(role)
                .registered(registered)
                .registeredAt(registeredAt)
                .fresh(false)
                .build();
    }
}
