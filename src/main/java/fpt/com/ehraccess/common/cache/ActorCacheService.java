package fpt.com.ehraccess.common.cache;

import fpt.com.ehraccess.domain.identity.dto.ActorResponse;

import java.util.Optional;

/**
 * Read-through cache for registered actors. Only registered actors are ever stored:
 * registration is terminal and roles are immutable, so an entry can never go stale.
 */
public interface ActorCacheService {
    Optional<ActorResponse> get(String address);
    void put(ActorResponse actor);
}
