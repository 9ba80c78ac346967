package fpt.com.ehraccess.domain.identity.service;

import fpt.com.ehraccess.common.cache.ActorCacheService;
import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ConflictException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.NotFoundException;
import fpt.com.ehraccess.common.util.TimeUtils;
import fpt.com.ehraccess.domain.identity.dto.ActorResponse;
import fpt.com.ehraccess.domain.identity.entity.Actor;
import fpt.com.ehraccess.domain.identity.entity.ActorRole;
import fpt.com.ehraccess.domain.identity.repository.ActorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the actor lifecycle: unregistered, then registered for good.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityRegistryService {

    private final ActorRepository repository;
    private final ActorCacheService actorCache;
    private final Clock clock;

    /**
     * Runs without an outer transaction: the insert commits or fails on its own, so the address can be
     * checked again after a rejected insert.
     */
    public Actor register(String address, String name, String role) {
        String normalizedAddress = requireText(address, "address", Constants.MAX_ADDRESS_LENGTH);
        // an existing address wins over any other complaint about the payload
        if (repository.existsById(normalizedAddress)) {
            throw new ConflictException(ErrorCode.ALREADY_REGISTERED, "address");
        }
        String normalizedName = requireText(name, "name", Constants.MAX_NAME_LENGTH);
        ActorRole parsedRole = ActorRole.parse(role);

        Actor actor = Actor.builder()
                .address(normalizedAddress)
                .name(normalizedName)
                .role(parsedRole)
                .registered(true)
                .registeredAt(TimeUtils.now(clock))
                .build();
        try {
            Actor saved = repository.saveAndFlush(actor);
            log.info("Registered actor {} as {}", saved.getAddress(), saved.getRole());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            if (repository.existsById(normalizedAddress)) {
                log.debug("Concurrent registration lost for {}", normalizedAddress);
                throw new ConflictException(ErrorCode.ALREADY_REGISTERED, "address");
            }
            log.error("Registration of {} rejected by the store", normalizedAddress, ex);
            throw ex;
        }
    }

    @Transactional(readOnly = true)
    public Actor lookup(String address) {
        return find(address).orElseThrow(() -> new NotFoundException(ErrorCode.NOT_FOUND, "address"));
    }

    @Transactional(readOnly = true)
    public Optional<Actor> find(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        String key = address.trim();
        Optional<ActorResponse> cached = actorCache.get(key);
        if (cached.isPresent()) {
            return cached.map(ActorResponse::toActor);
        }
        Optional<Actor> stored = repository.findById(key).filter(Actor::isRegistered);
        stored.ifPresent(a -> actorCache.put(ActorResponse.from(a)));
        return stored;
    }

    @Transactional(readOnly = true)
    public boolean isRole(String address, ActorRole role) {
        if (role == null) return false;
        return find(address).map(a -> a.hasRole(role)).orElse(false);
    }

    @Transactional(readOnly = true)
    public List<Actor> listProviders() {
        List<ActorRole> providerRoles = Arrays.stream(ActorRole.values())
                .filter(ActorRole::isProvider)
                .collect(Collectors.toList());
        return repository.findByRoleInAndRegisteredTrueOrderByNameAsc(providerRoles);
    }

    private String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, field);
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, field);
        }
        return trimmed;
    }
}
