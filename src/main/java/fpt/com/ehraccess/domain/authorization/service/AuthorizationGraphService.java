package fpt.com.ehraccess.domain.authorization.service;

import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.ForbiddenException;
import fpt.com.ehraccess.common.exception.NotFoundException;
import fpt.com.ehraccess.common.util.TimeUtils;
import fpt.com.ehraccess.domain.authorization.entity.AuthorizationEdge;
import fpt.com.ehraccess.domain.authorization.repository.AuthorizationEdgeRepository;
import fpt.com.ehraccess.domain.identity.entity.Actor;
import fpt.com.ehraccess.domain.identity.entity.ActorRole;
import fpt.com.ehraccess.domain.identity.service.IdentityRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sole writer of authorization edges. Grant and revoke are idempotent so client retries are safe.
 * Callers are expected to hold the patient's lane around grant/revoke.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationGraphService {

    private final AuthorizationEdgeRepository repository;
    private final IdentityRegistryService identityRegistry;
    private final Clock clock;

    /**
     * @return true when an edge was created or reactivated, false when it was already active
     */
    @Transactional
    public boolean grant(String patientAddress, String providerAddress) {
        Actor patient = identityRegistry.find(patientAddress)
                .orElseThrow(() -> new NotFoundException(ErrorCode.NOT_REGISTERED, "patientAddress"));
        if (patient.getRole() != ActorRole.PATIENT) {
            throw new ForbiddenException(ErrorCode.NOT_A_PATIENT, "patientAddress");
        }
        Actor provider = identityRegistry.find(providerAddress)
                .orElseThrow(() -> new NotFoundException(ErrorCode.NOT_REGISTERED, "providerAddress"));
        if (!provider.getRole().isProvider()) {
            throw new BadRequestException(ErrorCode.TARGET_IS_PATIENT, "providerAddress");
        }

        Optional<AuthorizationEdge> existing = repository.findByPatientAddressAndProviderAddress(
                patient.getAddress(), provider.getAddress());
        if (existing.isPresent() && existing.get().isActive()) {
            log.debug("Grant {} -> {} already active", patient.getAddress(), provider.getAddress());
            return false;
        }

        AuthorizationEdge edge = existing.orElseGet(() -> AuthorizationEdge.builder()
                .patientAddress(patient.getAddress())
                .providerAddress(provider.getAddress())
                .build());
        edge.setActive(true);
        edge.setGrantedAt(TimeUtils.now(clock));
        edge.setRevokedAt(null);
        repository.save(edge);
        log.info("Patient {} granted access to {}", patient.getAddress(), provider.getAddress());
        return true;
    }

    /**
     * @return true when an active edge was deactivated, false when there was nothing to revoke
     */
    @Transactional
    public boolean revoke(String patientAddress, String providerAddress) {
        if (!identityRegistry.isRole(patientAddress, ActorRole.PATIENT)) {
            throw new ForbiddenException(ErrorCode.NOT_A_PATIENT, "patientAddress");
        }
        if (providerAddress == null || providerAddress.isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, "providerAddress");
        }
        Optional<AuthorizationEdge> existing = repository.findByPatientAddressAndProviderAddress(
                patientAddress.trim(), providerAddress.trim());
        if (existing.isEmpty() || !existing.get().isActive()) {
            log.debug("Revoke {} -> {} is a no-op", patientAddress, providerAddress);
            return false;
        }
        AuthorizationEdge edge = existing.get();
        edge.setActive(false);
        edge.setRevokedAt(TimeUtils.now(clock));
        repository.save(edge);
        log.info("Patient {} revoked access of {}", edge.getPatientAddress(), edge.getProviderAddress());
        return true;
    }

    /**
     * Self-access is implicit; it is never stored as an edge and so can never be revoked.
     */
    @Transactional(readOnly = true)
    public boolean isAuthorized(String patientAddress, String providerAddress) {
        if (patientAddress == null || providerAddress == null) {
            return false;
        }
        String patient = patientAddress.trim();
        String provider = providerAddress.trim();
        if (Objects.equals(patient, provider)) {
            return !patient.isEmpty();
        }
        return repository.existsByPatientAddressAndProviderAddressAndActiveTrue(patient, provider);
    }

    @Transactional(readOnly = true)
    public List<String> listAuthorizedProviders(String patientAddress) {
        if (patientAddress == null || patientAddress.isBlank()) {
            return List.of();
        }
        return repository.findActiveProviderAddresses(patientAddress.trim());
    }
}
