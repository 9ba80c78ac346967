package fpt.com.ehraccess.domain.authorization.service;

import fpt.com.ehraccess.common.exception.AppException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.ForbiddenException;
import fpt.com.ehraccess.domain.authorization.entity.AuthorizationEdge;
import fpt.com.ehraccess.domain.authorization.repository.AuthorizationEdgeRepository;
import fpt.com.ehraccess.domain.identity.entity.Actor;
import fpt.com.ehraccess.domain.identity.entity.ActorRole;
import fpt.com.ehraccess.domain.identity.service.IdentityRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthorizationGraphServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private AuthorizationEdgeRepository repository;

    @Mock
    private IdentityRegistryService identityRegistry;

    private AuthorizationGraphService service;

    @BeforeEach
    void setUp() {
        service = new AuthorizationGraphService(repository, identityRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void registered(String address, ActorRole role) {
        lenient().when(identityRegistry.find(address)).thenReturn(Optional.of(
                Actor.builder().address(address).name(address).role(role).registered(true)
                        .registeredAt(NOW).fresh(false).build()));
    }

    @Test
    @DisplayName("First grant creates an active edge")
    void grantCreatesEdge() {
        registered("p1", ActorRole.PATIENT);
        registered("d1", ActorRole.DOCTOR);
        when(repository.findByPatientAddressAndProviderAddress("p1", "d1")).thenReturn(Optional.empty());

        assertTrue(service.grant("p1", "d1"));

        ArgumentCaptor<AuthorizationEdge> captor = ArgumentCaptor.forClass(AuthorizationEdge.class);
        verify(repository).save(captor.capture());
        assertTrue(captor.getValue().isActive());
        assertEquals(NOW, captor.getValue().getGrantedAt());
    }

    @Test
    @DisplayName("Granting an active edge again is a no-op")
    void grantIsIdempotent() {
        registered("p1", ActorRole.PATIENT);
        registered("d1", ActorRole.DOCTOR);
        AuthorizationEdge active = AuthorizationEdge.builder().patientAddress("p1").providerAddress("d1").active(true).build();
        when(repository.findByPatientAddressAndProviderAddress("p1", "d1")).thenReturn(Optional.of(active));

        assertFalse(service.grant("p1", "d1"));
        verify(repository, never()).save(any());
    }

    @Test
    void grantReactivatesRevokedEdge() {
        registered("p1", ActorRole.PATIENT);
        registered("d1", ActorRole.DOCTOR);
        AuthorizationEdge revoked = AuthorizationEdge.builder().patientAddress("p1").providerAddress("d1")
                .active(false).revokedAt(NOW.minusSeconds(60)).build();
        when(repository.findByPatientAddressAndProviderAddress("p1", "d1")).thenReturn(Optional.of(revoked));

        assertTrue(service.grant("p1", "d1"));
        assertTrue(revoked.isActive());
        assertNull(revoked.getRevokedAt());
        verify(repository).save(revoked);
    }

    @Test
    @DisplayName("A doctor cannot grant as a patient")
    void nonPatientCannotGrant() {
        registered("d1", ActorRole.DOCTOR);

        ForbiddenException ex = assertThrows(ForbiddenException.class, () -> service.grant("d1", "p1"));
        assertEquals(ErrorCode.NOT_A_PATIENT, ex.getCode());
    }

    @Test
    void unregisteredPatientAndProviderAreReported() {
        when(identityRegistry.find("ghost")).thenReturn(Optional.empty());
        AppException patientEx = assertThrows(AppException.class, () -> service.grant("ghost", "d1"));
        assertEquals(ErrorCode.NOT_REGISTERED, patientEx.getCode());
        assertEquals("patientAddress", patientEx.getField());

        registered("p1", ActorRole.PATIENT);
        AppException providerEx = assertThrows(AppException.class, () -> service.grant("p1", "ghost"));
        assertEquals(ErrorCode.NOT_REGISTERED, providerEx.getCode());
        assertEquals("providerAddress", providerEx.getField());
    }

    @Test
    void patientCannotBeGrantee() {
        registered("p1", ActorRole.PATIENT);
        registered("p2", ActorRole.PATIENT);

        AppException ex = assertThrows(AppException.class, () -> service.grant("p1", "p2"));
        assertEquals(ErrorCode.TARGET_IS_PATIENT, ex.getCode());
    }

    @Test
    void revokeDeactivatesAndRepeatsAsNoOp() {
        when(identityRegistry.isRole("p1", ActorRole.PATIENT)).thenReturn(true);
        AuthorizationEdge edge = AuthorizationEdge.builder().patientAddress("p1").providerAddress("d1").active(true).build();
        when(repository.findByPatientAddressAndProviderAddress("p1", "d1")).thenReturn(Optional.of(edge));

        assertTrue(service.revoke("p1", "d1"));
        assertFalse(edge.isActive());
        assertEquals(NOW, edge.getRevokedAt());

        assertFalse(service.revoke("p1", "d1"));
        verify(repository, times(1)).save(edge);
    }

    @Test
    void revokeByNonPatientIsRejected() {
        when(identityRegistry.isRole("d1", ActorRole.PATIENT)).thenReturn(false);

        AppException ex = assertThrows(AppException.class, () -> service.revoke("d1", "p1"));
        assertEquals(ErrorCode.NOT_A_PATIENT, ex.getCode());
    }

    @Test
    @DisplayName("Self access needs no edge")
    void selfAccessShortCircuits() {
        assertTrue(service.isAuthorized("p1", "p1"));
        assertFalse(service.isAuthorized("p1", null));
        verifyNoInteractions(repository);
    }

    @Test
    void otherAccessFollowsActiveEdge() {
        when(repository.existsByPatientAddressAndProviderAddressAndActiveTrue("p1", "d1")).thenReturn(true);
        when(repository.existsByPatientAddressAndProviderAddressAndActiveTrue("p1", "d2")).thenReturn(false);

        assertTrue(service.isAuthorized("p1", "d1"));
        assertFalse(service.isAuthorized("p1", "d2"));
    }
}
