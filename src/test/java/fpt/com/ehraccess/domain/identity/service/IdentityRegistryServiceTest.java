package fpt.com.ehraccess.domain.identity.service;

import fpt.com.ehraccess.common.cache.ActorCacheService;
import fpt.com.ehraccess.common.exception.AppException;
import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ConflictException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.NotFoundException;
import fpt.com.ehraccess.domain.identity.dto.ActorResponse;
import fpt.com.ehraccess.domain.identity.entity.Actor;
import fpt.com.ehraccess.domain.identity.entity.ActorRole;
import fpt.com.ehraccess.domain.identity.repository.ActorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityRegistryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30.123456789Z");

    @Mock
    private ActorRepository repository;

    @Mock
    private ActorCacheService actorCache;

    private IdentityRegistryService service;

    @BeforeEach
    void setUp() {
        service = new IdentityRegistryService(repository, actorCache, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Actor actor(String address, ActorRole role) {
        return Actor.builder().address(address).name(address).role(role)
                .registered(true).registeredAt(NOW).fresh(false).build();
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        void storesTrimmedActorWithMicrosecondTimestamp() {
            when(repository.existsById("p1")).thenReturn(false);
            when(repository.saveAndFlush(any(Actor.class))).thenAnswer(inv -> inv.getArgument(0));

            Actor saved = service.register(" p1 ", " Alice ", "patient");

            ArgumentCaptor<Actor> captor = ArgumentCaptor.forClass(Actor.class);
            verify(repository).saveAndFlush(captor.capture());
            assertThat(captor.getValue().isNew()).isTrue();
            assertThat(saved.getAddress()).isEqualTo("p1");
            assertThat(saved.getName()).isEqualTo("Alice");
            assertThat(saved.getRole()).isEqualTo(ActorRole.PATIENT);
            assertThat(saved.isRegistered()).isTrue();
            assertThat(saved.getRegisteredAt()).isEqualTo(Instant.parse("2024-03-01T10:15:30.123456Z"));
        }

        @Test
        @DisplayName("An existing address wins even when name and role are invalid")
        void duplicateBeatsInvalidPayload() {
            when(repository.existsById("p1")).thenReturn(true);

            assertThatThrownBy(() -> service.register("p1", "", "NOT_A_ROLE"))
                    .isInstanceOfSatisfying(ConflictException.class,
                            ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.ALREADY_REGISTERED));
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        void losingAConcurrentInsertIsAlreadyRegistered() {
            when(repository.existsById("p1")).thenReturn(false, true);
            when(repository.saveAndFlush(any(Actor.class))).thenThrow(new DataIntegrityViolationException("pk"));

            assertThatThrownBy(() -> service.register("p1", "Alice", "PATIENT"))
                    .isInstanceOfSatisfying(AppException.class,
                            ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.ALREADY_REGISTERED));
        }

        @Test
        @DisplayName("A store rejection without a stored duplicate is not reported as already registered")
        void rejectionWithoutDuplicateIsRethrown() {
            when(repository.existsById("p1")).thenReturn(false, false);
            DataIntegrityViolationException rejection = new DataIntegrityViolationException("check");
            when(repository.saveAndFlush(any(Actor.class))).thenThrow(rejection);

            assertThatThrownBy(() -> service.register("p1", "Alice", "PATIENT")).isSameAs(rejection);
        }

        @Test
        void addressLongerThanItsColumnIsInvalidArgument() {
            assertThatThrownBy(() -> service.register("a".repeat(200), "P", "PATIENT"))
                    .isInstanceOfSatisfying(BadRequestException.class, ex -> {
                        assertThat(ex.getCode()).isEqualTo(ErrorCode.INVALID_ARGUMENT);
                        assertThat(ex.getField()).isEqualTo("address");
                    });
            verifyNoInteractions(repository);
        }

        @Test
        void addressAtItsColumnLimitIsAccepted() {
            String address = "a".repeat(128);
            when(repository.existsById(address)).thenReturn(false);
            when(repository.saveAndFlush(any(Actor.class))).thenAnswer(inv -> inv.getArgument(0));

            assertThat(service.register(address, "P", "PATIENT").getAddress()).isEqualTo(address);
        }

        @Test
        void nameLongerThanItsColumnIsInvalidArgument() {
            when(repository.existsById("p1")).thenReturn(false);

            assertThatThrownBy(() -> service.register("p1", "n".repeat(256), "PATIENT"))
                    .isInstanceOfSatisfying(BadRequestException.class, ex -> {
                        assertThat(ex.getCode()).isEqualTo(ErrorCode.INVALID_ARGUMENT);
                        assertThat(ex.getField()).isEqualTo("name");
                    });
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        void invalidRoleIsRejected() {
            when(repository.existsById("p1")).thenReturn(false);

            assertThatThrownBy(() -> service.register("p1", "Alice", "NURSE"))
                    .isInstanceOfSatisfying(BadRequestException.class,
                            ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.INVALID_ROLE));
        }

        @Test
        void blankAddressIsInvalidArgument() {
            assertThatThrownBy(() -> service.register("  ", "Alice", "PATIENT"))
                    .isInstanceOfSatisfying(BadRequestException.class, ex -> {
                        assertThat(ex.getCode()).isEqualTo(ErrorCode.INVALID_ARGUMENT);
                        assertThat(ex.getField()).isEqualTo("address");
                    });
            verifyNoInteractions(repository);
        }
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        void cacheHitSkipsRepository() {
            when(actorCache.get("d1")).thenReturn(Optional.of(ActorResponse.from(actor("d1", ActorRole.DOCTOR))));

            Actor found = service.lookup("d1");

            assertThat(found.getRole()).isEqualTo(ActorRole.DOCTOR);
            assertThat(found.isNew()).isFalse();
            verifyNoInteractions(repository);
        }

        @Test
        void cacheMissLoadsAndWarmsCache() {
            when(actorCache.get("d1")).thenReturn(Optional.empty());
            when(repository.findById("d1")).thenReturn(Optional.of(actor("d1", ActorRole.DOCTOR)));

            assertThat(service.lookup("d1").getAddress()).isEqualTo("d1");
            verify(actorCache).put(any(ActorResponse.class));
        }

        @Test
        void unknownAddressIsNotFound() {
            when(actorCache.get("ghost")).thenReturn(Optional.empty());
            when(repository.findById("ghost")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.lookup("ghost"))
                    .isInstanceOfSatisfying(NotFoundException.class,
                            ex -> assertThat(ex.getField()).isEqualTo("address"));
            verify(actorCache, never()).put(any());
        }

        @Test
        void isRoleIsFalseForUnknownActors() {
            when(actorCache.get("ghost")).thenReturn(Optional.empty());
            when(repository.findById("ghost")).thenReturn(Optional.empty());

            assertThat(service.isRole("ghost", ActorRole.PATIENT)).isFalse();
            assertThat(service.isRole(null, ActorRole.PATIENT)).isFalse();
        }
    }

    @Test
    void listProvidersAsksForEveryNonPatientRole() {
        when(repository.findByRoleInAndRegisteredTrueOrderByNameAsc(any()))
                .thenReturn(List.of(actor("d1", ActorRole.DOCTOR)));

        assertThat(service.listProviders()).extracting(Actor::getAddress).containsExactly("d1");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<java.util.Collection<ActorRole>> roles = ArgumentCaptor.forClass(java.util.Collection.class);
        verify(repository).findByRoleInAndRegisteredTrueOrderByNameAsc(roles.capture());
        assertThat(roles.getValue()).containsExactlyInAnyOrder(
                ActorRole.DOCTOR, ActorRole.HOSPITAL, ActorRole.PHARMACY, ActorRole.CLINIC);
    }
}
