package fpt.com.ehraccess.integration;

import fpt.com.ehraccess.common.exception.AppException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.domain.access.dto.SubmissionResult;
import fpt.com.ehraccess.domain.access.service.AccessFacade;
import fpt.com.ehraccess.domain.accesslog.entity.AccessAction;
import fpt.com.ehraccess.domain.authorization.entity.AuthorizationEdge;
import fpt.com.ehraccess.domain.authorization.repository.AuthorizationEdgeRepository;
import fpt.com.ehraccess.domain.record.entity.RecordEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class LaneConcurrencyIntegrationTest {

    private static final int SUBMITTERS = 8;

    @Autowired
    private AccessFacade facade;

    @Autowired
    private AuthorizationEdgeRepository edgeRepository;

    private final ExecutorService executor = Executors.newFixedThreadPool(SUBMITTERS + 1);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void createsRacingARevokeNeverLandAfterIt() throws Exception {
        facade.register("p1", "Patient One", "PATIENT");
        facade.register("d1", "Doctor One", "DOCTOR");
        facade.grant("p1", "d1");

        CountDownLatch start = new CountDownLatch(1);
        List<Future<SubmissionResult>> submissions = new ArrayList<>();
        for (int i = 0; i < SUBMITTERS; i++) {
            String hash = "hash-" + i;
            submissions.add(executor.submit(() -> {
                start.await();
                return facade.submitRecord("p1", "d1", hash, "LAB_RESULT", null, null);
            }));
        }
        Future<Boolean> revoke = executor.submit(() -> {
            start.await();
            return facade.revoke("p1", "d1");
        });
        start.countDown();

        assertThat(revoke.get(10, TimeUnit.SECONDS)).isTrue();
        int succeeded = 0;
        for (Future<SubmissionResult> f : submissions) {
            try {
                SubmissionResult result = f.get(10, TimeUnit.SECONDS);
                succeeded++;
                assertThat(result.isAuditPending()).isFalse();
            } catch (java.util.concurrent.ExecutionException ex) {
                assertThat(ex.getCause()).isInstanceOf(AppException.class);
                assertThat(((AppException) ex.getCause()).getCode()).isEqualTo(ErrorCode.NOT_AUTHORIZED);
            }
        }

        AuthorizationEdge edge = edgeRepository.findByPatientAddressAndProviderAddress("p1", "d1").orElseThrow();
        List<RecordEntry> records = facade.fetchPatientRecords("p1", "p1", null);
        assertThat(records).hasSize(succeeded);
        for (RecordEntry record : records) {
            assertThat(record.getCreatedAt()).isBeforeOrEqualTo(edge.getRevokedAt());
            assertThat(facade.fetchAccessLogs(record.getRecordId(), "p1"))
                    .filteredOn(e -> e.getAction() == AccessAction.CREATE)
                    .hasSize(1);
        }

        assertThatThrownBy(() -> facade.submitRecord("p1", "d1", "late", "LAB_RESULT", null, null))
                .isInstanceOfSatisfying(AppException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ErrorCode.NOT_AUTHORIZED));
    }
}
