package fpt.com.ehraccess.domain.access.service;

import fpt.com.ehraccess.common.blob.BlobStore;
import fpt.com.ehraccess.common.concurrent.LaneLockRegistry;
import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.common.event.EventPublisher;
import fpt.com.ehraccess.common.event.EventType;
import fpt.com.ehraccess.common.exception.AppException;
import fpt.com.ehraccess.common.exception.AuditAppendFailedException;
import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.ForbiddenException;
import fpt.com.ehraccess.common.exception.NotFoundException;
import fpt.com.ehraccess.common.exception.RetryPolicy;
import fpt.com.ehraccess.common.util.TimeUtils;
import fpt.com.ehraccess.domain.access.dto.SubmissionResult;
import fpt.com.ehraccess.domain.accesslog.dto.ChainVerification;
import fpt.com.ehraccess.domain.accesslog.entity.AccessAction;
import fpt.com.ehraccess.domain.accesslog.entity.AccessLogEntry;
import fpt.com.ehraccess.domain.accesslog.service.AccessAuditLogService;
import fpt.com.ehraccess.domain.accesslog.service.AccessLogChainHasher;
import fpt.com.ehraccess.domain.accesslog.service.AuditOutboxService;
import fpt.com.ehraccess.domain.authorization.service.AuthorizationGraphService;
import fpt.com.ehraccess.domain.identity.entity.Actor;
import fpt.com.ehraccess.domain.identity.entity.ActorRole;
import fpt.com.ehraccess.domain.identity.service.IdentityRegistryService;
import fpt.com.ehraccess.domain.record.entity.RecordEntry;
import fpt.com.ehraccess.domain.record.entity.RecordType;
import fpt.com.ehraccess.domain.record.service.RecordLedgerService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for every inbound operation. Authorization is checked here, once, and every read or
 * write of a record is followed by its access log entry.
 * <p>
 * Mutations of a patient's graph or records run on that patient's lane. The lane covers the
 * authorization check and the ledger write only; the audit append happens after it is released.
 */
@Slf4j
@Service
public class AccessFacade {

    private final IdentityRegistryService identityRegistry;
    private final AuthorizationGraphService authorizationGraph;
    private final RecordLedgerService recordLedger;
    private final AccessAuditLogService auditLog;
    private final AuditOutboxService auditOutbox;
    private final LaneLockRegistry lanes;
    private final BlobStore blobStore;
    private final EventPublisher events;
    private final Clock clock;
    private final Counter retryCounter;
    private final Counter pendingCounter;
    private final Counter deniedCounter;
    private final int maxAttempts;
    private final long backoffMs;

    public AccessFacade(IdentityRegistryService identityRegistry,
                        AuthorizationGraphService authorizationGraph,
                        RecordLedgerService recordLedger,
                        AccessAuditLogService auditLog,
                        AuditOutboxService auditOutbox,
                        LaneLockRegistry lanes,
                        BlobStore blobStore,
                        EventPublisher events,
                        Clock clock,
                        MeterRegistry meterRegistry,
                        @Value("${app.audit.append.max-attempts:3}") int maxAttempts,
                        @Value("${app.audit.append.backoff-ms:100}") long backoffMs) {
        this.identityRegistry = identityRegistry;
        this.authorizationGraph = authorizationGraph;
        this.recordLedger = recordLedger;
        this.auditLog = auditLog;
        this.auditOutbox = auditOutbox;
        this.lanes = lanes;
        this.blobStore = blobStore;
        this.events = events;
        this.clock = clock;
        this.retryCounter = meterRegistry.counter("audit.append.retry");
        this.pendingCounter = meterRegistry.counter("audit.append.pending");
        this.deniedCounter = meterRegistry.counter("access.denied");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    // ---- identity ----

    public Actor register(String address, String name, String role) {
        Actor actor = identityRegistry.register(address, name, role);
        events.publish(EventType.ACTOR_REGISTERED, actor.getAddress(), "Actor registered",
                Map.of("role", actor.getRole().name()));
        return actor;
    }

    public Actor lookupActor(String address) {
        return identityRegistry.lookup(address);
    }

    public List<Actor> listProviders() {
        return identityRegistry.listProviders();
    }

    // ---- authorization graph ----

    public boolean grant(String patient, String provider) {
        String patientAddress = requireText(patient, "patientAddress");
        boolean changed = lanes.withLane(patientLane(patientAddress),
                () -> authorizationGraph.grant(patientAddress, provider));
        if (changed) {
            events.publish(EventType.ACCESS_GRANTED, patientAddress, "Access granted",
                    Map.of("providerAddress", provider.trim()));
        }
        return changed;
    }

    public boolean revoke(String patient, String provider) {
        String patientAddress = requireText(patient, "patientAddress");
        boolean changed = lanes.withLane(patientLane(patientAddress),
                () -> authorizationGraph.revoke(patientAddress, provider));
        if (changed) {
            events.publish(EventType.ACCESS_REVOKED, patientAddress, "Access revoked",
                    Map.of("providerAddress", provider.trim()));
        }
        return changed;
    }

    public List<String> listAuthorizedProviders(String patient) {
        return authorizationGraph.listAuthorizedProviders(patient);
    }

    // ---- records ----

    public SubmissionResult submitRecord(String patient, String uploader, String contentHash,
                                         String recordType, String description, String context) {
        RecordType type = RecordType.parse(recordType);
        String patientAddress = requireText(patient, "patientAddress");
        String uploaderAddress = requireText(uploader, "uploaderAddress");
        String hash = requireText(contentHash, "contentHash", Constants.MAX_CONTENT_HASH_LENGTH);
        requireDescription(description);
        requirePatient(patientAddress);

        RecordEntry record = lanes.withLane(patientLane(patientAddress), () -> {
            // checked inside the lane so a revoke committed before this point always wins
            requireAuthorized(patientAddress, uploaderAddress, "uploaderAddress");
            return recordLedger.addRecord(patientAddress, uploaderAddress, hash, type, description);
        });
        events.publish(EventType.RECORD_ADDED, uploaderAddress, "Record added",
                Map.of("recordId", record.getRecordId(), "patientAddress", patientAddress, "recordType", type.name()));

        boolean pending = audit(record.getRecordId(), uploaderAddress, AccessAction.CREATE, context);
        return new SubmissionResult(record, pending);
    }

    /**
     * Stores the document first, then submits a record pointing at it. Authorization is checked up front
     * so unauthorized callers never leave content behind.
     */
    public SubmissionResult submitDocument(String patient, String uploader, byte[] content,
                                           String recordType, String description, String context) {
        RecordType.parse(recordType);
        String patientAddress = requireText(patient, "patientAddress");
        String uploaderAddress = requireText(uploader, "uploaderAddress");
        if (content == null || content.length == 0) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, "content");
        }
        requireDescription(description);
        requirePatient(patientAddress);
        requireAuthorized(patientAddress, uploaderAddress, "uploaderAddress");
        String contentHash = blobStore.put(content);
        return submitRecord(patientAddress, uploaderAddress, contentHash, recordType, description, context);
    }

    /**
     * Active records of the patient, newest first. Nothing is returned unless every VIEW entry was
     * either written or queued.
     */
    public List<RecordEntry> fetchPatientRecords(String patient, String requester, String context) {
        String patientAddress = requireText(patient, "patientAddress");
        String requesterAddress = requireText(requester, "requester");
        requirePatient(patientAddress);
        requireAuthorized(patientAddress, requesterAddress, "requester");

        List<RecordEntry> snapshot = recordLedger.getRecordsForPatient(patientAddress);
        int pending = 0;
        for (RecordEntry record : snapshot) {
            if (audit(record.getRecordId(), requesterAddress, AccessAction.VIEW, context)) {
                pending++;
            }
        }
        if (pending > 0) {
            log.warn("{} of {} VIEW entries for patient {} are pending", pending, snapshot.size(), patientAddress);
        }
        return snapshot;
    }

    public RecordEntry fetchRecord(Long recordId, String requester, String context) {
        String requesterAddress = requireText(requester, "requester");
        RecordEntry record = recordLedger.getRecord(recordId);
        requireAuthorized(record.getPatientAddress(), requesterAddress, "requester");
        audit(record.getRecordId(), requesterAddress, AccessAction.VIEW, context);
        return record;
    }

    public byte[] fetchDocument(Long recordId, String requester, String context) {
        String requesterAddress = requireText(requester, "requester");
        RecordEntry record = recordLedger.getRecord(recordId);
        requireAuthorized(record.getPatientAddress(), requesterAddress, "requester");
        byte[] content = blobStore.get(record.getContentHash());
        audit(record.getRecordId(), requesterAddress, AccessAction.VIEW, context);
        return content;
    }

    /**
     * Only the owning patient may archive. Archiving twice is a no-op and logs nothing the second time.
     */
    public RecordEntry archiveRecord(Long recordId, String requester, String context) {
        String requesterAddress = requireText(requester, "requester");
        RecordEntry record = recordLedger.getRecord(recordId);
        String patientAddress = record.getPatientAddress();
        if (!Objects.equals(patientAddress, requesterAddress)) {
            deniedCounter.increment();
            throw new ForbiddenException(ErrorCode.NOT_AUTHORIZED, "requester");
        }

        AtomicBoolean changed = new AtomicBoolean(false);
        RecordEntry archived = lanes.withLane(patientLane(patientAddress), () -> {
            changed.set(recordLedger.getRecord(recordId).isActive());
            return recordLedger.archive(recordId, requesterAddress);
        });
        if (changed.get()) {
            events.publish(EventType.RECORD_ARCHIVED, requesterAddress, "Record archived",
                    Map.of("recordId", recordId));
            audit(recordId, requesterAddress, AccessAction.ARCHIVE, context);
        }
        return archived;
    }

    // ---- access log ----

    /**
     * Reading the log is not itself logged.
     */
    public List<AccessLogEntry> fetchAccessLogs(Long recordId, String requester) {
        try {
            return auditLog.getLogsForRecord(recordId, requester);
        } catch (ForbiddenException ex) {
            deniedCounter.increment();
            throw ex;
        }
    }

    public ChainVerification verifyAccessLogChain(Long recordId, String requester) {
        RecordEntry record = recordLedger.getRecord(recordId);
        try {
            auditLog.requireLogReader(record, requester);
        } catch (ForbiddenException ex) {
            deniedCounter.increment();
            throw ex;
        }
        return auditLog.verifyChain(recordId);
    }

    // ---- internals ----

    /**
     * Appends with bounded retry, then falls back to the outbox.
     *
     * @return true when the entry was queued instead of written
     * @throws AuditAppendFailedException when the outbox refused it as well
     */
    private boolean audit(Long recordId, String accessor, AccessAction action, String context) {
        Instant occurredAt = TimeUtils.now(clock);
        String boundedContext = AccessLogChainHasher.boundContext(context);
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                auditLog.append(recordId, accessor, action, boundedContext, occurredAt);
                return false;
            } catch (RuntimeException ex) {
                if (isPermanent(ex)) {
                    // would fail the same way on every retry and on replay
                    log.error("Audit entry {} for record {} by {} rejected", action, recordId, accessor, ex);
                    throw new AuditAppendFailedException(recordId, ex);
                }
                lastFailure = ex;
                log.warn("Audit append {} for record {} failed (attempt {}/{}): {}",
                        action, recordId, attempt, maxAttempts, ex.getMessage());
            }
            if (attempt < maxAttempts) {
                retryCounter.increment();
                if (!sleepBackoff(attempt)) {
                    break;
                }
            }
        }

        pendingCounter.increment();
        try {
            auditOutbox.enqueue(recordId, accessor, action, boundedContext, occurredAt);
        } catch (RuntimeException ex) {
            if (lastFailure != null) {
                ex.addSuppressed(lastFailure);
            }
            log.error("Audit entry {} for record {} by {} could not be queued", action, recordId, accessor, ex);
            throw new AuditAppendFailedException(recordId, ex);
        }
        events.publish(EventType.AUDIT_DEFERRED, accessor, "Audit entry queued",
                Map.of("recordId", recordId, "action", action.name()));
        return true;
    }

    private static boolean isPermanent(RuntimeException ex) {
        if (ex instanceof DataIntegrityViolationException) {
            return true;
        }
        return ex instanceof AppException
                && ((AppException) ex).getRetryPolicy() != RetryPolicy.WAIT_AND_RETRY;
    }

    private boolean sleepBackoff(int attempt) {
        long delay = backoffMs * (1L << (attempt - 1));
        if (delay <= 0) return true;
        try {
            TimeUnit.MILLISECONDS.sleep(delay);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void requirePatient(String patientAddress) {
        if (!identityRegistry.isRole(patientAddress, ActorRole.PATIENT)) {
            throw new NotFoundException(ErrorCode.NOT_FOUND, "patientAddress");
        }
    }

    private void requireAuthorized(String patientAddress, String accessor, String field) {
        if (!authorizationGraph.isAuthorized(patientAddress, accessor)) {
            deniedCounter.increment();
            log.debug("Access to patient {} denied for {}", patientAddress, accessor);
            throw new ForbiddenException(ErrorCode.NOT_AUTHORIZED, field);
        }
    }

    private static String patientLane(String patientAddress) {
        return Constants.PATIENT_LANE_PREFIX + patientAddress;
    }

    private static String requireText(String value, String field) {
        return requireText(value, field, Constants.MAX_ADDRESS_LENGTH);
    }

    private static String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank() || value.trim().length() > maxLength) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, field);
        }
        return value.trim();
    }

    private static void requireDescription(String description) {
        if (description != null && description.trim().length() > Constants.MAX_DESCRIPTION_LENGTH) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, "description");
        }
    }
}
