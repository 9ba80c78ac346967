package fpt.com.ehraccess.domain.accesslog.service;

import fpt.com.ehraccess.common.util.TimeUtils;
import fpt.com.ehraccess.domain.accesslog.entity.AccessAction;
import fpt.com.ehraccess.domain.accesslog.entity.PendingAuditEntry;
import fpt.com.ehraccess.domain.accesslog.entity.PendingAuditStatus;
import fpt.com.ehraccess.domain.accesslog.repository.PendingAuditEntryRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Holds audit entries whose append failed after the access itself was committed, and replays them
 * into the access log oldest first.
 */
@Slf4j
@Service
public class AuditOutboxService {

    private static final int MAX_ERROR_LENGTH = 500;

    private final PendingAuditEntryRepository repository;
    private final AccessAuditLogService auditLog;
    private final Clock clock;
    private final Counter replayedCounter;
    private final Counter failedCounter;
    private final int batchSize;

    public AuditOutboxService(PendingAuditEntryRepository repository,
                              AccessAuditLogService auditLog,
                              Clock clock,
                              MeterRegistry meterRegistry,
                              @Value("${app.audit.outbox.batch-size:50}") int batchSize) {
        this.repository = repository;
        this.auditLog = auditLog;
        this.clock = clock;
        this.replayedCounter = meterRegistry.counter("audit.outbox.replayed");
        this.failedCounter = meterRegistry.counter("audit.outbox.failed");
        this.batchSize = batchSize;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PendingAuditEntry enqueue(Long recordId, String accessor, AccessAction action, String context, Instant occurredAt) {
        Instant now = TimeUtils.now(clock);
        PendingAuditEntry pending = PendingAuditEntry.builder()
                .recordId(recordId)
                .accessorAddress(accessor)
                .action(action)
                .context(AccessLogChainHasher.boundContext(context))
                .occurredAt(occurredAt == null ? now : TimeUtils.truncate(occurredAt))
                .status(PendingAuditStatus.PENDING)
                .attempts(0)
                .createdAt(now)
                .build();
        PendingAuditEntry saved = repository.save(pending);
        log.warn("Queued {} audit entry for record {} by {} ({})", action, recordId, accessor, saved.getPendingId());
        return saved;
    }

    /**
     * Replays one batch. A failure on a record holds back the rest of that record's entries until the next
     * run so they still land in their original order.
     *
     * @return number of entries written to the access log
     */
    public int replayPending() {
        List<PendingAuditEntry> batch = repository.findByStatusOrderByCreatedAtAsc(
                PendingAuditStatus.PENDING, PageRequest.of(0, batchSize));
        if (batch.isEmpty()) return 0;

        Set<Long> heldBack = new HashSet<>();
        int replayed = 0;
        for (PendingAuditEntry pending : batch) {
            if (heldBack.contains(pending.getRecordId())) {
                continue;
            }
            pending.setAttempts(pending.getAttempts() + 1);
            try {
                auditLog.append(pending.getRecordId(), pending.getAccessorAddress(), pending.getAction(),
                        pending.getContext(), pending.getOccurredAt());
            } catch (RuntimeException ex) {
                heldBack.add(pending.getRecordId());
                pending.setLastError(abbreviate(ex.getMessage()));
                repository.save(pending);
                failedCounter.increment();
                log.warn("Replay of pending audit {} for record {} failed (attempt {}): {}",
                        pending.getPendingId(), pending.getRecordId(), pending.getAttempts(), ex.getMessage());
                continue;
            }
            pending.setStatus(PendingAuditStatus.APPLIED);
            pending.setAppliedAt(TimeUtils.now(clock));
            pending.setLastError(null);
            repository.save(pending);
            replayedCounter.increment();
            replayed++;
        }
        if (replayed > 0) {
            log.info("Replayed {} pending audit entries", replayed);
        }
        return replayed;
    }

    @Transactional(readOnly = true)
    public long countPending(Long recordId) {
        return repository.countByRecordIdAndStatus(recordId, PendingAuditStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return repository.countByStatus(PendingAuditStatus.PENDING);
    }

    private static String abbreviate(String message) {
        if (message == null) return null;
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
