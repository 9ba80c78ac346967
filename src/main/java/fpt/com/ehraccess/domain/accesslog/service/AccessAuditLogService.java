package fpt.com.ehraccess.domain.accesslog.service;

import fpt.com.ehraccess.common.concurrent.LaneLockRegistry;
import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.ForbiddenException;
import fpt.com.ehraccess.common.exception.NotFoundException;
import fpt.com.ehraccess.common.util.TimeUtils;
import fpt.com.ehraccess.domain.accesslog.dto.ChainVerification;
import fpt.com.ehraccess.domain.accesslog.entity.AccessAction;
import fpt.com.ehraccess.domain.accesslog.entity.AccessLogEntry;
import fpt.com.ehraccess.domain.accesslog.repository.AccessLogEntryRepository;
import fpt.com.ehraccess.domain.authorization.service.AuthorizationGraphService;
import fpt.com.ehraccess.domain.record.entity.RecordEntry;
import fpt.com.ehraccess.domain.record.service.RecordLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only, per-record access history. Each entry is chained to its predecessor by hash.
 * <p>
 * Appends for one record run on the {@code record:<id>} lane and commit before the lane is released,
 * so sequence numbers and timestamps grow together.
 */
@Slf4j
@Service
public class AccessAuditLogService {

    private final AccessLogEntryRepository repository;
    private final RecordLedgerService recordLedger;
    private final AuthorizationGraphService authorizationGraph;
    private final AccessLogChainHasher hasher;
    private final LaneLockRegistry lanes;
    private final TransactionTemplate appendTransaction;
    private final Clock clock;
    private final boolean allowAuthorizedProviders;

    public AccessAuditLogService(AccessLogEntryRepository repository,
                                 RecordLedgerService recordLedger,
                                 AuthorizationGraphService authorizationGraph,
                                 AccessLogChainHasher hasher,
                                 LaneLockRegistry lanes,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock,
                                 @Value("${app.access-log.allow-authorized-providers:false}") boolean allowAuthorizedProviders) {
        this.repository = repository;
        this.recordLedger = recordLedger;
        this.authorizationGraph = authorizationGraph;
        this.hasher = hasher;
        this.lanes = lanes;
        this.appendTransaction = new TransactionTemplate(transactionManager);
        this.appendTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.allowAuthorizedProviders = allowAuthorizedProviders;
    }

    public AccessLogEntry append(Long recordId, String accessor, AccessAction action, String context) {
        return append(recordId, accessor, action, context, null);
    }

    /**
     * @param occurredAt when the access happened; null means now. Replayed entries keep their original time
     *                   while {@code timestamp} still records the append.
     */
    public AccessLogEntry append(Long recordId, String accessor, AccessAction action, String context, Instant occurredAt) {
        if (action == null) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, "action");
        }
        if (accessor == null || accessor.isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_ARGUMENT, "accessorAddress");
        }
        if (!recordLedger.exists(recordId)) {
            throw new NotFoundException(ErrorCode.NOT_FOUND, "recordId");
        }
        String accessorAddress = accessor.trim();
        String boundedContext = AccessLogChainHasher.boundContext(context);
        return lanes.withLane(Constants.RECORD_LANE_PREFIX + recordId,
                () -> appendTransaction.execute(status -> appendInLane(recordId, accessorAddress, action, boundedContext, occurredAt)));
    }

    private AccessLogEntry appendInLane(Long recordId, String accessor, AccessAction action, String context, Instant occurredAt) {
        Optional<AccessLogEntry> last = repository.findTopByRecordIdOrderBySequenceNoDesc(recordId);
        int sequenceNo = last.map(e -> e.getSequenceNo() + 1).orElse(1);
        String previousHash = last.map(AccessLogEntry::getEntryHash).orElse(AccessLogChainHasher.GENESIS_HASH);
        // a clock step backwards must not reorder the chain
        Instant timestamp = TimeUtils.latest(TimeUtils.now(clock), last.map(AccessLogEntry::getTimestamp).orElse(null));
        Instant occurred = occurredAt == null ? timestamp : TimeUtils.truncate(occurredAt);

        AccessLogEntry entry = AccessLogEntry.builder()
                .recordId(recordId)
                .sequenceNo(sequenceNo)
                .accessorAddress(accessor)
                .action(action)
                .context(context)
                .occurredAt(occurred)
                .timestamp(timestamp)
                .previousHash(previousHash)
                .entryHash(hasher.hash(recordId, sequenceNo, accessor, action, context, occurred, timestamp, previousHash))
                .build();
        AccessLogEntry saved = repository.save(entry);
        log.debug("Access log #{} for record {}: {} by {}", sequenceNo, recordId, action, accessor);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AccessLogEntry> getLogsForRecord(Long recordId, String requester) {
        RecordEntry record = recordLedger.getRecord(recordId);
        requireLogReader(record, requester);
        return List.copyOf(repository.findByRecordIdOrderByTimestampAscSequenceNoAsc(recordId));
    }

    /**
     * The record owner always; authorized providers only when {@code app.access-log.allow-authorized-providers} is on.
     */
    public boolean canReadLogs(RecordEntry record, String requester) {
        if (requester == null || requester.isBlank()) {
            return false;
        }
        String caller = requester.trim();
        if (Objects.equals(record.getPatientAddress(), caller)) {
            return true;
        }
        return allowAuthorizedProviders && authorizationGraph.isAuthorized(record.getPatientAddress(), caller);
    }

    public void requireLogReader(RecordEntry record, String requester) {
        if (!canReadLogs(record, requester)) {
            log.debug("Log read on record {} denied for {}", record.getRecordId(), requester);
            throw new ForbiddenException(ErrorCode.NOT_AUTHORIZED, "requester");
        }
    }

    @Transactional(readOnly = true)
    public ChainVerification verifyChain(Long recordId) {
        if (!recordLedger.exists(recordId)) {
            throw new NotFoundException(ErrorCode.NOT_FOUND, "recordId");
        }
        List<AccessLogEntry> entries = repository.findByRecordIdOrderBySequenceNoAsc(recordId);
        String expectedPrevious = AccessLogChainHasher.GENESIS_HASH;
        int expectedSequence = 1;
        for (AccessLogEntry entry : entries) {
            boolean intact = entry.getSequenceNo() == expectedSequence
                    && Objects.equals(entry.getPreviousHash(), expectedPrevious)
                    && Objects.equals(entry.getEntryHash(), hasher.hash(entry));
            if (!intact) {
                log.warn("Access log chain of record {} broken at #{}", recordId, entry.getSequenceNo());
                return new ChainVerification(recordId, entries.size(), false, entry.getSequenceNo());
            }
            expectedPrevious = entry.getEntryHash();
            expectedSequence++;
        }
        return new ChainVerification(recordId, entries.size(), true, null);
    }
}
