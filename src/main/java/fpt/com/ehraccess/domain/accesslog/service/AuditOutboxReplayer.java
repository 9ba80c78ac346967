package fpt.com.ehraccess.domain.accesslog.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.audit.outbox", name = "replay-enabled", havingValue = "true", matchIfMissing = true)
public class AuditOutboxReplayer {

    private final AuditOutboxService outboxService;

    public AuditOutboxReplayer(AuditOutboxService outboxService) {
        this.outboxService = outboxService;
    }

    @Scheduled(fixedDelayString = "${app.audit.outbox.replay-delay-ms:10000}")
    public void replay() {
        try {
            outboxService.replayPending();
        } catch (RuntimeException ex) {
            // keep the schedule alive; the rows stay PENDING for the next run
            log.error("Pending audit replay run failed", ex);
        }
    }
}
