package fpt.com.ehraccess.common.exception;

import java.util.Map;

/**
 * The access itself went through (or the record was committed) but neither the audit log
 * nor the pending-audit outbox accepted the entry.
 */
public class AuditAppendFailedException extends ServiceUnavailableException {

    private final Long recordId;

    public AuditAppendFailedException(Long recordId, Throwable cause) {
        super(ErrorCode.AUDIT_APPEND_FAILED, "recordId", Map.of("recordId", recordId));
        this.recordId = recordId;
        initCause(cause);
    }

    public Long getRecordId() {
        return recordId;
    }
}
