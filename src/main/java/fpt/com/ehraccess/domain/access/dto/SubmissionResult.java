package fpt.com.ehraccess.domain.access.dto;

import fpt.com.ehraccess.domain.record.entity.RecordEntry;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Committed record plus whether its CREATE entry is still waiting in the pending-audit outbox.
 */
@Getter
@AllArgsConstructor
public class SubmissionResult {
    private final RecordEntry record;
    private final boolean auditPending;
}
