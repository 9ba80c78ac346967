package fpt.com.ehraccess.common.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppExceptionTest {

    @Test
    void messageCarriesCodeAndField() {
        AppException ex = new NotFoundException(ErrorCode.NOT_FOUND, "recordId");

        assertEquals("NOT_FOUND: recordId", ex.getMessage());
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
        assertEquals(RetryPolicy.FIX_INPUT, ex.getRetryPolicy());
    }

    @Test
    void statusFollowsTheExceptionType() {
        assertEquals(HttpStatus.BAD_REQUEST, new BadRequestException(ErrorCode.INVALID_TYPE, "recordType").getStatus());
        assertEquals(HttpStatus.CONFLICT, new ConflictException(ErrorCode.ALREADY_REGISTERED, "address").getStatus());
        assertEquals(HttpStatus.FORBIDDEN, new ForbiddenException(ErrorCode.NOT_A_PATIENT, "patientAddress").getStatus());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, new ServiceUnavailableException(ErrorCode.LANE_BUSY, "patient:p1").getStatus());
    }

    @Test
    void onlyTransientCodesAreWorthRetrying() {
        for (ErrorCode code : ErrorCode.values()) {
            boolean transientCode = code == ErrorCode.AUDIT_APPEND_FAILED
                    || code == ErrorCode.LANE_BUSY
                    || code == ErrorCode.OPERATION_CANCELLED;
            assertEquals(transientCode, code.getRetryPolicy() == RetryPolicy.WAIT_AND_RETRY, code.name());
        }
        assertEquals(RetryPolicy.NEVER, ErrorCode.NOT_AUTHORIZED.getRetryPolicy());
        assertEquals(RetryPolicy.NEVER, ErrorCode.ALREADY_REGISTERED.getRetryPolicy());
    }

    @Test
    void auditFailureKeepsRecordAndCause() {
        IllegalStateException cause = new IllegalStateException("db down");
        AuditAppendFailedException ex = new AuditAppendFailedException(5L, cause);

        assertEquals(5L, ex.getRecordId());
        assertSame(cause, ex.getCause());
        assertEquals(Map.of("recordId", 5L), ex.getParams());
        assertEquals(RetryPolicy.WAIT_AND_RETRY, ex.getRetryPolicy());
    }
}
