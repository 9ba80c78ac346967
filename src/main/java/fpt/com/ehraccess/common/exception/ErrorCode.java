package fpt.com.ehraccess.common.exception;

public enum ErrorCode {
    ALREADY_REGISTERED(RetryPolicy.NEVER),
    INVALID_ROLE(RetryPolicy.FIX_INPUT),
    INVALID_TYPE(RetryPolicy.FIX_INPUT),
    INVALID_ARGUMENT(RetryPolicy.FIX_INPUT),
    TARGET_IS_PATIENT(RetryPolicy.FIX_INPUT),
    NOT_FOUND(RetryPolicy.FIX_INPUT),
    NOT_REGISTERED(RetryPolicy.FIX_INPUT),
    NOT_AUTHORIZED(RetryPolicy.NEVER),
    NOT_A_PATIENT(RetryPolicy.NEVER),
    AUDIT_APPEND_FAILED(RetryPolicy.WAIT_AND_RETRY),
    LANE_BUSY(RetryPolicy.WAIT_AND_RETRY),
    OPERATION_CANCELLED(RetryPolicy.WAIT_AND_RETRY);

    private final RetryPolicy retryPolicy;

    ErrorCode(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
