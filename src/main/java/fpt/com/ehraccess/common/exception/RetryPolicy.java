package fpt.com.ehraccess.common.exception;

/**
 * Tells a caller what to do after a failure.
 */
public enum RetryPolicy {
    FIX_INPUT,
    WAIT_AND_RETRY,
    NEVER
}
