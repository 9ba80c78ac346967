package fpt.com.ehraccess.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class AppException extends RuntimeException {
    private final ErrorCode code;
    private final HttpStatus status;
    private final String field;
    private final Map<String, Object> params;

    public AppException(ErrorCode code, HttpStatus status, String field) {
        this(code, status, field, null);
    }

    public AppException(ErrorCode code, HttpStatus status, String field, Map<String, Object> params) {
        super(field == null ? code.name() : code.name() + ": " + field);
        this.code = code;
        this.status = status;
        this.field = field;
        this.params = params;
    }

    public ErrorCode getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getField() {
        return field;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public RetryPolicy getRetryPolicy() {
        return code.getRetryPolicy();
    }
}
