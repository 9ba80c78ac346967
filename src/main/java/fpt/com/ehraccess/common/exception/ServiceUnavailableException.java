package fpt.com.ehraccess.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ServiceUnavailableException extends AppException {
    public ServiceUnavailableException(ErrorCode code, String field) {
        super(code, HttpStatus.SERVICE_UNAVAILABLE, field);
    }
    public ServiceUnavailableException(ErrorCode code, String field, Map<String,Object> params) {
        super(code, HttpStatus.SERVICE_UNAVAILABLE, field, params);
    }
}
