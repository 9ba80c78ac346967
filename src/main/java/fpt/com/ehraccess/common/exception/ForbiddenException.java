package fpt.com.ehraccess.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ForbiddenException extends AppException {
    public ForbiddenException(ErrorCode code, String field) {
        super(code, HttpStatus.FORBIDDEN, field);
    }
    public ForbiddenException(ErrorCode code, String field, Map<String,Object> params) {
        super(code, HttpStatus.FORBIDDEN, field, params);
    }
}
