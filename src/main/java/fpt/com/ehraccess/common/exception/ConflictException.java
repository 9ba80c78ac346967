package fpt.com.ehraccess.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ConflictException extends AppException {
    public ConflictException(ErrorCode code, String field) {
        super(code, HttpStatus.CONFLICT, field);
    }
    public ConflictException(ErrorCode code, String field, Map<String,Object> params) {
        super(code, HttpStatus.CONFLICT, field, params);
    }
}
