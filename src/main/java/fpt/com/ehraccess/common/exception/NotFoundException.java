package fpt.com.ehraccess.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class NotFoundException extends AppException {
    public NotFoundException(ErrorCode code, String field) {
        super(code, HttpStatus.NOT_FOUND, field);
    }
    public NotFoundException(ErrorCode code, String field, Map<String,Object> params) {
        super(code, HttpStatus.NOT_FOUND, field, params);
    }
}
