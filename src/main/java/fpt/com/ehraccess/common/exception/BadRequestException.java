package fpt.com.ehraccess.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class BadRequestException extends AppException {
    public BadRequestException(ErrorCode code, String field) {
        super(code, HttpStatus.BAD_REQUEST, field);
    }
    public BadRequestException(ErrorCode code, String field, Map<String,Object> params) {
        super(code, HttpStatus.BAD_REQUEST, field, params);
    }
}
