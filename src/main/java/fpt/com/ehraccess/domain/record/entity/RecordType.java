package fpt.com.ehraccess.domain.record.entity;

import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ErrorCode;

import java.util.Locale;

public enum RecordType {
    PRESCRIPTION,
    LAB_RESULT,
    DIAGNOSIS,
    MEDICAL_HISTORY,
    VACCINATION;

    public static RecordType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_TYPE, "recordType");
        }
        try {
            return RecordType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new BadRequestException(ErrorCode.INVALID_TYPE, "recordType");
        }
    }
}
