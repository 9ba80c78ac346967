package fpt.com.ehraccess.domain.identity.entity;

import fpt.com.ehraccess.common.exception.BadRequestException;
import fpt.com.ehraccess.common.exception.ErrorCode;

import java.util.Locale;

public enum ActorRole {
    PATIENT,
    DOCTOR,
    HOSPITAL,
    PHARMACY,
    CLINIC;

    public boolean isProvider() {
        switch (this) {
            case PATIENT:
                return false;
            case DOCTOR:
            case HOSPITAL:
            case PHARMACY:
            case CLINIC:
                return true;
            default:
                throw new IllegalStateException("Unhandled role " + this);
        }
    }

    /**
     * Parses an inbound role value; anything outside the five roles is INVALID_ROLE.
     */
    public static ActorRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_ROLE, "role");
        }
        try {
            return ActorRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new BadRequestException(ErrorCode.INVALID_ROLE, "role");
        }
    }
}
