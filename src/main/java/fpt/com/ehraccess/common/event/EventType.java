package fpt.com.ehraccess.common.event;

/**
 * Domain events raised by the access facade.
 */
public enum EventType {
    ACTOR_REGISTERED("E_00001"),
    ACCESS_GRANTED("E_00002"),
    ACCESS_REVOKED("E_00003"),
    RECORD_ADDED("E_00004"),
    RECORD_ARCHIVED("E_00005"),
    AUDIT_DEFERRED("E_00006");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
