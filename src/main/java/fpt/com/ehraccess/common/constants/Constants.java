package fpt.com.ehraccess.common.constants;

/**
 * Shared constants for the whole service.
 */
public final class Constants {

    private Constants() {}

    public static final String API_PREFIX = "/api/v1";

    // Caller identity; authentication happens upstream
    public static final String ACTOR_HEADER = "X-Actor-Address";

    public static final String PATIENT_LANE_PREFIX = "patient:";
    public static final String RECORD_LANE_PREFIX = "record:";

    // Column limits, mirrored by the entities
    public static final int MAX_ADDRESS_LENGTH = 128;
    public static final int MAX_NAME_LENGTH = 255;
    public static final int MAX_CONTENT_HASH_LENGTH = 255;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;
    public static final int MAX_CONTEXT_LENGTH = 255;

    // Common messages
    public static final String MSG_SUCCESS = "Operation successful";
    public static final String MSG_CREATED = "Resource created successfully";
    public static final String MSG_AUDIT_PENDING = "Resource created, audit entry pending";
}
