package fpt.com.ehraccess.common.util;

import fpt.com.ehraccess.common.constants.Constants;
import lombok.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Common response envelope for every endpoint.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiResponse<T> {

    private boolean success;
    private String message;
    private T data;
    private ApiError error;
    private OffsetDateTime timestamp;

    public static <T> ApiResponse<T> ok(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .message(Constants.MSG_SUCCESS)
                .data(data)
                .timestamp(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
    }

    public static <T> ApiResponse<T> created(T data) {
        return created(data, Constants.MSG_CREATED);
    }

    public static <T> ApiResponse<T> created(T data, String message) {
        return ApiResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .timestamp(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
    }

    public static ApiResponse<Void> fail(String message, ApiError error) {
        return ApiResponse.<Void>builder()
                .success(false)
                .message(message)
                .error(error)
                .timestamp(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
    }
}
