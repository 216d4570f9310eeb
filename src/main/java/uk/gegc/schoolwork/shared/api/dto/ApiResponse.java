package uk.gegc.schoolwork.shared.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Success envelope shared by every endpoint: {@code { "success": true, "data": ... }}.
 */
@Schema(name = "ApiResponse", description = "Success envelope")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        @Schema(description = "Always true for successful responses")
        boolean success,

        @Schema(description = "Response payload")
        T data,

        @Schema(description = "Optional human readable message")
        String message
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }
}
