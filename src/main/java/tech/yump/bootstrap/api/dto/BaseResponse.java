package tech.yump.bootstrap.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Envelope returned by every versioned route, successful or not.
 */
@Schema(description = "Common response envelope")
public record BaseResponse(
        @Schema(description = "API version", example = "v3")
        String apiVersion,
        @Schema(description = "Request id, always empty", example = "")
        String requestId,
        @Schema(description = "Error message, empty on success", example = "")
        String message,
        @Schema(description = "HTTP status code", example = "200")
        int statusCode
) {
    public static final String API_VERSION = "v3";

    // requestId is always empty on this API version.
    public static BaseResponse ok() {
        return new BaseResponse(API_VERSION, "", "", 200);
    }

    public static BaseResponse error(String message, int statusCode) {
        return new BaseResponse(API_VERSION, "", nullToEmpty(message), statusCode);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
