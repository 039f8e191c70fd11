package tech.yump.bootstrap.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry: who triggered what, against which resource, and how it ended.
 * Logged as JSON.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "token_operation", "credential_bootstrap"
        String action,          // e.g. "regenerate_token", "launch_provider"
        String outcome,         // "success" or "failure"

        AuthInfo authInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,

        // Event specific context (entity id, executable, database names). Never secrets.
        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,
            String sourceAddress
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,     // correlation id supplied by the caller, if any
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive headers only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
