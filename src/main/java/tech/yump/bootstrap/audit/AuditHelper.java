package tech.yump.bootstrap.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final AuditBackend auditBackend;

    /**
     * Logs an audit event for the outcome of the current HTTP request.
     * Request and caller details are taken from the current request, when there is one.
     *
     * @param type         The type of event (e.g., "token_operation").
     * @param action       The specific action performed (e.g., "regenerate_token").
     * @param outcome      The result ("success" or "failure").
     * @param statusCode   The HTTP status code associated with the outcome.
     * @param errorMessage Optional error message (for failures).
     * @param data         Optional map containing context-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();

        AuditEvent.AuthInfo authInfo = buildAuthInfo(request);
        AuditEvent.RequestInfo requestInfo = buildRequestInfo(request);
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, authInfo, requestInfo, responseInfo, data);
    }

    /**
     * Logs an audit event for work the service does on its own, e.g. during start-up.
     *
     * @param type      The type of event (e.g., "credential_bootstrap").
     * @param action    The specific action performed (e.g., "fetch_credentials").
     * @param outcome   The result ("success" or "failure").
     * @param data      Optional map containing context-specific data.
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable Map<String, Object> data) {

        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal("system")
                .build();

        logEventInternal(type, action, outcome, authInfo, null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    private AuditEvent.AuthInfo buildAuthInfo(@Nullable HttpServletRequest request) {
        AuditEvent.AuthInfo.AuthInfoBuilder builder = AuditEvent.AuthInfo.builder()
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown");

        // The regeneration route is open; callers are authenticated upstream by the gateway.
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.isAuthenticated() && !"anonymousUser".equals(authentication.getPrincipal())) {
            builder.principal(authentication.getName());
        } else {
            builder.principal("anonymous");
        }
        return builder.build();
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId(request.getHeader(CORRELATION_ID_HEADER))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
