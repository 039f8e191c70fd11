package tech.yump.bootstrap.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.bootstrap.api.dto.BaseResponse;
import tech.yump.bootstrap.audit.AuditHelper;
import tech.yump.bootstrap.provider.TokenProviderException;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Pattern TOKEN_PATH_PATTERN = Pattern.compile(".*/api/v3/token/entityId/([^/]+)");

    private final AuditHelper auditHelper;

    @ExceptionHandler(TokenProviderException.class)
    public ResponseEntity<BaseResponse> handleTokenProviderException(TokenProviderException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        log.error("Token provider error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditHelper.logHttpEvent(
                determineEventType(request),
                determineActionFromRequest(request),
                "failure",
                status.value(),
                ex.getMessage(),
                extractContextData(request)
        );
        return buildResponse(ex.getMessage(), status);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<BaseResponse> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditHelper.logHttpEvent(
                determineEventType(request),
                determineActionFromRequest(request),
                "failure",
                status.value(),
                ex.getMessage(),
                extractContextData(request)
        );
        return buildResponse(ex.getMessage(), status);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<BaseResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent(
                "system_error",
                determineActionFromRequest(request),
                "failure",
                status.value(),
                message, // Don't expose internal details
                extractContextData(request)
        );
        return buildResponse(message, status);
    }

    // Standard Spring MVC exceptions (unsupported method, unreadable request, ...) use the same envelope.
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        String message = (body instanceof ProblemDetail problemDetail && problemDetail.getDetail() != null)
                ? problemDetail.getDetail()
                : ex.getMessage();
        log.warn("Request rejected by Spring MVC: {} ({})", message, statusCode.value());

        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent(
                    "request_validation",
                    determineActionFromRequest(servletRequest),
                    "failure",
                    statusCode.value(),
                    message,
                    extractContextData(servletRequest)
            );
        }
        return new ResponseEntity<>(BaseResponse.error(message, statusCode.value()), headers, statusCode);
    }

    private ResponseEntity<BaseResponse> buildResponse(String message, HttpStatus status) {
        return ResponseEntity.status(status).body(BaseResponse.error(message, status.value()));
    }

    private String determineEventType(HttpServletRequest request) {
        if (request.getRequestURI().contains("/api/v3/token/")) {
            return "token_operation";
        }
        return "request_error";
    }

    private String determineActionFromRequest(HttpServletRequest request) {
        if (request.getRequestURI().contains("/api/v3/token/entityId/")) return "regenerate_token";
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        Matcher tokenMatcher = TOKEN_PATH_PATTERN.matcher(request.getRequestURI());
        if (tokenMatcher.matches()) {
            data.put("entity_id", tokenMatcher.group(1));
        }
        return data;
    }
}
