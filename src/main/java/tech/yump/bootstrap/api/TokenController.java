package tech.yump.bootstrap.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.bootstrap.api.dto.BaseResponse;
import tech.yump.bootstrap.audit.AuditHelper;
import tech.yump.bootstrap.config.BootstrapProperties;
import tech.yump.bootstrap.config.SecretStoreInfo;
import tech.yump.bootstrap.provider.CancellationSignal;
import tech.yump.bootstrap.provider.TokenProvider;
import tech.yump.bootstrap.provider.TokenProviderException;
import tech.yump.bootstrap.provider.TokenProviderFactory;

import java.util.Map;

@RestController
@RequestMapping("/api/" + BaseResponse.API_VERSION)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Token", description = "Secret-store token lifecycle")
public class TokenController {

    private final BootstrapProperties properties;
    private final TokenProviderFactory tokenProviderFactory;
    private final AuditHelper auditHelper;

    @PutMapping("/token/entityId/{entityId}")
    @Operation(
            summary = "Regenerate the token of an entity",
            description = "Runs the configured one-shot token provider to create a new secret-store token for the given entity id. "
                    + "Succeeds without doing anything when no token provider is configured.",
            security = {}
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Token regenerated, or no token provider configured.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = BaseResponse.class))),
            @ApiResponse(responseCode = "500", description = "The token provider is misconfigured, could not be started or failed.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = BaseResponse.class)))
    })
    public ResponseEntity<BaseResponse> regenToken(
            @Parameter(description = "Identity whose token is regenerated.", required = true, example = "5ad3d8b8-6e2a-4f3c-9d4f-1c2b3a4d5e6f")
            @PathVariable String entityId) {

        SecretStoreInfo secretStoreInfo = properties.secretStore();
        if (!StringUtils.hasText(secretStoreInfo.tokenProvider())) {
            log.info("no token provider configured; skipping token regeneration for entity id '{}'", entityId);
            return ResponseEntity.ok(BaseResponse.ok());
        }

        log.debug("Regenerating token for entity id '{}'", entityId);
        try (CancellationSignal signal = tokenProviderFactory.newSignal()) {
            TokenProvider tokenProvider = tokenProviderFactory.create(signal);
            tokenProvider.setConfiguration(secretStoreInfo);
            tokenProvider.launchRegenToken(entityId);
        } catch (TokenProviderException e) {
            log.error("failed to regenerate token for entity id '{}': {}", entityId, e.getMessage());
            throw e;
        }

        auditHelper.logHttpEvent("token_operation", "regenerate_token", "success", HttpStatus.OK.value(),
                null, Map.of("entity_id", entityId));
        return ResponseEntity.ok(BaseResponse.ok());
    }
}
