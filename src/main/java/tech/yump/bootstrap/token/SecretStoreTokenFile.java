package tech.yump.bootstrap.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of a secret-store token-creation (or initialization) response this service reads.
 * The file carries many more fields, which are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretStoreTokenFile(
        @JsonProperty("auth") Auth auth,
        @JsonProperty("root_token") String rootToken
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Auth(
            @JsonProperty("client_token") String clientToken,
            @JsonProperty("entity_id") String entityId
    ) {}
}
