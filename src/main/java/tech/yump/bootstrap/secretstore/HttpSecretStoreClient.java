package tech.yump.bootstrap.secretstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SecretStoreClient} speaking the Vault/OpenBao KV read API over {@link HttpClient}.
 *
 * <p>A read is {@code GET <baseUrl><subPath>} with the token in the auth header; the secret
 * key/value pairs are expected under the {@code data} field of the JSON response.
 */
@Slf4j
public class HttpSecretStoreClient implements SecretStoreClient {

    public static final String VAULT_TOKEN_HEADER = "X-Vault-Token";
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String authHeader;
    private final String authToken;
    private final Duration requestTimeout;

    public HttpSecretStoreClient(HttpClient httpClient, ObjectMapper objectMapper, SecretStoreClientConfig config) {
        this(httpClient, objectMapper, config, DEFAULT_REQUEST_TIMEOUT);
    }

    public HttpSecretStoreClient(HttpClient httpClient, ObjectMapper objectMapper,
                                 SecretStoreClientConfig config, Duration requestTimeout) {
        if (config.authentication() == null || !StringUtils.hasText(config.authentication().authToken())) {
            throw new IllegalArgumentException("Secret store client requires an authentication token.");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = config.baseUrl();
        this.authHeader = resolveAuthHeader(config.authentication().authType());
        this.authToken = config.authentication().authToken();
        this.requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
    }

    // "token" is the symbolic auth type; older configurations put the header name itself in authType.
    static String resolveAuthHeader(String authType) {
        if (!StringUtils.hasText(authType) || SecretStoreClientConfig.Authentication.TOKEN_AUTH_TYPE.equalsIgnoreCase(authType)) {
            return VAULT_TOKEN_HEADER;
        }
        return authType;
    }

    @Override
    public Map<String, String> getSecrets(String subPath, String... keys) throws SecretStoreException {
        Map<String, JsonNode> data = readSecretData(subPath);

        if (keys == null || keys.length == 0) {
            Map<String, String> all = new LinkedHashMap<>();
            data.forEach((key, value) -> all.put(key, asSecretValue(subPath, key, value)));
            return all;
        }

        // Only the requested keys are validated; other entries of the secret are ignored.
        Map<String, String> values = new LinkedHashMap<>();
        List<String> notFound = new ArrayList<>();
        for (String key : keys) {
            JsonNode value = data.get(key);
            if (value == null) {
                notFound.add(key);
                continue;
            }
            values.put(key, asSecretValue(subPath, key, value));
        }

        if (!notFound.isEmpty()) {
            log.warn("Secret at '{}' is missing keys {}", subPath, notFound);
            throw new SecretNotFoundException(subPath, notFound);
        }
        return values;
    }

    private static String asSecretValue(String subPath, String key, JsonNode value) {
        if (!value.isValueNode() || value.isNull()) {
            throw new SecretStoreException("secret value for key '" + key + "' at '" + subPath + "' is not a string");
        }
        return value.asText();
    }

    private Map<String, JsonNode> readSecretData(String subPath) {
        HttpRequest request;
        try {
            URI uri = URI.create(baseUrl + normalizeSubPath(subPath));
            log.debug("Using secrets URL of '{}'", uri);
            request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(requestTimeout)
                    .header(authHeader, authToken)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SecretStoreException("invalid secret store URL for '" + subPath + "': " + e.getMessage(), 0, e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SecretStoreException("failed to read secret at '" + subPath + "': " + e.getMessage(), 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SecretStoreException("interrupted while reading secret at '" + subPath + "'", 0, e);
        }

        int status = response.statusCode();
        log.debug("Secret store response for '{}': {}", subPath, status);
        if (status == 404) {
            throw new SecretNotFoundException(subPath, status);
        }
        if (status < 200 || status > 299) {
            throw new SecretStoreException("received a '" + status + "' response from the secret store for '" + subPath + "'", status);
        }

        JsonNode data;
        try {
            JsonNode root = objectMapper.readTree(response.body() == null ? "" : response.body());
            data = root == null ? null : root.get("data");
        } catch (JsonProcessingException e) {
            throw new SecretStoreException("failed to parse secret store response for '" + subPath + "': " + e.getOriginalMessage(), status, e);
        }

        if (data == null || !data.isObject() || data.isEmpty()) {
            throw new SecretStoreException("no secret key values are present at '" + subPath + "'", status);
        }

        Map<String, JsonNode> secrets = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            secrets.put(field.getKey(), field.getValue());
        }
        return secrets;
    }

    private static String normalizeSubPath(String subPath) {
        if (!StringUtils.hasText(subPath)) {
            return "";
        }
        return subPath.startsWith("/") ? subPath : "/" + subPath;
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
