package tech.yump.bootstrap.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link TokenFileLoader} reading the JSON token file straight from the filesystem.
 * Nothing is cached: each call opens and parses the file again.
 */
@Slf4j
@RequiredArgsConstructor
public class FileTokenLoader implements TokenFileLoader {

    private final ObjectMapper objectMapper;

    @Override
    public String load(Path tokenFile) throws TokenFileException {
        SecretStoreTokenFile parsed = read(tokenFile);

        SecretStoreTokenFile.Auth auth = parsed.auth();
        if (auth != null && StringUtils.hasLength(auth.clientToken())) {
            log.debug("Using client token from {}", tokenFile);
            return auth.clientToken();
        }
        if (StringUtils.hasLength(parsed.rootToken())) {
            log.debug("No client token in {}, falling back to root token", tokenFile);
            return parsed.rootToken();
        }
        throw new TokenFileException("unable to find authentication token in " + tokenFile);
    }

    @Override
    public String readEntityId(Path tokenFile) throws TokenFileException {
        SecretStoreTokenFile parsed = read(tokenFile);

        SecretStoreTokenFile.Auth auth = parsed.auth();
        if (auth != null && StringUtils.hasLength(auth.entityId())) {
            return auth.entityId();
        }
        throw new TokenFileException("unable to find entity id in " + tokenFile);
    }

    private SecretStoreTokenFile read(Path tokenFile) {
        if (tokenFile == null) {
            throw new IllegalArgumentException("Token file path cannot be null.");
        }
        try (InputStream in = Files.newInputStream(tokenFile)) {
            SecretStoreTokenFile parsed = objectMapper.readValue(in, SecretStoreTokenFile.class);
            // A literal JSON null parses to null; treat it like an empty document.
            return parsed != null ? parsed : new SecretStoreTokenFile(null, null);
        } catch (JsonProcessingException e) {
            log.error("Malformed token file {}: {}", tokenFile, e.getOriginalMessage());
            throw new TokenFileException("failed to parse token file " + tokenFile + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            log.error("Unable to read token file {}: {}", tokenFile, e.getMessage());
            throw new TokenFileException("failed to read token file " + tokenFile + ": " + e, e);
        }
    }
}
