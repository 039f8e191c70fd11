package tech.yump.bootstrap.secretstore;

import java.util.List;

/**
 * Thrown when a secret path does not exist, or exists without some of the requested keys.
 */
public class SecretNotFoundException extends SecretStoreException {

    private final List<String> missingKeys;

    public SecretNotFoundException(String subPath, int statusCode) {
        super("no secret found at '" + subPath + "': received a '" + statusCode + "' response from the secret store", statusCode);
        this.missingKeys = List.of();
    }

    public SecretNotFoundException(String subPath, List<String> missingKeys) {
        super("no value for the keys: " + missingKeys + " exists at '" + subPath + "'", 200);
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
