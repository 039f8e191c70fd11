package tech.yump.bootstrap.token;

import java.nio.file.Path;

/**
 * Reads secret-store tokens from an on-disk token file.
 * Implementations must re-read the file on every call; tokens are rotated underneath running services.
 */
public interface TokenFileLoader {

    /**
     * Loads the bearer token from the token file.
     * The client token is preferred; the root token is only used for the first, unauthenticated bootstrap.
     *
     * @param tokenFile Path of the JSON token file.
     * @return The non-empty token.
     * @throws TokenFileException If the file cannot be read or parsed, or carries no token.
     */
    String load(Path tokenFile) throws TokenFileException;

    /**
     * Reads the identity (entity id) the token in the file belongs to.
     *
     * @param tokenFile Path of the JSON token file.
     * @return The non-empty entity id.
     * @throws TokenFileException If the file cannot be read or parsed, or carries no entity id.
     */
    String readEntityId(Path tokenFile) throws TokenFileException;
}
