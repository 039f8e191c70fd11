package tech.yump.bootstrap.secretstore;

import tech.yump.bootstrap.config.SecretStoreInfo;

/**
 * Everything needed to construct a {@link SecretStoreClient}.
 */
public record SecretStoreClientConfig(
        String host,
        int port,
        String path,
        String protocol,
        String rootCaCertPath,
        String serverName,
        Authentication authentication
) {

    public static final String HTTPS = "https";

    public record Authentication(
            String authType,
            String authToken
    ) {
        public static final String TOKEN_AUTH_TYPE = "token";

        public static Authentication token(String authToken) {
            return new Authentication(TOKEN_AUTH_TYPE, authToken);
        }

        @Override
        public String toString() {
            return "Authentication[authType=" + authType + ", authToken=******]";
        }
    }

    /**
     * Client settings for the given store, always over https and authenticated with {@code token}.
     */
    public static SecretStoreClientConfig secureTokenConfig(SecretStoreInfo info, String token) {
        return new SecretStoreClientConfig(
                info.host(),
                info.port(),
                info.path(),
                HTTPS,
                info.rootCaCertPath(),
                info.serverName(),
                Authentication.token(token)
        );
    }

    public String baseUrl() {
        String basePath = path == null ? "" : path.trim();
        if (!basePath.isEmpty() && !basePath.startsWith("/")) {
            basePath = "/" + basePath;
        }
        while (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        return protocol + "://" + host + ":" + port + basePath;
    }
}
