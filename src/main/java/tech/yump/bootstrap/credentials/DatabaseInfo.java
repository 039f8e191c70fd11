package tech.yump.bootstrap.credentials;

/**
 * Username/password pair for one logical database (e.g. {@code redisdb}).
 */
public record DatabaseInfo(
        String username,
        String password
) {
    @Override
    public String toString() {
        // Avoid logging the password in toString()
        return "DatabaseInfo[username='" + username + "', password=******]";
    }
}
