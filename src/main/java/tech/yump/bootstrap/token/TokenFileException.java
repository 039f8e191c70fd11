package tech.yump.bootstrap.token;

/**
 * Thrown when a token file is missing, unreadable, malformed or lacks the requested value.
 */
public class TokenFileException extends RuntimeException {

  public TokenFileException(String message) {
    super(message);
  }

  public TokenFileException(String message, Throwable cause) {
    super(message, cause);
  }
}
