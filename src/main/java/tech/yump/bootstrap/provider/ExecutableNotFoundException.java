package tech.yump.bootstrap.provider;

/**
 * Thrown by {@link ExecRunner#lookPath(String)} when no executable matches.
 */
public class ExecutableNotFoundException extends Exception {

  public ExecutableNotFoundException(String message) {
    super(message);
  }
}
