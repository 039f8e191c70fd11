package tech.yump.bootstrap.credentials;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the database credentials resolved at start-up for the service's storage layer.
 */
@Slf4j
@Component
public class DatabaseCredentialRegistry {

  // Replaced as a whole, so readers see either the old or the new set.
  private volatile Map<String, DatabaseInfo> credentials = Map.of();

  /**
   * Replaces the whole credential set.
   */
  public void publish(Map<String, DatabaseInfo> resolved) {
    Map<String, DatabaseInfo> next = resolved == null ? Map.of() : Map.copyOf(resolved);
    credentials = next;
    log.debug("Published credentials for databases {}", next.keySet());
  }

  public Optional<DatabaseInfo> get(String databaseName) {
    if (databaseName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(credentials.get(databaseName));
  }

  public Set<String> databaseNames() {
    return credentials.keySet();
  }
}
