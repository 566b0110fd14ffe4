package janitor.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC store adapters.
 */
public final class JanitorStoreException extends RuntimeException {
  public JanitorStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
