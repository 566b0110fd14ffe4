package janitor.jdbc;

import java.util.Objects;

/**
 * Validation for table and column names spliced into generated SQL.
 */
public final class SqlIdentifiers {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private SqlIdentifiers() {}

  /**
   * Returns {@code identifier} unchanged if it is a plain SQL identifier.
   *
   * @param kind       what the identifier names, used in the error message
   * @param identifier the identifier to check
   * @return the identifier
   * @throws IllegalArgumentException if it contains anything but letters, digits and underscores
   */
  public static String validate(String kind, String identifier) {
    Objects.requireNonNull(identifier, kind);
    if (!identifier.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid " + kind + ": " + identifier);
    }
    return identifier;
  }
}
