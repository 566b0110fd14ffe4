package janitor.jdbc;

import janitor.spi.ConnectionProvider;
import janitor.spi.ItemDeleter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ItemDeleter} that removes an item row and its dependent rows in one
 * transaction.
 *
 * <p>Dependent tables are cleared first, in registration order, then the item
 * row itself is deleted. Any failure rolls the whole delete back. Use this when
 * the cascade is purely relational; hosts that also release blobs or caches
 * should supply their own {@link ItemDeleter}.
 *
 * <pre>{@code
 * ItemDeleter deleter = JdbcItemDeleter.builder()
 *     .connectionProvider(connections)
 *     .dependent("posts", "thread_id")
 *     .build();
 * }</pre>
 */
public final class JdbcItemDeleter implements ItemDeleter {
  private static final Logger logger = Logger.getLogger(JdbcItemDeleter.class.getName());

  private final ConnectionProvider connectionProvider;
  private final List<String> dependentSql;
  private final String itemSql;

  private JdbcItemDeleter(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    String table = SqlIdentifiers.validate("table name", builder.table);
    String idColumn = SqlIdentifiers.validate("id column", builder.idColumn);
    String partitionColumn = SqlIdentifiers.validate("partition column", builder.partitionColumn);

    List<String> dependents = new ArrayList<>();
    for (String[] dependent : builder.dependents) {
      dependents.add("DELETE FROM " + SqlIdentifiers.validate("dependent table", dependent[0])
          + " WHERE " + SqlIdentifiers.validate("foreign key column", dependent[1]) + " = ?");
    }
    this.dependentSql = List.copyOf(dependents);
    this.itemSql = "DELETE FROM " + table + " WHERE " + idColumn + " = ? AND " + partitionColumn + " = ?";
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void delete(String partition, long itemId) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        int dependentRows = 0;
        for (String sql : dependentSql) {
          dependentRows += JdbcTemplate.update(conn, sql, itemId);
        }
        int itemRows = JdbcTemplate.update(conn, itemSql, itemId, partition);
        conn.commit();
        logger.log(Level.FINE, "Deleted item {0} from partition {1} ({2} row(s), {3} dependent row(s))",
            new Object[]{itemId, partition, itemRows, dependentRows});
      } catch (RuntimeException | SQLException e) {
        try {
          conn.rollback();
        } catch (SQLException rollbackError) {
          e.addSuppressed(rollbackError);
        }
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    }
  }

  /** Builder for {@link JdbcItemDeleter}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private String table = "threads";
    private String idColumn = "id";
    private String partitionColumn = "board";
    private final List<String[]> dependents = new ArrayList<>();

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Optional. Defaults to {@code "threads"}. */
    public Builder table(String table) {
      this.table = table;
      return this;
    }

    /** Optional. Defaults to {@code "id"}. */
    public Builder idColumn(String idColumn) {
      this.idColumn = idColumn;
      return this;
    }

    /** Optional. Defaults to {@code "board"}. */
    public Builder partitionColumn(String partitionColumn) {
      this.partitionColumn = partitionColumn;
      return this;
    }

    /**
     * Adds a table whose rows referencing the item are deleted first.
     *
     * @param table            dependent table
     * @param foreignKeyColumn column referencing the item id
     * @return this builder
     */
    public Builder dependent(String table, String foreignKeyColumn) {
      dependents.add(new String[]{
          Objects.requireNonNull(table, "table"),
          Objects.requireNonNull(foreignKeyColumn, "foreignKeyColumn")});
      return this;
    }

    public JdbcItemDeleter build() {
      return new JdbcItemDeleter(this);
    }
  }
}
