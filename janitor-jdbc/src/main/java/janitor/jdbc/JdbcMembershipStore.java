package janitor.jdbc;

import janitor.spi.ConnectionProvider;
import janitor.spi.MembershipStore;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link MembershipStore} reading ids from a table of timestamped membership events.
 *
 * <p>Issues {@code SELECT <idColumn> FROM <table> WHERE <timestampColumn> >= ?}
 * on a fresh auto-commit connection per call. Defaults match a
 * {@code user_blacklist(user_id, blacklisted_at)} table.
 */
public final class JdbcMembershipStore implements MembershipStore {
  private final ConnectionProvider connectionProvider;
  private final String sql;

  private JdbcMembershipStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    String table = SqlIdentifiers.validate("table name", builder.table);
    String idColumn = SqlIdentifiers.validate("id column", builder.idColumn);
    String timestampColumn = SqlIdentifiers.validate("timestamp column", builder.timestampColumn);
    this.sql = "SELECT " + idColumn + " FROM " + table + " WHERE " + timestampColumn + " >= ?";
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public List<Long> findMembersSince(Instant since) {
    Objects.requireNonNull(since, "since");
    return JdbcTemplate.withConnection(connectionProvider, conn ->
        JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), Timestamp.from(since)));
  }

  String sql() {
    return sql;
  }

  /** Builder for {@link JdbcMembershipStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private String table = "user_blacklist";
    private String idColumn = "user_id";
    private String timestampColumn = "blacklisted_at";

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Optional. Defaults to {@code "user_blacklist"}. */
    public Builder table(String table) {
      this.table = table;
      return this;
    }

    /** Optional. Defaults to {@code "user_id"}. */
    public Builder idColumn(String idColumn) {
      this.idColumn = idColumn;
      return this;
    }

    /** Optional. Defaults to {@code "blacklisted_at"}. */
    public Builder timestampColumn(String timestampColumn) {
      this.timestampColumn = timestampColumn;
      return this;
    }

    public JdbcMembershipStore build() {
      return new JdbcMembershipStore(this);
    }
  }
}
