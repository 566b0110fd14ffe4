package janitor.jdbc;

import janitor.spi.ConnectionProvider;
import janitor.spi.PartitionStore;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * {@link PartitionStore} over an item table with a partition key column.
 *
 * <p>Defaults match a {@code threads(id, board, last_bumped_at)} table. The
 * oldest item is the one with the smallest order column value, ties broken by
 * id. When a pinned column is configured, rows where it is true are never
 * offered for eviction but still count toward the cap.
 *
 * <p>Partitions are listed from a dedicated table when
 * {@link Builder#partitionSource(String, String)} is set (so empty partitions
 * are scanned too), otherwise as the distinct keys of the item table.
 */
public final class JdbcPartitionStore implements PartitionStore {
  private final ConnectionProvider connectionProvider;
  private final String listSql;
  private final String countSql;
  private final String oldestSql;

  private JdbcPartitionStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    String table = SqlIdentifiers.validate("table name", builder.table);
    String partitionColumn = SqlIdentifiers.validate("partition column", builder.partitionColumn);
    String idColumn = SqlIdentifiers.validate("id column", builder.idColumn);
    String orderColumn = SqlIdentifiers.validate("order column", builder.orderColumn);

    if (builder.partitionTable != null) {
      String partitionTable = SqlIdentifiers.validate("partition table", builder.partitionTable);
      String keyColumn = SqlIdentifiers.validate("partition key column", builder.partitionKeyColumn);
      this.listSql = "SELECT " + keyColumn + " FROM " + partitionTable + " ORDER BY " + keyColumn;
    } else {
      this.listSql = "SELECT DISTINCT " + partitionColumn + " FROM " + table
          + " ORDER BY " + partitionColumn;
    }

    this.countSql = "SELECT COUNT(*) FROM " + table + " WHERE " + partitionColumn + " = ?";

    String pinnedFilter = "";
    if (builder.pinnedColumn != null) {
      String pinnedColumn = SqlIdentifiers.validate("pinned column", builder.pinnedColumn);
      pinnedFilter = " AND " + pinnedColumn + " = FALSE";
    }
    this.oldestSql = "SELECT " + idColumn + " FROM " + table
        + " WHERE " + partitionColumn + " = ?" + pinnedFilter
        + " ORDER BY " + orderColumn + " ASC, " + idColumn + " ASC LIMIT 1";
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public List<String> listPartitions() {
    return JdbcTemplate.withConnection(connectionProvider, conn ->
        JdbcTemplate.query(conn, listSql, rs -> rs.getString(1)));
  }

  @Override
  public int countItems(String partition) {
    long count = JdbcTemplate.withConnection(connectionProvider, conn ->
        JdbcTemplate.queryForLong(conn, countSql, partition));
    return Math.toIntExact(count);
  }

  @Override
  public OptionalLong findOldestItem(String partition) {
    List<Long> ids = JdbcTemplate.withConnection(connectionProvider, conn ->
        JdbcTemplate.query(conn, oldestSql, rs -> rs.getLong(1), partition));
    return ids.isEmpty() ? OptionalLong.empty() : OptionalLong.of(ids.get(0));
  }

  String oldestSql() {
    return oldestSql;
  }

  /** Builder for {@link JdbcPartitionStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private String table = "threads";
    private String partitionColumn = "board";
    private String idColumn = "id";
    private String orderColumn = "last_bumped_at";
    private String pinnedColumn;
    private String partitionTable;
    private String partitionKeyColumn;

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Item table. Optional. Defaults to {@code "threads"}. */
    public Builder table(String table) {
      this.table = table;
      return this;
    }

    /** Optional. Defaults to {@code "board"}. */
    public Builder partitionColumn(String partitionColumn) {
      this.partitionColumn = partitionColumn;
      return this;
    }

    /** Optional. Defaults to {@code "id"}. */
    public Builder idColumn(String idColumn) {
      this.idColumn = idColumn;
      return this;
    }

    /**
     * Column whose ascending order defines age (oldest first).
     *
     * <p>Optional. Defaults to {@code "last_bumped_at"}.
     */
    public Builder orderColumn(String orderColumn) {
      this.orderColumn = orderColumn;
      return this;
    }

    /**
     * Boolean column marking items that must never be evicted.
     *
     * <p>Optional. Unset by default.
     */
    public Builder pinnedColumn(String pinnedColumn) {
      this.pinnedColumn = pinnedColumn;
      return this;
    }

    /**
     * Lists partitions from {@code table.keyColumn} instead of the item table.
     *
     * @param table     partition table, e.g. {@code boards}
     * @param keyColumn column holding the partition key, e.g. {@code short_name}
     * @return this builder
     */
    public Builder partitionSource(String table, String keyColumn) {
      this.partitionTable = Objects.requireNonNull(table, "table");
      this.partitionKeyColumn = Objects.requireNonNull(keyColumn, "keyColumn");
      return this;
    }

    public JdbcPartitionStore build() {
      return new JdbcPartitionStore(this);
    }
  }
}
