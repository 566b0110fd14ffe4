package janitor.jdbc;

import janitor.spi.ConnectionProvider;
import janitor.spi.PathRecordStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * {@link PathRecordStore} reading every referenced path from one table.
 *
 * <p>A row may reference several blobs, e.g. an upload and its thumbnail, so any
 * number of path columns can be configured. {@code NULL} and empty values are
 * skipped. Defaults match a {@code files(file_path, thumbnail_path)} table.
 */
public final class JdbcPathRecordStore implements PathRecordStore {
  private final ConnectionProvider connectionProvider;
  private final List<String> pathColumns;
  private final String sql;

  private JdbcPathRecordStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    String table = SqlIdentifiers.validate("table name", builder.table);
    if (builder.pathColumns.isEmpty()) {
      throw new IllegalArgumentException("At least one path column is required");
    }
    for (String column : builder.pathColumns) {
      SqlIdentifiers.validate("path column", column);
    }
    this.pathColumns = List.copyOf(builder.pathColumns);
    this.sql = "SELECT " + String.join(", ", pathColumns) + " FROM " + table;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Collection<String> findAllPaths() {
    int columns = pathColumns.size();
    List<List<String>> rows = JdbcTemplate.withConnection(connectionProvider, conn ->
        JdbcTemplate.query(conn, sql, rs -> {
          List<String> values = new ArrayList<>(columns);
          for (int i = 1; i <= columns; i++) {
            values.add(rs.getString(i));
          }
          return values;
        }));

    List<String> paths = new ArrayList<>(rows.size() * columns);
    for (List<String> row : rows) {
      for (String path : row) {
        if (path != null && !path.isEmpty()) {
          paths.add(path);
        }
      }
    }
    return paths;
  }

  List<String> pathColumns() {
    return pathColumns;
  }

  /** Builder for {@link JdbcPathRecordStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private String table = "files";
    private List<String> pathColumns = List.of("file_path", "thumbnail_path");

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Optional. Defaults to {@code "files"}. */
    public Builder table(String table) {
      this.table = table;
      return this;
    }

    /**
     * Columns holding blob paths.
     *
     * <p>Optional. Defaults to {@code file_path, thumbnail_path}.
     */
    public Builder pathColumns(String... pathColumns) {
      return pathColumns(List.of(pathColumns));
    }

    public Builder pathColumns(List<String> pathColumns) {
      this.pathColumns = List.copyOf(Objects.requireNonNull(pathColumns, "pathColumns"));
      return this;
    }

    public JdbcPathRecordStore build() {
      return new JdbcPathRecordStore(this);
    }
  }
}
