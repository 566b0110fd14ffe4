package janitor.jdbc;

import janitor.spi.ConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Fresh in-memory H2 database per test with the board schema used by the JDBC stores.
 */
final class H2Fixture {
  final JdbcDataSource dataSource;
  final ConnectionProvider connections;

  H2Fixture() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    connections = dataSource::getConnection;

    execute(
        "CREATE TABLE user_blacklist (" +
            "user_id BIGINT PRIMARY KEY," +
            "blacklisted_at TIMESTAMP NOT NULL" +
            ")",
        "CREATE TABLE boards (" +
            "short_name VARCHAR(10) PRIMARY KEY" +
            ")",
        "CREATE TABLE threads (" +
            "id BIGINT PRIMARY KEY," +
            "board VARCHAR(10) NOT NULL," +
            "last_bumped_at TIMESTAMP NOT NULL," +
            "is_pinned BOOLEAN NOT NULL DEFAULT FALSE" +
            ")",
        "CREATE TABLE posts (" +
            "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
            "thread_id BIGINT NOT NULL," +
            "body VARCHAR(200)" +
            ")",
        "CREATE TABLE files (" +
            "id BIGINT AUTO_INCREMENT PRIMARY KEY," +
            "file_path VARCHAR(255) NOT NULL," +
            "thumbnail_path VARCHAR(255)" +
            ")");
  }

  void execute(String... statements) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    }
  }

  long count(String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.queryForLong(conn, sql);
    }
  }
}
