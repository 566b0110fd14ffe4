package janitor.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the JDBC store adapters.
 *
 * <p>Each store query obtains its own connection and closes it before returning,
 * so a pass never holds a connection across units of work.
 *
 * <p>A {@code javax.sql.DataSource} adapts with {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
