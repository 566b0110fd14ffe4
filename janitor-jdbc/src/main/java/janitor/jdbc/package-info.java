/**
 * JDBC implementations of the janitor store queries.
 *
 * <p>Every store builds its SQL once from validated identifiers and runs each
 * query on its own auto-commit connection from a
 * {@link janitor.spi.ConnectionProvider}. JDBC failures surface as
 * {@link janitor.jdbc.JanitorStoreException}.
 *
 * <ul>
 *   <li>{@link janitor.jdbc.JdbcMembershipStore}: ids with a recent membership timestamp</li>
 *   <li>{@link janitor.jdbc.JdbcPathRecordStore}: every referenced blob path</li>
 *   <li>{@link janitor.jdbc.JdbcPartitionStore}: partition list, counts and oldest item</li>
 *   <li>{@link janitor.jdbc.JdbcItemDeleter}: transactional relational cascade delete</li>
 * </ul>
 */
package janitor.jdbc;
