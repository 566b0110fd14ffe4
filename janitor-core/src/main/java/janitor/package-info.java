/**
 * Root API for janitor: background jobs that keep derived state consistent with
 * authoritative stores without blocking request-serving code.
 *
 * <h2>Jobs</h2>
 * <ul>
 *   <li>{@link janitor.membership.MembershipCache}: blacklist-style membership set,
 *       rebuilt from a recency window and swapped in atomically</li>
 *   <li>{@link janitor.orphan.OrphanReconciler}: deletes blob-store files that no
 *       authoritative record references, past a safety age</li>
 *   <li>{@link janitor.evict.BoundedCollectionEvictor}: trims each partition back
 *       to a global cap, oldest items first</li>
 * </ul>
 *
 * <p>Every job implements {@link janitor.Job}; {@link janitor.schedule.PeriodicTask}
 * runs one on a fixed delay and {@link janitor.Janitor} supervises all of them.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>janitor-core</b>: jobs, scheduling, SPI, filesystem blob store (zero external deps)</li>
 *   <li><b>janitor-jdbc</b>: JDBC implementations of the store queries</li>
 *   <li><b>janitor-micrometer</b>: {@link janitor.spi.MetricsExporter} for Micrometer</li>
 *   <li><b>janitor-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ConnectionProvider connections = dataSource::getConnection;
 *
 * var blacklist = MembershipCache.builder()
 *     .store(JdbcMembershipStore.builder().connectionProvider(connections).build())
 *     .validityWindow(Duration.ofHours(1))
 *     .build();
 *
 * var mediaGc = OrphanReconciler.builder()
 *     .pathRecordStore(JdbcPathRecordStore.builder().connectionProvider(connections).build())
 *     .blobStore(new FileSystemBlobStore(Path.of("/var/media")))
 *     .safetyThreshold(Duration.ofMinutes(10))
 *     .build();
 *
 * var threadGc = BoundedCollectionEvictor.builder()
 *     .partitionStore(JdbcPartitionStore.builder().connectionProvider(connections).build())
 *     .itemDeleter(threadService::delete)
 *     .maxItemsPerPartition(100)
 *     .build();
 *
 * try (Janitor janitor = Janitor.builder()
 *     .membership(blacklist, Duration.ofSeconds(30))
 *     .orphans(mediaGc, Duration.ofHours(1))
 *     .eviction(threadGc, Duration.ofMinutes(5))
 *     .build()) {
 *   janitor.start();
 *   ...
 * }
 * }</pre>
 *
 * @see janitor.Janitor
 * @see janitor.Job
 * @see janitor.PassAbortedException
 */
package janitor;
