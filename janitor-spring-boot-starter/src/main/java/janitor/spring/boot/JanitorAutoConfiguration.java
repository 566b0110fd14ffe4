package janitor.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import janitor.Janitor;
import janitor.blob.FileSystemBlobStore;
import janitor.evict.BoundedCollectionEvictor;
import janitor.jdbc.JdbcMembershipStore;
import janitor.jdbc.JdbcPartitionStore;
import janitor.jdbc.JdbcPathRecordStore;
import janitor.membership.MembershipCache;
import janitor.micrometer.MicrometerMetricsExporter;
import janitor.orphan.OrphanReconciler;
import janitor.spi.BlobStore;
import janitor.spi.ConnectionProvider;
import janitor.spi.ItemDeleter;
import janitor.spi.MembershipStore;
import janitor.spi.MetricsExporter;
import janitor.spi.PartitionStore;
import janitor.spi.PathRecordStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.AnyNestedCondition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Auto-configuration for the janitor background jobs.
 *
 * <p>Wires JDBC stores from the {@link DataSource}, builds each job enabled under
 * {@link JanitorProperties} and exposes a {@link Janitor} that is started with
 * the context and closed on shutdown. Any store or job bean defined by the
 * application replaces the default.
 *
 * <p>Eviction additionally needs an {@link ItemDeleter} bean, since only the
 * host knows how to cascade a delete.
 *
 * <p>When Micrometer and a {@link MeterRegistry} bean are present and
 * {@code janitor.metrics.enabled} is not false, the jobs report through a
 * {@link MicrometerMetricsExporter}.
 *
 * @see JanitorProperties
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(Janitor.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(JanitorProperties.class)
public class JanitorAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public ConnectionProvider janitorConnectionProvider(DataSource dataSource) {
    return dataSource::getConnection;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @Conditional(AnyJobEnabledCondition.class)
  public Janitor janitor(JanitorProperties props,
      ObjectProvider<MembershipCache> membershipProvider,
      ObjectProvider<OrphanReconciler> orphanProvider,
      ObjectProvider<BoundedCollectionEvictor> evictorProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = Janitor.builder()
        .shutdownTimeout(props.getShutdownTimeout())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));

    MembershipCache membership = membershipProvider.getIfAvailable();
    if (membership != null) {
      builder.membership(membership, props.getMembership().getRefreshInterval())
          .warmMembershipOnStart(props.getMembership().isWarmOnStart());
    }
    OrphanReconciler reconciler = orphanProvider.getIfAvailable();
    if (reconciler != null) {
      builder.orphans(reconciler, props.getOrphan().getInterval());
    }
    BoundedCollectionEvictor evictor = evictorProvider.getIfAvailable();
    if (evictor != null) {
      builder.eviction(evictor, props.getEviction().getInterval());
    }
    return builder.build();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(prefix = "janitor.metrics", name = "enabled", matchIfMissing = true)
  static class MetricsConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
        MeterRegistry meterRegistry, JanitorProperties props) {
      return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "janitor.membership", name = "enabled", havingValue = "true")
  static class MembershipConfiguration {

    @Bean
    @ConditionalOnMissingBean(MembershipStore.class)
    public JdbcMembershipStore membershipStore(ConnectionProvider connectionProvider, JanitorProperties props) {
      var membership = props.getMembership();
      return JdbcMembershipStore.builder()
          .connectionProvider(connectionProvider)
          .table(membership.getTable())
          .idColumn(membership.getIdColumn())
          .timestampColumn(membership.getTimestampColumn())
          .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public MembershipCache membershipCache(MembershipStore store, JanitorProperties props,
        ObjectProvider<MetricsExporter> metricsProvider) {
      return MembershipCache.builder()
          .store(store)
          .validityWindow(props.getMembership().getValidityWindow())
          .metrics(metricsProvider.getIfAvailable())
          .build();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "janitor.orphan", name = "enabled", havingValue = "true")
  static class OrphanConfiguration {

    @Bean
    @ConditionalOnMissingBean(PathRecordStore.class)
    public JdbcPathRecordStore pathRecordStore(ConnectionProvider connectionProvider, JanitorProperties props) {
      return JdbcPathRecordStore.builder()
          .connectionProvider(connectionProvider)
          .table(props.getOrphan().getTable())
          .pathColumns(props.getOrphan().getPathColumns())
          .build();
    }

    @Bean
    @ConditionalOnMissingBean(BlobStore.class)
    public FileSystemBlobStore blobStore(JanitorProperties props) {
      String rootPath = props.getOrphan().getRootPath();
      if (rootPath == null || rootPath.isBlank()) {
        throw new IllegalStateException(
            "janitor.orphan.root-path must be set when janitor.orphan.enabled=true and no BlobStore bean exists");
      }
      return new FileSystemBlobStore(Path.of(rootPath));
    }

    @Bean
    @ConditionalOnMissingBean
    public OrphanReconciler orphanReconciler(PathRecordStore pathRecordStore, BlobStore blobStore,
        JanitorProperties props, ObjectProvider<MetricsExporter> metricsProvider) {
      return OrphanReconciler.builder()
          .pathRecordStore(pathRecordStore)
          .blobStore(blobStore)
          .safetyThreshold(props.getOrphan().getSafetyThreshold())
          .maxRecordedErrors(props.getOrphan().getMaxRecordedErrors())
          .metrics(metricsProvider.getIfAvailable())
          .build();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "janitor.eviction", name = "enabled", havingValue = "true")
  static class EvictionConfiguration {

    @Bean
    @ConditionalOnMissingBean(PartitionStore.class)
    public JdbcPartitionStore partitionStore(ConnectionProvider connectionProvider, JanitorProperties props) {
      var eviction = props.getEviction();
      var builder = JdbcPartitionStore.builder()
          .connectionProvider(connectionProvider)
          .table(eviction.getTable())
          .partitionColumn(eviction.getPartitionColumn())
          .idColumn(eviction.getIdColumn())
          .orderColumn(eviction.getOrderColumn());
      if (eviction.getPinnedColumn() != null && !eviction.getPinnedColumn().isEmpty()) {
        builder.pinnedColumn(eviction.getPinnedColumn());
      }
      if (eviction.getPartitionTable() != null && !eviction.getPartitionTable().isEmpty()) {
        if (eviction.getPartitionKeyColumn() == null) {
          throw new IllegalStateException(
              "janitor.eviction.partition-key-column must be set together with janitor.eviction.partition-table");
        }
        builder.partitionSource(eviction.getPartitionTable(), eviction.getPartitionKeyColumn());
      }
      return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public BoundedCollectionEvictor boundedCollectionEvictor(PartitionStore partitionStore,
        ObjectProvider<ItemDeleter> itemDeleterProvider, JanitorProperties props,
        ObjectProvider<MetricsExporter> metricsProvider) {
      ItemDeleter itemDeleter = itemDeleterProvider.getIfAvailable();
      if (itemDeleter == null) {
        throw new IllegalStateException(
            "janitor.eviction.enabled=true requires an ItemDeleter bean");
      }
      return BoundedCollectionEvictor.builder()
          .partitionStore(partitionStore)
          .itemDeleter(itemDeleter)
          .maxItemsPerPartition(props.getEviction().getMaxItemsPerPartition())
          .maxRecordedErrors(props.getEviction().getMaxRecordedErrors())
          .metrics(metricsProvider.getIfAvailable())
          .build();
    }
  }

  static class AnyJobEnabledCondition extends AnyNestedCondition {

    AnyJobEnabledCondition() {
      super(ConfigurationPhase.REGISTER_BEAN);
    }

    @ConditionalOnProperty(prefix = "janitor.membership", name = "enabled", havingValue = "true")
    static class MembershipEnabled {
    }

    @ConditionalOnProperty(prefix = "janitor.orphan", name = "enabled", havingValue = "true")
    static class OrphanEnabled {
    }

    @ConditionalOnProperty(prefix = "janitor.eviction", name = "enabled", havingValue = "true")
    static class EvictionEnabled {
    }
  }
}
