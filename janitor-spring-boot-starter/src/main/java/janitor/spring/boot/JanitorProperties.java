package janitor.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the janitor background jobs.
 *
 * <p>Every job is off until its {@code enabled} flag is set.
 *
 * @see JanitorAutoConfiguration
 */
@ConfigurationProperties(prefix = "janitor")
public class JanitorProperties {

    /**
     * How long shutdown waits for each in-flight pass.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private final Membership membership = new Membership();
    private final Orphan orphan = new Orphan();
    private final Eviction eviction = new Eviction();
    private final Metrics metrics = new Metrics();

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Membership getMembership() {
        return membership;
    }

    public Orphan getOrphan() {
        return orphan;
    }

    public Eviction getEviction() {
        return eviction;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Membership {
        private boolean enabled;
        /**
         * Validity window of the credentials the cache gates, e.g. the access token TTL.
         */
        private Duration validityWindow = Duration.ofHours(1);
        private Duration refreshInterval = Duration.ofSeconds(30);
        private boolean warmOnStart = true;
        private String table = "user_blacklist";
        private String idColumn = "user_id";
        private String timestampColumn = "blacklisted_at";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getValidityWindow() {
            return validityWindow;
        }

        public void setValidityWindow(Duration validityWindow) {
            this.validityWindow = validityWindow;
        }

        public Duration getRefreshInterval() {
            return refreshInterval;
        }

        public void setRefreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
        }

        public boolean isWarmOnStart() {
            return warmOnStart;
        }

        public void setWarmOnStart(boolean warmOnStart) {
            this.warmOnStart = warmOnStart;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getIdColumn() {
            return idColumn;
        }

        public void setIdColumn(String idColumn) {
            this.idColumn = idColumn;
        }

        public String getTimestampColumn() {
            return timestampColumn;
        }

        public void setTimestampColumn(String timestampColumn) {
            this.timestampColumn = timestampColumn;
        }
    }

    public static class Orphan {
        private boolean enabled;
        /**
         * Directory holding the blobs. Required when the orphan job is enabled
         * and no BlobStore bean is defined.
         */
        private String rootPath;
        private Duration safetyThreshold = Duration.ofMinutes(10);
        private Duration interval = Duration.ofHours(1);
        private String table = "files";
        private List<String> pathColumns = new ArrayList<>(List.of("file_path", "thumbnail_path"));
        private int maxRecordedErrors = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getRootPath() {
            return rootPath;
        }

        public void setRootPath(String rootPath) {
            this.rootPath = rootPath;
        }

        public Duration getSafetyThreshold() {
            return safetyThreshold;
        }

        public void setSafetyThreshold(Duration safetyThreshold) {
            this.safetyThreshold = safetyThreshold;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public List<String> getPathColumns() {
            return pathColumns;
        }

        public void setPathColumns(List<String> pathColumns) {
            this.pathColumns = pathColumns;
        }

        public int getMaxRecordedErrors() {
            return maxRecordedErrors;
        }

        public void setMaxRecordedErrors(int maxRecordedErrors) {
            this.maxRecordedErrors = maxRecordedErrors;
        }
    }

    public static class Eviction {
        private boolean enabled;
        /**
         * Per-partition item cap. Eviction stays idle while unset.
         */
        private Integer maxItemsPerPartition;
        private Duration interval = Duration.ofMinutes(5);
        private String table = "threads";
        private String partitionColumn = "board";
        private String idColumn = "id";
        private String orderColumn = "last_bumped_at";
        private String pinnedColumn;
        private String partitionTable;
        private String partitionKeyColumn;
        private int maxRecordedErrors = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Integer getMaxItemsPerPartition() {
            return maxItemsPerPartition;
        }

        public void setMaxItemsPerPartition(Integer maxItemsPerPartition) {
            this.maxItemsPerPartition = maxItemsPerPartition;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getPartitionColumn() {
            return partitionColumn;
        }

        public void setPartitionColumn(String partitionColumn) {
            this.partitionColumn = partitionColumn;
        }

        public String getIdColumn() {
            return idColumn;
        }

        public void setIdColumn(String idColumn) {
            this.idColumn = idColumn;
        }

        public String getOrderColumn() {
            return orderColumn;
        }

        public void setOrderColumn(String orderColumn) {
            this.orderColumn = orderColumn;
        }

        public String getPinnedColumn() {
            return pinnedColumn;
        }

        public void setPinnedColumn(String pinnedColumn) {
            this.pinnedColumn = pinnedColumn;
        }

        public String getPartitionTable() {
            return partitionTable;
        }

        public void setPartitionTable(String partitionTable) {
            this.partitionTable = partitionTable;
        }

        public String getPartitionKeyColumn() {
            return partitionKeyColumn;
        }

        public void setPartitionKeyColumn(String partitionKeyColumn) {
            this.partitionKeyColumn = partitionKeyColumn;
        }

        public int getMaxRecordedErrors() {
            return maxRecordedErrors;
        }

        public void setMaxRecordedErrors(int maxRecordedErrors) {
            this.maxRecordedErrors = maxRecordedErrors;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "janitor";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
