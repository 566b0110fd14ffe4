package janitor.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JanitorPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(JanitorProperties.class);
            assertEquals(Duration.ofSeconds(30), props.getShutdownTimeout());

            assertFalse(props.getMembership().isEnabled());
            assertEquals(Duration.ofHours(1), props.getMembership().getValidityWindow());
            assertEquals(Duration.ofSeconds(30), props.getMembership().getRefreshInterval());
            assertTrue(props.getMembership().isWarmOnStart());
            assertEquals("user_blacklist", props.getMembership().getTable());
            assertEquals("user_id", props.getMembership().getIdColumn());
            assertEquals("blacklisted_at", props.getMembership().getTimestampColumn());

            assertFalse(props.getOrphan().isEnabled());
            assertNull(props.getOrphan().getRootPath());
            assertEquals(Duration.ofMinutes(10), props.getOrphan().getSafetyThreshold());
            assertEquals(Duration.ofHours(1), props.getOrphan().getInterval());
            assertEquals("files", props.getOrphan().getTable());
            assertEquals(List.of("file_path", "thumbnail_path"), props.getOrphan().getPathColumns());
            assertEquals(100, props.getOrphan().getMaxRecordedErrors());

            assertFalse(props.getEviction().isEnabled());
            assertNull(props.getEviction().getMaxItemsPerPartition());
            assertEquals(Duration.ofMinutes(5), props.getEviction().getInterval());
            assertEquals("threads", props.getEviction().getTable());
            assertEquals("board", props.getEviction().getPartitionColumn());
            assertEquals("id", props.getEviction().getIdColumn());
            assertEquals("last_bumped_at", props.getEviction().getOrderColumn());
            assertNull(props.getEviction().getPinnedColumn());
            assertNull(props.getEviction().getPartitionTable());

            assertTrue(props.getMetrics().isEnabled());
            assertEquals("janitor", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "janitor.shutdown-timeout=5s",
                "janitor.membership.enabled=true",
                "janitor.membership.validity-window=15m",
                "janitor.membership.refresh-interval=10s",
                "janitor.membership.warm-on-start=false",
                "janitor.orphan.enabled=true",
                "janitor.orphan.root-path=/var/media",
                "janitor.orphan.safety-threshold=PT2M",
                "janitor.orphan.path-columns=path",
                "janitor.eviction.enabled=true",
                "janitor.eviction.max-items-per-partition=100",
                "janitor.eviction.pinned-column=is_pinned",
                "janitor.eviction.partition-table=boards",
                "janitor.eviction.partition-key-column=short_name",
                "janitor.metrics.name-prefix=forum.janitor"
        ).run(ctx -> {
            var props = ctx.getBean(JanitorProperties.class);
            assertEquals(Duration.ofSeconds(5), props.getShutdownTimeout());
            assertTrue(props.getMembership().isEnabled());
            assertEquals(Duration.ofMinutes(15), props.getMembership().getValidityWindow());
            assertEquals(Duration.ofSeconds(10), props.getMembership().getRefreshInterval());
            assertFalse(props.getMembership().isWarmOnStart());
            assertEquals("/var/media", props.getOrphan().getRootPath());
            assertEquals(Duration.ofMinutes(2), props.getOrphan().getSafetyThreshold());
            assertEquals(List.of("path"), props.getOrphan().getPathColumns());
            assertEquals(100, props.getEviction().getMaxItemsPerPartition());
            assertEquals("is_pinned", props.getEviction().getPinnedColumn());
            assertEquals("boards", props.getEviction().getPartitionTable());
            assertEquals("short_name", props.getEviction().getPartitionKeyColumn());
            assertEquals("forum.janitor", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(JanitorProperties.class)
    static class PropsConfig {
    }
}
