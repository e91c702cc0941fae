package com.entity.pipeline.metrics;

import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.RelationshipType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordStageDuration("extract", true, Duration.ofMillis(100));
                noOp.incrementMentionsWritten(3);
                noOp.incrementEntityMerged(EntityType.PERSON, MatchMethod.FUZZY);
                noOp.incrementEntityDeleted("junk");
                noOp.incrementEntityFlagged("junk");
                noOp.incrementRelationshipUpserted(RelationshipType.CO_OCCURRENCE, true);
                noOp.incrementItemSkipped("relate", "dense-document");
                noOp.recordBatchSize(50);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record stage duration per outcome")
        void recordStageDuration() {
            metrics.recordStageDuration("resolve", true, Duration.ofMillis(150));
            metrics.recordStageDuration("resolve", true, Duration.ofMillis(250));
            metrics.recordStageDuration("resolve", false, Duration.ofMillis(10));

            Timer success = registry.find("pipeline.stage.duration")
                    .tag("stage", "resolve")
                    .tag("outcome", "success")
                    .timer();
            Timer failure = registry.find("pipeline.stage.duration")
                    .tag("stage", "resolve")
                    .tag("outcome", "failure")
                    .timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertNotNull(failure);
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("Should count merges by type and method")
        void incrementEntityMerged() {
            metrics.incrementEntityMerged(EntityType.PERSON, MatchMethod.FUZZY);
            metrics.incrementEntityMerged(EntityType.PERSON, MatchMethod.FUZZY);
            metrics.incrementEntityMerged(EntityType.PERSON, MatchMethod.ALIAS);

            Counter fuzzy = registry.find("pipeline.entity.merged")
                    .tag("entityType", "PERSON")
                    .tag("method", "FUZZY")
                    .counter();

            assertNotNull(fuzzy);
            assertEquals(2.0, fuzzy.count());
        }

        @Test
        @DisplayName("Should count written mentions")
        void incrementMentionsWritten() {
            metrics.incrementMentionsWritten(5);
            metrics.incrementMentionsWritten(2);

            assertEquals(7.0, registry.find("pipeline.mentions.written").counter().count());
        }

        @Test
        @DisplayName("Should separate inserted and accumulated relationships")
        void incrementRelationshipUpserted() {
            metrics.incrementRelationshipUpserted(RelationshipType.COMMUNICATED, true);
            metrics.incrementRelationshipUpserted(RelationshipType.COMMUNICATED, false);
            metrics.incrementRelationshipUpserted(RelationshipType.COMMUNICATED, false);

            Counter accumulated = registry.find("pipeline.relationship.upserted")
                    .tag("type", "communicated")
                    .tag("operation", "accumulate")
                    .counter();

            assertNotNull(accumulated);
            assertEquals(2.0, accumulated.count());
        }

        @Test
        @DisplayName("Should count skipped items by stage and reason")
        void incrementItemSkipped() {
            metrics.incrementItemSkipped("relate", "unresolved-name");

            Counter skipped = registry.find("pipeline.item.skipped")
                    .tag("stage", "relate")
                    .tag("reason", "unresolved-name")
                    .counter();

            assertNotNull(skipped);
            assertEquals(1.0, skipped.count());
        }

        @Test
        @DisplayName("Should record batch sizes and cache lookups")
        void batchAndCache() {
            metrics.recordBatchSize(100);
            metrics.recordBatchSize(50);
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            DistributionSummary batches = registry.find("pipeline.batch.size").summary();
            assertNotNull(batches);
            assertEquals(2, batches.count());
            assertEquals(150.0, batches.totalAmount());
            assertEquals(1.0, registry.find("pipeline.cache.hit").counter().count());
            assertEquals(2.0, registry.find("pipeline.cache.miss").counter().count());
        }
    }
}
