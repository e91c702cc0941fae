package com.entity.pipeline.metrics;

import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.RelationshipType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code pipeline.stage.duration} Timer (tags: stage, outcome)</li>
 *   <li>{@code pipeline.mentions.written} Counter</li>
 *   <li>{@code pipeline.entity.merged} Counter (tags: entityType, method)</li>
 *   <li>{@code pipeline.entity.deleted} Counter (tag: reason)</li>
 *   <li>{@code pipeline.entity.flagged} Counter (tag: reason)</li>
 *   <li>{@code pipeline.relationship.upserted} Counter (tags: type, operation)</li>
 *   <li>{@code pipeline.item.skipped} Counter (tags: stage, reason)</li>
 *   <li>{@code pipeline.batch.size} DistributionSummary</li>
 *   <li>{@code pipeline.cache.hit} / {@code pipeline.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter mentionsWrittenCounter;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mentionsWrittenCounter = Counter.builder("pipeline.mentions.written")
                .description("Mention rows inserted or updated by extraction")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("pipeline.batch.size")
                .description("Distribution of batch sizes on commit")
                .register(registry);
        this.cacheHitCounter = Counter.builder("pipeline.cache.hit")
                .description("Number of resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("pipeline.cache.miss")
                .description("Number of resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(stage + ":" + outcome, k ->
                Timer.builder("pipeline.stage.duration")
                        .description("Duration of pipeline stage runs")
                        .tag("stage", stage)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMentionsWritten(long count) {
        mentionsWrittenCounter.increment(count);
    }

    @Override
    public void incrementEntityMerged(EntityType type, MatchMethod method) {
        counter("merged:" + type.name() + ":" + method.name(), () ->
                Counter.builder("pipeline.entity.merged")
                        .description("Number of entities merged into a canonical entity")
                        .tag("entityType", type.name())
                        .tag("method", method.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementEntityDeleted(String reason) {
        counter("deleted:" + reason, () ->
                Counter.builder("pipeline.entity.deleted")
                        .description("Number of entities hard-deleted")
                        .tag("reason", reason)
                        .register(registry)).increment();
    }

    @Override
    public void incrementEntityFlagged(String reason) {
        counter("flagged:" + reason, () ->
                Counter.builder("pipeline.entity.flagged")
                        .description("Number of entities flagged for review")
                        .tag("reason", reason)
                        .register(registry)).increment();
    }

    @Override
    public void incrementRelationshipUpserted(RelationshipType type, boolean created) {
        String operation = created ? "insert" : "accumulate";
        counter("rel:" + type.getValue() + ":" + operation, () ->
                Counter.builder("pipeline.relationship.upserted")
                        .description("Relationship edges inserted or accumulated")
                        .tag("type", type.getValue())
                        .tag("operation", operation)
                        .register(registry)).increment();
    }

    @Override
    public void incrementItemSkipped(String stage, String reason) {
        counter("skipped:" + stage + ":" + reason, () ->
                Counter.builder("pipeline.item.skipped")
                        .description("Items skipped with a warning")
                        .tag("stage", stage)
                        .tag("reason", reason)
                        .register(registry)).increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
