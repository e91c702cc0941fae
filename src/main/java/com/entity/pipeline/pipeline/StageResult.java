package com.entity.pipeline.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one stage run: named counters plus item-level warnings.
 */
public record StageResult(
        PipelineStage stage,
        boolean dryRun,
        Map<String, Long> counters,
        List<String> warnings,
        Duration duration
) {
    public StageResult {
        counters = counters != null ? Map.copyOf(counters) : Map.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /**
     * Value of a counter, 0 when it was never incremented.
     */
    public long count(String counter) {
        return counters.getOrDefault(counter, 0L);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "StageResult{" +
                "stage=" + stage.getCommand() +
                ", dryRun=" + dryRun +
                ", counters=" + new TreeMap<>(counters) +
                ", warnings=" + warnings.size() +
                ", durationMs=" + duration.toMillis() +
                '}';
    }

    public static Builder builder(PipelineStage stage, boolean dryRun) {
        return new Builder(stage, dryRun);
    }

    /**
     * Mutable accumulator used while a stage runs.
     */
    public static class Builder {
        private static final int MAX_WARNINGS = 1000;

        private final PipelineStage stage;
        private final boolean dryRun;
        private final long startNanos = System.nanoTime();
        private final Map<String, Long> counters = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder(PipelineStage stage, boolean dryRun) {
            this.stage = stage;
            this.dryRun = dryRun;
        }

        public Builder increment(String counter) {
            return add(counter, 1);
        }

        public Builder add(String counter, long amount) {
            counters.merge(counter, amount, Long::sum);
            return this;
        }

        public Builder set(String counter, long value) {
            counters.put(counter, value);
            return this;
        }

        public long get(String counter) {
            return counters.getOrDefault(counter, 0L);
        }

        public Builder warn(String warning) {
            if (warnings.size() < MAX_WARNINGS) {
                warnings.add(warning);
            }
            return add("warnings", 1);
        }

        public StageResult build() {
            return new StageResult(stage, dryRun, counters, warnings,
                    Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }
}
