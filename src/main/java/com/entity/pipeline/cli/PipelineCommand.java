package com.entity.pipeline.cli;

import com.entity.pipeline.config.ConfigLoader;
import com.entity.pipeline.config.PipelineConfig;
import com.entity.pipeline.lock.LockAcquisitionException;
import com.entity.pipeline.lock.WriterLock;
import com.entity.pipeline.metrics.MicrometerMetricsService;
import com.entity.pipeline.pipeline.PipelineException;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.rules.ResolverRules;
import com.entity.pipeline.rules.RulesLoader;
import com.entity.pipeline.rules.ScoringRules;
import com.entity.pipeline.store.SqliteStoreConnection;
import com.entity.pipeline.store.StoreException;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Command-line entry point: {@code PipelineCommand <stage> --db=<file> [options]}.
 *
 * <p>Exit codes: 0 success, 1 fatal pipeline failure, 2 usage error, 3 writer lock held by
 * another process.</p>
 */
public final class PipelineCommand {
    private static final Logger log = LoggerFactory.getLogger(PipelineCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_LOCKED = 3;

    private PipelineCommand() {
    }

    public static void main(String[] args) {
        System.exit(run(System.out, System.err, args));
    }

    public static int run(PrintStream out, PrintStream err, String... args) {
        CommandLineOptions options;
        PipelineConfig config;
        ResolverRules resolverRules;
        ScoringRules scoringRules;
        try {
            options = CommandLineOptions.parse(args);
            if (options.isHelp()) {
                out.print(CommandLineOptions.USAGE);
                return EXIT_OK;
            }
            config = ConfigLoader.load(options.getConfigFile());
            resolverRules = RulesLoader.loadResolverRules(options.getRulesFile());
            scoringRules = RulesLoader.loadScoringRules(options.getScoringRulesFile());
        } catch (UsageException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.print(CommandLineOptions.USAGE);
            return EXIT_USAGE;
        }

        if (!Files.isRegularFile(options.getDatabase())) {
            err.println("error: database not found: " + options.getDatabase());
            return EXIT_FAILURE;
        }

        StageOptions stageOptions = options.toStageOptions(config.batchSize())
                .withProgress((processed, total, message) -> log.debug("progress {} {}", processed, message));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (WriterLock writerLock = WriterLock.acquire(options.getDatabase());
             SqliteStoreConnection store = new SqliteStoreConnection(options.getDatabase().toString())) {
            store.createSchema();
            PipelineRunner runner = PipelineRunner.builder()
                    .store(store)
                    .config(config)
                    .resolverRules(resolverRules)
                    .scoringRules(scoringRules)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();
            List<StageResult> results = runner.run(options.getStage(), stageOptions);
            report(out, results);
            logMetricsSummary(registry);
            return EXIT_OK;
        } catch (LockAcquisitionException e) {
            err.println("error: " + e.getMessage());
            return EXIT_LOCKED;
        } catch (PipelineException | StoreException e) {
            log.error("pipeline.failed {}", e.getMessage(), e);
            err.println("error: " + e.getMessage());
            logMetricsSummary(registry);
            return EXIT_FAILURE;
        }
    }

    private static void report(PrintStream out, List<StageResult> results) {
        for (StageResult result : results) {
            out.printf("%s%s: %s (%d ms)%n", result.stage().getCommand(), result.dryRun() ? " [dry run]" : "",
                    new TreeMap<>(result.counters()), result.duration().toMillis());
            for (String warning : result.warnings()) {
                out.println("  warning: " + warning);
            }
        }
    }

    private static void logMetricsSummary(SimpleMeterRegistry registry) {
        Map<String, Double> summary = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            StringBuilder name = new StringBuilder(meter.getId().getName());
            meter.getId().getTags().forEach(tag -> name.append(',').append(tag.getKey()).append('=')
                    .append(tag.getValue()));
            for (Measurement measurement : meter.measure()) {
                if (measurement.getValue() != 0.0) {
                    summary.put(name + "." + measurement.getStatistic().getTagValueRepresentation(),
                            measurement.getValue());
                }
            }
        }
        log.info("metrics.summary {}", summary);
    }
}
