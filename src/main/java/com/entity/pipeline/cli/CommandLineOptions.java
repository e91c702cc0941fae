package com.entity.pipeline.cli;

import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.store.IdRange;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parsed command line of {@link PipelineCommand}.
 * Options are written {@code --name=value} or {@code --name value}.
 */
public final class CommandLineOptions {

    public static final String ALL_STAGES = "all";

    static final String USAGE = """
            Usage: PipelineCommand <stage> --db=<file> [options]

            Stages: extract, resolve, relate, score, integrity, all

            Options:
              --db=<file>             SQLite database to process (required)
              --dry-run               run every unit of work and roll it back, report counts
              --batch-size=<n>        items per transaction (default 500)
              --from-id=<n>           first id to process (entity ids; document ids for relate)
              --to-id=<n>             last id to process
              --rules=<json>          resolver rules file (default: bundled rules)
              --scoring-rules=<json>  scoring keyword and anchor file (default: bundled rules)
              --config=<json>         configuration overrides
              --rebuild               relate: discard evidence-based edges and recompute
              --resume                continue after the last committed checkpoint
              --help                  print this text

            Exit codes: 0 success, 1 pipeline failure, 2 usage error, 3 database locked
            """;

    private static final Set<String> FLAGS = Set.of("--dry-run", "--rebuild", "--resume", "--help", "-h");

    private String stage;
    private Path database;
    private boolean dryRun;
    private Integer batchSize;
    private Long fromId;
    private Long toId;
    private Path rulesFile;
    private Path scoringRulesFile;
    private Path configFile;
    private boolean rebuild;
    private boolean resume;
    private boolean help;

    private CommandLineOptions() {
    }

    public static CommandLineOptions parse(String... args) throws UsageException {
        CommandLineOptions options = new CommandLineOptions();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-")) {
                positional.add(arg);
                continue;
            }
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            } else if (!FLAGS.contains(arg)) {
                if (i + 1 >= args.length) {
                    throw new UsageException("Missing value for " + arg);
                }
                value = args[++i];
            }
            options.apply(name, value);
        }
        if (options.help) {
            return options;
        }
        if (positional.size() != 1) {
            throw new UsageException(positional.isEmpty() ? "Missing stage" : "Unexpected arguments: " + positional);
        }
        options.stage = validateStage(positional.get(0));
        if (options.database == null) {
            throw new UsageException("Missing required option --db");
        }
        if (options.fromId != null && options.toId != null && options.fromId > options.toId) {
            throw new UsageException("--from-id must not be greater than --to-id");
        }
        return options;
    }

    private void apply(String name, String value) throws UsageException {
        switch (name) {
            case "--db" -> database = Path.of(requireValue(name, value));
            case "--dry-run" -> dryRun = flag(name, value);
            case "--rebuild" -> rebuild = flag(name, value);
            case "--resume" -> resume = flag(name, value);
            case "--help", "-h" -> help = true;
            case "--batch-size" -> {
                batchSize = (int) parseLong(name, value);
                if (batchSize <= 0) {
                    throw new UsageException("--batch-size must be positive");
                }
            }
            case "--from-id" -> fromId = parseLong(name, value);
            case "--to-id" -> toId = parseLong(name, value);
            case "--rules" -> rulesFile = Path.of(requireValue(name, value));
            case "--scoring-rules" -> scoringRulesFile = Path.of(requireValue(name, value));
            case "--config" -> configFile = Path.of(requireValue(name, value));
            default -> throw new UsageException("Unknown option " + name);
        }
    }

    private static String validateStage(String stage) throws UsageException {
        if (ALL_STAGES.equalsIgnoreCase(stage)) {
            return ALL_STAGES;
        }
        try {
            return PipelineStage.fromCommand(stage).getCommand();
        } catch (IllegalArgumentException e) {
            throw new UsageException("Unknown stage '" + stage + "'", e);
        }
    }

    private static String requireValue(String name, String value) throws UsageException {
        if (value == null || value.isBlank()) {
            throw new UsageException("Missing value for " + name);
        }
        return value;
    }

    private static boolean flag(String name, String value) throws UsageException {
        if (value == null || value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new UsageException("Invalid value for " + name + ": " + value);
    }

    private static long parseLong(String name, String value) throws UsageException {
        try {
            return Long.parseLong(requireValue(name, value).trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid number for " + name + ": " + value, e);
        }
    }

    /**
     * Stage options for this invocation; the batch size falls back to {@code defaultBatchSize}.
     */
    public StageOptions toStageOptions(int defaultBatchSize) {
        return new StageOptions(dryRun, batchSize != null ? batchSize : defaultBatchSize,
                IdRange.of(fromId, toId), rebuild, resume, null);
    }

    public String getStage() {
        return stage;
    }

    public boolean isAllStages() {
        return ALL_STAGES.equals(stage);
    }

    public Path getDatabase() {
        return database;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public Long getFromId() {
        return fromId;
    }

    public Long getToId() {
        return toId;
    }

    public Path getRulesFile() {
        return rulesFile;
    }

    public Path getScoringRulesFile() {
        return scoringRulesFile;
    }

    public Path getConfigFile() {
        return configFile;
    }

    public boolean isRebuild() {
        return rebuild;
    }

    public boolean isResume() {
        return resume;
    }

    public boolean isHelp() {
        return help;
    }
}
