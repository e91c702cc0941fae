package com.entity.pipeline.cli;

import com.entity.pipeline.audit.AuditService;
import com.entity.pipeline.audit.SqliteAuditRepository;
import com.entity.pipeline.cache.CaffeineResolutionCache;
import com.entity.pipeline.cache.NoOpResolutionCache;
import com.entity.pipeline.cache.ResolutionCache;
import com.entity.pipeline.config.PipelineConfig;
import com.entity.pipeline.integrity.IntegrityGuard;
import com.entity.pipeline.lock.EntityLock;
import com.entity.pipeline.lock.LocalEntityLock;
import com.entity.pipeline.mention.MentionExtractor;
import com.entity.pipeline.merge.MergeEngine;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.metrics.NoOpMetricsService;
import com.entity.pipeline.pipeline.PipelineException;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.relationship.RelationshipBuilder;
import com.entity.pipeline.resolve.IdentityResolver;
import com.entity.pipeline.resolve.JunkClassifier;
import com.entity.pipeline.resolve.NameMatcher;
import com.entity.pipeline.rules.ResolverRules;
import com.entity.pipeline.rules.ScoringRules;
import com.entity.pipeline.scoring.ScoringEngine;
import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wires the pipeline components over one store and runs stages.
 *
 * <p>Usage:</p>
 * <pre>
 * PipelineRunner runner = PipelineRunner.builder()
 *         .store(store)
 *         .config(PipelineConfig.defaults())
 *         .build();
 * List&lt;StageResult&gt; results = runner.run("all", StageOptions.defaults());
 * </pre>
 */
public class PipelineRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    /**
     * Stage order of {@code all}: the integrity pass also runs right after resolution so that
     * relationship building starts from a clean graph.
     */
    static final List<PipelineStage> ALL_STAGES = List.of(
            PipelineStage.EXTRACT,
            PipelineStage.RESOLVE,
            PipelineStage.INTEGRITY,
            PipelineStage.RELATE,
            PipelineStage.SCORE,
            PipelineStage.INTEGRITY);

    private final MentionExtractor mentionExtractor;
    private final IdentityResolver identityResolver;
    private final RelationshipBuilder relationshipBuilder;
    private final ScoringEngine scoringEngine;
    private final IntegrityGuard integrityGuard;
    private final MergeEngine mergeEngine;
    private final AuditService auditService;
    private final MetricsService metricsService;

    private PipelineRunner(Builder builder) {
        StoreConnection store = builder.store;
        PipelineConfig config = builder.config;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null
                ? builder.auditService : new AuditService(new SqliteAuditRepository(store));

        ResolutionCache cache = builder.resolutionCache;
        if (cache == null) {
            cache = config.cache().enabled() ? new CaffeineResolutionCache(config.cache()) : new NoOpResolutionCache();
        }
        EntityLock entityLock = builder.entityLock != null ? builder.entityLock : new LocalEntityLock(config.lock());
        JunkClassifier junkClassifier = new JunkClassifier(builder.resolverRules);

        this.mergeEngine = new MergeEngine(store, entityLock, auditService, metricsService);
        this.mentionExtractor = new MentionExtractor(store, config.extraction(), metricsService);
        this.identityResolver = new IdentityResolver(store, new NameMatcher(builder.resolverRules), junkClassifier,
                mergeEngine, cache, auditService, metricsService);
        this.relationshipBuilder = new RelationshipBuilder(store, identityResolver, config.relationship(),
                auditService, metricsService);
        this.scoringEngine = new ScoringEngine(store, builder.scoringRules, config.scoring(), metricsService);
        this.integrityGuard = new IntegrityGuard(store, junkClassifier, config.integrity(), auditService,
                metricsService);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs one stage by its command name, or every stage for {@code all}.
     *
     * @throws PipelineException on a fatal failure; stages already run keep their commits
     */
    public List<StageResult> run(String stage, StageOptions options) {
        if (CommandLineOptions.ALL_STAGES.equalsIgnoreCase(stage)) {
            List<StageResult> results = new ArrayList<>();
            for (PipelineStage next : ALL_STAGES) {
                results.add(runStage(next, options));
            }
            return results;
        }
        return List.of(runStage(PipelineStage.fromCommand(stage), options));
    }

    public StageResult runStage(PipelineStage stage, StageOptions options) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            StageResult result = switch (stage) {
                case EXTRACT -> mentionExtractor.extract(options);
                case RESOLVE -> identityResolver.resolve(options);
                case RELATE -> relationshipBuilder.build(options);
                case SCORE -> scoringEngine.score(options);
                case INTEGRITY -> integrityGuard.check(options);
            };
            success = true;
            return result;
        } catch (StoreException e) {
            throw new PipelineException(stage, null, "store failure: " + e.getMessage(), e);
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordStageDuration(stage.getCommand(), success, elapsed);
            if (!success) {
                log.error("stage.failed stage={} elapsedMs={}", stage.getCommand(), elapsed.toMillis());
            }
        }
    }

    public IdentityResolver getIdentityResolver() {
        return identityResolver;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static class Builder {
        private StoreConnection store;
        private PipelineConfig config = PipelineConfig.defaults();
        private ResolverRules resolverRules;
        private ScoringRules scoringRules;
        private AuditService auditService;
        private MetricsService metricsService;
        private ResolutionCache resolutionCache;
        private EntityLock entityLock;

        /**
         * Sets the store every component works on. Required.
         */
        public Builder store(StoreConnection store) {
            this.store = store;
            return this;
        }

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the resolver rules. Defaults to the bundled rules.
         */
        public Builder resolverRules(ResolverRules resolverRules) {
            this.resolverRules = resolverRules;
            return this;
        }

        /**
         * Sets the scoring keywords and anchors. Defaults to the bundled rules.
         */
        public Builder scoringRules(ScoringRules scoringRules) {
            this.scoringRules = scoringRules;
            return this;
        }

        /**
         * Sets a custom audit service. Defaults to one writing to the store's audit table.
         */
        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder resolutionCache(ResolutionCache resolutionCache) {
            this.resolutionCache = resolutionCache;
            return this;
        }

        public Builder entityLock(EntityLock entityLock) {
            this.entityLock = entityLock;
            return this;
        }

        public PipelineRunner build() {
            Objects.requireNonNull(store, "store is required");
            Objects.requireNonNull(config, "config is required");
            if (resolverRules == null) {
                resolverRules = ResolverRules.defaults();
            }
            if (scoringRules == null) {
                scoringRules = ScoringRules.defaults();
            }
            return new PipelineRunner(this);
        }
    }
}
