package com.entity.pipeline.scoring;

import com.entity.pipeline.core.model.Document;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.logging.LogContext;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.rules.ScoringRules;
import com.entity.pipeline.store.CheckpointRepository;
import com.entity.pipeline.store.DocumentRepository;
import com.entity.pipeline.store.EntityRepository;
import com.entity.pipeline.store.IdRange;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.RelationshipRepository;
import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes document risk, then entity importance and risk, from the current store state.
 * Scores never depend on previous scores, so running the stage twice gives the same values.
 */
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    static final String DOCUMENT_CHECKPOINT = "score.documents";
    static final String ENTITY_CHECKPOINT = "score.entities";

    private final StoreConnection store;
    private final EntityRepository entityRepository;
    private final DocumentRepository documentRepository;
    private final MentionRepository mentionRepository;
    private final RelationshipRepository relationshipRepository;
    private final CheckpointRepository checkpointRepository;
    private final ScoringRules rules;
    private final ImportanceScorer importanceScorer;
    private final DocumentRiskScorer documentRiskScorer;
    private final EntityRiskScorer entityRiskScorer;
    private final MetricsService metricsService;

    public ScoringEngine(StoreConnection store, ScoringRules rules, ScoringConfig config,
                         MetricsService metricsService) {
        this.store = store;
        this.entityRepository = new EntityRepository(store);
        this.documentRepository = new DocumentRepository(store);
        this.mentionRepository = new MentionRepository(store);
        this.relationshipRepository = new RelationshipRepository(store);
        this.checkpointRepository = new CheckpointRepository(store);
        this.rules = rules;
        this.importanceScorer = new ImportanceScorer(config);
        this.documentRiskScorer = new DocumentRiskScorer(rules, config);
        this.entityRiskScorer = new EntityRiskScorer(config);
        this.metricsService = metricsService;
    }

    public StageResult score(StageOptions options) {
        StageResult.Builder result = StageResult.builder(PipelineStage.SCORE, options.dryRun());
        try (LogContext ctx = LogContext.forStage(PipelineStage.SCORE.getCommand(),
                LogContext.generateCorrelationId())) {
            log.info("score.starting dryRun={} range={}", options.dryRun(), options.range());
            try (StoreTransaction dryRunScope = StoreTransaction.dryRunScope(store, "score dry run",
                    options.dryRun())) {
                Set<Long> anchors = anchorEntityIds();
                result.set("anchorsFound", anchors.size());
                scoreDocuments(anchors, options, result);
                scoreEntities(anchors, options, result);
            }
            if (!options.dryRun()) {
                checkpointRepository.clear(DOCUMENT_CHECKPOINT);
                checkpointRepository.clear(ENTITY_CHECKPOINT);
            }
            StageResult built = result.build();
            log.info("score.completed {}", built);
            return built;
        }
    }

    /**
     * Ids of the configured anchor entities present in the store, of any kind, found by
     * canonical name or by an alias left behind by a merge.
     */
    Set<Long> anchorEntityIds() {
        Set<Long> ids = new HashSet<>();
        for (String name : rules.anchorEntities()) {
            List<Entity> matches = entityRepository.findByNameOrAlias(name);
            matches.forEach(entity -> ids.add(entity.getId()));
            if (matches.isEmpty()) {
                log.debug("Anchor entity '{}' is not in the store", name);
            }
        }
        return ids;
    }

    // ========== Documents ==========

    private void scoreDocuments(Set<Long> anchors, StageOptions options, StageResult.Builder result) {
        long afterId = resumePoint(DOCUMENT_CHECKPOINT, options);
        long batchNumber = 0;
        while (true) {
            // document risk feeds entity risk, so the entity id range does not restrict this pass
            List<Document> page = documentRepository.findPage(afterId, IdRange.all(), options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long lastId = page.get(page.size() - 1).id();
            batchNumber++;
            try (LogContext batchCtx = LogContext.forBatch("score.documents", batchNumber);
                 StoreTransaction tx = StoreTransaction.begin(store, "score documents batch " + batchNumber,
                         options.dryRun())) {
                for (Document document : page) {
                    tx.execute("document " + document.id(), () -> scoreDocument(document, anchors, result));
                }
                tx.execute("checkpoint", () -> checkpointRepository.save(DOCUMENT_CHECKPOINT, lastId,
                        result.get("documentsScored")));
                tx.markSuccess();
            }
            afterId = lastId;
        }
    }

    private void scoreDocument(Document document, Set<Long> anchors, StageResult.Builder result) {
        int anchorsMentioned = (int) mentionRepository.findByDocument(document.id()).stream()
                .filter(m -> anchors.contains(m.entityId()))
                .count();
        double risk = documentRiskScorer.score(document.content(), anchorsMentioned);
        int rating = RiskRating.fromScore(risk);
        documentRepository.updateRisk(document.id(), risk, rating);
        result.increment("documentsScored");
        result.increment("documentRating." + rating);
    }

    // ========== Entities ==========

    private void scoreEntities(Set<Long> anchors, StageOptions options, StageResult.Builder result) {
        long maxMentions = entityRepository.maxMentionCount();
        Map<Long, Integer> degrees = entityRepository.evidenceDegrees();
        long afterId = resumePoint(ENTITY_CHECKPOINT, options);
        long batchNumber = 0;
        while (true) {
            List<Entity> page = entityRepository.findPage(afterId, options.range(), options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long lastId = page.get(page.size() - 1).getId();
            batchNumber++;
            metricsService.recordBatchSize(page.size());
            try (LogContext batchCtx = LogContext.forBatch(PipelineStage.SCORE.getCommand(), batchNumber);
                 StoreTransaction tx = StoreTransaction.begin(store, "score entities batch " + batchNumber,
                         options.dryRun())) {
                for (Entity entity : page) {
                    tx.execute("entity " + entity.getId(), () -> scoreEntity(entity, maxMentions,
                            degrees.getOrDefault(entity.getId(), 0), anchors, result));
                }
                tx.execute("checkpoint", () -> checkpointRepository.save(ENTITY_CHECKPOINT, lastId,
                        result.get("entitiesScored")));
                tx.markSuccess();
            }
            afterId = lastId;
            options.progress().onProgress(result.get("entitiesScored"), -1, "entities scored");
        }
    }

    private void scoreEntity(Entity entity, long maxMentions, int degree, Set<Long> anchors,
                             StageResult.Builder result) {
        long id = entity.getId();
        double importance = importanceScorer.score(entity.getMentionCount(), maxMentions, degree,
                entity.isInCuratedSource());
        long anchorLinks = anchorLinks(id, anchors);
        double risk = entityRiskScorer.score(entity.getMentionCount(), mentionRepository.maxDocumentRisk(id),
                anchorLinks, anchors.contains(id));
        int rating = RiskRating.fromScore(risk);
        entityRepository.updateScores(id, importance, risk, rating);
        result.increment("entitiesScored");
        result.increment("entityRating." + rating);
    }

    private long anchorLinks(long entityId, Set<Long> anchors) {
        if (anchors.isEmpty()) {
            return 0;
        }
        return relationshipRepository.findByEntity(entityId).stream()
                .filter(r -> r.getType().isEvidenceBased())
                .map(r -> r.otherEndpoint(entityId))
                .filter(anchors::contains)
                .count();
    }

    private long resumePoint(String checkpoint, StageOptions options) {
        if (!options.resume()) {
            return 0;
        }
        return checkpointRepository.find(checkpoint).map(CheckpointRepository.Checkpoint::lastProcessedId).orElse(0L);
    }
}
