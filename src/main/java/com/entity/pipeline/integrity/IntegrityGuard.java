package com.entity.pipeline.integrity;

import com.entity.pipeline.audit.AuditAction;
import com.entity.pipeline.audit.AuditService;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.Relationship;
import com.entity.pipeline.core.model.RelationshipType;
import com.entity.pipeline.logging.LogContext;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.pipeline.PipelineException;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.relationship.ConfidenceModel;
import com.entity.pipeline.resolve.JunkClassifier;
import com.entity.pipeline.store.EntityRepository;
import com.entity.pipeline.store.EvidenceLedgerRepository;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.RelationshipRepository;
import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repairs the structural invariants of the graph after the other stages.
 *
 * <p>One pass, in one transaction:</p>
 * <ol>
 *   <li>delete orphan mentions, relationships and evidence ledger rows, and self-loops;</li>
 *   <li>purge junk-named entities with no mentions and no evidence-based relationships;</li>
 *   <li>drop synthetic links of entities that now have evidence, and links to a former hub;</li>
 *   <li>recompute mention counts from the mention rows;</li>
 *   <li>link every remaining isolated entity to the hub with one synthetic link.</li>
 * </ol>
 *
 * <p>A missing hub entity is fatal: the pass is rolled back and a {@link PipelineException}
 * is thrown.</p>
 */
public class IntegrityGuard {
    private static final Logger log = LoggerFactory.getLogger(IntegrityGuard.class);

    static final String TRIGGERED_BY = "integrity-guard";

    private final StoreConnection store;
    private final EntityRepository entityRepository;
    private final MentionRepository mentionRepository;
    private final RelationshipRepository relationshipRepository;
    private final EvidenceLedgerRepository evidenceLedger;
    private final JunkClassifier junkClassifier;
    private final IntegrityConfig config;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public IntegrityGuard(StoreConnection store, JunkClassifier junkClassifier, IntegrityConfig config,
                          AuditService auditService, MetricsService metricsService) {
        this.store = store;
        this.entityRepository = new EntityRepository(store);
        this.mentionRepository = new MentionRepository(store);
        this.relationshipRepository = new RelationshipRepository(store);
        this.evidenceLedger = new EvidenceLedgerRepository(store);
        this.junkClassifier = junkClassifier;
        this.config = config;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public StageResult check(StageOptions options) {
        StageResult.Builder result = StageResult.builder(PipelineStage.INTEGRITY, options.dryRun());
        try (LogContext ctx = LogContext.forStage(PipelineStage.INTEGRITY.getCommand(),
                LogContext.generateCorrelationId())) {
            log.info("integrity.starting dryRun={} hub='{}'", options.dryRun(), config.hubName());
            try (StoreTransaction tx = StoreTransaction.begin(store, "integrity pass", options.dryRun())) {
                Entity hub = findHub().orElseThrow(() -> new PipelineException(PipelineStage.INTEGRITY,
                        "hub entity '" + config.hubName() + "' not found; create it before running the pass"));
                ctx.with("hubEntityId", String.valueOf(hub.getId()));

                tx.execute("delete orphans", () -> deleteOrphans(result));
                if (config.purgeJunk()) {
                    tx.execute("purge junk", () -> purgeJunk(hub.getId(), options, result));
                }
                tx.execute("drop stale synthetic links", () -> {
                    result.add("syntheticLinksRedundant", relationshipRepository.deleteRedundantSyntheticLinks());
                    result.add("syntheticLinksRetargeted", relationshipRepository.deleteSyntheticLinksNotTo(hub.getId()));
                });
                tx.execute("recompute mention counts", () ->
                        result.set("mentionCountsRecomputed", entityRepository.recomputeAllMentionCounts()));
                tx.execute("link isolates", () -> linkIsolates(hub, result));
                tx.markSuccess();
            }
            StageResult built = result.build();
            log.info("integrity.completed {}", built);
            return built;
        }
    }

    /**
     * The hub entity, matched by canonical name ignoring case, lowest id first. When a merge
     * folded the hub into a variant spelling, the survivor carrying the name as an alias is
     * the hub.
     */
    Optional<Entity> findHub() {
        return entityRepository.findByNameOrAlias(config.hubName()).stream().findFirst();
    }

    private void deleteOrphans(StageResult.Builder result) {
        result.add("orphanMentionsDeleted", mentionRepository.deleteOrphans());
        result.add("orphanRelationshipsDeleted", relationshipRepository.deleteOrphans());
        result.add("orphanLedgerRowsDeleted", evidenceLedger.deleteOrphans());
        result.add("selfLoopsDeleted", relationshipRepository.deleteSelfLoops());
    }

    private void purgeJunk(long hubId, StageOptions options, StageResult.Builder result) {
        List<Entity> entities = entityRepository.findAll().stream()
                .sorted(Comparator.comparing(Entity::getId))
                .toList();
        for (Entity entity : entities) {
            if (entity.getId() == hubId) {
                continue;
            }
            Optional<String> reason = junkClassifier.classify(entity.getCanonicalName());
            if (reason.isEmpty()) {
                continue;
            }
            if (mentionRepository.sumForEntity(entity.getId()) > 0
                    || relationshipRepository.countEvidenceBased(entity.getId()) > 0) {
                result.increment("junkKept");
                continue;
            }
            entityRepository.delete(entity.getId());
            auditService.record(AuditAction.ENTITY_DELETED, entity.getId(), TRIGGERED_BY, Map.of(
                    "canonicalName", entity.getCanonicalName(),
                    "reason", reason.get()));
            result.increment("junkPurged");
            if (!options.dryRun()) {
                metricsService.incrementEntityDeleted("junk");
            }
            log.debug("Purged junk entity {} '{}': {}", entity.getId(), entity.getCanonicalName(), reason.get());
        }
    }

    private void linkIsolates(Entity hub, StageResult.Builder result) {
        RelationshipType type = RelationshipType.SYNTHETIC_ISOLATE_LINK;
        double weight = type.getBaseWeight();
        for (long isolateId : relationshipRepository.findIsolatedEntityIds(hub.getId())) {
            relationshipRepository.insert(Relationship.builder()
                    .sourceId(isolateId)
                    .targetId(hub.getId())
                    .type(type)
                    .weight(weight)
                    .confidence(ConfidenceModel.confidence(type, weight))
                    .build());
            auditService.record(AuditAction.SYNTHETIC_LINK_CREATED, isolateId, TRIGGERED_BY, Map.of(
                    "hubEntityId", hub.getId()));
            result.increment("syntheticLinksCreated");
        }
        if (result.get("syntheticLinksCreated") > 0) {
            log.info("integrity.isolates-linked count={} hubEntityId={}",
                    result.get("syntheticLinksCreated"), hub.getId());
        }
    }
}
