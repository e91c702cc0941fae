package com.entity.pipeline.merge;

import com.entity.pipeline.audit.AuditAction;
import com.entity.pipeline.audit.AuditService;
import com.entity.pipeline.audit.MergeLedger;
import com.entity.pipeline.cache.MergeListener;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.MatchResult;
import com.entity.pipeline.core.model.MergeRecord;
import com.entity.pipeline.core.model.Relationship;
import com.entity.pipeline.core.model.RelationshipType;
import com.entity.pipeline.lock.EntityLock;
import com.entity.pipeline.logging.LogContext;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.pipeline.PipelineException;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.relationship.ConfidenceModel;
import com.entity.pipeline.store.EntityRepository;
import com.entity.pipeline.store.EvidenceLedgerRepository;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.RelationshipRepository;
import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Folds one entity into another inside a single {@link StoreTransaction}.
 *
 * Merge process:
 * 1. Lock both entity ids (ascending order)
 * 2. Re-point mentions, summing counts on shared documents
 * 3. Re-point relationships, folding them into existing equivalent edges and dropping self-loops
 * 4. Re-key the evidence ledger
 * 5. Add the source's names to the target's aliases and mark the target consolidated
 * 6. Delete the source, recompute the target's mention count
 * 7. Write the merge ledger and audit entries
 *
 * Any failure rolls back every step and surfaces as a {@link PipelineException}.
 * Listeners are notified only after the transaction committed.
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final StoreConnection store;
    private final EntityRepository entityRepository;
    private final MentionRepository mentionRepository;
    private final RelationshipRepository relationshipRepository;
    private final EvidenceLedgerRepository evidenceLedger;
    private final MergeLedger mergeLedger;
    private final AuditService auditService;
    private final EntityLock entityLock;
    private final MetricsService metricsService;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    public MergeEngine(StoreConnection store, EntityLock entityLock, AuditService auditService,
                       MetricsService metricsService) {
        this.store = store;
        this.entityRepository = new EntityRepository(store);
        this.mentionRepository = new MentionRepository(store);
        this.relationshipRepository = new RelationshipRepository(store);
        this.evidenceLedger = new EvidenceLedgerRepository(store);
        this.mergeLedger = new MergeLedger(store);
        this.auditService = auditService;
        this.entityLock = entityLock;
        this.metricsService = metricsService;
    }

    public MergeResult merge(long sourceEntityId, long targetEntityId, MatchResult matchResult, String triggeredBy) {
        return merge(sourceEntityId, targetEntityId, matchResult, triggeredBy, false);
    }

    /**
     * Merges the source entity into the target entity.
     *
     * @param sourceEntityId entity merged away and deleted
     * @param targetEntityId surviving canonical entity
     * @param matchResult    the match that justified the merge
     * @param triggeredBy    identifier of who or what triggered the merge
     * @param dryRun         perform every step, then roll back
     * @return the merge result; skipped if either entity no longer exists
     * @throws PipelineException if a step fails; nothing is changed in that case
     */
    public MergeResult merge(long sourceEntityId, long targetEntityId, MatchResult matchResult,
                             String triggeredBy, boolean dryRun) {
        if (sourceEntityId == targetEntityId) {
            throw new IllegalArgumentException("Cannot merge entity " + sourceEntityId + " into itself");
        }
        if (!matchResult.matched()) {
            throw new IllegalArgumentException("Merge requires a positive match result");
        }
        try (LogContext logCtx = LogContext.forMerge(
                LogContext.generateCorrelationId(), sourceEntityId, targetEntityId);
             EntityLock.Held held = entityLock.lockAll(sourceEntityId, targetEntityId)) {
            log.info("merge.starting sourceEntityId={} targetEntityId={} method={} triggeredBy={}",
                    sourceEntityId, targetEntityId, matchResult.method(), triggeredBy);

            Optional<Entity> sourceOpt = entityRepository.findById(sourceEntityId);
            Optional<Entity> targetOpt = entityRepository.findById(targetEntityId);
            if (sourceOpt.isEmpty()) {
                log.info("merge.skipped sourceEntityId={} reason=source-missing", sourceEntityId);
                return MergeResult.skipped("Source entity not found: " + sourceEntityId);
            }
            if (targetOpt.isEmpty()) {
                log.info("merge.skipped targetEntityId={} reason=target-missing", targetEntityId);
                return MergeResult.skipped("Target entity not found: " + targetEntityId);
            }
            Entity source = sourceOpt.get();
            Entity target = targetOpt.get();
            if (source.getType() != target.getType()) {
                return MergeResult.skipped(source, target, "Entity types differ: "
                        + source.getType() + " vs " + target.getType());
            }

            MergeRecord mergeRecord;
            try (StoreTransaction tx = StoreTransaction.begin(store,
                    "merge " + sourceEntityId + " into " + targetEntityId, dryRun)) {
                MergeRecord.Builder recordBuilder = MergeRecord.builder()
                        .sourceEntityId(sourceEntityId)
                        .targetEntityId(targetEntityId)
                        .sourceName(source.getCanonicalName())
                        .targetName(target.getCanonicalName())
                        .matchMethod(matchResult.method())
                        .matchScore(matchResult.score())
                        .triggeredBy(triggeredBy);

                tx.execute("re-point mentions", () -> {
                    MentionRepository.ReassignOutcome outcome =
                            mentionRepository.reassign(sourceEntityId, targetEntityId);
                    recordBuilder.mentionsMoved(outcome.moved()).mentionsCombined(outcome.combined());
                });

                tx.execute("re-point relationships",
                        () -> migrateRelationships(sourceEntityId, targetEntityId, recordBuilder));

                tx.execute("re-key evidence ledger", () -> evidenceLedger.rekey(sourceEntityId, targetEntityId));

                tx.execute("absorb names", () -> {
                    Entity updated = copyWithAliases(target);
                    updated.addAlias(source.getCanonicalName());
                    for (String alias : source.getAliases()) {
                        updated.addAlias(alias);
                    }
                    entityRepository.updateAliases(updated);
                    entityRepository.markConsolidated(targetEntityId);
                });

                tx.execute("delete source", () -> entityRepository.delete(sourceEntityId));

                tx.execute("recompute mention count", () -> entityRepository.recomputeMentionCount(targetEntityId));

                mergeRecord = recordBuilder.build();
                tx.execute("record in merge ledger", () -> mergeLedger.record(mergeRecord));

                tx.execute("create audit entry", () -> auditService.record(
                        AuditAction.ENTITY_MERGED, targetEntityId, triggeredBy, Map.of(
                                "sourceEntityId", sourceEntityId,
                                "sourceName", source.getCanonicalName(),
                                "method", matchResult.method().name(),
                                "score", matchResult.score()
                        )));

                tx.markSuccess();
            }

            if (dryRun) {
                log.info("merge.dry-run sourceEntityId={} targetEntityId={} mentionsMoved={} relationshipsMoved={}",
                        sourceEntityId, targetEntityId, mergeRecord.mentionsMoved(), mergeRecord.relationshipsMoved());
                return MergeResult.success(target, source, mergeRecord, true);
            }

            log.info("merge.completed sourceEntityId={} targetEntityId={} mentionsMoved={} mentionsCombined={} "
                            + "relationshipsMoved={} relationshipsCombined={} selfLoopsRemoved={}",
                    sourceEntityId, targetEntityId, mergeRecord.mentionsMoved(), mergeRecord.mentionsCombined(),
                    mergeRecord.relationshipsMoved(), mergeRecord.relationshipsCombined(),
                    mergeRecord.selfLoopsRemoved());
            metricsService.incrementEntityMerged(target.getType(), matchResult.method());
            notifyMergeListeners(sourceEntityId, targetEntityId);
            return MergeResult.success(target, source, mergeRecord, false);

        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("merge.failed sourceEntityId={} targetEntityId={} error={}",
                    sourceEntityId, targetEntityId, e.getMessage());
            throw new PipelineException(PipelineStage.RESOLVE, sourceEntityId,
                    "merge into " + targetEntityId + " failed and was rolled back: " + e.getMessage(), e);
        }
    }

    /**
     * Moves every edge of the source onto the target. An edge to the target itself would
     * become a self-loop and is deleted; an edge the target already has is folded into it.
     */
    private void migrateRelationships(long sourceId, long targetId, MergeRecord.Builder recordBuilder) {
        int moved = 0;
        int combined = 0;
        int selfLoops = 0;
        for (Relationship relationship : relationshipRepository.findByEntity(sourceId)) {
            long other = relationship.otherEndpoint(sourceId);
            if (other == targetId) {
                relationshipRepository.delete(relationship.getId());
                selfLoops++;
                continue;
            }
            Optional<Relationship> existing = relationshipRepository.find(targetId, other, relationship.getType());
            if (existing.isEmpty()) {
                relationshipRepository.repoint(relationship, sourceId, targetId);
                moved++;
                continue;
            }
            Relationship kept = existing.get();
            if (relationship.getType() != RelationshipType.SYNTHETIC_ISOLATE_LINK) {
                double weight = kept.getWeight() + relationship.getWeight();
                double risk = Math.min(100.0, kept.getRiskScore() + relationship.getRiskScore());
                relationshipRepository.updateTotals(kept.getId(), weight,
                        ConfidenceModel.confidence(kept.getType(), weight), risk,
                        kept.getEvidence().plus(relationship.getEvidence()));
            }
            relationshipRepository.delete(relationship.getId());
            combined++;
        }
        log.debug("Relationships {} -> {}: moved={} combined={} selfLoops={}",
                sourceId, targetId, moved, combined, selfLoops);
        recordBuilder.relationshipsMoved(moved).relationshipsCombined(combined).selfLoopsRemoved(selfLoops);
    }

    private static Entity copyWithAliases(Entity target) {
        return Entity.builder()
                .id(target.getId())
                .canonicalName(target.getCanonicalName())
                .type(target.getType())
                .aliases(target.getAliases())
                .build();
    }

    /**
     * Adds a listener that will be notified after committed merges.
     */
    public void addMergeListener(MergeListener listener) {
        if (listener != null) {
            mergeListeners.add(listener);
        }
    }

    private void notifyMergeListeners(long sourceEntityId, long targetEntityId) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(sourceEntityId, targetEntityId);
            } catch (RuntimeException e) {
                log.warn("Merge listener notification failed: {}", e.getMessage());
            }
        }
    }

    public List<MergeRecord> getMergeHistory(long entityId) {
        return mergeLedger.getRecordsForTarget(entityId);
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }
}
