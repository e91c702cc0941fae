package com.entity.pipeline.relationship;

import com.entity.pipeline.audit.AuditAction;
import com.entity.pipeline.audit.AuditService;
import com.entity.pipeline.core.model.Communication;
import com.entity.pipeline.core.model.Document;
import com.entity.pipeline.core.model.DocumentClassification;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.EvidenceSummary;
import com.entity.pipeline.core.model.Mention;
import com.entity.pipeline.core.model.Relationship;
import com.entity.pipeline.core.model.RelationshipType;
import com.entity.pipeline.core.model.TimelineEvent;
import com.entity.pipeline.core.model.WeightComponents;
import com.entity.pipeline.logging.LogContext;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.resolve.IdentityResolver;
import com.entity.pipeline.store.CheckpointRepository;
import com.entity.pipeline.store.DocumentRepository;
import com.entity.pipeline.store.EvidenceLedgerRepository;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.RelationshipRepository;
import com.entity.pipeline.store.SignalRepository;
import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Builds typed, weighted edges between entities from three kinds of evidence:
 * co-occurrence in a document, message headers, and curated timeline events.
 *
 * <p>Every contribution is keyed by (signal, entity pair, type) in the evidence ledger and
 * counted once, so running the stage again over the same corpus changes nothing. A rebuild
 * discards all evidence-based edges and the ledger first.</p>
 */
public class RelationshipBuilder {
    private static final Logger log = LoggerFactory.getLogger(RelationshipBuilder.class);

    static final String DOCUMENT_CHECKPOINT = "relate.documents";
    static final String COMMUNICATION_CHECKPOINT = "relate.communications";
    static final String TIMELINE_CHECKPOINT = "relate.timeline";
    static final String TRIGGERED_BY = "relationship-builder";

    private static final List<EntityType> SIGNAL_NAME_TYPES = List.of(EntityType.PERSON, EntityType.ORGANIZATION);

    private final StoreConnection store;
    private final DocumentRepository documentRepository;
    private final MentionRepository mentionRepository;
    private final RelationshipRepository relationshipRepository;
    private final EvidenceLedgerRepository evidenceLedger;
    private final SignalRepository signalRepository;
    private final CheckpointRepository checkpointRepository;
    private final IdentityResolver identityResolver;
    private final CoOccurrenceWeigher weigher;
    private final RelationshipConfig config;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public RelationshipBuilder(StoreConnection store, IdentityResolver identityResolver, RelationshipConfig config,
                               AuditService auditService, MetricsService metricsService) {
        this.store = store;
        this.documentRepository = new DocumentRepository(store);
        this.mentionRepository = new MentionRepository(store);
        this.relationshipRepository = new RelationshipRepository(store);
        this.evidenceLedger = new EvidenceLedgerRepository(store);
        this.signalRepository = new SignalRepository(store);
        this.checkpointRepository = new CheckpointRepository(store);
        this.identityResolver = identityResolver;
        this.weigher = new CoOccurrenceWeigher(config);
        this.config = config;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public StageResult build(StageOptions options) {
        StageResult.Builder result = StageResult.builder(PipelineStage.RELATE, options.dryRun());
        try (LogContext ctx = LogContext.forStage(PipelineStage.RELATE.getCommand(),
                LogContext.generateCorrelationId())) {
            log.info("relate.starting dryRun={} rebuild={} range={}",
                    options.dryRun(), options.rebuild(), options.range());
            try (StoreTransaction dryRunScope = StoreTransaction.dryRunScope(store, "relate dry run",
                    options.dryRun())) {
                if (options.rebuild()) {
                    rebuild(options, result);
                }
                buildCoOccurrences(options, result);
                buildCommunications(options, result);
                buildTimelineConnections(options, result);
            }
            if (!options.dryRun()) {
                checkpointRepository.clear(DOCUMENT_CHECKPOINT);
                checkpointRepository.clear(COMMUNICATION_CHECKPOINT);
                checkpointRepository.clear(TIMELINE_CHECKPOINT);
            }
            StageResult built = result.build();
            log.info("relate.completed {}", built);
            return built;
        }
    }

    private void rebuild(StageOptions options, StageResult.Builder result) {
        try (StoreTransaction tx = StoreTransaction.begin(store, "relationship rebuild", options.dryRun())) {
            tx.execute("delete evidence edges", () -> result.add("edgesDeleted",
                    relationshipRepository.deleteEvidenceBased()));
            tx.execute("clear evidence ledger", () -> result.add("ledgerRowsDeleted", evidenceLedger.clear()));
            tx.execute("clear checkpoints", () -> {
                checkpointRepository.clear(DOCUMENT_CHECKPOINT);
                checkpointRepository.clear(COMMUNICATION_CHECKPOINT);
                checkpointRepository.clear(TIMELINE_CHECKPOINT);
            });
            tx.execute("audit", () -> auditService.record(AuditAction.RELATIONSHIPS_REBUILT, null, TRIGGERED_BY,
                    Map.of("edgesDeleted", result.get("edgesDeleted"))));
            tx.markSuccess();
        }
        log.info("relate.rebuild edgesDeleted={} ledgerRowsDeleted={}",
                result.get("edgesDeleted"), result.get("ledgerRowsDeleted"));
    }

    // ========== Co-occurrence ==========

    void buildCoOccurrences(StageOptions options, StageResult.Builder result) {
        long afterId = resumePoint(DOCUMENT_CHECKPOINT, options);
        long batchNumber = 0;
        while (true) {
            List<Document> page = documentRepository.findPage(afterId, options.range(), options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long lastId = page.get(page.size() - 1).id();
            batchNumber++;
            metricsService.recordBatchSize(page.size());
            try (LogContext batchCtx = LogContext.forBatch(PipelineStage.RELATE.getCommand(), batchNumber);
                 StoreTransaction tx = StoreTransaction.begin(store, "relate documents batch " + batchNumber,
                         options.dryRun())) {
                for (Document document : page) {
                    tx.execute("document " + document.id(), () -> relateDocument(document, options, result));
                }
                tx.execute("checkpoint", () -> checkpointRepository.save(DOCUMENT_CHECKPOINT, lastId,
                        result.get("documentsScanned")));
                tx.markSuccess();
            }
            afterId = lastId;
            options.progress().onProgress(result.get("documentsScanned"), -1, "documents related");
        }
    }

    private void relateDocument(Document document, StageOptions options, StageResult.Builder result) {
        result.increment("documentsScanned");
        List<Mention> mentions = new ArrayList<>(mentionRepository.findByDocument(document.id()));
        if (mentions.size() < 2) {
            result.increment("documentsSkippedSparse");
            return;
        }
        if (mentions.size() > config.maxEntitiesPerDocument()) {
            result.increment("documentsSkippedDense");
            metricsService.incrementItemSkipped(PipelineStage.RELATE.getCommand(), "dense-document");
            log.debug("Skipping document {} with {} entities (ceiling {})",
                    document.id(), mentions.size(), config.maxEntitiesPerDocument());
            return;
        }
        mentions.sort(Comparator.comparingLong(Mention::entityId));
        String signalKey = "doc:" + document.id();
        double risk = weigher.risk(document);
        for (int i = 0; i < mentions.size(); i++) {
            for (int j = i + 1; j < mentions.size(); j++) {
                Mention a = mentions.get(i);
                Mention b = mentions.get(j);
                WeightComponents components = weigher.weigh(a, b, document);
                upsert(a.entityId(), b.entityId(), RelationshipType.CO_OCCURRENCE, components, risk,
                        signalKey, options, result);
                if (document.classification() == DocumentClassification.TRAVEL) {
                    upsert(a.entityId(), b.entityId(), RelationshipType.TRAVELED_WITH,
                            WeightComponents.baseOnly(RelationshipType.TRAVELED_WITH.getBaseWeight()),
                            document.riskScore(), signalKey, options, result);
                }
            }
        }
    }

    // ========== Explicit signals ==========

    void buildCommunications(StageOptions options, StageResult.Builder result) {
        long afterId = resumePoint(COMMUNICATION_CHECKPOINT, options);
        while (true) {
            List<Communication> page = signalRepository.findCommunicationPage(afterId, options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long lastId = page.get(page.size() - 1).id();
            try (StoreTransaction tx = StoreTransaction.begin(store, "relate communications after " + afterId,
                    options.dryRun())) {
                for (Communication communication : page) {
                    if (communication.documentId() != null && !options.range().contains(communication.documentId())) {
                        continue;
                    }
                    tx.execute("communication " + communication.id(),
                            () -> relateCommunication(communication, options, result));
                }
                tx.execute("checkpoint", () -> checkpointRepository.save(COMMUNICATION_CHECKPOINT, lastId,
                        result.get("communicationsScanned")));
                tx.markSuccess();
            }
            afterId = lastId;
        }
    }

    private void relateCommunication(Communication communication, StageOptions options, StageResult.Builder result) {
        result.increment("communicationsScanned");
        Optional<Entity> sender = resolveSignalName(communication.sender(), result);
        if (sender.isEmpty()) {
            return;
        }
        String signalKey = "comm:" + communication.id();
        for (String recipientName : communication.recipients()) {
            Optional<Entity> recipient = resolveSignalName(recipientName, result);
            if (recipient.isEmpty() || recipient.get().getId().equals(sender.get().getId())) {
                continue;
            }
            upsert(sender.get().getId(), recipient.get().getId(), RelationshipType.COMMUNICATED,
                    WeightComponents.baseOnly(RelationshipType.COMMUNICATED.getBaseWeight()), 0.0,
                    signalKey, options, result);
        }
    }

    void buildTimelineConnections(StageOptions options, StageResult.Builder result) {
        long afterId = resumePoint(TIMELINE_CHECKPOINT, options);
        while (true) {
            List<TimelineEvent> page = signalRepository.findTimelineEventPage(afterId, options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long lastId = page.get(page.size() - 1).id();
            try (StoreTransaction tx = StoreTransaction.begin(store, "relate timeline after " + afterId,
                    options.dryRun())) {
                for (TimelineEvent event : page) {
                    tx.execute("timeline event " + event.id(), () -> relateTimelineEvent(event, options, result));
                }
                tx.execute("checkpoint", () -> checkpointRepository.save(TIMELINE_CHECKPOINT, lastId,
                        result.get("timelineEventsScanned")));
                tx.markSuccess();
            }
            afterId = lastId;
        }
    }

    private void relateTimelineEvent(TimelineEvent event, StageOptions options, StageResult.Builder result) {
        result.increment("timelineEventsScanned");
        TreeSet<Long> participantIds = new TreeSet<>();
        for (String participant : event.participants()) {
            resolveSignalName(participant, result).ifPresent(entity -> participantIds.add(entity.getId()));
        }
        List<Long> ids = new ArrayList<>(participantIds);
        String signalKey = "event:" + event.id();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                upsert(ids.get(i), ids.get(j), RelationshipType.TIMELINE_CONNECTION,
                        WeightComponents.baseOnly(RelationshipType.TIMELINE_CONNECTION.getBaseWeight()), 0.0,
                        signalKey, options, result);
            }
        }
    }

    /**
     * Resolves a name from a structured signal to an existing entity. Never creates entities.
     */
    private Optional<Entity> resolveSignalName(String name, StageResult.Builder result) {
        if (name == null || name.isBlank()) {
            result.increment("unresolvedNames");
            return Optional.empty();
        }
        for (EntityType type : SIGNAL_NAME_TYPES) {
            Optional<Entity> entity;
            try {
                entity = identityResolver.resolveName(name, type);
            } catch (IllegalArgumentException e) {
                log.debug("Unusable signal name '{}': {}", name, e.getMessage());
                result.increment("unresolvedNames");
                return Optional.empty();
            }
            if (entity.isPresent()) {
                return entity;
            }
        }
        log.debug("Signal name '{}' does not resolve to any entity, skipped", name);
        result.increment("unresolvedNames");
        metricsService.incrementItemSkipped(PipelineStage.RELATE.getCommand(), "unresolved-name");
        return Optional.empty();
    }

    // ========== Upsert ==========

    /**
     * Adds one contribution to the edge between two entities, creating the edge on first sight.
     * A contribution whose key is already in the evidence ledger is skipped.
     */
    void upsert(long sourceId, long targetId, RelationshipType type, WeightComponents components, double risk,
                String signalKey, StageOptions options, StageResult.Builder result) {
        if (sourceId == targetId) {
            return;
        }
        if (evidenceLedger.isRecorded(signalKey, sourceId, targetId, type)) {
            result.increment("contributionsAlreadyCounted");
            return;
        }
        EvidenceSummary contribution = EvidenceSummary.of(components, signalKey);
        Optional<Relationship> existing = relationshipRepository.find(sourceId, targetId, type);
        boolean created = existing.isEmpty();
        if (created) {
            double weight = components.total();
            relationshipRepository.insert(Relationship.builder()
                    .sourceId(sourceId)
                    .targetId(targetId)
                    .type(type)
                    .weight(weight)
                    .confidence(ConfidenceModel.confidence(type, weight))
                    .riskScore(Math.min(100.0, risk))
                    .evidence(contribution)
                    .build());
            result.increment("relationshipsCreated");
        } else {
            Relationship edge = existing.get();
            double weight = edge.getWeight() + components.total();
            relationshipRepository.updateTotals(edge.getId(), weight, ConfidenceModel.confidence(type, weight),
                    Math.min(100.0, edge.getRiskScore() + risk), edge.getEvidence().plus(contribution));
            result.increment("relationshipsUpdated");
        }
        evidenceLedger.record(signalKey, sourceId, targetId, type, components.total());
        result.increment("contributions." + type.getValue());
        if (!options.dryRun()) {
            metricsService.incrementRelationshipUpserted(type, created);
        }
    }

    private long resumePoint(String checkpoint, StageOptions options) {
        if (!options.resume() || options.rebuild()) {
            return 0;
        }
        return checkpointRepository.find(checkpoint).map(CheckpointRepository.Checkpoint::lastProcessedId).orElse(0L);
    }
}
