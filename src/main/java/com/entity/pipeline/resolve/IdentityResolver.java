package com.entity.pipeline.resolve;

import com.entity.pipeline.audit.AuditAction;
import com.entity.pipeline.audit.AuditService;
import com.entity.pipeline.cache.MergeListener;
import com.entity.pipeline.cache.ResolutionCache;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.MatchResult;
import com.entity.pipeline.logging.LogContext;
import com.entity.pipeline.merge.MergeEngine;
import com.entity.pipeline.merge.MergeResult;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.similarity.BlockingKeyStrategy;
import com.entity.pipeline.similarity.DefaultBlockingKeyStrategy;
import com.entity.pipeline.store.CheckpointRepository;
import com.entity.pipeline.store.EntityRepository;
import com.entity.pipeline.store.InputSanitizer;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.RelationshipRepository;
import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collapses duplicate entity records into one canonical identity and removes junk names.
 *
 * <p>A batch run has two passes:</p>
 * <ol>
 *   <li>junk pass: names classified as junk are hard-deleted when nothing references
 *       them, otherwise flagged for review;</li>
 *   <li>merge pass: entities sharing a blocking key are compared with {@link NameMatcher},
 *       matches are grouped into components, and each member that matches the component's
 *       canonical entity (most mentions, lowest id on ties) is merged into it.</li>
 * </ol>
 *
 * <p>{@link #resolveName} and {@link #resolveOrCreate} resolve single names for other stages.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    static final String TRIGGERED_BY = "identity-resolver";
    static final String JUNK_CHECKPOINT = "resolve.junk";

    /** Buckets larger than this are too coarse to compare pairwise and are skipped. */
    static final int MAX_BLOCK_SIZE = 500;

    private final StoreConnection store;
    private final EntityRepository entityRepository;
    private final MentionRepository mentionRepository;
    private final RelationshipRepository relationshipRepository;
    private final CheckpointRepository checkpointRepository;
    private final NameMatcher matcher;
    private final JunkClassifier junkClassifier;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final MergeEngine mergeEngine;
    private final ResolutionCache cache;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public IdentityResolver(StoreConnection store, NameMatcher matcher, JunkClassifier junkClassifier,
                            MergeEngine mergeEngine, ResolutionCache cache, AuditService auditService,
                            MetricsService metricsService) {
        this(store, matcher, junkClassifier, new DefaultBlockingKeyStrategy(), mergeEngine, cache,
                auditService, metricsService);
    }

    public IdentityResolver(StoreConnection store, NameMatcher matcher, JunkClassifier junkClassifier,
                            BlockingKeyStrategy blockingKeyStrategy, MergeEngine mergeEngine,
                            ResolutionCache cache, AuditService auditService, MetricsService metricsService) {
        this.store = store;
        this.entityRepository = new EntityRepository(store);
        this.mentionRepository = new MentionRepository(store);
        this.relationshipRepository = new RelationshipRepository(store);
        this.checkpointRepository = new CheckpointRepository(store);
        this.matcher = matcher;
        this.junkClassifier = junkClassifier;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.mergeEngine = mergeEngine;
        this.cache = cache;
        this.auditService = auditService;
        this.metricsService = metricsService;
        if (cache instanceof MergeListener) {
            mergeEngine.addMergeListener((MergeListener) cache);
        }
    }

    // ========== Batch resolution ==========

    public StageResult resolve(StageOptions options) {
        StageResult.Builder result = StageResult.builder(PipelineStage.RESOLVE, options.dryRun());
        try (LogContext ctx = LogContext.forStage(PipelineStage.RESOLVE.getCommand(),
                LogContext.generateCorrelationId())) {
            log.info("resolve.starting dryRun={} range={}", options.dryRun(), options.range());
            try (StoreTransaction dryRunScope = StoreTransaction.dryRunScope(store, "resolve dry run",
                    options.dryRun())) {
                junkPass(options, result);
                mergePass(options, result);
            }
            StageResult built = result.build();
            log.info("resolve.completed {}", built);
            return built;
        }
    }

    /**
     * Deletes unreferenced junk entities and flags referenced ones, one transaction per batch.
     */
    void junkPass(StageOptions options, StageResult.Builder result) {
        long afterId = 0;
        if (options.resume()) {
            afterId = checkpointRepository.find(JUNK_CHECKPOINT)
                    .map(CheckpointRepository.Checkpoint::lastProcessedId).orElse(0L);
        }
        long batchNumber = 0;
        while (true) {
            List<Entity> page = entityRepository.findPage(afterId, options.range(), options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long lastId = page.get(page.size() - 1).getId();
            batchNumber++;
            try (LogContext batchCtx = LogContext.forBatch(PipelineStage.RESOLVE.getCommand(), batchNumber);
                 StoreTransaction tx = StoreTransaction.begin(store, "junk batch " + batchNumber, options.dryRun())) {
                for (Entity entity : page) {
                    tx.execute("classify " + entity.getId(), () -> classifyJunk(entity, options, result));
                }
                tx.execute("checkpoint", () -> checkpointRepository.save(JUNK_CHECKPOINT, lastId,
                        result.get("entitiesScanned")));
                tx.markSuccess();
            }
            afterId = lastId;
            options.progress().onProgress(result.get("entitiesScanned"), -1, "junk pass");
        }
        if (!options.dryRun()) {
            checkpointRepository.clear(JUNK_CHECKPOINT);
        }
    }

    private void classifyJunk(Entity entity, StageOptions options, StageResult.Builder result) {
        result.increment("entitiesScanned");
        Optional<String> reason = junkClassifier.classify(entity.getCanonicalName());
        if (reason.isEmpty()) {
            return;
        }
        long mentions = mentionRepository.sumForEntity(entity.getId());
        long relationships = relationshipRepository.countAll(entity.getId());
        if (mentions == 0 && relationships == 0) {
            entityRepository.delete(entity.getId());
            auditService.record(AuditAction.ENTITY_DELETED, entity.getId(), TRIGGERED_BY, Map.of(
                    "canonicalName", entity.getCanonicalName(),
                    "reason", reason.get()));
            result.increment("junkDeleted");
            if (!options.dryRun()) {
                cache.invalidate(entity.getId());
                metricsService.incrementEntityDeleted("junk");
            }
            log.debug("Deleted junk entity {} '{}': {}", entity.getId(), entity.getCanonicalName(), reason.get());
            return;
        }
        String reviewReason = "possible junk name (" + reason.get() + "), referenced by "
                + mentions + " mentions and " + relationships + " relationships";
        if (entityRepository.flagForReview(entity.getId(), reviewReason)) {
            auditService.record(AuditAction.ENTITY_FLAGGED_FOR_REVIEW, entity.getId(), TRIGGERED_BY, Map.of(
                    "reason", reviewReason));
            result.increment("flaggedForReview");
            if (!options.dryRun()) {
                metricsService.incrementEntityFlagged("junk");
            }
        }
    }

    /**
     * Groups matching entities and merges each component into its canonical member.
     */
    void mergePass(StageOptions options, StageResult.Builder result) {
        List<Entity> candidates = new ArrayList<>();
        for (Entity entity : entityRepository.findAll()) {
            if (options.range().contains(entity.getId()) && !junkClassifier.isJunk(entity.getCanonicalName())) {
                candidates.add(entity);
            }
        }
        Map<Long, Entity> byId = new HashMap<>();
        for (Entity entity : candidates) {
            byId.put(entity.getId(), entity);
        }

        Map<String, List<Long>> blocks = buildBlocks(candidates);
        UnionFind components = new UnionFind();
        Set<String> compared = new HashSet<>();
        for (Map.Entry<String, List<Long>> block : blocks.entrySet()) {
            List<Long> ids = block.getValue();
            if (ids.size() < 2) {
                continue;
            }
            if (ids.size() > MAX_BLOCK_SIZE) {
                result.warn("blocking key " + block.getKey() + " has " + ids.size() + " entities, skipped");
                metricsService.incrementItemSkipped(PipelineStage.RESOLVE.getCommand(), "oversized-block");
                continue;
            }
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    long a = ids.get(i);
                    long b = ids.get(j);
                    if (!compared.add(Math.min(a, b) + ":" + Math.max(a, b))) {
                        continue;
                    }
                    result.increment("pairsCompared");
                    if (matcher.match(byId.get(a), byId.get(b)).matched()) {
                        components.union(a, b);
                    }
                }
            }
        }

        for (List<Long> memberIds : components.groups().values()) {
            if (memberIds.size() < 2) {
                continue;
            }
            result.increment("componentsFound");
            List<Entity> members = memberIds.stream().map(byId::get).toList();
            Entity canonical = chooseCanonical(members);
            for (Entity member : members) {
                if (member.getId().equals(canonical.getId())) {
                    continue;
                }
                MatchResult match = matcher.match(member, canonical);
                if (!match.matched()) {
                    log.debug("Entity {} is linked to {} only transitively, not merged",
                            member.getId(), canonical.getId());
                    result.increment("transitiveOnly");
                    continue;
                }
                MergeResult merge = mergeEngine.merge(member.getId(), canonical.getId(), match, TRIGGERED_BY,
                        options.dryRun());
                if (merge.isSuccess()) {
                    result.increment("merged");
                    result.increment("merged." + match.method().name().toLowerCase());
                } else {
                    result.warn("merge " + member.getId() + " -> " + canonical.getId() + " skipped: "
                            + merge.errorMessage());
                }
            }
        }
    }

    private Map<String, List<Long>> buildBlocks(List<Entity> candidates) {
        Map<String, List<Long>> blocks = new TreeMap<>();
        for (Entity entity : candidates) {
            Set<String> keys = new HashSet<>();
            for (String name : entity.getAllNames()) {
                String normalized = matcher.normalize(name, entity.getType());
                if (normalized.isEmpty()) {
                    continue;
                }
                for (String key : blockingKeyStrategy.generateKeys(normalized)) {
                    keys.add(key);
                }
                keys.add("nick:" + matcher.nicknameCanonicalForm(name, entity.getType()));
            }
            for (String key : keys) {
                blocks.computeIfAbsent(entity.getType().name() + "/" + key, k -> new ArrayList<>())
                        .add(entity.getId());
            }
        }
        return blocks;
    }

    /**
     * Most mentions wins; ties go to the lowest id.
     */
    static Entity chooseCanonical(List<Entity> members) {
        return members.stream()
                .min(Comparator.comparingInt(Entity::getMentionCount).reversed()
                        .thenComparing(Entity::getId))
                .orElseThrow();
    }

    // ========== Single-name resolution ==========

    /**
     * Finds the entity a name refers to without creating one.
     * Exact matches win over alias matches, alias over fuzzy; among fuzzy matches the
     * smallest distance wins, then the most mentioned entity, then the lowest id.
     */
    public Optional<Entity> resolveName(String name, EntityType type) {
        InputSanitizer.validateEntityName(name);
        String collapsed = InputSanitizer.collapseWhitespace(name);
        String key = matcher.normalize(collapsed, type);

        Optional<Long> cached = cache.get(key, type);
        if (cached.isPresent()) {
            Optional<Entity> entity = entityRepository.findById(cached.get());
            if (entity.isPresent()) {
                metricsService.recordCacheHit();
                return entity;
            }
            cache.invalidate(cached.get());
        }
        metricsService.recordCacheMiss();

        Optional<Entity> resolved = entityRepository.findByNameIgnoreCase(collapsed, type).stream().findFirst();
        if (resolved.isEmpty()) {
            resolved = bestCandidate(collapsed, type);
        }
        resolved.ifPresent(entity -> cache.put(key, type, entity.getId()));
        return resolved;
    }

    /**
     * Resolves a name, creating a new entity when nothing matches.
     */
    public Entity resolveOrCreate(String name, EntityType type) {
        Optional<Entity> existing = resolveName(name, type);
        if (existing.isPresent()) {
            return existing.get();
        }
        String collapsed = InputSanitizer.collapseWhitespace(name);
        Entity created = entityRepository.create(collapsed, type);
        cache.put(matcher.normalize(collapsed, type), type, created.getId());
        log.info("entity.created id={} name='{}' type={}", created.getId(), collapsed, type);
        return created;
    }

    private Optional<Entity> bestCandidate(String name, EntityType type) {
        Entity best = null;
        MatchResult bestMatch = null;
        for (Entity candidate : entityRepository.findAllByType(type)) {
            MatchResult match = matcher.match(name, type, candidate);
            if (!match.matched()) {
                continue;
            }
            if (best == null || isBetter(match, candidate, bestMatch, best)) {
                best = candidate;
                bestMatch = match;
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean isBetter(MatchResult match, Entity candidate, MatchResult bestMatch, Entity best) {
        int byMethod = Integer.compare(rank(match.method()), rank(bestMatch.method()));
        if (byMethod != 0) {
            return byMethod < 0;
        }
        if (match.editDistance() != bestMatch.editDistance()) {
            return match.editDistance() < bestMatch.editDistance();
        }
        if (candidate.getMentionCount() != best.getMentionCount()) {
            return candidate.getMentionCount() > best.getMentionCount();
        }
        return candidate.getId() < best.getId();
    }

    private static int rank(MatchMethod method) {
        return method.ordinal();
    }

    public NameMatcher getMatcher() {
        return matcher;
    }

    public JunkClassifier getJunkClassifier() {
        return junkClassifier;
    }

    /**
     * Disjoint-set forest over entity ids.
     */
    private static final class UnionFind {
        private final Map<Long, Long> parent = new HashMap<>();

        long find(long id) {
            Long p = parent.get(id);
            if (p == null) {
                parent.put(id, id);
                return id;
            }
            if (p == id) {
                return id;
            }
            long root = find(p);
            parent.put(id, root);
            return root;
        }

        void union(long a, long b) {
            long rootA = find(a);
            long rootB = find(b);
            if (rootA != rootB) {
                parent.put(Math.max(rootA, rootB), Math.min(rootA, rootB));
            }
        }

        Map<Long, List<Long>> groups() {
            Map<Long, List<Long>> groups = new LinkedHashMap<>();
            for (Long id : new ArrayList<>(parent.keySet())) {
                groups.computeIfAbsent(find(id), k -> new ArrayList<>()).add(id);
            }
            for (List<Long> members : groups.values()) {
                members.sort(Long::compare);
            }
            return groups;
        }
    }
}
