package com.entity.pipeline.mention;

import com.entity.pipeline.core.model.Document;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.Mention;
import com.entity.pipeline.core.model.MentionContext;
import com.entity.pipeline.logging.LogContext;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.store.CheckpointRepository;
import com.entity.pipeline.store.DocumentRepository;
import com.entity.pipeline.store.EntityRepository;
import com.entity.pipeline.store.InputSanitizer;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.StoreConnection;
import com.entity.pipeline.store.StoreException;
import com.entity.pipeline.store.StoreTransaction;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Finds where each entity is mentioned in the corpus.
 *
 * <p>For each entity the full-text index narrows the corpus to candidate documents; each
 * candidate is then re-scanned with a whole-word pattern over all the entity's names, which
 * gives the exact count, the first span and context snippets. Mention rows hold the exact
 * result of the latest scan, so re-running the stage never inflates counts.</p>
 */
public class MentionExtractor {
    private static final Logger log = LoggerFactory.getLogger(MentionExtractor.class);

    static final String CHECKPOINT = PipelineStage.EXTRACT.getCommand();

    private final StoreConnection store;
    private final EntityRepository entityRepository;
    private final DocumentRepository documentRepository;
    private final MentionRepository mentionRepository;
    private final CheckpointRepository checkpointRepository;
    private final ExtractionConfig config;
    private final NamePatternCache patternCache;
    private final SnippetExtractor snippetExtractor;
    private final Cache<Long, Optional<String>> documentCache;
    private final MetricsService metricsService;

    public MentionExtractor(StoreConnection store, ExtractionConfig config, MetricsService metricsService) {
        this.store = store;
        this.entityRepository = new EntityRepository(store);
        this.documentRepository = new DocumentRepository(store);
        this.mentionRepository = new MentionRepository(store);
        this.checkpointRepository = new CheckpointRepository(store);
        this.config = config;
        this.patternCache = new NamePatternCache(config.patternCacheSize());
        this.snippetExtractor = new SnippetExtractor(config.contextWindow());
        this.documentCache = Caffeine.newBuilder().maximumSize(config.documentCacheSize()).build();
        this.metricsService = metricsService;
    }

    public StageResult extract(StageOptions options) {
        StageResult.Builder result = StageResult.builder(PipelineStage.EXTRACT, options.dryRun());
        try (LogContext ctx = LogContext.forStage(PipelineStage.EXTRACT.getCommand(),
                LogContext.generateCorrelationId())) {
            log.info("extract.starting dryRun={} range={} batchSize={}",
                    options.dryRun(), options.range(), options.batchSize());
            documentCache.invalidateAll();
            try (StoreTransaction dryRunScope = StoreTransaction.dryRunScope(store, "extract dry run",
                    options.dryRun())) {
                // inside the scope so a dry run discards the rebuilt index with everything else
                documentRepository.rebuildFullTextIndex();
                runBatches(options, result);
            }
            if (!options.dryRun()) {
                checkpointRepository.clear(CHECKPOINT);
                metricsService.incrementMentionsWritten(result.get("mentionsWritten"));
            }
            StageResult built = result.build();
            log.info("extract.completed {}", built);
            return built;
        }
    }

    private void runBatches(StageOptions options, StageResult.Builder result) {
        long afterId = 0;
        if (options.resume()) {
            afterId = checkpointRepository.find(CHECKPOINT)
                    .map(CheckpointRepository.Checkpoint::lastProcessedId).orElse(0L);
            if (afterId > 0) {
                log.info("extract.resuming afterEntityId={}", afterId);
            }
        }
        long batchNumber = 0;
        while (true) {
            List<Entity> page = entityRepository.findPage(afterId, options.range(), options.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long lastId = page.get(page.size() - 1).getId();
            batchNumber++;
            metricsService.recordBatchSize(page.size());
            try (LogContext batchCtx = LogContext.forBatch(PipelineStage.EXTRACT.getCommand(), batchNumber);
                 StoreTransaction tx = StoreTransaction.begin(store, "extract batch " + batchNumber,
                         options.dryRun())) {
                for (Entity entity : page) {
                    tx.execute("extract " + entity.getId(), () -> extractEntity(entity, result));
                }
                tx.execute("checkpoint", () -> checkpointRepository.save(CHECKPOINT, lastId,
                        result.get("entitiesScanned")));
                tx.markSuccess();
            }
            afterId = lastId;
            options.progress().onProgress(result.get("entitiesScanned"), -1, "entities scanned");
        }

        Map<Long, Integer> dense = mentionRepository.findDenseDocuments(config.maxEntitiesPerDocument());
        result.set("denseDocuments", dense.size());
        for (Map.Entry<Long, Integer> entry : dense.entrySet()) {
            log.info("extract.dense-document documentId={} entities={} ceiling={}",
                    entry.getKey(), entry.getValue(), config.maxEntitiesPerDocument());
        }
    }

    /**
     * Scans the corpus for one entity and writes its mention rows.
     */
    void extractEntity(Entity entity, StageResult.Builder result) {
        result.increment("entitiesScanned");
        Pattern pattern;
        try {
            pattern = patternCache.patternFor(entity.getAllNames());
        } catch (IllegalArgumentException e) {
            // PatternSyntaxException is an IllegalArgumentException
            String reason = e instanceof PatternSyntaxException ? "bad-pattern" : "no-name";
            result.warn("entity " + entity.getId() + " '" + entity.getCanonicalName() + "': " + e.getMessage());
            metricsService.incrementItemSkipped(PipelineStage.EXTRACT.getCommand(), reason);
            return;
        }

        Set<Long> candidates = candidateDocuments(entity, result);
        result.add("candidateDocuments", candidates.size());

        Set<Long> found = new TreeSet<>();
        for (long documentId : candidates) {
            Optional<String> content = documentContent(documentId);
            if (content.isEmpty()) {
                result.warn("document " + documentId + " disappeared during extraction");
                continue;
            }
            Optional<Mention> mention = scan(entity.getId(), documentId, content.get(), pattern);
            if (mention.isEmpty()) {
                continue;
            }
            found.add(documentId);
            if (mentionRepository.replace(mention.get())) {
                result.increment("mentionsWritten");
            }
            result.add("occurrences", mention.get().count());
        }
        int removed = mentionRepository.removeStale(entity.getId(), found);
        if (removed > 0) {
            result.add("mentionsRemoved", removed);
            log.debug("Removed {} stale mentions of entity {}", removed, entity.getId());
        }
        entityRepository.recomputeMentionCount(entity.getId());
    }

    /**
     * Candidate documents for every name of the entity. A name the index cannot handle
     * falls back to a substring scan.
     */
    private Set<Long> candidateDocuments(Entity entity, StageResult.Builder result) {
        Set<Long> candidates = new LinkedHashSet<>();
        for (String name : entity.getAllNames()) {
            Optional<String> phrase = InputSanitizer.toFtsPhrase(name);
            if (phrase.isPresent()) {
                try {
                    candidates.addAll(documentRepository.findCandidatesByPhrase(phrase.get()));
                    continue;
                } catch (StoreException e) {
                    result.warn("full-text query failed for '" + name + "', using substring scan: "
                            + e.getMessage());
                }
            } else {
                result.warn("name '" + name + "' of entity " + entity.getId()
                        + " has no indexable tokens, using substring scan");
            }
            result.increment("substringFallbacks");
            candidates.addAll(documentRepository.findCandidatesBySubstring(name.trim()));
        }
        return candidates;
    }

    /**
     * Exact occurrences of the pattern in one document.
     *
     * @return empty if the pattern does not occur
     */
    Optional<Mention> scan(long entityId, long documentId, String content, Pattern pattern) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        int firstStart = -1;
        int firstEnd = -1;
        List<MentionContext> contexts = new ArrayList<>();
        while (matcher.find()) {
            if (count == 0) {
                firstStart = matcher.start();
                firstEnd = matcher.end();
            }
            if (contexts.size() < config.maxContextsPerMention()) {
                MentionContext context = snippetExtractor.extract(content, matcher.start(), matcher.end());
                if (contexts.stream().noneMatch(c -> c.snippet().equals(context.snippet()))) {
                    contexts.add(context);
                }
            }
            count++;
        }
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(new Mention(entityId, documentId, count, firstStart, firstEnd, contexts));
    }

    private Optional<String> documentContent(long documentId) {
        return documentCache.get(documentId, id -> documentRepository.findById(id).map(Document::content));
    }

    public NamePatternCache getPatternCache() {
        return patternCache;
    }
}
