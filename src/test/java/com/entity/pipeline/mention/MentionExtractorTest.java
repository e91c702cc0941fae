package com.entity.pipeline.mention;

import com.entity.pipeline.core.model.DocumentClassification;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.Mention;
import com.entity.pipeline.metrics.MetricsService;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.store.CheckpointRepository;
import com.entity.pipeline.store.DocumentRepository;
import com.entity.pipeline.store.EntityRepository;
import com.entity.pipeline.store.IdRange;
import com.entity.pipeline.store.InputSanitizer;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.SqliteStoreConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MentionExtractorTest {

    private SqliteStoreConnection store;
    private EntityRepository entities;
    private DocumentRepository documents;
    private MentionRepository mentions;
    @Mock
    private MetricsService metrics;
    private MentionExtractor extractor;

    @BeforeEach
    void setUp() {
        store = SqliteStoreConnection.inMemory();
        entities = new EntityRepository(store);
        documents = new DocumentRepository(store);
        mentions = new MentionRepository(store);
        extractor = new MentionExtractor(store, ExtractionConfig.defaults(), metrics);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Nested
    @DisplayName("Counting")
    class Counting {

        @Test
        @DisplayName("Should count every whole-word occurrence of any name")
        void countsOccurrences() {
            Entity epstein = entities.save(Entity.builder()
                    .canonicalName("Jeffrey Epstein").type(EntityType.PERSON).alias("Jeff Epstein").build());
            long doc = documents.save("Jeffrey Epstein flew to Palm Beach. Later, jeff  epstein returned. "
                    + "JEFFREY EPSTEIN left.", DocumentClassification.TRAVEL).id();

            StageResult result = extractor.extract(StageOptions.defaults());

            Mention mention = mentions.find(epstein.getId(), doc).orElseThrow();
            assertEquals(3, mention.count());
            assertEquals(0, mention.firstStart());
            assertEquals("Jeffrey Epstein".length(), mention.firstEnd());
            assertEquals(3, mention.contexts().size());
            assertEquals(1, result.count("mentionsWritten"));
            assertEquals(3, entities.findById(epstein.getId()).orElseThrow().getMentionCount());
        }

        @Test
        @DisplayName("Should not count names embedded in longer words")
        void ignoresPartialWords() {
            Entity maxwell = entities.create("Maxwell", EntityType.PERSON);
            long doc = documents.save("The Maxwellian equations. Maxwell arrived.", DocumentClassification.GENERIC).id();

            extractor.extract(StageOptions.defaults());

            assertEquals(1, mentions.find(maxwell.getId(), doc).orElseThrow().count());
        }

        @Test
        @DisplayName("Should create no row for documents that do not mention the entity")
        void noRowWithoutMention() {
            Entity wexner = entities.create("Leslie Wexner", EntityType.PERSON);
            documents.save("Nothing relevant here.", DocumentClassification.GENERIC);

            StageResult result = extractor.extract(StageOptions.defaults());

            assertTrue(mentions.findByEntity(wexner.getId()).isEmpty());
            assertEquals(0, result.count("mentionsWritten"));
            assertEquals(1, result.count("entitiesScanned"));
        }

        @Test
        @DisplayName("Should keep at most the configured number of snippets")
        void capsContexts() {
            extractor = new MentionExtractor(store, new ExtractionConfig(200, 1, 50, 100, 100), metrics);
            Entity brunel = entities.create("Brunel", EntityType.PERSON);
            long doc = documents.save("Brunel called. Brunel wrote. Brunel left.", DocumentClassification.GENERIC).id();

            extractor.extract(StageOptions.defaults());

            Mention mention = mentions.find(brunel.getId(), doc).orElseThrow();
            assertEquals(3, mention.count());
            assertEquals(1, mention.contexts().size());
        }
    }

    @Nested
    @DisplayName("Re-runs")
    class ReRuns {

        @Test
        @DisplayName("Should give the same counts when run twice")
        void idempotent() {
            Entity epstein = entities.create("Jeffrey Epstein", EntityType.PERSON);
            long doc = documents.save("Jeffrey Epstein and Jeffrey Epstein.", DocumentClassification.GENERIC).id();

            extractor.extract(StageOptions.defaults());
            StageResult second = extractor.extract(StageOptions.defaults());

            assertEquals(2, mentions.find(epstein.getId(), doc).orElseThrow().count());
            assertEquals(0, second.count("mentionsWritten"));
            assertEquals(2, entities.findById(epstein.getId()).orElseThrow().getMentionCount());
        }

        @Test
        @DisplayName("Should remove rows for documents that no longer mention the entity")
        void removesStaleRows() {
            Entity epstein = entities.create("Jeffrey Epstein", EntityType.PERSON);
            long doc = documents.save("Jeffrey Epstein was here.", DocumentClassification.GENERIC).id();
            extractor.extract(StageOptions.defaults());

            store.execute("UPDATE documents SET content = 'Nobody was here.' WHERE id = :id", Map.of("id", doc));
            StageResult result = extractor.extract(StageOptions.defaults());

            assertTrue(mentions.find(epstein.getId(), doc).isEmpty());
            assertEquals(1, result.count("mentionsRemoved"));
            assertEquals(0, entities.findById(epstein.getId()).orElseThrow().getMentionCount());
        }

        @Test
        @DisplayName("Should restrict the pass to the id range")
        void honorsRange() {
            Entity first = entities.create("Jeffrey Epstein", EntityType.PERSON);
            Entity second = entities.create("Ghislaine Maxwell", EntityType.PERSON);
            long doc = documents.save("Jeffrey Epstein met Ghislaine Maxwell.", DocumentClassification.GENERIC).id();

            extractor.extract(StageOptions.defaults().withRange(IdRange.of(second.getId(), null)));

            assertTrue(mentions.find(first.getId(), doc).isEmpty());
            assertTrue(mentions.find(second.getId(), doc).isPresent());
        }
    }

    @Nested
    @DisplayName("Dry run and checkpoints")
    class DryRun {

        @Test
        @DisplayName("Should report counts but write nothing on a dry run")
        void dryRunWritesNothing() {
            Entity epstein = entities.create("Jeffrey Epstein", EntityType.PERSON);
            documents.save("Jeffrey Epstein was here.", DocumentClassification.GENERIC);

            StageResult result = extractor.extract(StageOptions.defaults().withDryRun(true));

            assertTrue(result.dryRun());
            assertEquals(1, result.count("mentionsWritten"));
            assertTrue(mentions.findByEntity(epstein.getId()).isEmpty());
            assertEquals(0, entities.findById(epstein.getId()).orElseThrow().getMentionCount());
            verify(metrics, never()).incrementMentionsWritten(anyLong());
        }

        @Test
        @DisplayName("Should leave the full-text index untouched on a dry run")
        void dryRunLeavesIndexUnbuilt() {
            entities.create("Jeffrey Epstein", EntityType.PERSON);
            long doc = documents.save("Jeffrey Epstein was here.", DocumentClassification.GENERIC).id();
            String phrase = InputSanitizer.toFtsPhrase("Jeffrey Epstein").orElseThrow();

            extractor.extract(StageOptions.defaults().withDryRun(true));

            assertTrue(documents.findCandidatesByPhrase(phrase).isEmpty());

            extractor.extract(StageOptions.defaults());

            assertTrue(documents.findCandidatesByPhrase(phrase).contains(doc));
        }

        @Test
        @DisplayName("Should clear its checkpoint after a complete run")
        void clearsCheckpoint() {
            entities.create("Jeffrey Epstein", EntityType.PERSON);
            documents.save("Jeffrey Epstein was here.", DocumentClassification.GENERIC);

            extractor.extract(StageOptions.defaults().withBatchSize(1));

            assertTrue(new CheckpointRepository(store).find(MentionExtractor.CHECKPOINT).isEmpty());
        }

        @Test
        @DisplayName("Should continue after the saved checkpoint when resuming")
        void resumesAfterCheckpoint() {
            Entity first = entities.create("Jeffrey Epstein", EntityType.PERSON);
            Entity second = entities.create("Ghislaine Maxwell", EntityType.PERSON);
            long doc = documents.save("Jeffrey Epstein met Ghislaine Maxwell.", DocumentClassification.GENERIC).id();
            new CheckpointRepository(store).save(MentionExtractor.CHECKPOINT, first.getId(), 1);

            StageResult result = extractor.extract(StageOptions.defaults().withResume(true));

            assertEquals(1, result.count("entitiesScanned"));
            assertTrue(mentions.find(first.getId(), doc).isEmpty());
            assertTrue(mentions.find(second.getId(), doc).isPresent());
        }
    }

    @Test
    @DisplayName("Should fall back to a substring scan for names the index cannot query")
    void substringFallback() {
        entities.create("+++", EntityType.ORGANIZATION);
        documents.save("Total: +++ pending", DocumentClassification.FINANCIAL);

        StageResult result = extractor.extract(StageOptions.defaults());

        assertEquals(1, result.count("substringFallbacks"));
        assertTrue(result.hasWarnings());
    }

    @Test
    @DisplayName("Should report documents with more entities than the ceiling")
    void reportsDenseDocuments() {
        extractor = new MentionExtractor(store, new ExtractionConfig(200, 3, 2, 100, 100), metrics);
        entities.create("Alpha Person", EntityType.PERSON);
        entities.create("Bravo Person", EntityType.PERSON);
        entities.create("Charlie Person", EntityType.PERSON);
        documents.save("Alpha Person, Bravo Person and Charlie Person.", DocumentClassification.GENERIC);

        StageResult result = extractor.extract(StageOptions.defaults());

        assertEquals(1, result.count("denseDocuments"));
    }

    @Test
    void scan_emptyWhenPatternAbsent() {
        Optional<Mention> mention = extractor.scan(1, 1, "no names here",
                extractor.getPatternCache().patternFor(java.util.List.of("Jeffrey Epstein")));

        assertTrue(mention.isEmpty());
    }
}
