package com.entity.pipeline.integrity;

import com.entity.pipeline.audit.AuditAction;
import com.entity.pipeline.audit.AuditService;
import com.entity.pipeline.audit.SqliteAuditRepository;
import com.entity.pipeline.core.model.DocumentClassification;
import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.Relationship;
import com.entity.pipeline.core.model.RelationshipType;
import com.entity.pipeline.metrics.NoOpMetricsService;
import com.entity.pipeline.pipeline.PipelineException;
import com.entity.pipeline.pipeline.PipelineStage;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.pipeline.StageResult;
import com.entity.pipeline.resolve.JunkClassifier;
import com.entity.pipeline.rules.ResolverRules;
import com.entity.pipeline.store.DocumentRepository;
import com.entity.pipeline.store.EntityRepository;
import com.entity.pipeline.store.MentionRepository;
import com.entity.pipeline.store.RelationshipRepository;
import com.entity.pipeline.store.SqliteStoreConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityGuardTest {

    private SqliteStoreConnection store;
    private EntityRepository entities;
    private RelationshipRepository relationships;
    private AuditService auditService;

    private Entity hub;
    private Entity maxwell;
    private Entity wexner;
    private Entity brunel;

    @BeforeEach
    void setUp() {
        store = SqliteStoreConnection.inMemory();
        entities = new EntityRepository(store);
        relationships = new RelationshipRepository(store);
        auditService = new AuditService(new SqliteAuditRepository(store));
        hub = entities.create("Jeffrey Epstein", EntityType.PERSON);
        maxwell = entities.create("Ghislaine Maxwell", EntityType.PERSON);
        wexner = entities.create("Leslie Wexner", EntityType.PERSON);
        brunel = entities.create("Jean-Luc Brunel", EntityType.PERSON);
        coOccurrence(wexner, brunel);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private IntegrityGuard guard(IntegrityConfig config) {
        return new IntegrityGuard(store, new JunkClassifier(ResolverRules.defaults()), config, auditService,
                new NoOpMetricsService());
    }

    private void coOccurrence(Entity a, Entity b) {
        relationships.insert(Relationship.builder().sourceId(a.getId()).targetId(b.getId())
                .type(RelationshipType.CO_OCCURRENCE).weight(1.0).confidence(0.5).build());
    }

    private List<Relationship> syntheticLinks() {
        return relationships.findAll().stream()
                .filter(r -> r.getType() == RelationshipType.SYNTHETIC_ISOLATE_LINK)
                .toList();
    }

    @Nested
    @DisplayName("Isolate linking")
    class IsolateLinking {

        @Test
        @DisplayName("Should link every isolated entity to the hub exactly once")
        void linksIsolates() {
            StageResult result = guard(IntegrityConfig.defaults()).check(StageOptions.defaults());

            List<Relationship> links = syntheticLinks();
            assertEquals(1, result.count("syntheticLinksCreated"));
            assertEquals(1, links.size());
            assertEquals(maxwell.getId(), links.get(0).getSourceId());
            assertEquals(hub.getId(), links.get(0).getTargetId());
            assertEquals(0.1, links.get(0).getWeight(), 1e-9);
            assertEquals(1, auditService.getEntriesByAction(AuditAction.SYNTHETIC_LINK_CREATED).size());
        }

        @Test
        @DisplayName("Should leave every entity other than the hub with at least one edge")
        void noIsolatesRemain() {
            entities.create("Sarah Kellen", EntityType.PERSON);
            entities.create("Zorro Ranch", EntityType.LOCATION);

            guard(IntegrityConfig.defaults()).check(StageOptions.defaults());

            for (Entity entity : entities.findAll()) {
                if (!entity.getId().equals(hub.getId())) {
                    assertTrue(relationships.countAll(entity.getId()) > 0, entity.getCanonicalName());
                }
            }
            assertTrue(relationships.findAll().stream().noneMatch(r -> r.getSourceId() == r.getTargetId()));
        }

        @Test
        @DisplayName("Should create nothing on a second run")
        void idempotent() {
            IntegrityGuard guard = guard(IntegrityConfig.defaults());
            guard.check(StageOptions.defaults());

            StageResult second = guard.check(StageOptions.defaults());

            assertEquals(0, second.count("syntheticLinksCreated"));
            assertEquals(1, syntheticLinks().size());
        }

        @Test
        @DisplayName("Should drop the synthetic link once the entity has real evidence")
        void dropsRedundantLink() {
            IntegrityGuard guard = guard(IntegrityConfig.defaults());
            guard.check(StageOptions.defaults());
            coOccurrence(maxwell, wexner);

            StageResult second = guard.check(StageOptions.defaults());

            assertEquals(1, second.count("syntheticLinksRedundant"));
            assertTrue(syntheticLinks().isEmpty());
        }

        @Test
        @DisplayName("Should move synthetic links to a new hub")
        void retargetsAfterHubChange() {
            guard(IntegrityConfig.defaults()).check(StageOptions.defaults());

            StageResult result = guard(IntegrityConfig.defaults().withHubName("ghislaine maxwell"))
                    .check(StageOptions.defaults());

            assertEquals(1, result.count("syntheticLinksRetargeted"));
            List<Relationship> links = syntheticLinks();
            assertEquals(1, links.size());
            assertEquals(hub.getId(), links.get(0).getSourceId());
            assertEquals(maxwell.getId(), links.get(0).getTargetId());
        }
    }

    @Test
    @DisplayName("Should fail and change nothing when the hub is missing")
    void missingHubIsFatal() {
        PipelineException e = assertThrows(PipelineException.class,
                () -> guard(IntegrityConfig.defaults().withHubName("Nobody Here")).check(StageOptions.defaults()));

        assertEquals(PipelineStage.INTEGRITY, e.getStage());
        assertTrue(e.getMessage().contains("Nobody Here"));
        assertTrue(syntheticLinks().isEmpty());
        assertFalse(store.isInTransaction());
    }

    @Test
    @DisplayName("Should pick the lowest id among entities named like the hub")
    void hubLowestId() {
        entities.create("JEFFREY EPSTEIN", EntityType.ORGANIZATION);

        assertEquals(hub.getId(), guard(IntegrityConfig.defaults()).findHub().orElseThrow().getId());
    }

    @Test
    @DisplayName("Should find the hub through the alias left by a merge")
    void hubFoundByAlias() {
        Entity survivor = entities.save(Entity.builder()
                .canonicalName("Jeffery Epstein").type(EntityType.PERSON).alias("jeffrey epstein").build());

        assertEquals(hub.getId(), guard(IntegrityConfig.defaults()).findHub().orElseThrow().getId());

        entities.delete(hub.getId());
        guard(IntegrityConfig.defaults()).check(StageOptions.defaults());

        assertEquals(survivor.getId(), guard(IntegrityConfig.defaults()).findHub().orElseThrow().getId());
        assertTrue(syntheticLinks().stream().allMatch(r -> r.getTargetId() == survivor.getId()));
    }

    @Nested
    @DisplayName("Junk purge")
    class JunkPurge {

        @Test
        @DisplayName("Should delete junk entities without evidence")
        void purgesUnreferencedJunk() {
            Entity junk = entities.create("To Scale", EntityType.PERSON);

            StageResult result = guard(IntegrityConfig.defaults()).check(StageOptions.defaults());

            assertEquals(1, result.count("junkPurged"));
            assertTrue(entities.findById(junk.getId()).isEmpty());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.ENTITY_DELETED).size());
        }

        @Test
        @DisplayName("Should keep junk entities that are mentioned")
        void keepsMentionedJunk() {
            Entity junk = entities.create("To Scale", EntityType.PERSON);
            long doc = new DocumentRepository(store).save("Drawn to scale.", DocumentClassification.GENERIC).id();
            new MentionRepository(store).recordOccurrences(junk.getId(), doc, 1, 6, 14, null);

            StageResult result = guard(IntegrityConfig.defaults()).check(StageOptions.defaults());

            assertEquals(1, result.count("junkKept"));
            assertTrue(entities.findById(junk.getId()).isPresent());
        }

        @Test
        @DisplayName("Should never purge the hub")
        void neverPurgesHub() {
            Entity island = entities.create("The Island", EntityType.LOCATION);

            guard(IntegrityConfig.defaults().withHubName("The Island")).check(StageOptions.defaults());

            assertTrue(entities.findById(island.getId()).isPresent());
        }

        @Test
        @DisplayName("Should skip the purge when disabled")
        void purgeDisabled() {
            Entity junk = entities.create("To Scale", EntityType.PERSON);

            guard(new IntegrityConfig(IntegrityConfig.DEFAULT_HUB_NAME, false)).check(StageOptions.defaults());

            assertTrue(entities.findById(junk.getId()).isPresent());
        }
    }

    @Test
    @DisplayName("Should recompute mention counts from mention rows")
    void recomputesMentionCounts() {
        long doc = new DocumentRepository(store).save("Ghislaine Maxwell twice, Ghislaine Maxwell.",
                DocumentClassification.GENERIC).id();
        new MentionRepository(store).recordOccurrences(maxwell.getId(), doc, 2, 0, 17, null);

        guard(IntegrityConfig.defaults()).check(StageOptions.defaults());

        assertEquals(2, entities.findById(maxwell.getId()).orElseThrow().getMentionCount());
    }

    @Test
    @DisplayName("Should report links but write nothing on a dry run")
    void dryRun() {
        StageResult result = guard(IntegrityConfig.defaults()).check(StageOptions.defaults().withDryRun(true));

        assertEquals(1, result.count("syntheticLinksCreated"));
        assertTrue(syntheticLinks().isEmpty());
        assertTrue(auditService.getAllEntries().isEmpty());
    }
}
