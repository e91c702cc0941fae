package com.entity.pipeline.store;

import com.entity.pipeline.chaos.ChaosStoreConnection;
import com.entity.pipeline.core.model.DocumentClassification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StoreTransaction commit, rollback, compensation and dry-run behavior.
 */
class StoreTransactionTest {

    private SqliteStoreConnection store;
    private DocumentRepository documents;

    @BeforeEach
    void setUp() {
        store = SqliteStoreConnection.inMemory();
        documents = new DocumentRepository(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void successfulTransaction_commits() {
        try (StoreTransaction tx = StoreTransaction.begin(store, "insert")) {
            tx.execute("doc", () -> documents.save("first", DocumentClassification.GENERIC));
            tx.markSuccess();
        }

        assertEquals(1, documents.count());
        assertFalse(store.isInTransaction());
    }

    @Test
    void closedWithoutSuccess_rollsBack() {
        try (StoreTransaction tx = StoreTransaction.begin(store, "insert")) {
            tx.execute("doc", () -> documents.save("first", DocumentClassification.GENERIC));
        }

        assertEquals(0, documents.count());
        assertFalse(store.isInTransaction());
    }

    @Test
    void failedStep_rollsBackEarlierSteps() {
        assertThrows(IllegalStateException.class, () -> {
            try (StoreTransaction tx = StoreTransaction.begin(store, "insert")) {
                tx.execute("doc 1", () -> documents.save("first", DocumentClassification.GENERIC));
                tx.execute("doc 2", () -> {
                    throw new IllegalStateException("boom");
                });
                tx.markSuccess();
            }
        });

        assertEquals(0, documents.count());
    }

    @Test
    void failedStep_runsCompensationsInReverse() {
        List<String> log = new ArrayList<>();

        assertThrows(RuntimeException.class, () -> {
            try (StoreTransaction tx = StoreTransaction.begin(store, "steps")) {
                tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
                tx.execute("step2", () -> log.add("op2"), () -> log.add("comp2"));
                tx.execute("step3", () -> {
                    throw new RuntimeException("step3 failed");
                }, () -> log.add("comp3"));
            }
        });

        assertEquals(List.of("op1", "op2", "comp2", "comp1"), log);
    }

    @Test
    void executeAfterRollback_isRejected() {
        StoreTransaction tx = StoreTransaction.begin(store, "steps");
        assertThrows(RuntimeException.class, () -> tx.execute("fail", () -> {
            throw new RuntimeException("fail");
        }));

        assertThrows(IllegalStateException.class, () -> tx.execute("next", () -> { }));
        tx.close();
    }

    @Test
    void dryRun_rollsBackEvenWhenSuccessful() {
        try (StoreTransaction tx = StoreTransaction.begin(store, "dry", true)) {
            tx.execute("doc", () -> documents.save("first", DocumentClassification.GENERIC));
            tx.markSuccess();
            assertTrue(tx.isDryRun());
        }

        assertEquals(0, documents.count());
    }

    @Test
    void nestedUnit_joinsOuterAndOuterDecides() {
        try (StoreTransaction outer = StoreTransaction.begin(store, "outer")) {
            try (StoreTransaction inner = StoreTransaction.begin(store, "inner")) {
                inner.execute("doc", () -> documents.save("first", DocumentClassification.GENERIC));
                inner.markSuccess();
            }
            assertTrue(store.isInTransaction());
            // outer never marked successful
        }

        assertEquals(0, documents.count());
    }

    @Test
    void dryRunScope_nullWhenNotDryRun() {
        assertNull(StoreTransaction.dryRunScope(store, "scope", false));
        assertFalse(store.isInTransaction());
    }

    @Test
    void dryRunScope_innerCommitsAreVisibleThenDiscarded() {
        try (StoreTransaction scope = StoreTransaction.dryRunScope(store, "scope", true)) {
            for (int i = 0; i < 3; i++) {
                int n = i;
                try (StoreTransaction batch = StoreTransaction.begin(store, "batch " + n, true)) {
                    batch.execute("doc", () -> documents.save("doc " + n, DocumentClassification.GENERIC));
                    batch.markSuccess();
                }
            }
            assertEquals(3, documents.count());
        }

        assertEquals(0, documents.count());
    }

    @Test
    void inTransaction_returnsResultAndCommits() {
        long id = StoreTransaction.inTransaction(store, "save", false,
                () -> documents.save("first", DocumentClassification.LEGAL).id());

        assertTrue(documents.findById(id).isPresent());
    }

    @Test
    void commitFailure_rollsBackAndRethrows() {
        ChaosStoreConnection chaos = new ChaosStoreConnection(store);
        DocumentRepository chaosDocuments = new DocumentRepository(chaos);
        chaos.setFailOnCommit(true);

        assertThrows(StoreException.class, () -> {
            try (StoreTransaction tx = StoreTransaction.begin(chaos, "insert")) {
                tx.execute("doc", () -> chaosDocuments.save("first", DocumentClassification.GENERIC));
                tx.markSuccess();
            }
        });

        chaos.reset();
        assertFalse(chaos.isInTransaction());
        assertEquals(0, documents.count());
        assertEquals(1, chaos.getRollbackCount());
    }
}
