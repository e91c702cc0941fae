package com.entity.pipeline.audit;

import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.MergeRecord;
import com.entity.pipeline.store.SqliteStoreConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MergeLedgerTest {

    private SqliteStoreConnection store;
    private MergeLedger ledger;

    @BeforeEach
    void setUp() {
        store = SqliteStoreConnection.inMemory();
        ledger = new MergeLedger(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private MergeRecord record(long source, long target, MatchMethod method) {
        return MergeRecord.builder()
                .sourceEntityId(source)
                .targetEntityId(target)
                .sourceName("Source " + source)
                .targetName("Target " + target)
                .matchMethod(method)
                .matchScore(0.9)
                .mentionsMoved(2)
                .relationshipsCombined(1)
                .triggeredBy("identity-resolver")
                .build();
    }

    @Test
    @DisplayName("Should persist every field of a merge record")
    void persistsRecord() {
        MergeRecord written = ledger.record(record(2, 1, MatchMethod.FUZZY));

        MergeRecord read = ledger.getAllRecords().get(0);
        assertEquals(written.id(), read.id());
        assertEquals(2, read.sourceEntityId());
        assertEquals(1, read.targetEntityId());
        assertEquals("Source 2", read.sourceName());
        assertEquals(MatchMethod.FUZZY, read.matchMethod());
        assertEquals(0.9, read.matchScore(), 1e-9);
        assertEquals(2, read.mentionsMoved());
        assertEquals(1, read.relationshipsCombined());
        assertEquals("identity-resolver", read.triggeredBy());
    }

    @Test
    @DisplayName("Should query records by target and by source")
    void queriesByEndpoint() {
        ledger.record(record(2, 1, MatchMethod.FUZZY));
        ledger.record(record(3, 1, MatchMethod.ALIAS));
        ledger.record(record(4, 5, MatchMethod.EXACT));

        assertEquals(2, ledger.getRecordsForTarget(1).size());
        assertEquals(1, ledger.getRecordsForSource(4).size());
        assertTrue(ledger.getRecordsForSource(1).isEmpty());
    }
}
