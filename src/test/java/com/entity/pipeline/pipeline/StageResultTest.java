package com.entity.pipeline.pipeline;

import com.entity.pipeline.store.IdRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class StageResultTest {

    @Nested
    @DisplayName("StageResult")
    class Results {

        @Test
        @DisplayName("Should accumulate counters and default missing ones to zero")
        void accumulatesCounters() {
            StageResult result = StageResult.builder(PipelineStage.RELATE, false)
                    .increment("relationshipsCreated")
                    .increment("relationshipsCreated")
                    .add("documentsScanned", 40)
                    .set("edgesDeleted", 3)
                    .build();

            assertEquals(2, result.count("relationshipsCreated"));
            assertEquals(40, result.count("documentsScanned"));
            assertEquals(3, result.count("edgesDeleted"));
            assertEquals(0, result.count("neverTouched"));
            assertFalse(result.dryRun());
            assertFalse(result.hasWarnings());
        }

        @Test
        @DisplayName("Should count warnings alongside the warning text")
        void warnings() {
            StageResult result = StageResult.builder(PipelineStage.EXTRACT, true)
                    .warn("document 7 has no content")
                    .build();

            assertTrue(result.hasWarnings());
            assertEquals(1, result.count("warnings"));
            assertEquals("document 7 has no content", result.warnings().get(0));
            assertTrue(result.toString().contains("stage=extract"));
        }

        @Test
        void resultIsImmutable() {
            StageResult result = StageResult.builder(PipelineStage.SCORE, false).increment("entitiesScored").build();

            assertThrows(UnsupportedOperationException.class, () -> result.counters().put("x", 1L));
        }
    }

    @Nested
    @DisplayName("StageOptions")
    class Options {

        @Test
        void defaults() {
            StageOptions options = StageOptions.defaults();

            assertFalse(options.dryRun());
            assertEquals(StageOptions.DEFAULT_BATCH_SIZE, options.batchSize());
            assertTrue(options.range().isUnbounded());
            assertSame(ProgressCallback.NOOP, options.progress());
        }

        @Test
        void withersKeepOtherFields() {
            StageOptions options = StageOptions.defaults()
                    .withDryRun(true)
                    .withBatchSize(25)
                    .withRange(new IdRange(10, 20))
                    .withRebuild(true);

            assertTrue(options.dryRun());
            assertEquals(25, options.batchSize());
            assertTrue(options.range().contains(15));
            assertFalse(options.range().contains(21));
            assertTrue(options.rebuild());
            assertFalse(options.resume());
        }

        @Test
        void rejectsNonPositiveBatchSize() {
            assertThrows(IllegalArgumentException.class, () -> StageOptions.defaults().withBatchSize(0));
        }

        @Test
        void rejectsInvertedRange() {
            assertThrows(IllegalArgumentException.class, () -> new IdRange(5, 4));
            assertEquals(Long.MIN_VALUE, IdRange.of(null, 9L).fromId());
        }
    }

    @Nested
    @DisplayName("PipelineStage")
    class Stages {

        @ParameterizedTest
        @CsvSource({
                "extract, EXTRACT",
                "RESOLVE, RESOLVE",
                "relate, RELATE",
                "score, SCORE",
                "integrity, INTEGRITY"
        })
        void fromCommand(String command, PipelineStage expected) {
            assertEquals(expected, PipelineStage.fromCommand(command));
        }

        @Test
        void unknownCommand() {
            assertThrows(IllegalArgumentException.class, () -> PipelineStage.fromCommand("graph"));
        }
    }

    @Nested
    @DisplayName("PipelineException")
    class Exceptions {

        @Test
        @DisplayName("Should name the stage and entity in the message")
        void messageNamesStageAndEntity() {
            PipelineException e = new PipelineException(PipelineStage.RESOLVE, 42L, "merge failed", null);

            assertEquals("[resolve entity=42] merge failed", e.getMessage());
            assertEquals(PipelineStage.RESOLVE, e.getStage());
            assertEquals(42L, e.getEntityId());
        }

        @Test
        void messageWithoutEntity() {
            PipelineException e = new PipelineException(PipelineStage.INTEGRITY, "hub entity not found");

            assertEquals("[integrity] hub entity not found", e.getMessage());
            assertNull(e.getEntityId());
        }
    }
}
