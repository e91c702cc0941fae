package com.entity.pipeline.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_nullPathGivesDefaults() {
        assertEquals(PipelineConfig.defaults(), ConfigLoader.load(null));
    }

    @Test
    void overlay_changesOnlyNamedValues() {
        PipelineConfig config = ConfigLoader.overlay(PipelineConfig.defaults(),
                "{ \"batchSize\": 200, \"integrity\": { \"hubName\": \"Example Hub\" } }");

        assertEquals(200, config.batchSize());
        assertEquals("Example Hub", config.integrity().hubName());
        assertTrue(config.integrity().purgeJunk());
        assertEquals(PipelineConfig.defaults().relationship(), config.relationship());
        assertEquals(PipelineConfig.defaults().scoring(), config.scoring());
    }

    @Test
    void overlay_nestedNumericOverride() {
        PipelineConfig config = ConfigLoader.overlay(PipelineConfig.defaults(),
                "{ \"relationship\": { \"proximityWindow\": 120 }, \"cache\": { \"enabled\": false } }");

        assertEquals(120, config.relationship().proximityWindow());
        assertEquals(50, config.relationship().maxEntitiesPerDocument());
        assertFalse(config.cache().enabled());
    }

    @Test
    void overlay_rejectsUnknownSetting() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.overlay(PipelineConfig.defaults(), "{ \"batchSizes\": 10 }"));

        assertTrue(e.getMessage().startsWith("Invalid config"));
    }

    @Test
    void overlay_rejectsInvalidValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.overlay(PipelineConfig.defaults(), "{ \"batchSize\": 0 }"));

        assertTrue(e.getMessage().contains("batchSize must be > 0"));
    }

    @Test
    void overlay_rejectsNonObject() {
        assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.overlay(PipelineConfig.defaults(), "[1, 2]"));
    }

    @Test
    void overlay_rejectsMalformedJson() {
        assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.overlay(PipelineConfig.defaults(), "{ \"batchSize\": "));
    }

    @Test
    void load_readsFile() throws IOException {
        Path file = tempDir.resolve("pipeline.json");
        Files.writeString(file, "{ \"scoring\": { \"anchorBonus\": 15 } }");

        PipelineConfig config = ConfigLoader.load(file);

        assertEquals(15.0, config.scoring().anchorBonus(), 1e-9);
    }

    @Test
    void load_missingFileRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(tempDir.resolve("missing.json")));
    }
}
