package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.config.AnimatedGifPolicy;
import com.timxs.imageoptimizer.config.InvalidConfigurationException;
import com.timxs.imageoptimizer.config.OptimizerConfig;
import com.timxs.imageoptimizer.config.OutputFormatSetting;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsManagerImplTest {

    @TempDir
    Path tempDir;

    private OptimizerConfig load(String json) throws Exception {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, json);
        return new SettingsManagerImpl(file).getConfig();
    }

    @Test
    void missingFileGivesDefaults() {
        OptimizerConfig config = new SettingsManagerImpl(tempDir.resolve("none.json")).getConfig();

        assertEquals(OutputFormatSetting.WEBP, config.getFormat());
        assertEquals(82, config.getQuality());
        assertEquals(5, config.getMinSizeKb());
        assertEquals(20, config.getBatchSize());
        assertEquals(AnimatedGifPolicy.SKIP, config.getAnimatedGifPolicy());
        assertFalse(config.isDeleteOriginals());
        assertTrue(config.isKeepBackups());
        assertEquals(30, config.getBackupRetentionDays());
        assertTrue(config.isAutoOptimize());
        assertEquals(60, config.getMaxExecutionSeconds());
    }

    @Test
    void readsGroupedSettings() throws Exception {
        OptimizerConfig config = load("""
            {
              "conversion": {"format": "both", "quality": 70, "autoOptimize": false},
              "filter": {"minSizeKb": 0, "excludeFolders": ["private", " "], "excludePatterns": "logo-*.png\\nicon-?.png",
                         "animatedGifPolicy": "convert"},
              "bulk": {"batchSize": 50, "maxExecutionSeconds": 120, "backgroundBatchEnabled": "0"},
              "backup": {"deleteOriginals": 1, "keepBackups": "false", "backupRetentionDays": "7"}
            }
            """);

        assertEquals(OutputFormatSetting.BOTH, config.getFormat());
        assertEquals(70, config.getQuality());
        assertFalse(config.isAutoOptimize());
        assertEquals(0, config.getMinSizeKb());
        assertEquals(List.of("private"), config.getExcludeFolders());
        assertEquals(List.of("logo-*.png", "icon-?.png"), config.getExcludePatterns());
        assertEquals(AnimatedGifPolicy.CONVERT, config.getAnimatedGifPolicy());
        assertEquals(50, config.getBatchSize());
        assertEquals(120, config.getMaxExecutionSeconds());
        assertFalse(config.isBackgroundBatchEnabled());
        assertTrue(config.isDeleteOriginals());
        assertFalse(config.isKeepBackups());
        assertEquals(7, config.getBackupRetentionDays());
    }

    @Test
    void readsFlatSettings() throws Exception {
        OptimizerConfig config = load("{\"format\": \"avif\", \"batchSize\": 5}");

        assertEquals(OutputFormatSetting.AVIF, config.getFormat());
        assertEquals(5, config.getBatchSize());
    }

    @Test
    void clampsOutOfRangeNumbers() throws Exception {
        OptimizerConfig low = load("{\"quality\": 1, \"batchSize\": -4}");
        assertEquals(10, low.getQuality());
        assertEquals(1, low.getBatchSize());

        OptimizerConfig high = load("{\"quality\": 400, \"batchSize\": 1000}");
        assertEquals(100, high.getQuality());
        assertEquals(100, high.getBatchSize());
    }

    @Test
    void rejectsUnknownEnumValues() {
        assertThrows(InvalidConfigurationException.class, () -> load("{\"format\": \"jpegxl\"}"));
        assertThrows(InvalidConfigurationException.class, () -> load("{\"animatedGifPolicy\": \"maybe\"}"));
    }

    @Test
    void rejectsUnparseableDocument() {
        assertThrows(InvalidConfigurationException.class, () -> load("{not json"));
        assertThrows(InvalidConfigurationException.class, () -> load("[1, 2]"));
    }

    @Test
    void effectiveBatchSizeIsClamped() {
        OptimizerConfig config = new OptimizerConfig();
        config.setBatchSize(500);

        assertEquals(100, config.getEffectiveBatchSize());
    }
}
