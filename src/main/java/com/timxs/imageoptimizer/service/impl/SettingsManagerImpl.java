package com.timxs.imageoptimizer.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timxs.imageoptimizer.config.AnimatedGifPolicy;
import com.timxs.imageoptimizer.config.InvalidConfigurationException;
import com.timxs.imageoptimizer.config.OptimizerConfig;
import com.timxs.imageoptimizer.config.OutputFormatSetting;
import com.timxs.imageoptimizer.service.SettingsManager;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 配置管理器实现
 * 从 JSON 设置文件读取配置，转换为 OptimizerConfig 对象
 * 文件不存在时使用默认配置
 */
@Slf4j
public class SettingsManagerImpl implements SettingsManager {

    /**
     * JSON 解析器
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * 设置文件路径
     */
    private final Path settingsFile;

    public SettingsManagerImpl(Path settingsFile) {
        this.settingsFile = settingsFile;
    }

    @Override
    public OptimizerConfig getConfig() {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            log.debug("设置文件不存在，使用默认配置: {}", settingsFile);
            return new OptimizerConfig();
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(settingsFile.toFile());
        } catch (IOException e) {
            throw new InvalidConfigurationException("无法解析设置文件 " + settingsFile + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new OptimizerConfig();
        }
        if (!root.isObject()) {
            throw new InvalidConfigurationException("设置文件根节点必须是对象: " + settingsFile);
        }
        return parse(root);
    }

    /**
     * 构建配置对象
     * 设置项按 conversion、filter、bulk、backup 分组，也兼容不分组的扁平结构
     *
     * @param root 设置根节点
     * @return 配置对象
     */
    OptimizerConfig parse(JsonNode root) {
        OptimizerConfig config = new OptimizerConfig();
        applyConversionSettings(config, group(root, "conversion"));
        applyFilterSettings(config, group(root, "filter"));
        applyBulkSettings(config, group(root, "bulk"));
        applyBackupSettings(config, group(root, "backup"));
        return config;
    }

    private JsonNode group(JsonNode root, String name) {
        JsonNode node = root.get(name);
        return node != null && node.isObject() ? node : root;
    }

    private void applyConversionSettings(OptimizerConfig config, JsonNode node) {
        String format = getString(node, "format", null);
        if (format != null) {
            config.setFormat(parseEnum(OutputFormatSetting.class, "format", format));
        }
        int quality = getInt(node, "quality", config.getQuality());
        config.setQuality(Math.max(OptimizerConfig.MIN_QUALITY, Math.min(quality, OptimizerConfig.MAX_QUALITY)));
        config.setAutoOptimize(getBoolean(node, "autoOptimize", config.isAutoOptimize()));
    }

    private void applyFilterSettings(OptimizerConfig config, JsonNode node) {
        config.setMinSizeKb(Math.max(0, getInt(node, "minSizeKb", config.getMinSizeKb())));
        config.setExcludeFolders(getStringList(node, "excludeFolders"));
        config.setExcludePatterns(getStringList(node, "excludePatterns"));
        String gifPolicy = getString(node, "animatedGifPolicy", null);
        if (gifPolicy != null) {
            config.setAnimatedGifPolicy(parseEnum(AnimatedGifPolicy.class, "animatedGifPolicy", gifPolicy));
        }
    }

    private void applyBulkSettings(OptimizerConfig config, JsonNode node) {
        config.setBatchSize(OptimizerConfig.clampBatchSize(getInt(node, "batchSize", config.getBatchSize())));
        config.setMaxExecutionSeconds(Math.max(0, getInt(node, "maxExecutionSeconds", config.getMaxExecutionSeconds())));
        config.setBackgroundBatchEnabled(getBoolean(node, "backgroundBatchEnabled", config.isBackgroundBatchEnabled()));
    }

    private void applyBackupSettings(OptimizerConfig config, JsonNode node) {
        config.setDeleteOriginals(getBoolean(node, "deleteOriginals", config.isDeleteOriginals()));
        config.setKeepBackups(getBoolean(node, "keepBackups", config.isKeepBackups()));
        config.setBackupRetentionDays(Math.max(0, getInt(node, "backupRetentionDays", config.getBackupRetentionDays())));
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("设置项 " + key + " 的取值无效: " + value, e);
        }
    }

    // ========== JsonNode 辅助方法 ==========

    /**
     * 从 JsonNode 获取布尔值
     * 支持布尔类型以及 "1"/"0"、"true"/"false" 字符串
     */
    private boolean getBoolean(JsonNode node, String key, boolean defaultValue) {
        JsonNode value = node.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asInt() != 0;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if ("1".equals(text) || "true".equalsIgnoreCase(text)) {
                return true;
            }
            if ("0".equals(text) || "false".equalsIgnoreCase(text)) {
                return false;
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取整数值
     * 支持数字类型和字符串类型
     */
    private int getInt(JsonNode node, String key, int defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asInt();
            }
            if (value.isTextual()) {
                try {
                    return Integer.parseInt(value.asText().trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取字符串值
     */
    private String getString(JsonNode node, String key, String defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取字符串列表
     * 支持数组类型，以及逗号或换行分隔的字符串类型
     *
     * @return 字符串列表，没有配置时返回空列表
     */
    private List<String> getStringList(JsonNode node, String key) {
        JsonNode value = node.get(key);
        List<String> list = new ArrayList<>();
        if (value == null) {
            return list;
        }
        if (value.isArray()) {
            value.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    list.add(item.asText().trim());
                }
            });
        } else if (value.isTextual()) {
            for (String item : value.asText().split("[,\\r\\n]+")) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    list.add(trimmed);
                }
            }
        }
        return list;
    }
}
