package com.timxs.imageoptimizer.config;

import lombok.Data;

import java.util.List;

/**
 * 图片优化配置
 * 包含转换、过滤、批处理和备份设置
 */
@Data
public class OptimizerConfig {

    /**
     * 批次大小允许的最小值
     */
    public static final int MIN_BATCH_SIZE = 1;

    /**
     * 批次大小允许的最大值
     */
    public static final int MAX_BATCH_SIZE = 100;

    public static final int MIN_QUALITY = 10;

    public static final int MAX_QUALITY = 100;

    // ========== 转换设置 ==========

    /**
     * 目标格式
     */
    private OutputFormatSetting format = OutputFormatSetting.WEBP;

    /**
     * 输出质量（10-100）
     */
    private int quality = 82;

    /**
     * 上传时自动优化
     */
    private boolean autoOptimize = true;

    // ========== 文件过滤 ==========

    /**
     * 小于该大小（KB）的文件直接跳过，0 表示不限制
     */
    private int minSizeKb = 5;

    /**
     * 排除的目录（路径包含即命中）
     */
    private List<String> excludeFolders = List.of();

    /**
     * 排除的文件名通配符（支持 * 和 ?）
     */
    private List<String> excludePatterns = List.of();

    /**
     * 动图 GIF 策略
     */
    private AnimatedGifPolicy animatedGifPolicy = AnimatedGifPolicy.SKIP;

    // ========== 批处理 ==========

    /**
     * 每批处理数量，使用时会被限制在 1-100
     */
    private int batchSize = 20;

    /**
     * 单次执行时间上限（秒）
     */
    private int maxExecutionSeconds = 60;

    /**
     * 是否允许后台定时批处理
     */
    private boolean backgroundBatchEnabled = true;

    // ========== 原图删除与备份 ==========

    /**
     * 转换全部成功后删除原图
     */
    private boolean deleteOriginals = false;

    /**
     * 删除前备份原图
     */
    private boolean keepBackups = true;

    /**
     * 备份保留天数
     */
    private int backupRetentionDays = 30;

    /**
     * 限制在允许范围内的批次大小
     */
    public int getEffectiveBatchSize() {
        return clampBatchSize(batchSize);
    }

    public static int clampBatchSize(int size) {
        return Math.max(MIN_BATCH_SIZE, Math.min(size, MAX_BATCH_SIZE));
    }
}
