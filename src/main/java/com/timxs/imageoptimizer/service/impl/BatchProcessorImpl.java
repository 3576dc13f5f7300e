package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.config.OptimizerConfig;
import com.timxs.imageoptimizer.model.AssetOutcome;
import com.timxs.imageoptimizer.model.BatchStatus;
import com.timxs.imageoptimizer.model.Capabilities;
import com.timxs.imageoptimizer.model.ChunkResult;
import com.timxs.imageoptimizer.model.ConversionResult;
import com.timxs.imageoptimizer.model.ImageAsset;
import com.timxs.imageoptimizer.model.ImageFormat;
import com.timxs.imageoptimizer.model.ImageVariant;
import com.timxs.imageoptimizer.model.MetadataKeys;
import com.timxs.imageoptimizer.model.OptimizationStatus;
import com.timxs.imageoptimizer.model.StopReason;
import com.timxs.imageoptimizer.service.BackupStore;
import com.timxs.imageoptimizer.service.BatchProcessor;
import com.timxs.imageoptimizer.service.CapabilityProbe;
import com.timxs.imageoptimizer.service.ConversionEngine;
import com.timxs.imageoptimizer.service.ImageRepository;
import com.timxs.imageoptimizer.service.OptimizerLog;
import com.timxs.imageoptimizer.service.ResourceMonitor;
import com.timxs.imageoptimizer.service.SettingsManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 批量优化处理器实现
 * 同一进程内同时只允许一个批次运行，批次之间只通过附件元数据协调进度
 */
@Slf4j
@RequiredArgsConstructor
public class BatchProcessorImpl implements BatchProcessor {

    /**
     * 时间保护的最小预算（秒）
     */
    static final long MIN_TIME_BUDGET_SECONDS = 30;

    /**
     * 距离执行时间上限预留的秒数
     */
    static final long TIME_HEADROOM_SECONDS = 10;

    /**
     * 内存使用达到上限的该比例时停止
     */
    static final double MEMORY_THRESHOLD = 0.85;

    private final ImageRepository imageRepository;

    private final ConversionEngine conversionEngine;

    private final BackupStore backupStore;

    private final SettingsManager settingsManager;

    private final CapabilityProbe capabilityProbe;

    private final ResourceMonitor resourceMonitor;

    private final OptimizerLog optimizerLog;

    private final Clock clock;

    private final ReentrantLock chunkLock = new ReentrantLock();

    @Override
    public BatchStatus status() {
        long total = imageRepository.countAll();
        long processed = imageRepository.countProcessed();
        long succeeded = imageRepository.countSucceeded();

        long savedBytes = 0;
        long originalBytes = 0;
        for (ConversionResult result : imageRepository.listConversionResults()) {
            savedBytes += result.getSavings();
            originalBytes += result.getOriginalSize();
        }
        double avgPercent = originalBytes > 0
            ? Math.round((double) savedBytes / originalBytes * 1000) / 10.0
            : 0;

        return BatchStatus.builder()
            .total(total)
            .processed(processed)
            .succeeded(succeeded)
            .skipped(Math.max(0, processed - succeeded))
            .remaining(Math.max(0, total - processed))
            .savingsBytes(savedBytes)
            .avgPercent(avgPercent)
            .build();
    }

    @Override
    public ChunkResult runChunk() {
        return runChunk(settingsManager.getConfig().getBatchSize());
    }

    @Override
    public ChunkResult runChunk(int batchSize) {
        if (!chunkLock.tryLock()) {
            log.info("已有批次正在运行，本次调用直接返回");
            return ChunkResult.builder()
                .done(false)
                .stopReason(StopReason.BUSY)
                .build();
        }
        try {
            return doRunChunk(OptimizerConfig.clampBatchSize(batchSize));
        } finally {
            chunkLock.unlock();
        }
    }

    private ChunkResult doRunChunk(int batchSize) {
        Instant start = clock.instant();
        List<Long> ids = imageRepository.listUnprocessedIds(batchSize);
        if (ids.isEmpty()) {
            log.debug("没有待处理的附件");
            return ChunkResult.builder()
                .done(true)
                .stopReason(StopReason.NOTHING_TO_DO)
                .build();
        }

        OptimizerConfig config = settingsManager.getConfig();
        boolean deleteOriginals = config.isDeleteOriginals();
        boolean keepBackups = config.isKeepBackups();
        Capabilities caps = capabilityProbe.detect();
        long timeBudget = Math.max(MIN_TIME_BUDGET_SECONDS, caps.getMaxExecutionSeconds() - TIME_HEADROOM_SECONDS);
        long memoryLimit = caps.getMemoryLimit();

        log.info("开始处理批次: {} 个附件，时间预算 {} 秒", ids.size(), timeBudget);
        List<AssetOutcome> results = new ArrayList<>();
        StopReason stopReason = StopReason.COMPLETED;

        for (Long id : ids) {
            long elapsed = Duration.between(start, clock.instant()).toSeconds();
            if (elapsed >= timeBudget) {
                log.info("批次已运行 {} 秒，达到时间预算，提前结束", elapsed);
                stopReason = StopReason.TIME_LIMIT;
                break;
            }
            if (memoryLimit > 0 && resourceMonitor.usedMemory() >= MEMORY_THRESHOLD * memoryLimit) {
                log.warn("内存使用接近上限，提前结束批次");
                optimizerLog.warning("Memory limit approaching, stopping batch early.");
                stopReason = StopReason.MEMORY_LIMIT;
                break;
            }

            results.add(processAsset(id, deleteOriginals, keepBackups));
        }

        ChunkResult chunk = withTotals(ChunkResult.builder()
            .results(List.copyOf(results))
            .stopReason(stopReason));
        log.info("批次结束: 处理 {} 个，剩余 {} 个，结束原因 {}",
            chunk.getProcessedBatch(), chunk.getRemaining(), stopReason);
        return chunk;
    }

    /**
     * 处理单个附件：按需备份、转换、删除原图
     * 存储写入失败只记录到该附件的结果中，不中断批次
     */
    private AssetOutcome processAsset(long id, boolean deleteOriginals, boolean keepBackups) {
        try {
            ImageAsset asset = imageRepository.getAsset(id).orElse(null);

            // 需要删除原图时先备份
            boolean backupsOk = true;
            if (deleteOriginals && keepBackups && asset != null) {
                backupsOk = backupAsset(asset);
            }

            ConversionResult result = conversionEngine.optimizeAsset(id, asset);

            boolean originalsDeleted = false;
            if (deleteOriginals && result.getStatus() == OptimizationStatus.OPTIMIZED && result.isAllOk()) {
                originalsDeleted = deleteOriginalFiles(id, keepBackups, backupsOk);
            }

            return new AssetOutcome(id, result.isSuccess(), result.getSavings(),
                result.getError() == null ? "" : result.getError(), originalsDeleted);
        } catch (RuntimeException e) {
            log.error("处理附件 #{} 失败", id, e);
            optimizerLog.error("Failed to process #" + id + ": " + e.getMessage());
            return new AssetOutcome(id, false, 0, String.valueOf(e.getMessage()), false);
        }
    }

    /**
     * 备份主文件和存在的尺寸变体
     *
     * @return 所有备份调用是否都成功
     */
    private boolean backupAsset(ImageAsset asset) {
        boolean ok = backupStore.backup(asset.sourcePath());
        for (ImageVariant variant : asset.variants()) {
            if (Files.isRegularFile(variant.path())) {
                ok &= backupStore.backup(variant.path());
            }
        }
        if (!ok) {
            log.warn("附件 #{} 备份不完整", asset.id());
        }
        return ok;
    }

    /**
     * 删除原图和尺寸变体
     * 必须存在派生文件，开启备份时本批次备份必须全部成功且主文件备份存在
     *
     * @return 是否删除
     */
    private boolean deleteOriginalFiles(long id, boolean keepBackups, boolean backupsOk) {
        ImageAsset asset = imageRepository.getAsset(id).orElse(null);
        if (asset == null || !Files.isRegularFile(asset.sourcePath())) {
            return false;
        }
        Path file = asset.sourcePath();

        ImageFormat best = null;
        for (ImageFormat format : List.of(ImageFormat.AVIF, ImageFormat.WEBP)) {
            if (Files.isRegularFile(derivedPath(file, format))) {
                best = format;
                break;
            }
        }
        if (best == null) {
            log.warn("附件 #{} 没有派生文件，保留原图", id);
            optimizerLog.warning("Cannot delete original: no converted file for #" + id);
            return false;
        }

        if (keepBackups && (!backupsOk || !backupStore.hasBackup(id))) {
            log.warn("附件 #{} 没有可用备份，保留原图", id);
            optimizerLog.warning("Cannot delete original: no backup for #" + id);
            return false;
        }

        try {
            Files.delete(file);
        } catch (IOException e) {
            log.error("删除附件 #{} 原图失败", id, e);
            optimizerLog.error("Failed to delete original for #" + id + ": " + e.getMessage());
            return false;
        }
        log.info("已删除附件 #{} 的原图，派生文件: {}", id, derivedPath(file, best).getFileName());
        optimizerLog.info("Deleted original for #" + id + ", converted file: " + derivedPath(file, best));

        for (ImageVariant variant : asset.variants()) {
            try {
                Files.deleteIfExists(variant.path());
            } catch (IOException e) {
                log.warn("删除附件 #{} 尺寸 {} 失败: {}", id, variant.name(), e.getMessage());
            }
        }

        imageRepository.setMetadata(id, MetadataKeys.ORIGINALS_DELETED, true);
        return true;
    }

    private ChunkResult withTotals(ChunkResult.ChunkResultBuilder builder) {
        long total = imageRepository.countAll();
        long processed = imageRepository.countProcessed();
        long succeeded = imageRepository.countSucceeded();
        long remaining = Math.max(0, total - processed);
        return builder
            .done(remaining == 0)
            .total(total)
            .processedTotal(processed)
            .succeededTotal(succeeded)
            .skippedTotal(Math.max(0, processed - succeeded))
            .remaining(remaining)
            .build();
    }

    @Override
    public ConversionResult optimizeSingle(long id) {
        return conversionEngine.optimizeAsset(id);
    }

    @Override
    public boolean restoreSingle(long id) {
        return backupStore.restore(id);
    }

    @Override
    public Optional<ConversionResult> onUpload(long id) {
        OptimizerConfig config = settingsManager.getConfig();
        if (!config.isAutoOptimize()) {
            return Optional.empty();
        }
        ImageAsset asset = imageRepository.getAsset(id).orElse(null);
        if (asset == null || !ImageRepository.SUPPORTED_MIME_TYPES.contains(asset.mimeType())) {
            return Optional.empty();
        }
        if (Files.isRegularFile(asset.sourcePath()) && asset.size() < config.getMinSizeKb() * 1024L) {
            log.debug("上传的附件 #{} 小于 {} KB，不自动优化", id, config.getMinSizeKb());
            return Optional.empty();
        }
        return Optional.of(conversionEngine.optimizeAsset(id, asset));
    }

    private static Path derivedPath(Path file, ImageFormat format) {
        return file.resolveSibling(file.getFileName() + "." + format.getExtension());
    }
}
