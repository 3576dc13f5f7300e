package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.model.BackupExpiryStats;
import com.timxs.imageoptimizer.model.ImageAsset;
import com.timxs.imageoptimizer.model.ImageFormat;
import com.timxs.imageoptimizer.model.ImageVariant;
import com.timxs.imageoptimizer.model.MetadataKeys;
import com.timxs.imageoptimizer.service.BackupStore;
import com.timxs.imageoptimizer.service.ImageRepository;
import com.timxs.imageoptimizer.service.OptimizerLog;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 原图备份服务实现
 */
@Slf4j
public class BackupStoreImpl implements BackupStore {

    private final Path storageRoot;

    private final Path backupRoot;

    private final ImageRepository imageRepository;

    private final OptimizerLog optimizerLog;

    private final Clock clock;

    public BackupStoreImpl(Path backupRoot, ImageRepository imageRepository,
                           OptimizerLog optimizerLog, Clock clock) {
        this.imageRepository = Objects.requireNonNull(imageRepository, "imageRepository");
        this.storageRoot = imageRepository.storageRoot().toAbsolutePath().normalize();
        this.backupRoot = backupRoot.toAbsolutePath().normalize();
        this.optimizerLog = Objects.requireNonNull(optimizerLog, "optimizerLog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Path backupPath(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(storageRoot)) {
            throw new IllegalArgumentException("Path is outside storage root: " + path);
        }
        return backupRoot.resolve(storageRoot.relativize(normalized).toString());
    }

    @Override
    public boolean backup(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("备份跳过，文件不存在: {}", path);
            return false;
        }
        String relative;
        Path dest;
        try {
            dest = backupPath(path);
            relative = storageRoot.relativize(path.toAbsolutePath().normalize()).toString();
        } catch (IllegalArgumentException e) {
            log.error("备份失败: {}", e.getMessage());
            optimizerLog.error("Backup FAILED: " + path);
            return false;
        }
        try {
            Files.createDirectories(dest.getParent());
            Files.copy(path, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.debug("已备份: {}", relative);
            optimizerLog.info("Backup created: " + relative);
            return true;
        } catch (IOException e) {
            log.error("备份失败: {}", relative, e);
            optimizerLog.error("Backup FAILED: " + relative);
            return false;
        }
    }

    @Override
    public boolean restore(long assetId) {
        Optional<ImageAsset> found = imageRepository.getAsset(assetId);
        if (found.isEmpty()) {
            log.warn("恢复失败，附件不存在: #{}", assetId);
            return false;
        }
        ImageAsset asset = found.get();
        Path mainBackup = mirrorOf(asset.sourcePath());
        if (mainBackup == null || !Files.isRegularFile(mainBackup)) {
            log.warn("附件 #{} 没有备份", assetId);
            optimizerLog.warning("No backup found for attachment #" + assetId);
            return false;
        }

        try {
            copyBack(mainBackup, asset.sourcePath());
        } catch (IOException e) {
            log.error("附件 #{} 主文件恢复失败", assetId, e);
            optimizerLog.error("Restore FAILED for attachment #" + assetId);
            return false;
        }

        for (ImageVariant variant : asset.variants()) {
            Path variantBackup = mirrorOf(variant.path());
            if (variantBackup == null || !Files.isRegularFile(variantBackup)) {
                continue;
            }
            try {
                copyBack(variantBackup, variant.path());
            } catch (IOException e) {
                log.warn("附件 #{} 尺寸 {} 恢复失败: {}", assetId, variant.name(), e.getMessage());
            }
        }

        removeDerivedFiles(asset);
        imageRepository.deleteMetadata(assetId, MetadataKeys.OPTIMIZATION_KEYS);

        log.info("附件 #{} 已从备份恢复", assetId);
        optimizerLog.success("Restored attachment #" + assetId + " from backup", Map.of("id", assetId));
        return true;
    }

    @Override
    public boolean hasBackup(long assetId) {
        return imageRepository.getSourcePath(assetId)
            .map(this::mirrorOf)
            .map(Files::isRegularFile)
            .orElse(false);
    }

    @Override
    public BackupExpiryStats expire(int olderThanDays) {
        if (olderThanDays < 1 || !Files.isDirectory(backupRoot)) {
            return BackupExpiryStats.empty();
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
        ExpiryVisitor visitor = new ExpiryVisitor(cutoff);
        try {
            Files.walkFileTree(backupRoot, visitor);
        } catch (IOException e) {
            log.warn("遍历备份目录失败: {}", backupRoot, e);
        }
        BackupExpiryStats stats = visitor.toStats();
        log.info("已清理 {} 天前的备份: 删除 {} 个文件, 释放 {} 字节",
            olderThanDays, stats.deleted(), stats.bytesDeleted());
        optimizerLog.info("Cleaned up backups older than " + olderThanDays + " days.");
        return stats;
    }

    @Override
    public long totalSize() {
        if (!Files.isDirectory(backupRoot)) {
            return 0;
        }
        try (Stream<Path> stream = Files.walk(backupRoot)) {
            return stream
                .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                .mapToLong(path -> {
                    try {
                        return Files.size(path);
                    } catch (IOException e) {
                        return 0L;
                    }
                })
                .sum();
        } catch (IOException e) {
            log.warn("统计备份目录大小失败: {}", backupRoot, e);
            return 0;
        }
    }

    private Path mirrorOf(Path path) {
        try {
            return backupPath(path);
        } catch (IllegalArgumentException e) {
            log.warn("无法定位备份: {}", e.getMessage());
            return null;
        }
    }

    private void copyBack(Path backup, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(backup, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * 删除主文件和尺寸变体的所有派生文件
     */
    private void removeDerivedFiles(ImageAsset asset) {
        List<Path> files = new ArrayList<>();
        files.add(asset.sourcePath());
        asset.variants().forEach(variant -> files.add(variant.path()));
        for (Path file : files) {
            for (ImageFormat format : ImageFormat.values()) {
                Path derived = file.resolveSibling(file.getFileName() + "." + format.getExtension());
                try {
                    Files.deleteIfExists(derived);
                } catch (IOException e) {
                    log.warn("删除派生文件失败: {}", derived, e);
                }
            }
        }
    }

    /**
     * 删除过期文件，目录处理完后为空则一并删除（根目录保留）
     */
    private class ExpiryVisitor extends SimpleFileVisitor<Path> {

        private final Instant cutoff;
        private int scanned;
        private int deleted;
        private long bytesDeleted;
        private int deleteFailures;
        private int directoriesRemoved;

        ExpiryVisitor(Instant cutoff) {
            this.cutoff = cutoff;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            scanned++;
            if (!attrs.lastModifiedTime().toInstant().isBefore(cutoff)) {
                return FileVisitResult.CONTINUE;
            }
            try {
                Files.delete(file);
                deleted++;
                bytesDeleted += attrs.size();
            } catch (IOException e) {
                deleteFailures++;
                log.warn("删除过期备份失败: {}", file, e);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("无法读取备份文件: {}", file, exc);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (dir.equals(backupRoot)) {
                return FileVisitResult.CONTINUE;
            }
            try (Stream<Path> children = Files.list(dir)) {
                if (children.findAny().isEmpty()) {
                    Files.delete(dir);
                    directoriesRemoved++;
                }
            } catch (IOException e) {
                log.warn("清理空目录失败: {}", dir, e);
            }
            return FileVisitResult.CONTINUE;
        }

        BackupExpiryStats toStats() {
            return new BackupExpiryStats(scanned, deleted, bytesDeleted, deleteFailures, directoriesRemoved);
        }
    }
}
