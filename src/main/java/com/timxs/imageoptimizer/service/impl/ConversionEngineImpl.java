package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.codec.Codec;
import com.timxs.imageoptimizer.config.AnimatedGifPolicy;
import com.timxs.imageoptimizer.config.OptimizerConfig;
import com.timxs.imageoptimizer.config.OutputFormatSetting;
import com.timxs.imageoptimizer.model.ConversionResult;
import com.timxs.imageoptimizer.model.FileConversionResult;
import com.timxs.imageoptimizer.model.ImageAsset;
import com.timxs.imageoptimizer.model.ImageFormat;
import com.timxs.imageoptimizer.model.ImageVariant;
import com.timxs.imageoptimizer.model.LogLevel;
import com.timxs.imageoptimizer.model.MetadataKeys;
import com.timxs.imageoptimizer.model.OptimizationStatus;
import com.timxs.imageoptimizer.service.CapabilityProbe;
import com.timxs.imageoptimizer.service.ConversionEngine;
import com.timxs.imageoptimizer.service.ImageRepository;
import com.timxs.imageoptimizer.service.OptimizerLog;
import com.timxs.imageoptimizer.service.SettingsManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 转换引擎实现
 * 检查顺序：缺失 -> 过小 -> 排除 -> 动图 -> 无引擎，命中即写入终态并返回
 */
@Slf4j
@RequiredArgsConstructor
public class ConversionEngineImpl implements ConversionEngine {

    /**
     * GIF 图形控制扩展块标记，出现多于一次即为动图
     */
    private static final byte[] GRAPHIC_CONTROL_BLOCK = {0x00, 0x21, (byte) 0xF9, 0x04};

    /**
     * 结果中保留的错误条数
     */
    private static final int MAX_REPORTED_ERRORS = 5;

    private static final Set<String> DECODABLE_MIME_TYPES = ImageRepository.SUPPORTED_MIME_TYPES;

    private final ImageRepository imageRepository;

    private final CapabilityProbe capabilityProbe;

    private final SettingsManager settingsManager;

    private final OptimizerLog optimizerLog;

    private final Clock clock;

    @Override
    public ConversionResult optimizeAsset(long id) {
        return optimizeAsset(id, null);
    }

    @Override
    public ConversionResult optimizeAsset(long id, ImageAsset prefetched) {
        ImageAsset asset = prefetched != null ? prefetched : imageRepository.getAsset(id).orElse(null);
        if (asset == null) {
            // 图片库中没有该附件，无处写入元数据
            log.error("附件 #{} 不存在", id);
            optimizerLog.error("File not found for attachment #" + id);
            return ConversionResult.terminal(OptimizationStatus.MISSING, "File not found", 0, false, now());
        }

        Path file = asset.sourcePath();
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("附件 #{} 的源文件不存在: {}", id, file);
            optimizerLog.error("File not found for attachment #" + id);
            return markProcessed(id,
                ConversionResult.terminal(OptimizationStatus.MISSING, "File not found", 0, false, now()));
        }

        OptimizerConfig config = settingsManager.getConfig();
        long originalSize = sizeOf(file);

        // 过小文件
        long minBytes = config.getMinSizeKb() * 1024L;
        if (minBytes > 0 && originalSize < minBytes) {
            log.debug("附件 #{} 小于 {} KB，跳过", id, config.getMinSizeKb());
            optimizerLog.info("Skipped small file (#" + id + ")");
            return markProcessed(id, ConversionResult.terminal(OptimizationStatus.SKIPPED_SMALL,
                "Skipped (under size threshold)", originalSize, true, now()));
        }

        // 排除规则
        if (isExcluded(file, config)) {
            log.debug("附件 #{} 命中排除规则，跳过", id);
            optimizerLog.info("Skipped (excluded): #" + id);
            return markProcessed(id, ConversionResult.terminal(OptimizationStatus.SKIPPED_EXCLUDED,
                "Excluded", originalSize, true, now()));
        }

        // 动图 GIF
        if ("image/gif".equals(asset.mimeType())
            && config.getAnimatedGifPolicy() == AnimatedGifPolicy.SKIP
            && isAnimatedGif(file)) {
            log.debug("附件 #{} 是动图 GIF，跳过", id);
            optimizerLog.info("Skipped animated GIF: #" + id);
            return markProcessed(id, ConversionResult.terminal(OptimizationStatus.SKIPPED_ANIMATED,
                "Animated GIF skipped", originalSize, true, now()));
        }

        List<ImageFormat> formats = resolveFormats(config.getFormat());
        if (formats.isEmpty()) {
            String error = "No supported output format available on this server";
            log.error("{} (#{})", error, id);
            optimizerLog.error(error + " (#" + id + ")");
            return markProcessed(id, ConversionResult.terminal(OptimizationStatus.ERROR_NO_ENGINE,
                error, originalSize, false, now()));
        }

        return markProcessed(id, convertAsset(asset, formats, config.getQuality(), originalSize));
    }

    /**
     * 转换主文件和所有存在的尺寸变体
     */
    private ConversionResult convertAsset(ImageAsset asset, List<ImageFormat> formats, int quality,
                                          long originalSize) {
        long id = asset.id();
        Path file = asset.sourcePath();
        boolean allOk = true;
        long totalSaved = 0;
        List<String> errors = new ArrayList<>();
        Map<ImageFormat, Long> generated = new LinkedHashMap<>();

        // 主文件
        for (ImageFormat format : formats) {
            FileConversionResult result = convertFile(file, format, quality, asset.mimeType());
            if (result.success()) {
                generated.put(format, result.size());
            } else {
                allOk = false;
                errors.add(format.getExtension() + ": " + result.error());
                log.warn("附件 #{} 转换 {} 失败: {}", id, format, result.error());
                optimizerLog.record(LogLevel.WARNING,
                    "Conversion failed (" + format.getExtension() + ") for: " + file,
                    Map.of("error", String.valueOf(result.error())));
            }
        }

        long bestMain = generated.values().stream().mapToLong(Long::longValue).min().orElse(0);
        if (bestMain > 0 && bestMain < originalSize) {
            totalSaved += originalSize - bestMain;
        }
        boolean anyGenerated = !generated.isEmpty();

        // 尺寸变体，不存在的文件直接跳过
        for (ImageVariant variant : asset.variants()) {
            Path variantFile = variant.path();
            if (!Files.isRegularFile(variantFile)) {
                continue;
            }
            long variantOriginal = sizeOf(variantFile);
            long bestVariant = 0;
            for (ImageFormat format : formats) {
                FileConversionResult result = convertFile(variantFile, format, quality, asset.mimeType());
                if (result.success()) {
                    anyGenerated = true;
                    bestVariant = bestVariant == 0 ? result.size() : Math.min(bestVariant, result.size());
                } else {
                    allOk = false;
                    errors.add(format.getExtension() + " (size " + variant.name() + "): " + result.error());
                }
            }
            if (bestVariant > 0 && bestVariant < variantOriginal) {
                totalSaved += variantOriginal - bestVariant;
            }
        }

        OptimizationStatus status = anyGenerated
            ? (allOk ? OptimizationStatus.OPTIMIZED : OptimizationStatus.PARTIAL)
            : OptimizationStatus.SKIPPED;

        ConversionResult result = ConversionResult.builder()
            .status(status)
            .error(errors.isEmpty() ? "" : String.join(" | ", errors.subList(0, Math.min(errors.size(), MAX_REPORTED_ERRORS))))
            .originalSize(originalSize)
            .optimizedSize(bestMain > 0 ? bestMain : originalSize)
            .savings(Math.max(0, totalSaved))
            .formatsRequested(List.copyOf(formats))
            .formatsGenerated(List.copyOf(generated.keySet()))
            .allOk(allOk)
            .date(now())
            .build();

        if (result.isSuccess()) {
            log.info("附件 #{} 优化完成，状态 {}，节省 {}", id, status.getValue(), formatFileSize(result.getSavings()));
            optimizerLog.success("Optimized #" + id + ": saved " + formatFileSize(result.getSavings()),
                Map.of("formats", formats.stream().map(ImageFormat::getExtension).toList()));
        } else {
            log.info("附件 #{} 没有生成任何派生文件: {}", id, result.getError());
            optimizerLog.record(LogLevel.INFO, "Skipped #" + id, Map.of("reason", result.getError()));
        }
        return result;
    }

    @Override
    public FileConversionResult convertFile(Path source, ImageFormat format, int quality, String mime) {
        Path dest = source.resolveSibling(source.getFileName() + "." + format.getExtension());

        Optional<Codec> engine = capabilityProbe.engineFor(format);
        if (engine.isEmpty()) {
            return FileConversionResult.failed(format, "No engine for " + format.getExtension());
        }
        if (mime != null && !mime.isBlank() && !DECODABLE_MIME_TYPES.contains(mime)) {
            return FileConversionResult.failed(format, "Conversion produced no output");
        }
        int effectiveQuality = Math.max(OptimizerConfig.MIN_QUALITY, Math.min(quality, OptimizerConfig.MAX_QUALITY));

        // 设置本类的类加载器为上下文类加载器，确保 ImageIO 能找到 WebP 等格式的 SPI
        ClassLoader originalClassLoader = Thread.currentThread().getContextClassLoader();
        try {
            Thread.currentThread().setContextClassLoader(this.getClass().getClassLoader());
            engine.get().encode(source, dest, format, effectiveQuality);

            if (!Files.isRegularFile(dest)) {
                return FileConversionResult.failed(format, "Conversion produced no output");
            }
            long newSize = Files.size(dest);
            long originalSize = Files.size(source);
            // 派生文件不小于原图时丢弃
            if (newSize >= originalSize) {
                Files.deleteIfExists(dest);
                return FileConversionResult.failed(format, "Converted file larger than original");
            }
            return FileConversionResult.success(format, dest, newSize);
        } catch (Throwable t) {
            // 捕获所有异常包括 Error（如 UnsatisfiedLinkError），单个文件失败不影响整个附件
            log.debug("{} 转换 {} 失败", source.getFileName(), format, t);
            deleteQuietly(dest);
            String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
            return FileConversionResult.failed(format, message);
        } finally {
            Thread.currentThread().setContextClassLoader(originalClassLoader);
        }
    }

    /**
     * 请求的格式与服务器支持的格式取交集，为空且支持 WebP 时退回 WebP
     */
    List<ImageFormat> resolveFormats(OutputFormatSetting setting) {
        List<ImageFormat> formats = setting.getFormats().stream()
            .filter(capabilityProbe::has)
            .toList();
        if (formats.isEmpty() && capabilityProbe.has(ImageFormat.WEBP)) {
            return List.of(ImageFormat.WEBP);
        }
        return formats;
    }

    /**
     * 目录规则按完整路径包含匹配，文件名规则按通配符匹配
     */
    boolean isExcluded(Path file, OptimizerConfig config) {
        String fullPath = file.toString();
        for (String folder : config.getExcludeFolders()) {
            String trimmed = folder == null ? "" : folder.trim();
            if (!trimmed.isEmpty() && fullPath.contains(trimmed)) {
                return true;
            }
        }
        String basename = file.getFileName().toString();
        for (String pattern : config.getExcludePatterns()) {
            String trimmed = pattern == null ? "" : pattern.trim();
            if (!trimmed.isEmpty() && globToPattern(trimmed).matcher(basename).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 把 * 和 ? 通配符转换为正则，其余字符按字面匹配
     */
    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    /**
     * 图形控制扩展块出现多于一次即为动图
     */
    static boolean isAnimatedGif(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            log.warn("无法读取 GIF 文件 {}: {}", file, e.getMessage());
            return false;
        }
        int found = 0;
        outer:
        for (int i = 0; i <= content.length - GRAPHIC_CONTROL_BLOCK.length; i++) {
            for (int j = 0; j < GRAPHIC_CONTROL_BLOCK.length; j++) {
                if (content[i + j] != GRAPHIC_CONTROL_BLOCK[j]) {
                    continue outer;
                }
            }
            if (++found > 1) {
                return true;
            }
            i += GRAPHIC_CONTROL_BLOCK.length - 1;
        }
        return false;
    }

    /**
     * 写入终态元数据，没有错误时清除旧的错误信息
     */
    private ConversionResult markProcessed(long id, ConversionResult result) {
        String error = result.getError();
        if (error == null || error.isEmpty()) {
            imageRepository.deleteMetadata(id, List.of(MetadataKeys.ERROR));
        }
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(MetadataKeys.STATUS, result.getStatus().getValue());
        if (error != null && !error.isEmpty()) {
            values.put(MetadataKeys.ERROR, error);
        }
        values.put(MetadataKeys.DATA, result);
        values.put(MetadataKeys.OPTIMIZED, true);
        imageRepository.setMetadata(id, values);
        return result;
    }

    private Instant now() {
        return clock.instant();
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.warn("无法读取文件大小 {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("删除不完整的派生文件失败: {}", file, e);
        }
    }

    /**
     * 格式化文件大小显示
     *
     * @param bytes 字节数
     * @return 格式化后的字符串（如 1.5 MB）
     */
    private static String formatFileSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KB", bytes / 1024.0);
        return String.format("%.1f MB", bytes / (1024.0 * 1024.0));
    }
}
