package com.timxs.imageoptimizer.service.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.timxs.imageoptimizer.model.ConversionResult;
import com.timxs.imageoptimizer.model.ImageAsset;
import com.timxs.imageoptimizer.model.ImageVariant;
import com.timxs.imageoptimizer.model.MetadataKeys;
import com.timxs.imageoptimizer.service.ImageRepository;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 基于 JSON 文件的图片库
 * 整个库保存在一个 JSON 文档中，每次写入通过临时文件 + 原子移动完成
 */
@Slf4j
public class JsonImageRepository implements ImageRepository {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path storageRoot;

    private final Path libraryFile;

    /**
     * 按 ID 排序的附件
     */
    private final TreeMap<Long, AssetEntry> assets = new TreeMap<>();

    private long nextId = 1;

    public JsonImageRepository(Path storageRoot, Path libraryFile) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        this.libraryFile = libraryFile.toAbsolutePath().normalize();
        load();
    }

    @Override
    public Path storageRoot() {
        return storageRoot;
    }

    /**
     * 登记新附件
     *
     * @param relativePath 相对存储根目录的主文件路径
     * @param mimeType     MIME 类型
     * @param variantFiles 尺寸名称 -> 与主文件同目录的文件名
     * @return 新附件 ID
     */
    public synchronized long addAsset(String relativePath, String mimeType, Map<String, String> variantFiles) {
        AssetEntry entry = new AssetEntry();
        entry.setId(nextId++);
        entry.setPath(relativePath);
        entry.setMimeType(mimeType);
        List<VariantEntry> variants = new ArrayList<>();
        if (variantFiles != null) {
            variantFiles.forEach((name, file) -> {
                VariantEntry variant = new VariantEntry();
                variant.setName(name);
                variant.setFile(file);
                variants.add(variant);
            });
        }
        entry.setVariants(variants);
        assets.put(entry.getId(), entry);
        persist();
        log.debug("登记附件 #{}: {}", entry.getId(), relativePath);
        return entry.getId();
    }

    @Override
    public synchronized Optional<ImageAsset> getAsset(long id) {
        AssetEntry entry = assets.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        Path main = storageRoot.resolve(entry.getPath()).normalize();
        Path dir = main.getParent();
        List<ImageVariant> variants = new ArrayList<>();
        for (VariantEntry variant : entry.getVariants()) {
            Path file = dir.resolve(variant.getFile());
            variants.add(new ImageVariant(variant.getName(), file, sizeOf(file)));
        }
        return Optional.of(new ImageAsset(entry.getId(), main, entry.getMimeType(), sizeOf(main), variants));
    }

    @Override
    public synchronized List<Long> listUnprocessedIds(int limit) {
        return assets.values().stream()
            .filter(this::isSupported)
            .filter(entry -> !isProcessed(entry))
            .limit(Math.max(limit, 0))
            .map(AssetEntry::getId)
            .toList();
    }

    @Override
    public synchronized <T> Optional<T> getMetadata(long id, String key, Class<T> type) {
        AssetEntry entry = assets.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        JsonNode value = entry.getMetadata().get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.treeToValue(value, type));
        } catch (IOException e) {
            log.warn("附件 #{} 的元数据 {} 无法解析: {}", id, key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void setMetadata(long id, Map<String, Object> values) {
        AssetEntry entry = requireEntry(id);
        values.forEach((key, value) -> entry.getMetadata().put(key, objectMapper.valueToTree(value)));
        persist();
    }

    @Override
    public synchronized void deleteMetadata(long id, Collection<String> keys) {
        AssetEntry entry = requireEntry(id);
        boolean changed = false;
        for (String key : keys) {
            changed |= entry.getMetadata().remove(key) != null;
        }
        if (changed) {
            persist();
        }
    }

    @Override
    public synchronized long countAll() {
        return assets.values().stream().filter(this::isSupported).count();
    }

    @Override
    public synchronized long countProcessed() {
        return assets.values().stream().filter(this::isSupported).filter(this::isProcessed).count();
    }

    @Override
    public synchronized long countSucceeded() {
        return assets.values().stream()
            .filter(this::isSupported)
            .filter(this::isProcessed)
            .filter(entry -> {
                JsonNode status = entry.getMetadata().get(MetadataKeys.STATUS);
                // 没有状态的旧记录按成功统计
                return status == null || status.isNull()
                    || "optimized".equals(status.asText()) || "partial".equals(status.asText());
            })
            .count();
    }

    @Override
    public synchronized List<ConversionResult> listConversionResults() {
        List<ConversionResult> results = new ArrayList<>();
        for (AssetEntry entry : assets.values()) {
            JsonNode data = entry.getMetadata().get(MetadataKeys.DATA);
            if (data == null || data.isNull()) {
                continue;
            }
            try {
                results.add(objectMapper.treeToValue(data, ConversionResult.class));
            } catch (IOException e) {
                log.warn("附件 #{} 的优化结果无法解析: {}", entry.getId(), e.getMessage());
            }
        }
        return results;
    }

    private boolean isSupported(AssetEntry entry) {
        return entry.getMimeType() != null && SUPPORTED_MIME_TYPES.contains(entry.getMimeType());
    }

    private boolean isProcessed(AssetEntry entry) {
        JsonNode flag = entry.getMetadata().get(MetadataKeys.OPTIMIZED);
        return flag != null && flag.asBoolean(false);
    }

    private AssetEntry requireEntry(long id) {
        AssetEntry entry = assets.get(id);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown asset id: " + id);
        }
        return entry;
    }

    private long sizeOf(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.size(file) : 0;
        } catch (IOException e) {
            log.warn("无法读取文件大小 {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private void load() {
        if (!Files.exists(libraryFile)) {
            return;
        }
        try {
            LibraryDocument document = objectMapper.readValue(libraryFile.toFile(), LibraryDocument.class);
            for (AssetEntry entry : document.getAssets()) {
                assets.put(entry.getId(), entry);
            }
            long maxId = assets.isEmpty() ? 0 : assets.lastKey();
            nextId = Math.max(document.getNextId(), maxId + 1);
            log.info("已加载图片库 {}，共 {} 个附件", libraryFile, assets.size());
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取图片库 " + libraryFile, e);
        }
    }

    private void persist() {
        LibraryDocument document = new LibraryDocument();
        document.setNextId(nextId);
        document.setAssets(new ArrayList<>(assets.values()));
        document.getAssets().sort(Comparator.comparingLong(AssetEntry::getId));
        try {
            Path parent = libraryFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = libraryFile.resolveSibling(libraryFile.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, libraryFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, libraryFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("无法写入图片库 " + libraryFile, e);
        }
    }

    /**
     * 图片库文档
     */
    @Data
    static class LibraryDocument {
        private long nextId = 1;
        private List<AssetEntry> assets = new ArrayList<>();
    }

    /**
     * 附件条目，路径相对于存储根目录
     */
    @Data
    static class AssetEntry {
        private long id;
        private String path;
        private String mimeType;
        private List<VariantEntry> variants = new ArrayList<>();
        private Map<String, JsonNode> metadata = new LinkedHashMap<>();
    }

    /**
     * 尺寸变体条目，文件与主文件同目录
     */
    @Data
    static class VariantEntry {
        private String name;
        private String file;
    }
}
