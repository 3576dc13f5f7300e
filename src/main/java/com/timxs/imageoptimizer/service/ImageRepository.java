package com.timxs.imageoptimizer.service;

import com.timxs.imageoptimizer.model.ConversionResult;
import com.timxs.imageoptimizer.model.ImageAsset;
import com.timxs.imageoptimizer.model.ImageVariant;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 图片库接口
 * 负责附件文件位置和每个附件的元数据存储
 */
public interface ImageRepository {

    /**
     * 参与优化的 MIME 类型
     */
    Set<String> SUPPORTED_MIME_TYPES = Set.of("image/jpeg", "image/png", "image/gif");

    /**
     * 存储根目录，备份目录按相对于它的路径镜像
     */
    Path storageRoot();

    /**
     * 获取附件
     *
     * @param id 附件 ID
     * @return 附件，不存在时为空
     */
    Optional<ImageAsset> getAsset(long id);

    default Optional<Path> getSourcePath(long id) {
        return getAsset(id).map(ImageAsset::sourcePath);
    }

    default Optional<String> getMime(long id) {
        return getAsset(id).map(ImageAsset::mimeType);
    }

    default List<ImageVariant> listVariants(long id) {
        return getAsset(id).map(ImageAsset::variants).orElse(List.of());
    }

    /**
     * 按 ID 升序列出没有终态结果的附件
     *
     * @param limit 最大数量
     * @return 附件 ID 列表
     */
    List<Long> listUnprocessedIds(int limit);

    /**
     * 读取元数据
     *
     * @param id   附件 ID
     * @param key  元数据键
     * @param type 值类型
     * @return 元数据值，不存在时为空
     */
    <T> Optional<T> getMetadata(long id, String key, Class<T> type);

    /**
     * 写入单个元数据
     */
    default void setMetadata(long id, String key, Object value) {
        setMetadata(id, Map.of(key, value));
    }

    /**
     * 一次性写入多个元数据，整体原子生效
     *
     * @param id     附件 ID
     * @param values 键值对
     */
    void setMetadata(long id, Map<String, Object> values);

    /**
     * 删除元数据
     *
     * @param id   附件 ID
     * @param keys 要删除的键
     */
    void deleteMetadata(long id, Collection<String> keys);

    /**
     * 可优化附件总数
     */
    long countAll();

    /**
     * 已有终态结果的附件数
     */
    long countProcessed();

    /**
     * 成功优化（optimized 或 partial）的附件数
     */
    long countSucceeded();

    /**
     * 所有已记录的优化结果
     */
    List<ConversionResult> listConversionResults();
}
