package com.timxs.imageoptimizer.model;

import java.nio.file.Path;
import java.util.List;

/**
 * 图片附件
 * 由主文件和零个或多个尺寸变体组成
 *
 * @param id         稳定 ID（批处理按升序选取）
 * @param sourcePath 主文件路径
 * @param mimeType   MIME 类型
 * @param size       主文件大小（字节）
 * @param variants   尺寸变体
 */
public record ImageAsset(
    long id,
    Path sourcePath,
    String mimeType,
    long size,
    List<ImageVariant> variants
) {
    public ImageAsset {
        variants = variants == null ? List.of() : List.copyOf(variants);
    }
}
