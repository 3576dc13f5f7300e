package com.timxs.imageoptimizer.model;

import java.nio.file.Path;

/**
 * 附件的预生成尺寸变体（缩略图等）
 *
 * @param name 尺寸名称（如 thumbnail、medium）
 * @param path 文件路径
 * @param size 文件大小（字节）
 */
public record ImageVariant(
    String name,
    Path path,
    long size
) {
}
