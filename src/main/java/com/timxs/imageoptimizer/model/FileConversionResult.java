package com.timxs.imageoptimizer.model;

import java.nio.file.Path;

/**
 * 单个文件、单个格式的转换结果
 *
 * @param format  目标格式
 * @param success 是否成功并保留了派生文件
 * @param path    派生文件路径（失败时为 null）
 * @param size    派生文件大小（失败时为 0）
 * @param error   错误信息（成功时为 null）
 */
public record FileConversionResult(
    ImageFormat format,
    boolean success,
    Path path,
    long size,
    String error
) {
    /**
     * 创建成功结果
     */
    public static FileConversionResult success(ImageFormat format, Path path, long size) {
        return new FileConversionResult(format, true, path, size, null);
    }

    /**
     * 创建失败结果
     */
    public static FileConversionResult failed(ImageFormat format, String error) {
        return new FileConversionResult(format, false, null, 0, error);
    }
}
