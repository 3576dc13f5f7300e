package com.timxs.imageoptimizer.model;

/**
 * 派生图片格式枚举
 * 派生文件名为原文件名加上格式扩展名
 */
public enum ImageFormat {

    /**
     * WebP 格式（有损/无损压缩，体积小）
     */
    WEBP("webp"),

    /**
     * AVIF 格式（新一代格式，压缩率更高，需要额外支持）
     */
    AVIF("avif");

    /**
     * 文件扩展名
     */
    private final String extension;

    ImageFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
