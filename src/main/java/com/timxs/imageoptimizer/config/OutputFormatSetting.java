package com.timxs.imageoptimizer.config;

import com.timxs.imageoptimizer.model.ImageFormat;

import java.util.List;

/**
 * 目标格式设置
 */
public enum OutputFormatSetting {

    WEBP(List.of(ImageFormat.WEBP)),

    AVIF(List.of(ImageFormat.AVIF)),

    /**
     * 同时生成 WebP 和 AVIF
     */
    BOTH(List.of(ImageFormat.WEBP, ImageFormat.AVIF));

    private final List<ImageFormat> formats;

    OutputFormatSetting(List<ImageFormat> formats) {
        this.formats = formats;
    }

    /**
     * 该设置请求的格式（按生成顺序）
     */
    public List<ImageFormat> getFormats() {
        return formats;
    }
}
