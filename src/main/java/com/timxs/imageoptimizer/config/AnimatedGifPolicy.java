package com.timxs.imageoptimizer.config;

/**
 * 动图 GIF 处理策略
 */
public enum AnimatedGifPolicy {

    /**
     * 跳过动图，记录 skipped_animated
     */
    SKIP,

    /**
     * 照常转换（仅保留首帧）
     */
    CONVERT
}
