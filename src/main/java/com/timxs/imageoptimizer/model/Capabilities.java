package com.timxs.imageoptimizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 服务器能力快照
 * 包含各编码后端对各格式的支持情况以及资源上限
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Capabilities {

    /**
     * 全功能后端（ImageIO 插件）各格式支持情况
     */
    @Builder.Default
    private Map<ImageFormat, Boolean> imageIo = Map.of();

    /**
     * 轻量后端（命令行编码器）各格式支持情况
     */
    @Builder.Default
    private Map<ImageFormat, Boolean> commandLine = Map.of();

    /**
     * 内存上限（字节），0 表示未知或不限制
     */
    private long memoryLimit;

    /**
     * 单次执行时间上限（秒），0 表示不限制
     */
    private int maxExecutionSeconds;

    /**
     * 是否能以任一后端生成指定格式
     */
    public boolean has(ImageFormat format) {
        return Boolean.TRUE.equals(imageIo.get(format)) || Boolean.TRUE.equals(commandLine.get(format));
    }
}
