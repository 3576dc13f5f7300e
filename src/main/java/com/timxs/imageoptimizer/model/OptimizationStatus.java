package com.timxs.imageoptimizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 优化状态枚举
 * 每一种状态都是终态，写入后批处理不会再次选中该附件
 */
public enum OptimizationStatus {

    /**
     * 全部尝试的格式 × 文件均成功
     */
    OPTIMIZED("optimized"),

    /**
     * 部分成功（至少生成一个文件，但有失败项）
     */
    PARTIAL("partial"),

    /**
     * 进入转换阶段但没有生成任何文件
     */
    SKIPPED("skipped"),

    /**
     * 文件小于最小大小阈值
     */
    SKIPPED_SMALL("skipped_small"),

    /**
     * 命中排除规则
     */
    SKIPPED_EXCLUDED("skipped_excluded"),

    /**
     * 动图 GIF 且策略为跳过
     */
    SKIPPED_ANIMATED("skipped_animated"),

    /**
     * 源文件不存在
     */
    MISSING("missing"),

    /**
     * 服务器没有任何可用的编码引擎
     */
    ERROR_NO_ENGINE("error_no_engine");

    private final String value;

    OptimizationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 是否算作成功优化（统计口径：optimized 或 partial）
     */
    public boolean isSuccessful() {
        return this == OPTIMIZED || this == PARTIAL;
    }

    @JsonCreator
    public static OptimizationStatus fromValue(String value) {
        for (OptimizationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown optimization status: " + value);
    }
}
