package com.timxs.imageoptimizer.model;

/**
 * 批次结束原因
 */
public enum StopReason {

    /**
     * 本批次全部处理完毕
     */
    COMPLETED,

    /**
     * 接近执行时间上限，提前结束
     */
    TIME_LIMIT,

    /**
     * 内存使用超过阈值，提前结束
     */
    MEMORY_LIMIT,

    /**
     * 已有批次正在执行
     */
    BUSY,

    /**
     * 没有待处理的附件
     */
    NOTHING_TO_DO
}
