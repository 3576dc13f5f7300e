package com.timxs.imageoptimizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 批量优化总体进度
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatus {

    /**
     * 可优化图片总数
     */
    private long total;

    /**
     * 已处理数（存在终态结果）
     */
    private long processed;

    /**
     * 成功优化数（optimized 或 partial）
     */
    private long succeeded;

    /**
     * 已处理但未成功的数量
     */
    private long skipped;

    /**
     * 剩余未处理数
     */
    private long remaining;

    /**
     * 累计节省字节数
     */
    private long savingsBytes;

    /**
     * 平均节省百分比（保留一位小数）
     */
    private double avgPercent;
}
