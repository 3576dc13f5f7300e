package com.timxs.imageoptimizer.model;

/**
 * 批处理中单个附件的处理记录
 *
 * @param id               附件 ID
 * @param success          是否成功优化
 * @param savings          节省字节数
 * @param error            错误或跳过原因
 * @param originalsDeleted 本次是否删除了原图
 */
public record AssetOutcome(
    long id,
    boolean success,
    long savings,
    String error,
    boolean originalsDeleted
) {
}
