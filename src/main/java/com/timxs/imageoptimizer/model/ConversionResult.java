package com.timxs.imageoptimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 单个附件的优化结果
 * 每次尝试都会整体覆盖写入，存在即表示该附件已处理（终态）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionResult {

    /**
     * 优化状态
     */
    private OptimizationStatus status;

    /**
     * 主文件原始大小（字节）
     */
    private long originalSize;

    /**
     * 主文件最佳派生文件大小（字节），没有派生文件时等于原始大小
     */
    private long optimizedSize;

    /**
     * 主文件和所有尺寸变体节省的总字节数
     */
    private long savings;

    /**
     * 本次尝试的目标格式
     */
    @Builder.Default
    private List<ImageFormat> formatsRequested = List.of();

    /**
     * 主文件实际生成的格式
     */
    @Builder.Default
    private List<ImageFormat> formatsGenerated = List.of();

    /**
     * 所有尝试的格式 × 文件是否全部成功
     */
    private boolean allOk;

    /**
     * 处理时间
     */
    private Instant date;

    /**
     * 错误信息（截断后的错误列表或跳过原因）
     */
    private String error;

    /**
     * 创建短路终态结果（缺失、跳过、无引擎）
     *
     * @param status 终态
     * @param error  原因
     * @param size   原始大小
     * @param allOk  是否视为全部成功
     * @param date   处理时间
     * @return 结果对象
     */
    public static ConversionResult terminal(OptimizationStatus status, String error, long size,
                                            boolean allOk, Instant date) {
        return ConversionResult.builder()
            .status(status)
            .error(error)
            .originalSize(size)
            .optimizedSize(size)
            .savings(0)
            .allOk(allOk)
            .date(date)
            .build();
    }

    /**
     * 是否成功生成了派生文件（optimized 或 partial）
     */
    @JsonIgnore
    public boolean isSuccess() {
        return status != null && status.isSuccessful();
    }
}
