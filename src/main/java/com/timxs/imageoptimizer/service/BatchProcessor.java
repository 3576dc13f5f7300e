package com.timxs.imageoptimizer.service;

import com.timxs.imageoptimizer.model.BatchStatus;
import com.timxs.imageoptimizer.model.ChunkResult;
import com.timxs.imageoptimizer.model.ConversionResult;

import java.util.Optional;

/**
 * 批量优化处理器接口
 * 每次调用处理一小批未处理的附件，可被反复调用直到全部完成
 */
public interface BatchProcessor {

    /**
     * 获取总体进度
     *
     * @return 进度统计
     */
    BatchStatus status();

    /**
     * 使用配置的批次大小处理一批附件
     *
     * @return 本批次结果
     */
    ChunkResult runChunk();

    /**
     * 处理一批附件
     * 批次大小会被限制在 1-100，执行时间或内存接近上限时提前结束
     *
     * @param batchSize 批次大小
     * @return 本批次结果
     */
    ChunkResult runChunk(int batchSize);

    /**
     * 立即优化单个附件（不删除原图）
     *
     * @param id 附件 ID
     * @return 优化结果
     */
    ConversionResult optimizeSingle(long id);

    /**
     * 从备份恢复单个附件
     *
     * @param id 附件 ID
     * @return 是否恢复成功
     */
    boolean restoreSingle(long id);

    /**
     * 新附件入库后的自动优化
     * 未开启自动优化、类型不支持或文件过小时不做任何处理（也不写入元数据）
     *
     * @param id 附件 ID
     * @return 优化结果，未处理时为空
     */
    Optional<ConversionResult> onUpload(long id);
}
