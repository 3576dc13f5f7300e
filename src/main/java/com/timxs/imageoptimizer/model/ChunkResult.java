package com.timxs.imageoptimizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单次批处理调用的结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResult {

    /**
     * 是否已全部处理完毕
     */
    private boolean done;

    /**
     * 本批次每个附件的处理记录
     */
    @Builder.Default
    private List<AssetOutcome> results = List.of();

    private long total;

    private long processedTotal;

    private long succeededTotal;

    private long skippedTotal;

    private long remaining;

    private StopReason stopReason;

    /**
     * 本批次实际处理的附件数量
     */
    public int getProcessedBatch() {
        return results == null ? 0 : results.size();
    }
}
