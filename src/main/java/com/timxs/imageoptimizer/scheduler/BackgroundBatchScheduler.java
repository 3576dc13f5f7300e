package com.timxs.imageoptimizer.scheduler;

import com.timxs.imageoptimizer.model.ChunkResult;
import com.timxs.imageoptimizer.service.BatchProcessor;
import com.timxs.imageoptimizer.service.SettingsManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 后台批量优化定时任务
 * 有剩余附件时每次处理一小批，全部完成后空转
 */
@Slf4j
@RequiredArgsConstructor
public class BackgroundBatchScheduler {

    /**
     * 后台每次处理的附件数
     */
    static final int BACKGROUND_BATCH_SIZE = 10;

    private final BatchProcessor batchProcessor;

    private final SettingsManager settingsManager;

    /**
     * 上一次执行结束后延迟一段时间再执行
     */
    @Scheduled(fixedDelayString = "${image-optimizer.background.delay-ms:60000}",
        initialDelayString = "${image-optimizer.background.initial-delay-ms:60000}")
    public void runBackgroundBatch() {
        processNextChunk()
            .subscribe(
                result -> log.info("后台批次完成: 处理 {} 个，剩余 {} 个", result.getProcessedBatch(), result.getRemaining()),
                error -> log.error("后台批次执行失败", error)
            );
    }

    /**
     * 处理下一批附件
     * 未开启后台处理或没有剩余附件时返回空
     *
     * @return 批次结果（异步）
     */
    Mono<ChunkResult> processNextChunk() {
        return Mono.fromCallable(() -> {
                if (!settingsManager.getConfig().isBackgroundBatchEnabled()) {
                    log.debug("后台批量优化未开启");
                    return null;
                }
                if (batchProcessor.status().getRemaining() == 0) {
                    log.debug("没有待处理的附件");
                    return null;
                }
                return batchProcessor.runChunk(BACKGROUND_BATCH_SIZE);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }
}
