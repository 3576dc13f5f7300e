package com.timxs.imageoptimizer.scheduler;

import com.timxs.imageoptimizer.config.OptimizerConfig;
import com.timxs.imageoptimizer.model.BatchStatus;
import com.timxs.imageoptimizer.model.ChunkResult;
import com.timxs.imageoptimizer.service.BatchProcessor;
import com.timxs.imageoptimizer.service.SettingsManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackgroundBatchSchedulerTest {

    @Mock
    BatchProcessor batchProcessor;

    @Mock
    SettingsManager settingsManager;

    @InjectMocks
    BackgroundBatchScheduler scheduler;

    @Test
    void runsSmallChunkWhenWorkRemains() {
        ChunkResult chunk = ChunkResult.builder().done(false).remaining(3).build();
        when(settingsManager.getConfig()).thenReturn(new OptimizerConfig());
        when(batchProcessor.status()).thenReturn(BatchStatus.builder().total(13).remaining(13).build());
        when(batchProcessor.runChunk(BackgroundBatchScheduler.BACKGROUND_BATCH_SIZE)).thenReturn(chunk);

        assertSame(chunk, scheduler.processNextChunk().block(Duration.ofSeconds(5)));
        verify(batchProcessor).runChunk(10);
    }

    @Test
    void staysIdleWhenDisabled() {
        OptimizerConfig config = new OptimizerConfig();
        config.setBackgroundBatchEnabled(false);
        when(settingsManager.getConfig()).thenReturn(config);

        assertNull(scheduler.processNextChunk().block(Duration.ofSeconds(5)));
        verify(batchProcessor, never()).runChunk(anyInt());
    }

    @Test
    void staysIdleWhenNothingRemains() {
        when(settingsManager.getConfig()).thenReturn(new OptimizerConfig());
        when(batchProcessor.status()).thenReturn(BatchStatus.builder().total(4).processed(4).remaining(0).build());

        assertNull(scheduler.processNextChunk().block(Duration.ofSeconds(5)));
        verify(batchProcessor, never()).runChunk(anyInt());
    }

    @Test
    void scheduledTriggerRunsOffTheCallerThread() {
        when(settingsManager.getConfig()).thenReturn(new OptimizerConfig());
        when(batchProcessor.status()).thenReturn(BatchStatus.builder().remaining(1).build());
        when(batchProcessor.runChunk(10)).thenReturn(ChunkResult.builder().done(true).build());

        scheduler.runBackgroundBatch();

        verify(batchProcessor, timeout(5000)).runChunk(10);
    }
}
