package com.timxs.imageoptimizer.config;

import com.timxs.imageoptimizer.ImageOptimizerPlugin;
import com.timxs.imageoptimizer.codec.CommandLineCodec;
import com.timxs.imageoptimizer.codec.ImageIoCodec;
import com.timxs.imageoptimizer.scheduler.BackgroundBatchScheduler;
import com.timxs.imageoptimizer.scheduler.BackupCleanupScheduler;
import com.timxs.imageoptimizer.service.BackupStore;
import com.timxs.imageoptimizer.service.BatchProcessor;
import com.timxs.imageoptimizer.service.CapabilityProbe;
import com.timxs.imageoptimizer.service.ConversionEngine;
import com.timxs.imageoptimizer.service.ImageRepository;
import com.timxs.imageoptimizer.service.OptimizerLog;
import com.timxs.imageoptimizer.service.ResourceMonitor;
import com.timxs.imageoptimizer.service.SettingsManager;
import com.timxs.imageoptimizer.service.impl.BackupStoreImpl;
import com.timxs.imageoptimizer.service.impl.BatchProcessorImpl;
import com.timxs.imageoptimizer.service.impl.CapabilityProbeImpl;
import com.timxs.imageoptimizer.service.impl.ConversionEngineImpl;
import com.timxs.imageoptimizer.service.impl.JsonImageRepository;
import com.timxs.imageoptimizer.service.impl.OptimizerLogImpl;
import com.timxs.imageoptimizer.service.impl.RuntimeResourceMonitor;
import com.timxs.imageoptimizer.service.impl.SettingsManagerImpl;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 组件装配
 * 依赖顺序：能力探测 -> 转换引擎 -> 备份 -> 批处理
 */
@Configuration
@EnableScheduling
@PropertySource(value = "classpath:image-optimizer.properties", ignoreResourceNotFound = true)
public class ImageOptimizerConfiguration {

    @Bean
    public Clock optimizerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SettingsManager settingsManager(
        @Value("${image-optimizer.settings-file:config/image-optimizer.json}") String settingsFile) {
        return new SettingsManagerImpl(Path.of(settingsFile));
    }

    @Bean
    public OptimizerLog optimizerLog(Clock optimizerClock) {
        return new OptimizerLogImpl(optimizerClock);
    }

    @Bean
    public ImageRepository imageRepository(
        @Value("${image-optimizer.storage-root:uploads}") String storageRoot,
        @Value("${image-optimizer.library-file:config/library.json}") String libraryFile) {
        return new JsonImageRepository(Path.of(storageRoot), Path.of(libraryFile));
    }

    @Bean
    public ResourceMonitor resourceMonitor() {
        return new RuntimeResourceMonitor();
    }

    /**
     * 能力探测，ImageIO 优先，命令行编码器作为回退
     */
    @Bean
    public CapabilityProbe capabilityProbe(ResourceMonitor resourceMonitor, SettingsManager settingsManager,
                                           @Value("${image-optimizer.cwebp-binary:cwebp}") String cwebpBinary,
                                           @Value("${image-optimizer.avifenc-binary:avifenc}") String avifencBinary) {
        return new CapabilityProbeImpl(new ImageIoCodec(), new CommandLineCodec(cwebpBinary, avifencBinary),
            resourceMonitor, settingsManager);
    }

    @Bean
    public ConversionEngine conversionEngine(ImageRepository imageRepository, CapabilityProbe capabilityProbe,
                                             SettingsManager settingsManager, OptimizerLog optimizerLog,
                                             Clock optimizerClock) {
        return new ConversionEngineImpl(imageRepository, capabilityProbe, settingsManager, optimizerLog,
            optimizerClock);
    }

    @Bean
    public BackupStore backupStore(@Value("${image-optimizer.backup-root:uploads-backups}") String backupRoot,
                                   ImageRepository imageRepository, OptimizerLog optimizerLog,
                                   Clock optimizerClock) {
        return new BackupStoreImpl(Path.of(backupRoot), imageRepository, optimizerLog, optimizerClock);
    }

    @Bean
    public BatchProcessor batchProcessor(ImageRepository imageRepository, ConversionEngine conversionEngine,
                                         BackupStore backupStore, SettingsManager settingsManager,
                                         CapabilityProbe capabilityProbe, ResourceMonitor resourceMonitor,
                                         OptimizerLog optimizerLog, Clock optimizerClock) {
        return new BatchProcessorImpl(imageRepository, conversionEngine, backupStore, settingsManager,
            capabilityProbe, resourceMonitor, optimizerLog, optimizerClock);
    }

    @Bean
    public BackgroundBatchScheduler backgroundBatchScheduler(BatchProcessor batchProcessor,
                                                             SettingsManager settingsManager) {
        return new BackgroundBatchScheduler(batchProcessor, settingsManager);
    }

    @Bean
    public BackupCleanupScheduler backupCleanupScheduler(BackupStore backupStore, SettingsManager settingsManager) {
        return new BackupCleanupScheduler(backupStore, settingsManager);
    }

    @Bean
    public ImageOptimizerPlugin imageOptimizerPlugin(CapabilityProbe capabilityProbe, OptimizerLog optimizerLog) {
        return new ImageOptimizerPlugin(capabilityProbe, optimizerLog);
    }
}
