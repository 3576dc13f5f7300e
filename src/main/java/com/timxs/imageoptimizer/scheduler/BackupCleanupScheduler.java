package com.timxs.imageoptimizer.scheduler;

import com.timxs.imageoptimizer.model.BackupExpiryStats;
import com.timxs.imageoptimizer.service.BackupStore;
import com.timxs.imageoptimizer.service.SettingsManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 备份清理定时任务
 * 根据配置的保留天数自动清理过期备份
 */
@Slf4j
@RequiredArgsConstructor
public class BackupCleanupScheduler {

    /**
     * 备份服务
     */
    private final BackupStore backupStore;

    /**
     * 配置管理器
     */
    private final SettingsManager settingsManager;

    /**
     * 每天凌晨 2 点执行清理任务
     * cron 表达式：秒 分 时 日 月 周
     */
    @Scheduled(cron = "0 0 2 * * ?")
    public void cleanupExpiredBackups() {
        log.info("Starting scheduled backup cleanup task");

        cleanup()
            .subscribe(
                stats -> log.info("Backup cleanup completed: {} files deleted, {} bytes freed",
                    stats.deleted(), stats.bytesDeleted()),
                error -> log.error("Backup cleanup failed", error)
            );
    }

    /**
     * 按保留天数清理备份
     *
     * @return 清理统计（异步）
     */
    Mono<BackupExpiryStats> cleanup() {
        return Mono.fromCallable(() -> {
                int retentionDays = settingsManager.getConfig().getBackupRetentionDays();
                log.info("Cleaning up backups older than {} days", retentionDays);
                return backupStore.expire(retentionDays);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }
}
