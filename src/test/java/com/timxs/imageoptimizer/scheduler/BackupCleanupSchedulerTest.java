package com.timxs.imageoptimizer.scheduler;

import com.timxs.imageoptimizer.config.OptimizerConfig;
import com.timxs.imageoptimizer.model.BackupExpiryStats;
import com.timxs.imageoptimizer.service.BackupStore;
import com.timxs.imageoptimizer.service.SettingsManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackupCleanupSchedulerTest {

    @Mock
    BackupStore backupStore;

    @Mock
    SettingsManager settingsManager;

    @InjectMocks
    BackupCleanupScheduler scheduler;

    @Test
    void expiresBackupsUsingConfiguredRetention() {
        OptimizerConfig config = new OptimizerConfig();
        config.setBackupRetentionDays(7);
        BackupExpiryStats stats = new BackupExpiryStats(4, 2, 2048L, 0, 1);
        when(settingsManager.getConfig()).thenReturn(config);
        when(backupStore.expire(7)).thenReturn(stats);

        assertEquals(stats, scheduler.cleanup().block(Duration.ofSeconds(5)));
    }

    @Test
    void scheduledCleanupUsesDefaultRetention() {
        when(settingsManager.getConfig()).thenReturn(new OptimizerConfig());
        when(backupStore.expire(30)).thenReturn(BackupExpiryStats.empty());

        scheduler.cleanupExpiredBackups();

        verify(backupStore, timeout(5000)).expire(30);
    }
}
