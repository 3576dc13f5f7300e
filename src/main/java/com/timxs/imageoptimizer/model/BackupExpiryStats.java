package com.timxs.imageoptimizer.model;

/**
 * 备份过期清理的统计
 *
 * @param scanned            扫描的文件数
 * @param deleted            删除的文件数
 * @param bytesDeleted       删除的字节数
 * @param deleteFailures     删除失败数
 * @param directoriesRemoved 清理的空目录数
 */
public record BackupExpiryStats(
    int scanned,
    int deleted,
    long bytesDeleted,
    int deleteFailures,
    int directoriesRemoved
) {
    public static BackupExpiryStats empty() {
        return new BackupExpiryStats(0, 0, 0L, 0, 0);
    }
}
