package com.timxs.imageoptimizer.service;

import com.timxs.imageoptimizer.model.BackupExpiryStats;

import java.nio.file.Path;

/**
 * 原图备份服务
 * 备份目录按相对存储根目录的路径镜像原文件
 */
public interface BackupStore {

    /**
     * 备份单个文件，重复备份会覆盖
     *
     * @param path 存储根目录下的文件
     * @return 是否备份成功，失败时记录错误但不抛出异常
     */
    boolean backup(Path path);

    /**
     * 从备份恢复附件
     * 复制回主文件和有备份的尺寸变体，删除所有派生文件并清除优化元数据
     *
     * @param assetId 附件 ID
     * @return 主文件没有备份或复制失败时返回 false
     */
    boolean restore(long assetId);

    /**
     * 删除早于指定天数的备份文件，并清理空目录
     *
     * @param olderThanDays 保留天数，小于 1 时不做任何事
     * @return 清理统计
     */
    BackupExpiryStats expire(int olderThanDays);

    /**
     * 附件主文件是否存在备份
     */
    boolean hasBackup(long assetId);

    /**
     * 文件对应的备份路径
     *
     * @param path 存储根目录下的文件
     * @return 备份路径
     * @throws IllegalArgumentException 文件不在存储根目录下
     */
    Path backupPath(Path path);

    /**
     * 备份目录占用的总字节数
     */
    long totalSize();
}
