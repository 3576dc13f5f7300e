package com.timxs.imageoptimizer.service;

/**
 * 进程资源读数
 */
public interface ResourceMonitor {

    /**
     * 当前已使用内存（字节）
     */
    long usedMemory();

    /**
     * 内存上限（字节），0 表示未知或不限制
     */
    long memoryLimit();
}
