package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.service.ResourceMonitor;

/**
 * 基于 JVM 堆的资源读数
 */
public class RuntimeResourceMonitor implements ResourceMonitor {

    private final Runtime runtime;

    public RuntimeResourceMonitor() {
        this(Runtime.getRuntime());
    }

    RuntimeResourceMonitor(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public long usedMemory() {
        return runtime.totalMemory() - runtime.freeMemory();
    }

    @Override
    public long memoryLimit() {
        long max = runtime.maxMemory();
        return max == Long.MAX_VALUE ? 0 : max;
    }
}
