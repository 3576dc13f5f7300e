package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.codec.Codec;
import com.timxs.imageoptimizer.model.Capabilities;
import com.timxs.imageoptimizer.model.ImageFormat;
import com.timxs.imageoptimizer.service.CapabilityProbe;
import com.timxs.imageoptimizer.service.ResourceMonitor;
import com.timxs.imageoptimizer.service.SettingsManager;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 服务器能力探测实现
 * 编码后端探测只执行一次，结果在进程内缓存
 * 执行时间上限随设置变化，每次返回前按当前设置校正
 */
@Slf4j
public class CapabilityProbeImpl implements CapabilityProbe {

    /**
     * 全功能后端（优先）
     */
    private final Codec fullCodec;

    /**
     * 轻量后端（回退）
     */
    private final Codec fallbackCodec;

    private final ResourceMonitor resourceMonitor;

    private final SettingsManager settingsManager;

    private volatile Capabilities cached;

    public CapabilityProbeImpl(Codec fullCodec, Codec fallbackCodec, ResourceMonitor resourceMonitor,
                               SettingsManager settingsManager) {
        this.fullCodec = fullCodec;
        this.fallbackCodec = fallbackCodec;
        this.resourceMonitor = resourceMonitor;
        this.settingsManager = settingsManager;
    }

    @Override
    public Capabilities detect() {
        int maxExecutionSeconds = settingsManager.getConfig().getMaxExecutionSeconds();
        Capabilities result = cached;
        if (result == null || result.getMaxExecutionSeconds() != maxExecutionSeconds) {
            synchronized (this) {
                result = cached;
                if (result == null) {
                    result = probe(maxExecutionSeconds);
                } else if (result.getMaxExecutionSeconds() != maxExecutionSeconds) {
                    result = result.toBuilder().maxExecutionSeconds(maxExecutionSeconds).build();
                }
                cached = result;
            }
        }
        return result;
    }

    @Override
    public Optional<Codec> engineFor(ImageFormat format) {
        Capabilities caps = detect();
        if (Boolean.TRUE.equals(caps.getImageIo().get(format))) {
            return Optional.of(fullCodec);
        }
        if (Boolean.TRUE.equals(caps.getCommandLine().get(format))) {
            return Optional.of(fallbackCodec);
        }
        return Optional.empty();
    }

    private Capabilities probe(int maxExecutionSeconds) {
        Map<ImageFormat, Boolean> full = probeCodec(fullCodec);
        Map<ImageFormat, Boolean> fallback = probeCodec(fallbackCodec);

        Capabilities caps = Capabilities.builder()
            .imageIo(full)
            .commandLine(fallback)
            .memoryLimit(resourceMonitor.memoryLimit())
            .maxExecutionSeconds(maxExecutionSeconds)
            .build();

        log.info("能力探测完成 - {}: {}, {}: {}, 内存上限: {} MB, 执行时间上限: {}s",
            fullCodec.getName(), full, fallbackCodec.getName(), fallback,
            caps.getMemoryLimit() / (1024 * 1024), caps.getMaxExecutionSeconds());
        return caps;
    }

    private Map<ImageFormat, Boolean> probeCodec(Codec codec) {
        Map<ImageFormat, Boolean> support = new EnumMap<>(ImageFormat.class);
        for (ImageFormat format : ImageFormat.values()) {
            boolean supported;
            try {
                supported = codec.supportsFormat(format);
            } catch (RuntimeException | LinkageError e) {
                log.warn("探测 {} 对 {} 的支持时出错: {}", codec.getName(), format, e.toString());
                supported = false;
            }
            support.put(format, supported);
        }
        return Collections.unmodifiableMap(support);
    }
}
