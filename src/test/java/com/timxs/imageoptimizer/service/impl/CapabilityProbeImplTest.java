package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.codec.Codec;
import com.timxs.imageoptimizer.config.OptimizerConfig;
import com.timxs.imageoptimizer.model.Capabilities;
import com.timxs.imageoptimizer.model.ImageFormat;
import com.timxs.imageoptimizer.testutil.FakeCodec;
import com.timxs.imageoptimizer.testutil.FixedResourceMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CapabilityProbeImplTest {

    @Mock
    Codec brokenCodec;

    private OptimizerConfig config;

    @BeforeEach
    void setUp() {
        config = new OptimizerConfig();
    }

    @Test
    void prefersFullCodecAndFallsBackToLightweight() {
        FakeCodec full = new FakeCodec("full", ImageFormat.WEBP);
        FakeCodec cli = new FakeCodec("cli", ImageFormat.WEBP, ImageFormat.AVIF);
        config.setMaxExecutionSeconds(90);
        CapabilityProbeImpl probe = new CapabilityProbeImpl(full, cli, new FixedResourceMonitor(0, 2048), () -> config);

        assertSame(full, probe.engineFor(ImageFormat.WEBP).orElseThrow());
        assertSame(cli, probe.engineFor(ImageFormat.AVIF).orElseThrow());

        Capabilities caps = probe.detect();
        assertTrue(caps.getImageIo().get(ImageFormat.WEBP));
        assertFalse(caps.getImageIo().get(ImageFormat.AVIF));
        assertTrue(caps.getCommandLine().get(ImageFormat.AVIF));
        assertEquals(2048, caps.getMemoryLimit());
        assertEquals(90, caps.getMaxExecutionSeconds());
    }

    @Test
    void reportsNothingWhenNoBackendWorks() {
        CapabilityProbeImpl probe = new CapabilityProbeImpl(new FakeCodec("full"), new FakeCodec("cli"),
            new FixedResourceMonitor(0, 0), () -> config);

        assertFalse(probe.has(ImageFormat.WEBP));
        assertFalse(probe.has(ImageFormat.AVIF));
        assertTrue(probe.engineFor(ImageFormat.WEBP).isEmpty());
    }

    @Test
    void cachesDetection() {
        FakeCodec full = new FakeCodec("full", ImageFormat.WEBP);
        CapabilityProbeImpl probe = new CapabilityProbeImpl(full, new FakeCodec("cli"),
            new FixedResourceMonitor(0, 0), () -> config);

        Capabilities first = probe.detect();
        probe.engineFor(ImageFormat.WEBP);
        probe.has(ImageFormat.AVIF);

        assertSame(first, probe.detect());
        assertEquals(ImageFormat.values().length, full.probeCount());
    }

    @Test
    void treatsLinkageErrorAsUnsupported() {
        when(brokenCodec.getName()).thenReturn("broken");
        when(brokenCodec.supportsFormat(any())).thenThrow(new UnsatisfiedLinkError("no webp in java.library.path"));
        CapabilityProbeImpl probe = new CapabilityProbeImpl(brokenCodec, new FakeCodec("cli", ImageFormat.WEBP),
            new FixedResourceMonitor(0, 0), () -> config);

        assertEquals("cli", probe.engineFor(ImageFormat.WEBP).orElseThrow().getName());
    }

    @Test
    void followsUpdatedExecutionCeilingWithoutReprobing() {
        FakeCodec full = new FakeCodec("full", ImageFormat.WEBP);
        CapabilityProbeImpl probe = new CapabilityProbeImpl(full, new FakeCodec("cli"),
            new FixedResourceMonitor(0, 4096), () -> config);

        assertEquals(60, probe.detect().getMaxExecutionSeconds());
        config.setMaxExecutionSeconds(300);

        Capabilities caps = probe.detect();
        assertEquals(300, caps.getMaxExecutionSeconds());
        assertEquals(4096, caps.getMemoryLimit());
        assertTrue(caps.getImageIo().get(ImageFormat.WEBP));
        assertEquals(ImageFormat.values().length, full.probeCount());
    }
}
