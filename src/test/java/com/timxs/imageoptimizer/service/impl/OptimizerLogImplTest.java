package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.model.LogEntry;
import com.timxs.imageoptimizer.model.LogLevel;
import com.timxs.imageoptimizer.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptimizerLogImplTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final OptimizerLogImpl optimizerLog = new OptimizerLogImpl(clock);

    @Test
    void returnsNewestEntriesFirst() {
        optimizerLog.info("first");
        clock.advance(Duration.ofSeconds(1));
        optimizerLog.warning("second");
        clock.advance(Duration.ofSeconds(1));
        optimizerLog.success("third", Map.of("formats", List.of("webp")));

        List<LogEntry> entries = optimizerLog.recent(2);

        assertEquals(2, entries.size());
        assertEquals("third", entries.get(0).message());
        assertEquals(LogLevel.SUCCESS, entries.get(0).level());
        assertEquals(List.of("webp"), entries.get(0).context().get("formats"));
        assertEquals(Instant.parse("2024-05-01T10:00:01Z"), entries.get(1).time());
    }

    @Test
    void keepsBoundedHistory() {
        for (int i = 0; i < OptimizerLogImpl.MAX_RECENT + 25; i++) {
            optimizerLog.info("entry " + i);
        }

        List<LogEntry> entries = optimizerLog.recent(1000);

        assertEquals(OptimizerLogImpl.MAX_RECENT, entries.size());
        assertEquals("entry " + (OptimizerLogImpl.MAX_RECENT + 24), entries.get(0).message());
    }

    @Test
    void acceptsNullContextValues() {
        Map<String, Object> context = new HashMap<>();
        context.put("error", null);

        optimizerLog.record(LogLevel.ERROR, "failed", context);

        assertTrue(optimizerLog.recent(1).get(0).context().containsKey("error"));
        assertTrue(optimizerLog.recent(0).isEmpty());
    }
}
