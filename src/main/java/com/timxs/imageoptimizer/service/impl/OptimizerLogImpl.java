package com.timxs.imageoptimizer.service.impl;

import com.timxs.imageoptimizer.model.LogEntry;
import com.timxs.imageoptimizer.model.LogLevel;
import com.timxs.imageoptimizer.service.OptimizerLog;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 优化日志实现
 * 写入 SLF4J，并在内存中保留最近 200 条供轮询展示
 */
@Slf4j
public class OptimizerLogImpl implements OptimizerLog {

    /**
     * 内存中保留的最大条数
     */
    public static final int MAX_RECENT = 200;

    private final Clock clock;

    private final Deque<LogEntry> recent = new ArrayDeque<>();

    public OptimizerLogImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void record(LogLevel level, String message, Map<String, Object> context) {
        Map<String, Object> ctx = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        switch (level) {
            case ERROR -> log.error("{} {}", message, ctx.isEmpty() ? "" : ctx);
            case WARNING -> log.warn("{} {}", message, ctx.isEmpty() ? "" : ctx);
            default -> log.info("{} {}", message, ctx.isEmpty() ? "" : ctx);
        }

        synchronized (recent) {
            recent.addFirst(new LogEntry(clock.instant(), level, message, ctx));
            while (recent.size() > MAX_RECENT) {
                recent.removeLast();
            }
        }
    }

    @Override
    public List<LogEntry> recent(int limit) {
        synchronized (recent) {
            List<LogEntry> entries = new ArrayList<>(Math.min(Math.max(limit, 0), recent.size()));
            for (LogEntry entry : recent) {
                if (entries.size() >= limit) {
                    break;
                }
                entries.add(entry);
            }
            return entries;
        }
    }
}
