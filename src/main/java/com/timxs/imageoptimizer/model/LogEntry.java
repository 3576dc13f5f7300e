package com.timxs.imageoptimizer.model;

import java.time.Instant;
import java.util.Map;

/**
 * 优化日志条目
 *
 * @param time    记录时间
 * @param level   级别
 * @param message 消息
 * @param context 附加上下文
 */
public record LogEntry(
    Instant time,
    LogLevel level,
    String message,
    Map<String, Object> context
) {
}
