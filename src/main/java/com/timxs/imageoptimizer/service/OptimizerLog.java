package com.timxs.imageoptimizer.service;

import com.timxs.imageoptimizer.model.LogEntry;
import com.timxs.imageoptimizer.model.LogLevel;

import java.util.List;
import java.util.Map;

/**
 * 优化日志接口
 * 记录面向用户的处理事件，写入即返回，不影响调用方
 */
public interface OptimizerLog {

    /**
     * 记录一条日志
     *
     * @param level   级别
     * @param message 消息
     * @param context 附加上下文，可为 null
     */
    void record(LogLevel level, String message, Map<String, Object> context);

    /**
     * 获取最近的日志（最新在前）
     *
     * @param limit 最大条数
     * @return 日志列表
     */
    List<LogEntry> recent(int limit);

    default void info(String message) {
        record(LogLevel.INFO, message, null);
    }

    default void success(String message, Map<String, Object> context) {
        record(LogLevel.SUCCESS, message, context);
    }

    default void warning(String message) {
        record(LogLevel.WARNING, message, null);
    }

    default void error(String message) {
        record(LogLevel.ERROR, message, null);
    }
}
