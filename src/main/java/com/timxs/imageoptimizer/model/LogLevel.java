package com.timxs.imageoptimizer.model;

/**
 * 优化日志级别
 */
public enum LogLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
