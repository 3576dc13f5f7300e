package com.timxs.imageoptimizer.config;

/**
 * 配置无法解析或取值非法时抛出
 * 这是核心模块唯一会向调用方抛出的失败
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
