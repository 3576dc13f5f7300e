package com.timxs.imageoptimizer.service;

import com.timxs.imageoptimizer.config.InvalidConfigurationException;
import com.timxs.imageoptimizer.config.OptimizerConfig;

/**
 * 配置管理器接口
 * 读取优化设置
 */
public interface SettingsManager {

    /**
     * 获取当前配置
     * 每次调用都重新读取，设置修改后下一次调用即生效
     *
     * @return 优化配置
     * @throws InvalidConfigurationException 设置无法解析或取值非法
     */
    OptimizerConfig getConfig();
}
