package com.timxs.imageoptimizer.service;

import com.timxs.imageoptimizer.codec.Codec;
import com.timxs.imageoptimizer.model.Capabilities;
import com.timxs.imageoptimizer.model.ImageFormat;

import java.util.Optional;

/**
 * 服务器能力探测接口
 * 报告可用的编码后端、输出格式以及资源上限
 */
public interface CapabilityProbe {

    /**
     * 探测服务器能力
     * 首次调用时执行探测，之后返回缓存结果
     *
     * @return 能力快照
     */
    Capabilities detect();

    /**
     * 获取指定格式的首选编码后端
     * 优先全功能后端，其次轻量后端
     *
     * @param format 图片格式
     * @return 编码后端，不支持时为空
     */
    Optional<Codec> engineFor(ImageFormat format);

    /**
     * 是否能以任一后端生成指定格式
     *
     * @param format 图片格式
     * @return 是否支持
     */
    default boolean has(ImageFormat format) {
        return detect().has(format);
    }
}
