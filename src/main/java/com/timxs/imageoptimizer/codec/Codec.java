package com.timxs.imageoptimizer.codec;

import com.timxs.imageoptimizer.model.ImageFormat;

import java.nio.file.Path;

/**
 * 编码后端接口
 * 定义把源图片编码为派生格式文件的核心方法
 */
public interface Codec {

    /**
     * 后端名称，用于日志和能力报告
     *
     * @return 名称
     */
    String getName();

    /**
     * 检查是否能生成指定格式
     * 实现可以执行真实的试编码，调用方应缓存结果
     *
     * @param format 图片格式
     * @return 是否支持
     */
    boolean supportsFormat(ImageFormat format);

    /**
     * 编码图片
     * 成功返回时目标文件已写入
     *
     * @param source      源文件
     * @param destination 目标文件（已存在时覆盖）
     * @param format      目标格式
     * @param quality     输出质量（10-100）
     * @throws CodecException 编码失败
     */
    void encode(Path source, Path destination, ImageFormat format, int quality) throws CodecException;
}
