package com.timxs.imageoptimizer.service;

import com.timxs.imageoptimizer.model.ConversionResult;
import com.timxs.imageoptimizer.model.FileConversionResult;
import com.timxs.imageoptimizer.model.ImageAsset;
import com.timxs.imageoptimizer.model.ImageFormat;

import java.nio.file.Path;

/**
 * 转换引擎接口
 * 把一个附件（主文件和所有尺寸变体）转换为配置的派生格式
 */
public interface ConversionEngine {

    /**
     * 优化附件
     * 每一种结果（包括跳过和缺失）都会作为终态写入元数据
     *
     * @param id 附件 ID
     * @return 优化结果
     */
    ConversionResult optimizeAsset(long id);

    /**
     * 使用预先读取的附件信息优化附件
     *
     * @param id    附件 ID
     * @param asset 附件信息，为 null 时从图片库读取
     * @return 优化结果
     */
    ConversionResult optimizeAsset(long id, ImageAsset asset);

    /**
     * 转换单个文件，输出为 {@code <source>.<ext>}
     * 输出不小于源文件时删除输出并视为失败
     *
     * @param source  源文件
     * @param format  目标格式
     * @param quality 输出质量
     * @param mime    源文件 MIME 类型，可为 null
     * @return 转换结果
     */
    FileConversionResult convertFile(Path source, ImageFormat format, int quality, String mime);
}
