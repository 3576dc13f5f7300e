package com.timxs.imageoptimizer.codec;

import com.luciad.imageio.webp.WebPWriteParam;
import com.timxs.imageoptimizer.model.ImageFormat;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;

/**
 * 全功能编码后端
 * 使用 ImageIO 插件（WebP ImageIO 等）在进程内完成编码
 */
@Slf4j
public class ImageIoCodec implements Codec {

    public static final String NAME = "imageio";

    /**
     * WebP method 参数（0-6），6 为最高压缩
     */
    private static final int WEBP_METHOD = 6;

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * 检查是否支持指定格式
     * 仅有 ImageWriter 还不够，native 库可能加载失败，因此做一次 1x1 试编码
     *
     * @param format 图片格式
     * @return 是否支持
     */
    @Override
    public boolean supportsFormat(ImageFormat format) {
        if (format == null) {
            return false;
        }
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getExtension());
        if (!writers.hasNext()) {
            log.debug("没有可用的 {} ImageWriter", format);
            return false;
        }
        try {
            BufferedImage probe = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
            return write(probe, format, 80).length > 0;
        } catch (IOException | RuntimeException | LinkageError e) {
            log.warn("{} ImageWriter 存在但无法编码，系统架构: {} {} - {}", format,
                System.getProperty("os.name"), System.getProperty("os.arch"), e.toString());
            return false;
        }
    }

    /**
     * 编码图片
     *
     * @param source      源文件
     * @param destination 目标文件
     * @param format      目标格式
     * @param quality     输出质量
     * @throws CodecException 读取或编码失败
     */
    @Override
    public void encode(Path source, Path destination, ImageFormat format, int quality) throws CodecException {
        BufferedImage image;
        try {
            image = ImageIO.read(source.toFile());
        } catch (IOException e) {
            throw new CodecException("无法读取图片: " + source.getFileName(), e);
        }
        if (image == null) {
            throw new CodecException("无法读取图片数据: " + source.getFileName());
        }

        try {
            byte[] encoded = write(normalize(image), format, quality);
            Files.write(destination, encoded,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            log.debug("{} -> {}，质量 {}，大小 {} KB", source.getFileName(), format, quality,
                String.format("%.2f", encoded.length / 1024.0));
        } catch (IOException | RuntimeException e) {
            throw new CodecException("编码 " + format + " 失败: " + e.getMessage(), e);
        }
    }

    private byte[] write(BufferedImage image, ImageFormat format, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getExtension());
        if (!writers.hasNext()) {
            throw new IOException("No appropriate writer found for format: " + format);
        }

        ImageWriter writer = writers.next();
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(outputStream)) {
            writer.setOutput(ios);

            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                // WebP 需要先设置压缩类型，第一个为有损
                String[] compressionTypes = param.getCompressionTypes();
                if (compressionTypes != null && compressionTypes.length > 0) {
                    param.setCompressionType(compressionTypes[0]);
                }
                param.setCompressionQuality(quality / 100.0f);
            }
            if (param instanceof WebPWriteParam webpParam) {
                webpParam.setMethod(WEBP_METHOD);
            }

            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return outputStream.toByteArray();
    }

    /**
     * 将调色板、灰度等类型统一为 RGB 或 ARGB
     * 带透明通道的 PNG/GIF 保留 Alpha
     *
     * @param src 源图片
     * @return 统一类型后的图片
     */
    private BufferedImage normalize(BufferedImage src) {
        boolean alpha = src.getColorModel().hasAlpha();
        int targetType = alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        if (src.getType() == targetType) {
            return src;
        }

        BufferedImage converted = new BufferedImage(src.getWidth(), src.getHeight(), targetType);
        Graphics2D g = converted.createGraphics();
        try {
            if (!alpha) {
                g.setColor(Color.WHITE);
                g.fillRect(0, 0, src.getWidth(), src.getHeight());
            }
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return converted;
    }
}
