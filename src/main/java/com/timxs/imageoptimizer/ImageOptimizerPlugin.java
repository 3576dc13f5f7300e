package com.timxs.imageoptimizer;

import com.timxs.imageoptimizer.model.Capabilities;
import com.timxs.imageoptimizer.service.CapabilityProbe;
import com.timxs.imageoptimizer.service.OptimizerLog;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.spi.IIORegistry;
import javax.imageio.spi.IIOServiceProvider;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.spi.ImageWriterSpi;
import java.util.ArrayList;
import java.util.List;

/**
 * Image Optimizer 主类
 * 管理生命周期：启动时注册 WebP ImageIO SPI 并探测服务器能力，停止时注销 SPI
 *
 * @since 1.0.0
 */
@Slf4j
public class ImageOptimizerPlugin {

    private final CapabilityProbe capabilityProbe;

    private final OptimizerLog optimizerLog;

    /**
     * 已注册的 SPI 列表，用于停止时注销
     */
    private final List<IIOServiceProvider> registeredSpis = new ArrayList<>();

    public ImageOptimizerPlugin(CapabilityProbe capabilityProbe, OptimizerLog optimizerLog) {
        this.capabilityProbe = capabilityProbe;
        this.optimizerLog = optimizerLog;
    }

    /**
     * 启动
     * SPI 必须在能力探测之前注册，否则探测结果会被缓存为不支持
     */
    @PostConstruct
    public void start() {
        log.info("Image Optimizer 启动中...");

        // 手动注册 WebP ImageIO SPI（解决类加载器隔离问题）
        registerWebPImageIO();

        Capabilities caps = capabilityProbe.detect();
        log.info("服务器能力: imageio={}, cli={}, 内存上限={} 字节, 执行时间上限={} 秒",
            caps.getImageIo(), caps.getCommandLine(), caps.getMemoryLimit(), caps.getMaxExecutionSeconds());
        optimizerLog.info("Image Optimizer started");

        log.info("Image Optimizer 启动成功！");
    }

    /**
     * 停止
     */
    @PreDestroy
    public void stop() {
        log.info("Image Optimizer 停止中...");

        // 注销 WebP ImageIO SPI
        unregisterWebPImageIO();

        log.info("Image Optimizer 已停止");
    }

    /**
     * 已注册的 SPI 数量
     */
    int registeredSpiCount() {
        return registeredSpis.size();
    }

    /**
     * 手动注册 WebP ImageIO SPI
     * 宿主使用独立的类加载器时，ImageIO 的 SPI 自动发现机制可能失效
     * 需要手动使用本类的类加载器加载并注册 SPI
     */
    private void registerWebPImageIO() {
        ClassLoader classLoader = this.getClass().getClassLoader();
        IIORegistry registry = IIORegistry.getDefaultInstance();

        // 预加载 WebP 相关类，解决运行时 NoClassDefFoundError
        preloadWebPClasses(classLoader);

        // 注册 WebP ImageReaderSpi
        try {
            Class<?> readerSpiClass = classLoader.loadClass("com.luciad.imageio.webp.WebPImageReaderSpi");
            ImageReaderSpi readerSpi = (ImageReaderSpi) readerSpiClass.getDeclaredConstructor().newInstance();
            registry.registerServiceProvider(readerSpi);
            registeredSpis.add(readerSpi);
            log.info("WebP ImageReaderSpi 注册成功: {}", readerSpiClass.getName());
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            log.warn("WebP ImageReaderSpi 注册失败: {}", e.getMessage());
        }

        // 注册 WebP ImageWriterSpi
        try {
            Class<?> writerSpiClass = classLoader.loadClass("com.luciad.imageio.webp.WebPImageWriterSpi");
            ImageWriterSpi writerSpi = (ImageWriterSpi) writerSpiClass.getDeclaredConstructor().newInstance();
            registry.registerServiceProvider(writerSpi);
            registeredSpis.add(writerSpi);
            log.info("WebP ImageWriterSpi 注册成功: {}", writerSpiClass.getName());
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            log.warn("WebP ImageWriterSpi 注册失败: {}", e.getMessage());
        }
    }

    /**
     * 注销 WebP ImageIO SPI，避免类加载器泄漏
     */
    private void unregisterWebPImageIO() {
        if (registeredSpis.isEmpty()) {
            return;
        }

        IIORegistry registry = IIORegistry.getDefaultInstance();
        for (IIOServiceProvider spi : registeredSpis) {
            try {
                registry.deregisterServiceProvider(spi);
                log.info("SPI 注销成功: {}", spi.getClass().getName());
            } catch (RuntimeException e) {
                log.warn("SPI 注销失败: {} - {}", spi.getClass().getName(), e.getMessage());
            }
        }
        registeredSpis.clear();
    }

    /**
     * 预加载 WebP 相关类
     * 解决 ImageIO 在创建 Reader/Writer 实例时找不到依赖类的问题
     */
    private void preloadWebPClasses(ClassLoader classLoader) {
        String[] classNames = {
            "com.luciad.imageio.webp.WebPReadParam",
            "com.luciad.imageio.webp.WebPWriteParam",
            "com.luciad.imageio.webp.WebPImageReader",
            "com.luciad.imageio.webp.WebPImageWriter"
        };

        for (String className : classNames) {
            try {
                Class<?> clazz = classLoader.loadClass(className);
                log.debug("预加载 WebP 类成功: {}", clazz.getName());
            } catch (ClassNotFoundException e) {
                log.warn("预加载 WebP 类失败: {}", className);
            }
        }
    }
}
