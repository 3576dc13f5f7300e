package com.timxs.imageoptimizer.codec;

import com.timxs.imageoptimizer.model.ImageFormat;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * 轻量编码后端
 * 调用 libwebp 的 cwebp 和 libavif 的 avifenc 命令行工具
 */
@Slf4j
public class CommandLineCodec implements Codec {

    public static final String NAME = "cli";

    static final long ENCODE_TIMEOUT_SECONDS = 120;

    static final long PROBE_TIMEOUT_SECONDS = 10;

    private final String cwebpBinary;

    private final String avifencBinary;

    private final long probeTimeoutSeconds;

    private final long encodeTimeoutSeconds;

    public CommandLineCodec() {
        this("cwebp", "avifenc");
    }

    public CommandLineCodec(String cwebpBinary, String avifencBinary) {
        this(cwebpBinary, avifencBinary, PROBE_TIMEOUT_SECONDS, ENCODE_TIMEOUT_SECONDS);
    }

    CommandLineCodec(String cwebpBinary, String avifencBinary, long probeTimeoutSeconds, long encodeTimeoutSeconds) {
        this.cwebpBinary = cwebpBinary;
        this.avifencBinary = avifencBinary;
        this.probeTimeoutSeconds = probeTimeoutSeconds;
        this.encodeTimeoutSeconds = encodeTimeoutSeconds;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean supportsFormat(ImageFormat format) {
        if (format == null) {
            return false;
        }
        List<String> command = switch (format) {
            case WEBP -> List.of(cwebpBinary, "-version");
            case AVIF -> List.of(avifencBinary, "--version");
        };
        try {
            ProcessResult result = run(command, probeTimeoutSeconds);
            return result.exitCode() == 0;
        } catch (IOException e) {
            log.debug("{} 不可用: {}", command.get(0), e.getMessage());
            return false;
        }
    }

    @Override
    public void encode(Path source, Path destination, ImageFormat format, int quality) throws CodecException {
        Path input = source;
        Path transcoded = null;
        try {
            // cwebp 和 avifenc 都不能直接读取 GIF，先转为 PNG（首帧）
            if (isGif(source)) {
                transcoded = toPng(source);
                input = transcoded;
            }

            List<String> command = switch (format) {
                case WEBP -> List.of(cwebpBinary, "-quiet", "-q", String.valueOf(quality), "-m", "6",
                    "-metadata", "none", input.toString(), "-o", destination.toString());
                case AVIF -> List.of(avifencBinary, "-q", String.valueOf(quality), "-s", "6",
                    input.toString(), destination.toString());
            };

            ProcessResult result = run(command, encodeTimeoutSeconds);
            if (result.exitCode() != 0) {
                throw new CodecException(command.get(0) + " 退出码 " + result.exitCode() + ": " + result.output().trim());
            }
        } catch (IOException e) {
            throw new CodecException("命令行编码失败: " + e.getMessage(), e);
        } finally {
            if (transcoded != null) {
                try {
                    Files.deleteIfExists(transcoded);
                } catch (IOException e) {
                    log.warn("无法删除临时文件 {}", transcoded, e);
                }
            }
        }
    }

    private boolean isGif(Path source) {
        return source.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gif");
    }

    private Path toPng(Path gif) throws IOException, CodecException {
        BufferedImage image = ImageIO.read(gif.toFile());
        if (image == null) {
            throw new CodecException("无法读取 GIF 数据: " + gif.getFileName());
        }
        Path png = Files.createTempFile("image-optimizer", ".png");
        if (!ImageIO.write(image, "png", png.toFile())) {
            Files.deleteIfExists(png);
            throw new CodecException("无法写入临时 PNG");
        }
        return png;
    }

    /**
     * 执行命令
     * 输出写入临时文件，超时后强制结束进程并返回 -1
     *
     * @param command        命令
     * @param timeoutSeconds 超时时间（秒）
     * @return 退出码和输出
     * @throws IOException 进程无法启动或输出无法读取
     */
    private ProcessResult run(List<String> command, long timeoutSeconds) throws IOException {
        Path outputFile = Files.createTempFile("image-optimizer-cli", ".log");
        try {
            ProcessBuilder builder = new ProcessBuilder(new ArrayList<>(command));
            builder.redirectErrorStream(true);
            builder.redirectOutput(outputFile.toFile());
            Process process = builder.start();

            int exitCode;
            String suffix = "";
            try {
                if (process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                    exitCode = process.exitValue();
                } else {
                    log.warn("{} 超过 {} 秒未结束，强制终止", command.get(0), timeoutSeconds);
                    process.destroyForcibly();
                    exitCode = -1;
                    suffix = " (timeout after " + timeoutSeconds + "s)";
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                exitCode = -1;
                suffix = " (interrupted)";
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            return new ProcessResult(exitCode, output + suffix);
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    private record ProcessResult(int exitCode, String output) {
    }
}
