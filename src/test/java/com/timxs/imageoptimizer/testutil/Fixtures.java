package com.timxs.imageoptimizer.testutil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * 测试文件工具
 */
public final class Fixtures {

    private static final byte[] GIF_HEADER = {'G', 'I', 'F', '8', '9', 'a'};

    private static final byte[] GRAPHIC_CONTROL_BLOCK = {0x00, 0x21, (byte) 0xF9, 0x04};

    private Fixtures() {
    }

    /**
     * 写出指定大小的填充文件，自动创建父目录
     */
    public static Path writeBytes(Path file, int size) {
        byte[] content = new byte[size];
        Arrays.fill(content, (byte) 'x');
        return write(file, content);
    }

    /**
     * 写出带指定数量图形控制块的 GIF 样本
     */
    public static Path writeGif(Path file, int frames, int size) {
        byte[] content = new byte[Math.max(size, GIF_HEADER.length + frames * (GRAPHIC_CONTROL_BLOCK.length + 8))];
        System.arraycopy(GIF_HEADER, 0, content, 0, GIF_HEADER.length);
        int offset = GIF_HEADER.length + 2;
        for (int i = 0; i < frames; i++) {
            System.arraycopy(GRAPHIC_CONTROL_BLOCK, 0, content, offset, GRAPHIC_CONTROL_BLOCK.length);
            offset += GRAPHIC_CONTROL_BLOCK.length + 8;
        }
        return write(file, content);
    }

    private static Path write(Path file, byte[] content) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.write(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
