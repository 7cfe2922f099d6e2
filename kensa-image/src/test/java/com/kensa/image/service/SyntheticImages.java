package com.kensa.image.service;

import com.kensa.image.model.PixelGrid;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Random;

/**
 * 测试用合成图片。
 */
final class SyntheticImages {

    private SyntheticImages() {
    }

    static BufferedImage flatGray(int width, int height, int level) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        fill(img, 0, 0, width, height, level);
        return img;
    }

    /**
     * 灰色背景上画若干个亮色方块（模拟划痕/凹坑），方块按网格排布、互不接触。
     */
    static BufferedImage blobs(int width, int height, int count, int blobSize, int spacing) {
        BufferedImage img = flatGray(width, height, 90);
        int perRow = (width - spacing) / spacing;
        for (int i = 0; i < count; i++) {
            int x = spacing + (i % perRow) * spacing - blobSize / 2;
            int y = spacing + (i / perRow) * spacing - blobSize / 2;
            fill(img, x, y, blobSize, blobSize, 230);
        }
        return img;
    }

    static PixelGrid noiseGrid(int width, int height, int channels, long seed) {
        Random random = new Random(seed);
        byte[] samples = new byte[width * height * channels];
        random.nextBytes(samples);
        return new PixelGrid(width, height, channels, samples);
    }

    static byte[] png(BufferedImage img) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(img, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void fill(BufferedImage img, int x0, int y0, int w, int h, int level) {
        // 直接写栅格，避开 TYPE_BYTE_GRAY 的 setRGB 色彩空间换算
        for (int y = y0; y < y0 + h; y++) {
            for (int x = x0; x < x0 + w; x++) {
                img.getRaster().setSample(x, y, 0, level);
            }
        }
    }
}
