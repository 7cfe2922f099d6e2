package com.kensa.image.model;

import java.util.Arrays;

/**
 * 解码后的像素网格：行优先、8 位无符号采样。
 * <p>
 * 三通道时按 BGR 交错存放（与 OpenCV 解码顺序一致）。构造时拷贝入参，读取时返回副本，
 * 保证下游阶段拿不到可变引用。
 */
public final class PixelGrid {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] samples;

    public PixelGrid(int width, int height, int channels, byte[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("像素网格尺寸必须为正: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("仅支持 1 或 3 通道: " + channels);
        }
        if (samples == null || samples.length != width * height * channels) {
            throw new IllegalArgumentException("采样长度与尺寸不符: expected="
                    + (width * height * channels) + ", actual=" + (samples == null ? 0 : samples.length));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public long area() {
        return (long) width * height;
    }

    /**
     * 读取单个采样值 (0-255)。
     */
    public int sample(int x, int y, int channel) {
        return samples[(y * width + x) * channels + channel] & 0xFF;
    }

    public byte[] getSamples() {
        return samples.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelGrid)) return false;
        PixelGrid other = (PixelGrid) o;
        return width == other.width && height == other.height
                && channels == other.channels && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        result = 31 * result + channels;
        return 31 * result + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "PixelGrid(" + width + "x" + height + "x" + channels + ")";
    }
}
