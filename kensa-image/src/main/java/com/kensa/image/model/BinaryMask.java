package com.kensa.image.model;

/**
 * 二值边缘掩码，每个像素取值 0 或 1。
 */
public final class BinaryMask {

    private final int width;
    private final int height;
    private final byte[] bits;

    public BinaryMask(int width, int height, byte[] bits) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("掩码尺寸必须为正: " + width + "x" + height);
        }
        if (bits == null || bits.length != width * height) {
            throw new IllegalArgumentException("掩码长度与尺寸不符");
        }
        for (byte b : bits) {
            if (b != 0 && b != 1) {
                throw new IllegalArgumentException("掩码只能包含 0 或 1，发现: " + b);
            }
        }
        this.width = width;
        this.height = height;
        this.bits = bits.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isForeground(int x, int y) {
        return bits[y * width + x] == 1;
    }

    /**
     * 按行优先下标读取。
     */
    public boolean isForeground(int index) {
        return bits[index] == 1;
    }

    public int foregroundCount() {
        int count = 0;
        for (byte b : bits) {
            count += b;
        }
        return count;
    }

    public long area() {
        return (long) width * height;
    }
}
