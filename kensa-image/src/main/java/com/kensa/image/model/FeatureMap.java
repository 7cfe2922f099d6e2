package com.kensa.image.model;

/**
 * 梯度幅值图，已按单张图自身的最大值重标定到 0-255。
 */
public final class FeatureMap {

    private final int width;
    private final int height;
    private final float[] magnitudes;

    public FeatureMap(int width, int height, float[] magnitudes) {
        if (magnitudes == null || magnitudes.length != width * height) {
            throw new IllegalArgumentException("幅值数组长度与尺寸不符");
        }
        this.width = width;
        this.height = height;
        this.magnitudes = magnitudes.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public float get(int x, int y) {
        return magnitudes[y * width + x];
    }

    public float max() {
        float max = 0f;
        for (float m : magnitudes) {
            if (m > max) max = m;
        }
        return max;
    }

    public double mean() {
        double sum = 0;
        for (float m : magnitudes) {
            sum += m;
        }
        return sum / magnitudes.length;
    }
}
