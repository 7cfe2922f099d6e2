package com.kensa.image.model;

/**
 * 分类模型输入：缩放后的 RGB 张量（HWC，取值 0-1）及其 PNG 编码。
 */
public final class ClassifierInput {

    private final int width;
    private final int height;
    private final float[] rgb;
    private final byte[] png;

    public ClassifierInput(int width, int height, float[] rgb, byte[] png) {
        if (rgb == null || rgb.length != width * height * 3) {
            throw new IllegalArgumentException("RGB 张量长度与尺寸不符");
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb.clone();
        this.png = png == null ? new byte[0] : png.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public float[] getRgb() {
        return rgb.clone();
    }

    public byte[] getPng() {
        return png.clone();
    }
}
