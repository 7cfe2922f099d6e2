package com.kensa.image.config;

import com.kensa.common.exception.InvalidConfigurationException;
import lombok.Data;

/**
 * OpenCV 特征提取相关配置，挂在 kensa.inspection.opencv 下。
 */
@Data
public class OpenCvProperties {

    /** 高斯模糊核大小（必须为奇数） */
    private int gaussianKernelSize = 5;

    /** 是否启用 CLAHE 局部对比度均衡（补偿光照不均） */
    private boolean claheEnabled = false;

    /** CLAHE 对比度裁剪上限 */
    private double claheClipLimit = 2.0;

    /** CLAHE 分块边长（块数） */
    private int claheTileSize = 8;

    /** Sobel 算子核大小（1、3、5、7） */
    private int sobelKernelSize = 3;

    /** 闭运算结构元素边长，用于合并相邻的边缘碎片 */
    private int closingKernelSize = 3;

    /** 最小区域面积（像素），低于此值的连通域视为噪点 */
    private int minRegionArea = 10;

    /** 送入分类模型的输入边长（像素） */
    private int classifierInputSize = 224;

    public void validate() {
        if (gaussianKernelSize < 1 || gaussianKernelSize % 2 == 0) {
            throw new InvalidConfigurationException("高斯核大小必须为正奇数: " + gaussianKernelSize);
        }
        if (sobelKernelSize != 1 && sobelKernelSize != 3 && sobelKernelSize != 5 && sobelKernelSize != 7) {
            throw new InvalidConfigurationException("Sobel 核大小只能是 1/3/5/7: " + sobelKernelSize);
        }
        if (closingKernelSize < 1) {
            throw new InvalidConfigurationException("闭运算核大小必须为正数: " + closingKernelSize);
        }
        if (claheEnabled && (claheClipLimit <= 0 || claheTileSize < 1)) {
            throw new InvalidConfigurationException("CLAHE 参数非法: clipLimit=" + claheClipLimit
                    + ", tileSize=" + claheTileSize);
        }
        if (minRegionArea < 0) {
            throw new InvalidConfigurationException("最小区域面积不能为负: " + minRegionArea);
        }
        if (classifierInputSize < 1) {
            throw new InvalidConfigurationException("分类模型输入边长必须为正数: " + classifierInputSize);
        }
    }
}
