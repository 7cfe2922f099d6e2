package com.kensa.image.model;

import lombok.Value;

/**
 * 特征提取产物：幅值图、二值掩码及 Otsu 自动选出的阈值。
 */
@Value
public class FeatureExtraction {

    FeatureMap featureMap;

    BinaryMask mask;

    double otsuThreshold;
}
