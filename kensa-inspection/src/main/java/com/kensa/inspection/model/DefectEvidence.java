package com.kensa.inspection.model;

import com.kensa.image.model.RegionSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 评分策略的输入：几何模式给区域与边缘统计，分类模式给一个概率。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DefectEvidence {

    RegionSet regions;

    long imageArea;

    long edgePixels;

    Double probability;

    public static DefectEvidence geometric(RegionSet regions, long imageArea, long edgePixels) {
        if (imageArea <= 0) {
            throw new IllegalArgumentException("图片面积必须为正: " + imageArea);
        }
        return new DefectEvidence(regions, imageArea, edgePixels, null);
    }

    public static DefectEvidence probability(double probability) {
        return new DefectEvidence(RegionSet.empty(), 0, 0, probability);
    }

    public int defectCount() {
        return regions.count();
    }
}
