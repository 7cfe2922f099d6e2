package com.kensa.inspection.model;

/**
 * 缺陷评分模式。
 */
public enum ScoringMode {

    /** 按显著区域面积占比评分 */
    GEOMETRIC,

    /** 按边缘像素占比评分，健康分限制在上下限之间 */
    EDGE_DENSITY,

    /** 使用外部分类模型给出的缺陷概率 */
    CLASSIFIER;

    public boolean isGeometric() {
        return this != CLASSIFIER;
    }
}
