package com.kensa.inspection.score;

import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.model.DefectEvidence;
import com.kensa.inspection.model.ScoringMode;

/**
 * 缺陷评分策略：给出 0-1 的缺陷可能性以及对应的健康分。
 * <p>
 * 截断由 {@link ScoreEngine} 统一处理，策略只负责公式本身。
 */
public interface DefectScoringStrategy {

    ScoringMode getMode();

    DefectScore score(DefectEvidence evidence, InspectionProperties config);

    /**
     * 健康分下限，默认 0。
     */
    default double healthFloor(InspectionProperties config) {
        return 0.0;
    }

    /**
     * 健康分上限，默认 100。
     */
    default double healthCeiling(InspectionProperties config) {
        return 100.0;
    }
}
