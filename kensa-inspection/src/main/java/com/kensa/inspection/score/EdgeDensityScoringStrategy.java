package com.kensa.inspection.score;

import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.model.DefectEvidence;
import com.kensa.inspection.model.ScoringMode;
import org.springframework.stereotype.Component;

/**
 * 边缘密度评分：健康分 = 100 - 边缘像素百分比 × impactMultiplier，并限制在 [healthFloor, healthCeiling]。
 * <p>
 * 下限保证单帧噪声不会报出接近 0 的健康分（业务侧把接近 0 视为灾难级）。
 */
@Component
public class EdgeDensityScoringStrategy implements DefectScoringStrategy {

    @Override
    public ScoringMode getMode() {
        return ScoringMode.EDGE_DENSITY;
    }

    @Override
    public DefectScore score(DefectEvidence evidence, InspectionProperties config) {
        double edgeFraction = (double) evidence.getEdgePixels() / evidence.getImageArea();
        double health = 100.0 - (edgeFraction * 100.0) * config.getImpactMultiplier();
        return new DefectScore(edgeFraction, health);
    }

    @Override
    public double healthFloor(InspectionProperties config) {
        return config.getHealthFloor();
    }

    @Override
    public double healthCeiling(InspectionProperties config) {
        return config.getHealthCeiling();
    }
}
