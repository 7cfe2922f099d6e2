package com.kensa.inspection.score;

import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.model.DefectEvidence;
import com.kensa.inspection.model.ScoringMode;
import org.springframework.stereotype.Component;

/**
 * 面积占比评分：显著区域总面积达到 图片面积 × maxDefectFraction 即视为满额损伤。
 */
@Component
public class GeometricScoringStrategy implements DefectScoringStrategy {

    @Override
    public ScoringMode getMode() {
        return ScoringMode.GEOMETRIC;
    }

    @Override
    public DefectScore score(DefectEvidence evidence, InspectionProperties config) {
        double maxPossibleArea = evidence.getImageArea() * config.getMaxDefectFraction();
        double percent = Math.min(100.0, evidence.getRegions().significantArea() / maxPossibleArea * 100.0);
        double defectScore = percent / 100.0;
        return new DefectScore(defectScore, 100.0 - defectScore * 100.0);
    }
}
