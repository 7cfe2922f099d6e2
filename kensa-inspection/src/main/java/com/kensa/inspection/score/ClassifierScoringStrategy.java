package com.kensa.inspection.score;

import com.kensa.common.exception.ClassifierException;
import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.model.DefectEvidence;
import com.kensa.inspection.model.ScoringMode;
import org.springframework.stereotype.Component;

/**
 * 分类模型概率评分，分段线性映射：
 * <ul>
 *   <li>p ≤ 阈值：健康分 = 100 - p × 20，落在 [80, 100]</li>
 *   <li>p &gt; 阈值：健康分 = (1 - p) × 80，落在 [0, 80)</li>
 * </ul>
 * 合格件与不合格件的健康分不会在数值上混淆。
 */
@Component
public class ClassifierScoringStrategy implements DefectScoringStrategy {

    @Override
    public ScoringMode getMode() {
        return ScoringMode.CLASSIFIER;
    }

    @Override
    public DefectScore score(DefectEvidence evidence, InspectionProperties config) {
        Double p = evidence.getProbability();
        if (p == null || !Double.isFinite(p)) {
            throw new ClassifierException("缺陷概率缺失或不是有限数值: " + p);
        }
        double probability = Math.max(0.0, Math.min(1.0, p));
        double health = probability <= config.getClassifierFailThreshold()
                ? 100.0 - probability * 20.0
                : (1.0 - probability) * 80.0;
        return new DefectScore(probability, health);
    }
}
