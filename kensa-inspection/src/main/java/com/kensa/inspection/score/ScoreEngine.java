package com.kensa.inspection.score;

import com.kensa.common.exception.ClassifierException;
import com.kensa.common.exception.InvalidConfigurationException;
import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.model.DefectEvidence;
import com.kensa.inspection.model.ScoreResult;
import com.kensa.inspection.model.ScoringMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 评分引擎：按配置的模式选择策略，并把所有输出截断到声明的区间内。
 */
@Slf4j
@Component
public class ScoreEngine {

    private final Map<ScoringMode, DefectScoringStrategy> strategies = new EnumMap<>(ScoringMode.class);

    public ScoreEngine(List<DefectScoringStrategy> strategies) {
        for (DefectScoringStrategy strategy : strategies) {
            this.strategies.put(strategy.getMode(), strategy);
        }
    }

    public ScoreResult score(DefectEvidence evidence, Double gatekeeperScore, InspectionProperties config) {
        DefectScoringStrategy strategy = strategyFor(config.getMode());
        DefectScore raw = strategy.score(evidence, config);
        if (!Double.isFinite(raw.getDefectScore()) || !Double.isFinite(raw.getHealthScore())) {
            throw new IllegalStateException("评分策略 " + strategy.getMode() + " 输出了非有限数值");
        }

        ScoreResult result = ScoreResult.clamped(normalizeProbability(gatekeeperScore),
                raw.getDefectScore(), raw.getHealthScore(),
                strategy.healthFloor(config), strategy.healthCeiling(config));
        log.debug("评分完成 [{}]: 原始 defect={}, health={} -> {}",
                strategy.getMode(), raw.getDefectScore(), raw.getHealthScore(), result);
        return result;
    }

    /**
     * 被门控拦截（不确定 / 非金属）时的评分：不做缺陷评估，缺陷分与健康分记 0，
     * 健康分仍截断到当前模式的区间内（边缘密度模式下为 healthFloor）。
     */
    public ScoreResult gated(double gatekeeperScore, InspectionProperties config) {
        DefectScoringStrategy strategy = strategyFor(config.getMode());
        return ScoreResult.clamped(normalizeProbability(gatekeeperScore), 0.0, 0.0,
                strategy.healthFloor(config), strategy.healthCeiling(config));
    }

    /**
     * 校验并截断模型概率，非有限数值视为模型故障。
     */
    public Double normalizeProbability(Double probability) {
        if (probability == null) {
            return null;
        }
        if (!Double.isFinite(probability)) {
            throw new ClassifierException("模型概率不是有限数值: " + probability);
        }
        return ScoreResult.clamp(probability, 0.0, 1.0);
    }

    private DefectScoringStrategy strategyFor(ScoringMode mode) {
        DefectScoringStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new InvalidConfigurationException("未找到评分策略: " + mode + "，可选: " + strategies.keySet());
        }
        return strategy;
    }
}
