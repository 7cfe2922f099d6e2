package com.kensa.inspection.decision;

import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.model.ExplanationKey;
import com.kensa.inspection.model.ScoreResult;
import com.kensa.inspection.model.Verdict;
import com.kensa.inspection.model.VerdictStatus;
import com.kensa.inspection.score.ScoreEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 判定策略：每次检测只做一次决策，产出 PASS / FAIL / UNCERTAIN / INVALID_INPUT 之一。
 * <p>
 * 判定顺序：
 * 1. 门控分数落在 [lower, upper]（含端点）→ UNCERTAIN，不做缺陷评估
 * 2. 门控分数 &lt; lower → INVALID_INPUT，不做缺陷评估
 * 3. 其余情况（无门控，或门控 &gt; upper）→ 缺陷评估
 *    - 几何模式：健康分 &lt; passHealthThreshold 且 缺陷数 &gt; maxDefectCount 才判 FAIL
 *    - 分类模式：缺陷分 &gt; classifierFailThreshold 判 FAIL
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecisionPolicy {

    private final ScoreEngine scoreEngine;

    public GateOutcome gate(double gatekeeperScore, InspectionProperties config) {
        if (gatekeeperScore >= config.getUncertaintyLower() && gatekeeperScore <= config.getUncertaintyUpper()) {
            return GateOutcome.UNCERTAIN;
        }
        if (gatekeeperScore < config.getUncertaintyLower()) {
            return GateOutcome.INVALID_INPUT;
        }
        return GateOutcome.PROCEED;
    }

    /**
     * @param gatekeeperScore  门控分数，未配置门控模型时传 null
     * @param defectAssessment 缺陷评估，仅在门控放行后才会被调用
     */
    public Verdict decide(Double gatekeeperScore, Supplier<DefectAssessment> defectAssessment,
                          InspectionProperties config) {
        Double gate = scoreEngine.normalizeProbability(gatekeeperScore);

        if (gate != null) {
            GateOutcome outcome = gate(gate, config);
            if (outcome == GateOutcome.UNCERTAIN) {
                log.info("门控分数 {} 落在不确定区间 [{}, {}]，跳过缺陷评估",
                        gate, config.getUncertaintyLower(), config.getUncertaintyUpper());
                return gated(VerdictStatus.UNCERTAIN, ExplanationKey.SURFACE_UNCLEAR, gate, config);
            }
            if (outcome == GateOutcome.INVALID_INPUT) {
                log.info("门控分数 {} 低于 {}，判定为非金属表面", gate, config.getUncertaintyLower());
                return gated(VerdictStatus.INVALID_INPUT, ExplanationKey.NOT_INSPECTABLE_SURFACE, gate, config);
            }
        }

        DefectAssessment assessment = defectAssessment.get();
        boolean fail = isFailure(assessment, config);
        return Verdict.builder()
                .status(fail ? VerdictStatus.FAIL : VerdictStatus.PASS)
                .explanationKey(fail ? ExplanationKey.DEFECTS_EXCEED_LIMIT : ExplanationKey.SURFACE_CLEAN)
                .scores(assessment.getScores())
                .mode(assessment.getMode())
                .defectCount(assessment.getDefectCount())
                .build();
    }

    boolean isFailure(DefectAssessment assessment, InspectionProperties config) {
        ScoreResult scores = assessment.getScores();
        if (assessment.getMode().isGeometric()) {
            return scores.getHealthScore() < config.getPassHealthThreshold()
                    && assessment.getDefectCount() > config.getMaxDefectCount();
        }
        return scores.getDefectScore() > config.getClassifierFailThreshold();
    }

    private Verdict gated(VerdictStatus status, ExplanationKey key, double gate, InspectionProperties config) {
        return Verdict.builder()
                .status(status)
                .explanationKey(key)
                .scores(scoreEngine.gated(gate, config))
                .mode(config.getMode())
                .defectCount(0)
                .build();
    }
}
