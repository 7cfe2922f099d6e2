package com.kensa.inspection.decision;

import com.kensa.inspection.model.ScoreResult;
import com.kensa.inspection.model.ScoringMode;
import lombok.Value;

/**
 * 缺陷评估结果，供判定策略使用。
 */
@Value
public class DefectAssessment {

    ScoreResult scores;

    int defectCount;

    ScoringMode mode;
}
