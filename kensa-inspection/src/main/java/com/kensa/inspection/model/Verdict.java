package com.kensa.inspection.model;

import lombok.Builder;
import lombok.Value;

/**
 * 一次检测的最终结论，创建后不可变。
 */
@Value
@Builder
public class Verdict {

    VerdictStatus status;

    ExplanationKey explanationKey;

    ScoreResult scores;

    /** 生成该结论的评分模式 */
    ScoringMode mode;

    /** 显著缺陷区域数（分类模式及被门控拦截时为 0） */
    int defectCount;

    /**
     * PASS / FAIL 为确定性结论，其余需要重拍或人工处理。
     */
    public boolean isConclusive() {
        return status == VerdictStatus.PASS || status == VerdictStatus.FAIL;
    }
}
