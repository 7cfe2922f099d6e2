package com.kensa.inspection.decision;

/**
 * 门控分数的三种去向。
 */
public enum GateOutcome {

    /** 落在不确定区间内，拒绝给出结论 */
    UNCERTAIN,

    /** 低于区间下界，不是可检测的金属表面 */
    INVALID_INPUT,

    /** 高于区间上界，继续做缺陷评估 */
    PROCEED
}
