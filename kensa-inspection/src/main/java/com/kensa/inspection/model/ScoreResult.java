package com.kensa.inspection.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 评分结果。只能通过 {@link #clamped} 创建，三个字段始终落在各自区间内。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScoreResult {

    /** 门控分数 [0, 1]，未配置门控模型时为 null */
    Double gatekeeperScore;

    /** 缺陷分数 [0, 1] */
    double defectScore;

    /** 健康分 [0, 100]（边缘密度模式下为配置的上下限） */
    double healthScore;

    /**
     * 无条件截断到区间内，对已在区间内的值是幂等的。
     */
    public static ScoreResult clamped(Double gatekeeperScore, double defectScore, double healthScore,
                                      double healthMin, double healthMax) {
        requireFinite(defectScore, "defectScore");
        requireFinite(healthScore, "healthScore");
        Double gate = null;
        if (gatekeeperScore != null) {
            requireFinite(gatekeeperScore, "gatekeeperScore");
            gate = clamp(gatekeeperScore, 0.0, 1.0);
        }
        double lo = Math.max(0.0, healthMin);
        double hi = Math.min(100.0, healthMax);
        return new ScoreResult(gate, clamp(defectScore, 0.0, 1.0), clamp(healthScore, lo, hi));
    }

    public boolean hasGatekeeperScore() {
        return gatekeeperScore != null;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static void requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " 不是有限数值: " + value);
        }
    }
}
