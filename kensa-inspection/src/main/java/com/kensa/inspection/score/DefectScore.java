package com.kensa.inspection.score;

import lombok.Value;

/**
 * 策略输出的原始分数，尚未截断。
 */
@Value
public class DefectScore {

    double defectScore;

    double healthScore;
}
