package com.kensa.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.kensa.inspection.model.ExplanationKey;
import com.kensa.inspection.model.ScoreResult;
import com.kensa.inspection.model.ScoringMode;
import com.kensa.inspection.model.Verdict;
import com.kensa.inspection.model.VerdictStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * 检测报告：接口返回与历史查询共用。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InspectionReport {

    public static final String DEFAULT_INSPECTOR = "Edge Inspector";
    public static final String DEFAULT_BATCH = "BATCH-001";
    public static final String DISCLAIMER = "本结果为自动检测的参考指标，最终判定须由检验负责人作出。";
    public static final String DISCLAIMER_EN =
            "This result is an automated reference indicator. Final judgment must be made by the responsible inspector.";

    private static final Map<VerdictStatus, String> STATUS_LABELS = new EnumMap<>(VerdictStatus.class);

    static {
        STATUS_LABELS.put(VerdictStatus.PASS, "合格");
        STATUS_LABELS.put(VerdictStatus.FAIL, "不合格");
        STATUS_LABELS.put(VerdictStatus.UNCERTAIN, "判定保留");
        STATUS_LABELS.put(VerdictStatus.INVALID_INPUT, "无效");
    }

    /** 只有 PASS / FAIL 才分配单号 */
    private String inspectionId;

    private String inspector;
    private String batch;

    private VerdictStatus status;
    private String statusLabel;
    private ExplanationKey explanationKey;
    private String explanation;
    private ScoringMode mode;

    private double healthScore;
    private double defectScore;
    private Double gatekeeperScore;
    private int defectCount;

    private long processingTimeMs;
    private String createdAt;
    private String disclaimer;

    public static InspectionReport from(Verdict verdict, String inspector, String batch, long processingTimeMs) {
        ScoreResult scores = verdict.getScores();
        return InspectionReport.builder()
                .inspector(inspector)
                .batch(batch)
                .status(verdict.getStatus())
                .statusLabel(labelOf(verdict.getStatus()))
                .explanationKey(verdict.getExplanationKey())
                .explanation(verdict.getExplanationKey().getDescription())
                .mode(verdict.getMode())
                .healthScore(round(scores.getHealthScore(), 2))
                .defectScore(round(scores.getDefectScore(), 4))
                .gatekeeperScore(scores.hasGatekeeperScore() ? round(scores.getGatekeeperScore(), 4) : null)
                .defectCount(verdict.getDefectCount())
                .processingTimeMs(processingTimeMs)
                .disclaimer(DISCLAIMER)
                .build();
    }

    @JsonIgnore
    public boolean isConclusive() {
        return status == VerdictStatus.PASS || status == VerdictStatus.FAIL;
    }

    public static String labelOf(VerdictStatus status) {
        return STATUS_LABELS.get(status);
    }

    static double round(double value, int digits) {
        double factor = Math.pow(10, digits);
        return Math.round(value * factor) / factor;
    }
}
