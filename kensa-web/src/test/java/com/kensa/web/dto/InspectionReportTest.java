package com.kensa.web.dto;

import com.kensa.inspection.model.ExplanationKey;
import com.kensa.inspection.model.ScoreResult;
import com.kensa.inspection.model.ScoringMode;
import com.kensa.inspection.model.Verdict;
import com.kensa.inspection.model.VerdictStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InspectionReportTest {

    @Test
    void roundsScoresForDisplay() {
        Verdict verdict = Verdict.builder()
                .status(VerdictStatus.FAIL)
                .explanationKey(ExplanationKey.DEFECTS_EXCEED_LIMIT)
                .scores(ScoreResult.clamped(0.987654, 0.500012345, 39.99201, 0, 100))
                .mode(ScoringMode.CLASSIFIER)
                .defectCount(0)
                .build();

        InspectionReport report = InspectionReport.from(verdict, "Edge Inspector", "BATCH-001", 12);

        assertEquals(39.99, report.getHealthScore(), 1e-12);
        assertEquals(0.5, report.getDefectScore(), 1e-12);
        assertEquals(0.9877, report.getGatekeeperScore(), 1e-12);
        assertEquals("不合格", report.getStatusLabel());
        assertEquals(ExplanationKey.DEFECTS_EXCEED_LIMIT.getDescription(), report.getExplanation());
        assertTrue(report.isConclusive());
        assertNull(report.getInspectionId());
    }

    @Test
    void gatedVerdictHasNoInspectionNumberAndIsInconclusive() {
        Verdict verdict = Verdict.builder()
                .status(VerdictStatus.INVALID_INPUT)
                .explanationKey(ExplanationKey.NOT_INSPECTABLE_SURFACE)
                .scores(ScoreResult.clamped(0.2, 0, 0, 0, 100))
                .mode(ScoringMode.GEOMETRIC)
                .build();

        InspectionReport report = InspectionReport.from(verdict, "A", "B", 3);

        assertFalse(report.isConclusive());
        assertEquals("无效", report.getStatusLabel());
    }
}
