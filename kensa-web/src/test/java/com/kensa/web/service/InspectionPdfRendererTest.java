package com.kensa.web.service;

import com.kensa.inspection.model.ExplanationKey;
import com.kensa.inspection.model.ScoringMode;
import com.kensa.inspection.model.VerdictStatus;
import com.kensa.web.dto.InspectionReport;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class InspectionPdfRendererTest {

    private final InspectionPdfRenderer renderer = new InspectionPdfRenderer();

    private static String textOf(byte[] pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            return new PDFTextStripper().getText(document);
        }
    }

    @Test
    void passReportCarriesScoresReasonAndDisclaimer() throws IOException {
        InspectionReport report = InspectionReport.builder()
                .inspectionId("INSP-20261019-cccccccccccc")
                .inspector("Edge Inspector")
                .batch("BATCH-001")
                .status(VerdictStatus.PASS)
                .explanationKey(ExplanationKey.SURFACE_CLEAN)
                .mode(ScoringMode.CLASSIFIER)
                .healthScore(97.5)
                .defectScore(0.025)
                .gatekeeperScore(0.91)
                .defectCount(0)
                .createdAt("2026-10-19 10:00:00")
                .build();

        String text = textOf(renderer.render(report));

        assertThat(text).contains(InspectionPdfRenderer.TITLE)
                .contains("INSP-20261019-cccccccccccc")
                .contains("2026-10-19 10:00:00")
                .contains("PASS")
                .contains("Surface Health Score: 97.5")
                .contains("Gatekeeper Score: 0.91")
                .contains("No significant surface defects were detected.")
                .contains("Final judgment must be made");
    }

    @Test
    void missingFieldsRenderAsNotAvailable() throws IOException {
        InspectionReport report = InspectionReport.builder()
                .inspectionId("INSP-20261019-dddddddddddd")
                .status(VerdictStatus.FAIL)
                .explanationKey(ExplanationKey.DEFECTS_EXCEED_LIMIT)
                .build();

        String text = textOf(renderer.render(report));

        assertThat(text).contains("Inspector: N/A")
                .contains("Batch ID: N/A")
                .doesNotContain("Gatekeeper Score");
    }

    @Test
    void nonAsciiInspectorNameIsReplaced() throws IOException {
        InspectionReport report = InspectionReport.builder()
                .inspectionId("INSP-20261019-eeeeeeeeeeee")
                .inspector("田中")
                .status(VerdictStatus.PASS)
                .explanationKey(ExplanationKey.SURFACE_CLEAN)
                .build();

        String text = textOf(renderer.render(report));

        assertThat(text).contains("Inspector: ??");
        assertThat(InspectionPdfRenderer.sanitize("Müller 田中")).isEqualTo("M?ller ??");
    }
}
