package com.kensa.web.service;

import com.kensa.common.exception.ReportExportException;
import com.kensa.inspection.model.VerdictStatus;
import com.kensa.web.dto.InspectionReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 检测报告 PDF 渲染，单页 A4。
 * <p>
 * 使用 PDF 内置的 Helvetica 字体，不嵌入字体文件；非 ASCII 字符（如中文检验员姓名）输出为 '?'。
 */
@Slf4j
@Service
public class InspectionPdfRenderer {

    public static final String TITLE = "KENSA Surface Inspection Report";

    private static final float MARGIN = 56f;
    private static final int WRAP_WIDTH = 92;

    private static final Color PASS_COLOR = new Color(10, 125, 50);
    private static final Color FAIL_COLOR = new Color(200, 40, 40);

    public byte[] render(InspectionReport report) {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            PDFont italic = new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE);

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                Cursor cursor = new Cursor(content, page.getMediaBox().getHeight() - MARGIN);

                cursor.line(bold, 18, TITLE);
                cursor.gap(8);

                cursor.line(bold, 12, "Inspection Information");
                cursor.line(regular, 11, "Inspection ID: " + orNa(report.getInspectionId()));
                cursor.line(regular, 11, "Inspection DateTime: " + orNa(report.getCreatedAt()));
                cursor.line(regular, 11, "Inspector: " + orNa(report.getInspector()));
                cursor.line(regular, 11, "Batch ID: " + orNa(report.getBatch()));
                cursor.gap(6);

                cursor.line(bold, 12, "Judgment Result");
                content.setNonStrokingColor(report.getStatus() == VerdictStatus.PASS
                        ? PASS_COLOR : FAIL_COLOR);
                cursor.line(bold, 14, orNa(report.getStatus() != null ? report.getStatus().name() : null));
                content.setNonStrokingColor(Color.BLACK);
                cursor.line(regular, 11, "Surface Health Score: " + report.getHealthScore());
                cursor.line(regular, 11, "Defect Score: " + report.getDefectScore());
                if (report.getGatekeeperScore() != null) {
                    cursor.line(regular, 11, "Gatekeeper Score: " + report.getGatekeeperScore());
                }
                cursor.line(regular, 11, "Defect Regions: " + report.getDefectCount());
                cursor.line(regular, 11, "Scoring Mode: " + orNa(report.getMode() != null ? report.getMode().name() : null));
                cursor.gap(6);

                cursor.line(bold, 12, "Decision Reason");
                cursor.paragraph(regular, 10, report.getExplanationKey() != null
                        ? report.getExplanationKey().getEnglishDescription() : "N/A");
                cursor.gap(6);

                cursor.paragraph(italic, 9, InspectionReport.DISCLAIMER_EN);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            log.info("PDF 报告已生成: inspectionId={}, {} bytes", report.getInspectionId(), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new ReportExportException("PDF 报告生成失败: " + report.getInspectionId(), e);
        }
    }

    /**
     * 内置字体只覆盖 WinAnsi 字符集，这里收窄到可打印 ASCII。
     */
    static String sanitize(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(c >= 0x20 && c < 0x7f ? c : '?');
        }
        return sb.toString();
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }

    /**
     * 按行自上而下写文本。
     */
    private static final class Cursor {

        private final PDPageContentStream content;
        private float y;

        private Cursor(PDPageContentStream content, float top) {
            this.content = content;
            this.y = top;
        }

        void line(PDFont font, float size, String text) throws IOException {
            y -= size * 1.4f;
            content.beginText();
            content.setFont(font, size);
            content.newLineAtOffset(MARGIN, y);
            content.showText(sanitize(text));
            content.endText();
        }

        void paragraph(PDFont font, float size, String text) throws IOException {
            for (String row : wrap(text)) {
                line(font, size, row);
            }
        }

        void gap(float points) {
            y -= points;
        }

        private static List<String> wrap(String text) {
            List<String> rows = new ArrayList<>();
            StringBuilder row = new StringBuilder();
            for (String word : text.split(" ")) {
                if (row.length() > 0 && row.length() + word.length() + 1 > WRAP_WIDTH) {
                    rows.add(row.toString());
                    row.setLength(0);
                }
                if (row.length() > 0) row.append(' ');
                row.append(word);
            }
            rows.add(row.toString());
            return rows;
        }
    }
}
