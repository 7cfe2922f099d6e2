package com.kensa.web.service;

import com.kensa.inspection.model.ExplanationKey;
import com.kensa.inspection.model.ScoringMode;
import com.kensa.inspection.model.VerdictStatus;
import com.kensa.web.dto.InspectionReport;
import com.kensa.web.entity.InspectionEntity;
import com.kensa.web.repository.InspectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * 检测记录持久化服务，基于 Spring Data JDBC。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InspectionDataService {

    private static final DateTimeFormatter SQLITE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final InspectionRepository inspectionRepo;

    /**
     * 保存一条确定性检测结论，并回填报告的创建时间。
     */
    public InspectionEntity save(InspectionReport report, String originalFileName) {
        if (!report.isConclusive() || report.getInspectionId() == null) {
            throw new IllegalArgumentException("只有带单号的 PASS / FAIL 结论才会入库: " + report.getStatus());
        }
        String createdAt = LocalDateTime.now().format(SQLITE_FMT);
        InspectionEntity entity = InspectionEntity.builder()
                .inspectionId(report.getInspectionId())
                .inspector(report.getInspector())
                .batch(report.getBatch())
                .originalFileName(originalFileName)
                .status(report.getStatus().name())
                .explanationKey(report.getExplanationKey().name())
                .mode(report.getMode().name())
                .healthScore(report.getHealthScore())
                .defectScore(report.getDefectScore())
                .gatekeeperScore(report.getGatekeeperScore())
                .defectCount(report.getDefectCount())
                .processingTimeMs(report.getProcessingTimeMs())
                .createdAt(createdAt)
                .build();
        entity = inspectionRepo.save(entity);
        report.setCreatedAt(createdAt);

        log.info("检测记录已持久化: inspectionId={}, status={}, batch={}",
                report.getInspectionId(), report.getStatus(), report.getBatch());
        return entity;
    }

    public Optional<InspectionReport> findByInspectionId(String inspectionId) {
        return inspectionRepo.findByInspectionId(inspectionId).map(this::toReport);
    }

    /**
     * 最近 20 条检测记录，新的在前。
     */
    public List<InspectionReport> findRecent() {
        return inspectionRepo.findRecent().stream()
                .map(this::toReport)
                .toList();
    }

    public long countFailuresInBatch(String batch) {
        return inspectionRepo.countFailuresInBatch(batch);
    }

    private InspectionReport toReport(InspectionEntity e) {
        VerdictStatus status = VerdictStatus.valueOf(e.getStatus());
        ExplanationKey key = ExplanationKey.valueOf(e.getExplanationKey());
        return InspectionReport.builder()
                .inspectionId(e.getInspectionId())
                .inspector(e.getInspector())
                .batch(e.getBatch())
                .status(status)
                .statusLabel(InspectionReport.labelOf(status))
                .explanationKey(key)
                .explanation(key.getDescription())
                .mode(ScoringMode.valueOf(e.getMode()))
                .healthScore(e.getHealthScore() != null ? e.getHealthScore() : 0)
                .defectScore(e.getDefectScore() != null ? e.getDefectScore() : 0)
                .gatekeeperScore(e.getGatekeeperScore())
                .defectCount(e.getDefectCount() != null ? e.getDefectCount() : 0)
                .processingTimeMs(e.getProcessingTimeMs() != null ? e.getProcessingTimeMs() : 0)
                .createdAt(e.getCreatedAt())
                .disclaimer(InspectionReport.DISCLAIMER)
                .build();
    }
}
