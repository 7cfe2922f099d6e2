package com.kensa.web.service;

import com.kensa.inspection.model.VerdictStatus;
import com.kensa.web.dto.InspectionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 不合格告警：以日志形式通知产线主管，附带本批次累计不合格件数。
 * <p>
 * 累计件数查询失败时仍然发出告警，只是不带件数。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InspectionAlertService {

    private final InspectionDataService dataService;

    /**
     * @return 是否发出了告警（只有 FAIL 才告警）
     */
    public boolean notifyIfFailed(InspectionReport report) {
        if (report.getStatus() != VerdictStatus.FAIL) {
            log.debug("检测合格，无需告警: {}", report.getInspectionId());
            return false;
        }
        String failures;
        try {
            failures = String.valueOf(dataService.countFailuresInBatch(report.getBatch()));
        } catch (DataAccessException dbEx) {
            log.warn("批次不合格件数查询失败，告警不附带件数: {}", dbEx.getMessage());
            failures = "未知";
        }
        log.warn("【不合格告警】已通知产线主管: 单号 {} | 批次 {} (累计不合格 {} 件) | 检验员 {} | 健康分 {} | 缺陷数 {}",
                report.getInspectionId(), report.getBatch(), failures, report.getInspector(),
                report.getHealthScore(), report.getDefectCount());
        return true;
    }
}
