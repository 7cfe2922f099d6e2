package com.kensa.web.controller;

import com.kensa.classifier.provider.ClassifierRegistry;
import com.kensa.common.dto.ApiResponse;
import com.kensa.common.exception.KensaException;
import com.kensa.common.util.IdGenerator;
import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.model.Verdict;
import com.kensa.inspection.model.VerdictStatus;
import com.kensa.inspection.service.InspectionPipeline;
import com.kensa.web.dto.InspectionReport;
import com.kensa.web.service.InspectionAlertService;
import com.kensa.web.service.InspectionDataService;
import com.kensa.web.service.InspectionPdfRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 金属表面检测 REST API。
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InspectionController {

    public static final String INVALID_PROBABILITY = "INVALID_PROBABILITY";

    private final InspectionPipeline pipeline;
    private final InspectionDataService dataService;
    private final InspectionAlertService alertService;
    private final InspectionPdfRenderer pdfRenderer;
    private final ClassifierRegistry classifierRegistry;
    private final InspectionProperties inspectionProperties;

    /**
     * 上传一张金属表面图片进行检测。
     *
     * @param file        表面图片
     * @param inspector   检验员
     * @param batch       批次号
     * @param probability 调用方已持有的缺陷概率（可选，仅分类模式使用）
     */
    @PostMapping("/inspect")
    public ApiResponse<InspectionReport> inspect(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "inspector", defaultValue = InspectionReport.DEFAULT_INSPECTOR) String inspector,
            @RequestParam(value = "batch", defaultValue = InspectionReport.DEFAULT_BATCH) String batch,
            @RequestParam(value = "probability", required = false) Double probability) throws IOException {

        log.info("收到检测请求, 文件名: {}, 大小: {} bytes, 检验员: {}, 批次: {}",
                file.getOriginalFilename(), file.getSize(), inspector, batch);

        if (probability != null && !Double.isFinite(probability)) {
            throw new KensaException(INVALID_PROBABILITY, "缺陷概率必须是有限数值: " + probability);
        }

        long startTime = System.currentTimeMillis();
        OptionalDouble external = probability != null ? OptionalDouble.of(probability) : OptionalDouble.empty();
        Verdict verdict = pipeline.inspect(file.getBytes(), external);
        InspectionReport report = InspectionReport.from(verdict, inspector, batch,
                System.currentTimeMillis() - startTime);

        if (report.isConclusive()) {
            report.setInspectionId(IdGenerator.inspectionId());
            try {
                dataService.save(report, file.getOriginalFilename());
            } catch (DataAccessException dbEx) {
                log.warn("检测记录持久化失败（不影响返回）: {}", dbEx.getMessage());
            }
            if (report.getStatus() == VerdictStatus.FAIL) {
                alertService.notifyIfFailed(report);
            }
        }

        return ApiResponse.ok(report, report.getExplanation());
    }

    /**
     * 按单号查询检测报告。
     */
    @GetMapping("/inspect/{inspectionId}")
    public ApiResponse<InspectionReport> getReport(@PathVariable String inspectionId) {
        return dataService.findByInspectionId(inspectionId)
                .map(ApiResponse::ok)
                .orElse(ApiResponse.error("NOT_FOUND", "未找到检测记录: " + inspectionId));
    }

    /**
     * 导出检测报告 PDF。单号不存在时返回 404。
     */
    @GetMapping("/inspect/{inspectionId}/pdf")
    public ResponseEntity<?> exportPdf(@PathVariable String inspectionId) {
        return dataService.findByInspectionId(inspectionId)
                .<ResponseEntity<?>>map(report -> ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_PDF)
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename("KENSA_Report_" + inspectionId + ".pdf")
                                .build().toString())
                        .body(pdfRenderer.render(report)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(ApiResponse.error("NOT_FOUND", "未找到检测记录: " + inspectionId)));
    }

    /**
     * 最近 20 条检测记录。
     */
    @GetMapping("/inspect/history")
    public ApiResponse<List<InspectionReport>> history() {
        return ApiResponse.ok(dataService.findRecent());
    }

    /**
     * 服务就绪状态。几何模式不依赖模型；分类模式需要缺陷模型。
     */
    @GetMapping("/health")
    public ApiResponse<Map<String, Object>> health() {
        boolean gatekeeperLoaded = classifierRegistry.gatekeeper().isBound();
        boolean defectLoaded = classifierRegistry.defect().isBound();
        boolean ready = inspectionProperties.getMode().isGeometric() || defectLoaded;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "ready" : "not_ready");
        body.put("gatekeeperLoaded", gatekeeperLoaded);
        body.put("defectClassifierLoaded", defectLoaded);
        body.put("mode", inspectionProperties.getMode());
        return ApiResponse.ok(body);
    }
}
