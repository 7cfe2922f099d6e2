package com.kensa.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 检测记录表，只保存 PASS / FAIL 这类确定性结论。
 */
@Table("t_inspection")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InspectionEntity {

    @Id
    private Long id;

    private String inspectionId;
    private String inspector;
    private String batch;
    private String originalFileName;

    private String status;
    private String explanationKey;
    private String mode;

    private Double healthScore;
    private Double defectScore;
    /** 未配置门控模型时为空 */
    private Double gatekeeperScore;
    private Integer defectCount;

    private Long processingTimeMs;

    /** SQLite TEXT 格式 yyyy-MM-dd HH:mm:ss */
    private String createdAt;
}
