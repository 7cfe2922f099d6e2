package com.kensa.inspection.model;

/**
 * 判定理由。对外只暴露 key，文案由展示层决定。
 */
public enum ExplanationKey {

    SURFACE_CLEAN("表面未发现明显缺陷，处于合格范围内",
            "No significant surface defects were detected."),

    DEFECTS_EXCEED_LIMIT("检出的缺陷超过允许上限，不满足质量标准",
            "Defect patterns exceed acceptable limits."),

    SURFACE_UNCLEAR("图像不够清晰，建议改善光照后重新拍摄或人工复核",
            "Image clarity insufficient. Retake recommended."),

    NOT_INSPECTABLE_SURFACE("图像不像可检测的工业金属表面",
            "Image does not resemble an inspectable industrial metal surface.");

    private final String description;
    private final String englishDescription;

    ExplanationKey(String description, String englishDescription) {
        this.description = description;
        this.englishDescription = englishDescription;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 英文文案，PDF 报告使用。
     */
    public String getEnglishDescription() {
        return englishDescription;
    }
}
