package com.kensa.inspection.config;

import com.kensa.common.exception.InvalidConfigurationException;
import com.kensa.image.config.OpenCvProperties;
import com.kensa.inspection.model.ScoringMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * 检测判定相关配置。启动后只读，可在并发请求间共享。
 */
@Data
@ConfigurationProperties(prefix = "kensa.inspection")
public class InspectionProperties {

    /** 评分模式: geometric / edge-density / classifier */
    private ScoringMode mode = ScoringMode.GEOMETRIC;

    /** 视为“满额损伤”的缺陷面积占图片面积比例 */
    private double maxDefectFraction = 0.1;

    /** 边缘密度模式下，边缘百分比对健康分的放大倍数 */
    private double impactMultiplier = 2.0;

    /** 边缘密度模式健康分下限，防止单帧噪声报出接近 0 的健康分 */
    private double healthFloor = 10.0;

    /** 边缘密度模式健康分上限 */
    private double healthCeiling = 99.0;

    /** 健康分低于此值才可能判 FAIL */
    private double passHealthThreshold = 90.0;

    /** 缺陷区域数超过此值才可能判 FAIL */
    private int maxDefectCount = 5;

    /** 门控不确定区间下界（含） */
    private double uncertaintyLower = 0.45;

    /** 门控不确定区间上界（含） */
    private double uncertaintyUpper = 0.55;

    /** 分类模式下缺陷概率高于此值判 FAIL */
    private double classifierFailThreshold = 0.5;

    /** OpenCV 特征提取参数 */
    @NestedConfigurationProperty
    private OpenCvProperties opencv = new OpenCvProperties();

    public void validate() {
        if (mode == null) {
            throw new InvalidConfigurationException("评分模式未配置");
        }
        if (!(maxDefectFraction > 0 && maxDefectFraction <= 1)) {
            throw new InvalidConfigurationException("maxDefectFraction 必须在 (0, 1] 内: " + maxDefectFraction);
        }
        if (impactMultiplier < 0) {
            throw new InvalidConfigurationException("impactMultiplier 不能为负: " + impactMultiplier);
        }
        if (healthFloor < 0 || healthCeiling > 100 || healthFloor > healthCeiling) {
            throw new InvalidConfigurationException("健康分区间非法: [" + healthFloor + ", " + healthCeiling + "]");
        }
        if (uncertaintyLower < 0 || uncertaintyUpper > 1 || uncertaintyLower > uncertaintyUpper) {
            throw new InvalidConfigurationException("不确定区间非法: [" + uncertaintyLower + ", " + uncertaintyUpper + "]");
        }
        if (classifierFailThreshold < 0 || classifierFailThreshold > 1) {
            throw new InvalidConfigurationException("classifierFailThreshold 必须在 [0, 1] 内: " + classifierFailThreshold);
        }
        if (maxDefectCount < 0) {
            throw new InvalidConfigurationException("maxDefectCount 不能为负: " + maxDefectCount);
        }
        if (opencv == null) {
            throw new InvalidConfigurationException("OpenCV 参数未配置");
        }
        opencv.validate();
    }
}
