package com.kensa.config;

import com.kensa.classifier.provider.ClassifierRegistry;
import com.kensa.inspection.config.InspectionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时校验检测配置，并提示模型环节的装配情况。
 * <p>
 * 配置非法时直接抛出 {@link com.kensa.common.exception.InvalidConfigurationException} 终止启动，
 * 不等到第一张图片进来才报错。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InspectionStartupCheck implements CommandLineRunner {

    private final InspectionProperties inspectionProperties;
    private final ClassifierRegistry classifierRegistry;

    @Override
    public void run(String... args) {
        inspectionProperties.validate();
        log.info("检测配置已加载: 模式 {}, 不确定区间 [{}, {}], 合格健康分 {}, 缺陷数上限 {}",
                inspectionProperties.getMode(),
                inspectionProperties.getUncertaintyLower(), inspectionProperties.getUncertaintyUpper(),
                inspectionProperties.getPassHealthThreshold(), inspectionProperties.getMaxDefectCount());

        if (!inspectionProperties.getMode().isGeometric() && !classifierRegistry.defect().isBound()) {
            log.warn("==============================================");
            log.warn("  评分模式为 CLASSIFIER，但未配置缺陷模型！");
            log.warn("  请在 application.yml 中设置:");
            log.warn("  kensa.classifier.defect.url: http://model-host/predict");
            log.warn("  或在请求中携带 probability 参数");
            log.warn("==============================================");
        }
        if (!classifierRegistry.gatekeeper().isBound()) {
            log.info("未配置门控模型，所有图片直接进入缺陷评估");
        }
    }
}
