package com.kensa.classifier.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kensa.classifier.config.ClassifierProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * 分类模型注册表，根据配置构造门控模型与缺陷模型两个环节。
 */
@Slf4j
@Component
public class ClassifierRegistry {

    public static final String GATEKEEPER = "门控";
    public static final String DEFECT = "缺陷";

    private final ClassifierStage gatekeeper;
    private final ClassifierStage defect;

    public ClassifierRegistry(OkHttpClient classifierHttpClient, ClassifierProperties properties) {
        ObjectMapper objectMapper = new ObjectMapper();
        this.gatekeeper = build(GATEKEEPER, properties.getGatekeeper(), classifierHttpClient, objectMapper);
        this.defect = build(DEFECT, properties.getDefect(), classifierHttpClient, objectMapper);
        log.info("分类模型环节: {}, {}", gatekeeper.describe(), defect.describe());
    }

    public ClassifierStage gatekeeper() {
        return gatekeeper;
    }

    public ClassifierStage defect() {
        return defect;
    }

    private static ClassifierStage build(String role, ClassifierProperties.ModelEndpoint endpoint,
                                         OkHttpClient httpClient, ObjectMapper objectMapper) {
        if (!endpoint.isConfigured()) {
            log.warn("{}模型未配置 URL，该环节将被跳过", role);
            return ClassifierStage.unbound(role);
        }
        return ClassifierStage.bound(role,
                new HttpModelClassifier(httpClient, objectMapper, endpoint.getName(), endpoint.getUrl()));
    }
}
