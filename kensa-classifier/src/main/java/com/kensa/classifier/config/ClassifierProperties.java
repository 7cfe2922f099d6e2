package com.kensa.classifier.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 外部分类模型配置项。URL 为空表示该模型未部署。
 */
@Data
@ConfigurationProperties(prefix = "kensa.classifier")
public class ClassifierProperties {

    /** 金属表面门控模型 */
    private ModelEndpoint gatekeeper = new ModelEndpoint("metal-surface-validator");

    /** 缺陷检测模型 */
    private ModelEndpoint defect = new ModelEndpoint("defect-inspector");

    /** 单次模型调用的超时时间（秒） */
    private int requestTimeoutSeconds = 10;

    @Data
    public static class ModelEndpoint {

        /** 模型名称，随请求一起发送，便于服务端路由 */
        private String name;

        /** 模型推理服务地址，如 http://localhost:8501/v1/predict */
        private String url;

        public ModelEndpoint() {
        }

        public ModelEndpoint(String name) {
            this.name = name;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }
}
