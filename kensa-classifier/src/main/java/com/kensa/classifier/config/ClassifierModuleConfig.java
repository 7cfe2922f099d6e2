package com.kensa.classifier.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 分类模型模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.kensa.classifier")
@EnableConfigurationProperties(ClassifierProperties.class)
public class ClassifierModuleConfig {

    @Bean
    public OkHttpClient classifierHttpClient(ClassifierProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(5))
                .build();
    }
}
