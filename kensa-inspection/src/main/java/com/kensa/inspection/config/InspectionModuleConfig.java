package com.kensa.inspection.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 检测模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.kensa.inspection")
@EnableConfigurationProperties(InspectionProperties.class)
public class InspectionModuleConfig {
}
