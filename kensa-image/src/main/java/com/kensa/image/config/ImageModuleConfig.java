package com.kensa.image.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 图像模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.kensa.image")
public class ImageModuleConfig {
}
