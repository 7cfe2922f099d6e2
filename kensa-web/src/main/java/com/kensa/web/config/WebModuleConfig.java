package com.kensa.web.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.kensa.web")
public class WebModuleConfig {

    /**
     * Spring Data JDBC 不认识 SQLite，检测记录表需要手动注册方言。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }
}
