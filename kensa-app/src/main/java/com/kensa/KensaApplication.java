package com.kensa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 金属表面缺陷检测服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.kensa")
public class KensaApplication {

    public static void main(String[] args) throws Exception {
        // SQLite 不会自动创建父目录，启动前确保 data/ 存在
        Files.createDirectories(Path.of("data"));
        SpringApplication.run(KensaApplication.class, args);
    }
}
