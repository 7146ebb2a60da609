package com.example.automation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class AutomationApplication {

    public static void main(String[] args) {
        // 缓解 webhook 地址的 DNS 重绑定：JVM 缓存解析结果 60 秒
        java.security.Security.setProperty("networkaddress.cache.ttl", "60");
        SpringApplication.run(AutomationApplication.class, args);
    }

}
