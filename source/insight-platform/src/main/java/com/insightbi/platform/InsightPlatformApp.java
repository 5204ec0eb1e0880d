package com.insightbi.platform;

import com.insightbi.platform.config.RlsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ RlsProperties.class })
public class InsightPlatformApp {

    public static void main(String[] args) {
        SpringApplication.run(InsightPlatformApp.class, args);
    }
}
