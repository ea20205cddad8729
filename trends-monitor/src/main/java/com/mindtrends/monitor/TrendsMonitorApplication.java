package com.mindtrends.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class TrendsMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrendsMonitorApplication.class, args);
    }
}
