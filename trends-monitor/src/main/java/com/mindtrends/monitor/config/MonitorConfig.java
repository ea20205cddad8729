package com.mindtrends.monitor.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class MonitorConfig {

    @Bean
    public RestTemplate trendsRestTemplate(RestTemplateBuilder builder, TrendsMonitorProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getConnectTimeout())
                .setReadTimeout(properties.getApi().getReadTimeout())
                .defaultHeader("User-Agent", "trends-monitor/1.0")
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
