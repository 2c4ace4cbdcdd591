package com.supportdesk.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 业务时钟。所有 SLA 截止时间、复用窗口均基于该时钟计算，测试中替换为固定时钟。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.time-zone:}") String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(timeZone.trim()));
    }
}
