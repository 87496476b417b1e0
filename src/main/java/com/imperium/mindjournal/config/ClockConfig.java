package com.imperium.mindjournal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 时间源；测试中可替换为固定时钟 */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
