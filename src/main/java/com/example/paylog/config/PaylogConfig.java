package com.example.paylog.config;

import com.example.paylog.sync.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(SyncRetryProperties.class)
public class PaylogConfig {

    @Bean
    public Clock clock(@Value("${paylog.zone-id:Asia/Kolkata}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
