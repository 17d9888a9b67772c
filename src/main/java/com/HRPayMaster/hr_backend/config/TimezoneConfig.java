package com.HRPayMaster.hr_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.TimeZone;

@Slf4j
@Configuration
public class TimezoneConfig {

    @Value("${hr.timezone:Asia/Kuwait}")
    private String timezone;

    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(timezone));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(timezone));
    }
}
