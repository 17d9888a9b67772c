package com.HRPayMaster.hr_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "hr.coverage")
public class CoverageProperties {
    private int defaultThreshold = 2;
}
