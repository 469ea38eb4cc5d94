package com.travelcrm.global.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "travelcrm.rate-limit")
public class RateLimitProperties {

    private int requestsPerMinute = 60;
}
