package com.venturescout.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "venturescout.ratelimit")
public class RateLimitProperties {
    private int maxRequests = 20;
    private long windowSec = 60;
    private Map<String, Integer> source = new LinkedHashMap<>();
}
