package com.venturescout.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "venturescout.batch")
public class BatchProperties {
    private int threads = 4;
    private int topN = 20;
}
