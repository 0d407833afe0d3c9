package com.nifty.bulk.client.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "client.api")
public class ApiProperties {
    private String baseUrl = "http://localhost:5001/api";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);
    private int ioThreads = 4;
}
