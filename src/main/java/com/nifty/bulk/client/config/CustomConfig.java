package com.nifty.bulk.client.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nifty.bulk.client.common.constants.ApiProperties;
import com.nifty.bulk.client.common.constants.StoreProperties;
import com.nifty.bulk.client.common.constants.SyncProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({ApiProperties.class, SyncProperties.class, StoreProperties.class})
public class CustomConfig {

    @Bean
    public RestTemplate template(RestTemplateBuilder builder, ApiProperties api) {
        return builder
                .rootUri(api.getBaseUrl())
                .setConnectTimeout(api.getConnectTimeout())
                .setReadTimeout(api.getReadTimeout())
                .build();
    }

    @Bean
    @Primary
    public ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The single thread of control: timers fire here and every collaborator response is
     * posted back here before it touches client state.
     */
    @Bean(name = "syncScheduler")
    public ThreadPoolTaskScheduler syncScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("sync-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        return s;
    }

    // Blocking HTTP calls run here so the sync thread never waits on the network
    @Bean(name = "gatewayExecutor", destroyMethod = "shutdownNow")
    public ExecutorService gatewayExecutor(ApiProperties api) {
        AtomicInteger n = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, api.getIoThreads()), r -> {
            Thread t = new Thread(r, "gateway-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
