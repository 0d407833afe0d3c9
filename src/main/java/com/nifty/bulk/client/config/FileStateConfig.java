package com.nifty.bulk.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nifty.bulk.client.common.constants.StoreProperties;
import com.nifty.bulk.client.core.FileStateStore;
import com.nifty.bulk.client.core.StateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

@Configuration
@ConditionalOnProperty(name = "client.store.type", havingValue = "file", matchIfMissing = true)
@Slf4j
public class FileStateConfig {

    @Bean
    public StateStore stateStore(StoreProperties props, ObjectMapper mapper) {
        Path file = StringUtils.hasText(props.getFile())
                ? Paths.get(props.getFile())
                : Paths.get(System.getProperty("user.home"), ".nifty-bulk", "state.json");
        log.info("Using file state store at {}", file.toAbsolutePath());
        return new FileStateStore(file, mapper);
    }
}
