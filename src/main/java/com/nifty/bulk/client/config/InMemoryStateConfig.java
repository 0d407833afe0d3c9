package com.nifty.bulk.client.config;

import com.nifty.bulk.client.common.constants.StoreProperties;
import com.nifty.bulk.client.core.InMemoryStateStore;
import com.nifty.bulk.client.core.StateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "client.store.type", havingValue = "memory")
public class InMemoryStateConfig {

    @Bean
    public StateStore stateStore(StoreProperties props) {
        return new InMemoryStateStore(props.getKeyPrefix());
    }
}
