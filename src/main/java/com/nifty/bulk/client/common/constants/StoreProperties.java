package com.nifty.bulk.client.common.constants;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "client.store")
public class StoreProperties {
    private String type = "file";                     // file | memory | redis
    private String file;                             // defaults to ~/.nifty-bulk/state.json
    private String keyPrefix = "nb:";
}
