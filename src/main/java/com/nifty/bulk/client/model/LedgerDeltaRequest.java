package com.nifty.bulk.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerDeltaRequest {
    String userId;
    BigDecimal amount;
    String reason;
    String relatedTradeId;
}
