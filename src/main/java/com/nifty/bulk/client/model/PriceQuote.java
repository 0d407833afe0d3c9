package com.nifty.bulk.client.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class PriceQuote {
    String instrumentSymbol;
    BigDecimal price;
    Instant asOf;
}
