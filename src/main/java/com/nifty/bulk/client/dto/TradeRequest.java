package com.nifty.bulk.client.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record TradeRequest(
        @NotBlank(message = "Symbol cannot be blank")
        String symbol,

        @Positive(message = "Quantity must be positive")
        long quantity,

        @NotNull(message = "Price cannot be null")
        @Positive(message = "Price must be positive")
        BigDecimal price
) {
}
