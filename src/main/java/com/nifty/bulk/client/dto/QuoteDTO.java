package com.nifty.bulk.client.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Quote pushed into the local feed; a missing {@code asOf} means "now".
 */
public record QuoteDTO(
        @NotBlank(message = "Instrument symbol cannot be blank")
        String instrumentSymbol,

        @NotNull(message = "Price cannot be null")
        @Positive(message = "Price must be positive")
        BigDecimal price,

        Instant asOf
) {
}
