package com.nifty.bulk.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nifty.bulk.client.enums.TransactionKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only journal entry. Trade fields are null for CREDIT/DEBIT entries.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Transaction {
    String id;
    TransactionKind kind;
    String instrumentSymbol;
    Long quantity;
    BigDecimal price;
    BigDecimal amount;
    Instant timestamp;
    String reason;
    String relatedTradeId;
}
