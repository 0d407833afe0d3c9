package com.nifty.bulk.client.common.constants;

/**
 * Key namespaces of the shared state store. One owner per namespace.
 */
public interface StoreNamespaces {
    String SESSION = "session";     // SessionManager
    String LEDGER = "ledger";       // LedgerCache
    String PORTFOLIO = "portfolio"; // PositionBook
}
