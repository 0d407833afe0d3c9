package com.nifty.bulk.client.web;

import com.nifty.bulk.client.common.exception.Http;
import com.nifty.bulk.client.dto.LedgerDeltaDTO;
import com.nifty.bulk.client.service.ClientSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final ClientSessionService client;

    @GetMapping("/balance")
    public ResponseEntity<?> balance() {
        return Http.from(client.balance());
    }

    @GetMapping("/coins")
    public ResponseEntity<?> coins() {
        return Http.from(client.coinBalance());
    }

    @GetMapping("/wallet")
    public ResponseEntity<?> wallet() {
        return Http.from(client.walletBalance());
    }

    @PostMapping("/coins/deduct")
    public ResponseEntity<?> deduct(@Valid @RequestBody LedgerDeltaDTO req) {
        return Http.from(client.deductCoins(req.amount(), req.reason(), req.relatedTradeId()));
    }

    @PostMapping("/coins/add")
    public ResponseEntity<?> add(@Valid @RequestBody LedgerDeltaDTO req) {
        return Http.from(client.addCoins(req.amount(), req.reason(), req.relatedTradeId()));
    }

    @GetMapping("/coins/validate")
    public ResponseEntity<?> validate(@RequestParam("amount") BigDecimal amount) {
        return Http.from(client.validateSufficientCoins(amount));
    }
}
