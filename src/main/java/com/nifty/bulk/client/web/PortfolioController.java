package com.nifty.bulk.client.web;

import com.nifty.bulk.client.common.exception.Http;
import com.nifty.bulk.client.dto.TradeRequest;
import com.nifty.bulk.client.service.ClientSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
public class PortfolioController {

    private final ClientSessionService client;

    @GetMapping
    public ResponseEntity<?> valuation() {
        return Http.from(client.portfolio());
    }

    @GetMapping("/transactions")
    public ResponseEntity<?> transactions() {
        return Http.from(client.transactions());
    }

    @PostMapping("/buy")
    public ResponseEntity<?> buy(@Valid @RequestBody TradeRequest req) {
        return Http.from(client.buyStock(req.symbol(), req.quantity(), req.price()));
    }

    @PostMapping("/sell")
    public ResponseEntity<?> sell(@Valid @RequestBody TradeRequest req) {
        return Http.from(client.sellStock(req.symbol(), req.quantity(), req.price()));
    }
}
