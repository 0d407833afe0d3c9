package com.nifty.bulk.client.web;

import com.nifty.bulk.client.dto.QuoteDTO;
import com.nifty.bulk.client.model.PriceQuote;
import com.nifty.bulk.client.service.feed.PriceFeedSubscriber;
import com.nifty.bulk.client.service.gateway.InProcessPriceFeed;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/feed")
@RequiredArgsConstructor
public class FeedController {

    private final InProcessPriceFeed connection;
    private final PriceFeedSubscriber feed;
    private final Clock clock;

    /**
     * 202 when the quote reached subscribers, 204 when nobody is subscribed to the symbol.
     */
    @PostMapping("/quotes")
    public ResponseEntity<Void> push(@Valid @RequestBody QuoteDTO q) {
        PriceQuote quote = PriceQuote.builder()
                .instrumentSymbol(q.instrumentSymbol())
                .price(q.price())
                .asOf(q.asOf() == null ? clock.instant() : q.asOf())
                .build();
        boolean delivered = connection.publish(quote);
        return delivered ? ResponseEntity.accepted().build() : ResponseEntity.noContent().build();
    }

    @GetMapping("/quotes")
    public ResponseEntity<Map<String, PriceQuote>> quotes() {
        return ResponseEntity.ok(feed.latestQuotes());
    }
}
