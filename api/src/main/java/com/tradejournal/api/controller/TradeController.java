package com.tradejournal.api.controller;

import com.tradejournal.application.service.TradeCommandService;
import com.tradejournal.application.validation.TradeValidationException;
import com.tradejournal.domain.exception.PublishException;
import com.tradejournal.domain.model.ClosedTrade;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.model.TradeClosure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for trade journal operations.
 *
 * <p>Write endpoints only publish events; the relay consumer applies them to
 * the store. A 2xx response therefore means the event was acknowledged by the
 * broker, not that the store already reflects it.
 */
@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private static final Logger log = LoggerFactory.getLogger(TradeController.class);

    private final TradeCommandService commandService;

    public TradeController(TradeCommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping("/live")
    public ResponseEntity<?> createLiveTrade(@RequestBody LiveTrade request) {
        return handle(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(commandService.createLiveTrade(request)));
    }

    @PutMapping("/live/{id}")
    public ResponseEntity<?> updateLiveTrade(@PathVariable String id, @RequestBody LiveTradeUpdate request) {
        return handle(() -> ResponseEntity.ok(commandService.updateLiveTrade(id, request)));
    }

    @DeleteMapping("/live/{id}")
    public ResponseEntity<?> deleteLiveTrade(@PathVariable String id) {
        return handle(() -> {
            commandService.deleteLiveTrade(id);
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/live/{id}/close")
    public ResponseEntity<?> closeLiveTrade(@PathVariable String id, @RequestBody TradeClosure request) {
        return handle(() -> {
            commandService.closeLiveTrade(id, request);
            return ResponseEntity.ok(Map.of("message", "Trade closed"));
        });
    }

    @GetMapping("/live")
    public ResponseEntity<?> getLiveTrades(@RequestParam(required = false) String accountId) {
        return handle(() -> {
            List<LiveTrade> trades = commandService.findLiveTrades(accountId);
            return ResponseEntity.ok(trades);
        });
    }

    @GetMapping("/closed")
    public ResponseEntity<?> getClosedTrades(@RequestParam(required = false) String accountId) {
        return handle(() -> {
            List<ClosedTrade> trades = commandService.findClosedTrades(accountId);
            return ResponseEntity.ok(trades);
        });
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Invalid request body", "errors", List.of(e.getMostSpecificCause().getMessage())));
    }

    private ResponseEntity<?> handle(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (TradeValidationException e) {
            log.warn("Trade request rejected: {}", e.getErrors());
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Validation failed", "errors", e.getErrors()));
        } catch (PublishException e) {
            log.error("Trade event could not be published: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", e.getMessage()));
        }
    }
}
