package com.tradejournal.application.validation;

import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.model.TradeClosure;
import com.tradejournal.domain.model.TradeReference;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates trade commands and event payloads.
 *
 * <p>The same rules guard both ends of the relay: HTTP handlers check a command
 * before publishing it, and the consumer re-checks the payload before applying it.
 * Each method returns an empty list when the input is valid.
 */
@Service
public class TradeValidationService {

    private static final BigDecimal MIN_STOP_LOSS = BigDecimal.ONE;
    private static final BigDecimal MAX_STOP_LOSS = new BigDecimal("8");

    public List<String> validate(TradeEventEnvelope envelope) {
        return switch (envelope.getEventType()) {
            case TRADE_CREATED -> validateNewTrade(envelope.payload(LiveTrade.class));
            case TRADE_UPDATED -> validateUpdate(envelope.payload(LiveTradeUpdate.class));
            case TRADE_DELETED -> validateDeletion(envelope.payload(TradeReference.class));
            case TRADE_CLOSED -> validateClosure(envelope.payload(TradeClosure.class));
        };
    }

    public List<String> validateNewTrade(LiveTrade trade) {
        List<String> errors = new ArrayList<>();

        requireText(trade.getId(), "Trade ID is required", errors);
        requireText(trade.getAccountId(), "Account ID is required", errors);
        requireText(trade.getSymbol(), "Symbol is required", errors);

        if (trade.getEntryPrice() == null) {
            errors.add("Entry price is required");
        }
        if (trade.getTradeType() == null) {
            errors.add("Trade type is required");
        }
        if (trade.getSize() == null) {
            errors.add("Size is required");
        }
        if (trade.getQty() == null) {
            errors.add("Quantity is required");
        }
        if (trade.getSlPercentage() == null) {
            errors.add("Stop-loss percentage is required");
        }
        if (trade.getEntryDate() == null) {
            errors.add("Entry date is required");
        }

        checkEntryPrice(trade.getEntryPrice(), errors);
        checkQty(trade.getQty(), errors);
        checkStopLoss(trade.getSlPercentage(), errors);
        return errors;
    }

    public List<String> validateUpdate(LiveTradeUpdate update) {
        List<String> errors = new ArrayList<>();

        requireText(update.getId(), "Trade ID is required", errors);
        if (!update.hasChanges()) {
            errors.add("At least one field must be updated");
        }
        if (update.getSymbol() != null && update.getSymbol().trim().isEmpty()) {
            errors.add("Symbol must not be blank");
        }
        checkEntryPrice(update.getEntryPrice(), errors);
        checkQty(update.getQty(), errors);
        checkStopLoss(update.getSlPercentage(), errors);
        return errors;
    }

    public List<String> validateClosure(TradeClosure closure) {
        List<String> errors = new ArrayList<>();

        requireText(closure.getId(), "Trade ID is required", errors);
        if (closure.getExitPrice() == null) {
            errors.add("Exit price is required");
        } else if (closure.getExitPrice().signum() <= 0) {
            errors.add("Exit price must be positive");
        }
        if (closure.getFees() != null && closure.getFees().signum() < 0) {
            errors.add("Fees must not be negative");
        }
        return errors;
    }

    public List<String> validateDeletion(TradeReference reference) {
        List<String> errors = new ArrayList<>();
        requireText(reference.getId(), "Trade ID is required", errors);
        return errors;
    }

    /**
     * Query parameter check for the read endpoints.
     */
    public List<String> validateAccountId(String accountId) {
        List<String> errors = new ArrayList<>();
        requireText(accountId, "Account ID is required", errors);
        return errors;
    }

    private static void requireText(String value, String message, List<String> errors) {
        if (value == null || value.trim().isEmpty()) {
            errors.add(message);
        }
    }

    private static void checkEntryPrice(BigDecimal entryPrice, List<String> errors) {
        if (entryPrice != null && entryPrice.signum() <= 0) {
            errors.add("Entry price must be positive");
        }
    }

    private static void checkQty(Integer qty, List<String> errors) {
        if (qty != null && qty <= 0) {
            errors.add("Quantity must be a positive integer");
        }
    }

    private static void checkStopLoss(BigDecimal slPercentage, List<String> errors) {
        if (slPercentage != null
                && (slPercentage.compareTo(MIN_STOP_LOSS) < 0 || slPercentage.compareTo(MAX_STOP_LOSS) > 0)) {
            errors.add("Stop-loss percentage must be between 1 and 8");
        }
    }
}
