package com.ultramm.backend.service.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ultramm.backend.exception.TradingException;
import com.ultramm.backend.model.Order;
import com.ultramm.backend.model.OrderState;
import com.ultramm.backend.model.OrderTransition;
import com.ultramm.backend.model.Side;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * JSON form of an order's lifecycle, used for the audit log and the history endpoint.
 */
@Component
@RequiredArgsConstructor
public class OrderHistoryCodec {

    public record OrderHistory(
            String orderId,
            String parentId,
            String replacesOrderId,
            String symbol,
            Side side,
            double price,
            double size,
            double filledSize,
            double averageFillPrice,
            int retryCount,
            OrderState state,
            List<OrderTransition> transitions
    ) {}

    private final ObjectMapper objectMapper;

    public OrderHistory toHistory(Order order) {
        synchronized (order) {
            return new OrderHistory(order.getId(), order.getParentId(), order.getReplacesOrderId(), order.getSymbol(),
                    order.getSide(), order.getPrice(), order.getSize(), order.getFilledSize(),
                    order.getAverageFillPrice(), order.getRetryCount(), order.getState(),
                    List.copyOf(order.getHistory()));
        }
    }

    public String encode(Order order) {
        try {
            return objectMapper.writeValueAsString(toHistory(order));
        } catch (JsonProcessingException e) {
            throw new TradingException("Failed to encode history of order " + order.getId(), e);
        }
    }

    /**
     * Parses a history and checks that its transitions form a valid path from NEW to the recorded state.
     */
    public OrderHistory decode(String json) {
        OrderHistory history;
        try {
            history = objectMapper.readValue(json, OrderHistory.class);
        } catch (JsonProcessingException e) {
            throw new TradingException("Failed to decode order history", e);
        }
        OrderState state = OrderState.NEW;
        for (OrderTransition transition : history.transitions()) {
            if (transition.from() != state || !state.canTransitionTo(transition.to())) {
                throw new TradingException("Inconsistent history for order " + history.orderId() + ": "
                        + transition.from() + " -> " + transition.to() + " while in " + state);
            }
            state = transition.to();
        }
        if (state != history.state()) {
            throw new TradingException("History of order " + history.orderId() + " ends in " + state
                    + " but state is " + history.state());
        }
        return history;
    }
}
