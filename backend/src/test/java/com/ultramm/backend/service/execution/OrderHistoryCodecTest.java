package com.ultramm.backend.service.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ultramm.backend.exception.TradingException;
import com.ultramm.backend.model.Order;
import com.ultramm.backend.model.OrderState;
import com.ultramm.backend.model.OrderType;
import com.ultramm.backend.model.Side;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderHistoryCodecTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final OrderHistoryCodec codec = new OrderHistoryCodec(new ObjectMapper().findAndRegisterModules());

    @Test
    void encodedHistoryDecodesToSameLifecycle() {
        Order order = order();
        order.transitionTo(OrderState.SUBMITTED, "acknowledged", T0.plusMillis(5));
        order.applyFill(0.04, 50000);
        order.transitionTo(OrderState.PARTIALLY_FILLED, "filled 0.04", T0.plusMillis(10));
        order.applyFill(0.06, 50000);
        order.transitionTo(OrderState.FILLED, "filled 0.06", T0.plusMillis(20));

        OrderHistoryCodec.OrderHistory decoded = codec.decode(codec.encode(order));

        assertThat(decoded).isEqualTo(codec.toHistory(order));
        assertThat(decoded.transitions()).hasSize(3);
        assertThat(decoded.transitions().get(2).at()).isEqualTo(T0.plusMillis(20));
    }

    @Test
    void historyWithImpossibleTransitionIsRejected() {
        Order order = order();
        order.transitionTo(OrderState.SUBMITTED, "acknowledged", T0);
        String json = codec.encode(order).replace("\"from\":\"NEW\"", "\"from\":\"FILLED\"");

        assertThatThrownBy(() -> codec.decode(json))
                .isInstanceOf(TradingException.class)
                .hasMessageContaining("Inconsistent history");
    }

    @Test
    void historyEndingElsewhereThanStateIsRejected() {
        Order order = order();
        order.transitionTo(OrderState.SUBMITTED, "acknowledged", T0);
        String json = codec.encode(order).replace("\"state\":\"SUBMITTED\"", "\"state\":\"CANCELED\"");

        assertThatThrownBy(() -> codec.decode(json)).hasMessageContaining("ends in SUBMITTED");
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> codec.decode("{not json")).isInstanceOf(TradingException.class);
    }

    private static Order order() {
        return Order.builder()
                .id("o-1")
                .symbol("BTC/USDT")
                .side(Side.BUY)
                .type(OrderType.LIMIT)
                .price(50000)
                .size(0.1)
                .createdAt(T0)
                .build();
    }
}
