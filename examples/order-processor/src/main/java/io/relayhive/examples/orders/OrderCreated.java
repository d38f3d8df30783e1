package io.relayhive.examples.orders;

import java.math.BigDecimal;

/**
 * Payload published on {@code order.created}.
 */
public record OrderCreated(String orderId, String customerId, BigDecimal amount) {
}
