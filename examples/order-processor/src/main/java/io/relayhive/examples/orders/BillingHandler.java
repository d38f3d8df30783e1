package io.relayhive.examples.orders;

import io.relayhive.core.message.Envelope;
import io.relayhive.core.pipeline.MessageHandler;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Charges each created order once. Orders with a non-positive amount fail, which sends them
 * through the retry cycle and eventually to the dead-letter queue.
 */
@Component
class BillingHandler implements MessageHandler<OrderCreated> {

  private static final Logger log = LoggerFactory.getLogger(BillingHandler.class);

  private final Map<String, BigDecimal> charged = new ConcurrentHashMap<>();

  @Override
  public void handle(Envelope<OrderCreated> envelope) {
    OrderCreated order = envelope.message();
    if (order.amount() == null || order.amount().signum() <= 0) {
      throw new IllegalArgumentException("order " + order.orderId() + " has no chargeable amount");
    }
    BigDecimal previous = charged.putIfAbsent(order.orderId(), order.amount());
    if (previous != null) {
      log.info("order already charged orderId={} envelopeId={}", order.orderId(), envelope.meta().id());
      return;
    }
    log.info("charged orderId={} customerId={} amount={}", order.orderId(), order.customerId(), order.amount());
  }

  boolean isCharged(String orderId) {
    return charged.containsKey(orderId);
  }
}
