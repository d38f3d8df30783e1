package io.relayhive.examples.orders;

import io.relayhive.core.RelayHive;
import io.relayhive.core.message.Envelope;
import org.springframework.stereotype.Component;

/**
 * Publishes order events for the billing processor and any other subscriber of the topic.
 */
@Component
class OrderEvents {

  private final RelayHive relayHive;

  OrderEvents(RelayHive relayHive) {
    this.relayHive = relayHive;
  }

  String orderCreated(OrderCreated order) {
    Envelope<OrderCreated> envelope = relayHive.publish(OrderProcessorConfiguration.ORDER_CREATED, order);
    return envelope.meta().id();
  }
}
