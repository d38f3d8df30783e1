package io.relayhive.examples.orders;

import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.consumer.ProcessorRegistration;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
class OrderProcessorConfiguration {

  static final String ORDER_CREATED = "order.created";
  static final String BILLING = "billing";

  @Bean
  ProcessorRegistration<OrderCreated> billingProcessor(BillingHandler handler) {
    ProcessorConfig config = ProcessorConfig.builder(BILLING)
        .maxAttempts(3)
        .retryDelay(Duration.ofSeconds(10))
        .build();
    return ProcessorRegistration.of(ORDER_CREATED, config, OrderCreated.class, handler);
  }
}
