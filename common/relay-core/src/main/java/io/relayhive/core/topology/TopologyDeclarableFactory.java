package io.relayhive.core.topology;

import io.relayhive.core.config.ProcessorConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

/**
 * Converts a processor configuration into the AMQP declarables of its retry cycle:
 * <pre>
 *   router --topic,name--> main --(nack)--> dead-letter exchange --name--> retry
 *   retry --(ttl expiry)--> router --name--> main
 *   dead-letter exchange --dlq name--> dead-letter queue
 * </pre>
 */
public final class TopologyDeclarableFactory {

    public DirectExchange routerExchange() {
        return ExchangeBuilder.directExchange(TopologyNames.ROUTER_EXCHANGE).durable(true).build();
    }

    public DirectExchange deadLetterExchange() {
        return ExchangeBuilder.directExchange(TopologyNames.DEAD_LETTER_EXCHANGE).durable(true).build();
    }

    public Declarables create(String topic, ProcessorConfig config) {
        requireText(topic, "topic");
        Objects.requireNonNull(config, "config");
        TopologyNames names = TopologyNames.forProcessor(config.name());
        DirectExchange router = routerExchange();
        DirectExchange deadLetter = deadLetterExchange();

        Queue main = QueueBuilder.durable(names.main())
            .deadLetterExchange(deadLetter.getName())
            .deadLetterRoutingKey(names.main())
            .build();
        QueueBuilder retryBuilder = QueueBuilder.durable(names.retry())
            .deadLetterExchange(router.getName());
        if (!config.usePolicyForDelay()) {
            retryBuilder.ttl(Math.toIntExact(config.retryDelay().toMillis()));
        }
        Queue retry = retryBuilder.build();
        Queue deadLetterQueue = QueueBuilder.durable(names.deadLetter())
            .deadLetterExchange(router.getName())
            .deadLetterRoutingKey(names.main())
            .build();

        List<Declarable> declarables = new ArrayList<>();
        declarables.add(router);
        declarables.add(deadLetter);
        declarables.add(main);
        declarables.add(retry);
        declarables.add(deadLetterQueue);
        declarables.add(bind(main, router, topic));
        if (!topic.equals(names.main())) {
            declarables.add(bind(main, router, names.main()));
        }
        declarables.add(bind(retry, deadLetter, names.main()));
        declarables.add(bind(deadLetterQueue, deadLetter, names.deadLetter()));
        return new Declarables(declarables);
    }

    private static Binding bind(Queue queue, DirectExchange exchange, String routingKey) {
        return BindingBuilder.bind(queue).to(exchange).with(routingKey);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }
}
