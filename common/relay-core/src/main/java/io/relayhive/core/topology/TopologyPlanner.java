package io.relayhive.core.topology;

import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.management.TtlPolicyManager;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;

/**
 * Declares the main, retry and dead-letter queues of a processor together with both routers
 * and their bindings.
 * <p>
 * Declarations are passive on repeat: asserting the same processor twice with the same
 * configuration leaves the broker unchanged.
 */
public class TopologyPlanner {

    private static final Logger log = LoggerFactory.getLogger(TopologyPlanner.class);

    private final AmqpAdmin amqpAdmin;
    private final TtlPolicyManager ttlPolicyManager;
    private final TopologyDeclarableFactory declarableFactory;

    public TopologyPlanner(AmqpAdmin amqpAdmin, TtlPolicyManager ttlPolicyManager) {
        this(amqpAdmin, ttlPolicyManager, new TopologyDeclarableFactory());
    }

    public TopologyPlanner(AmqpAdmin amqpAdmin,
                           TtlPolicyManager ttlPolicyManager,
                           TopologyDeclarableFactory declarableFactory) {
        this.amqpAdmin = Objects.requireNonNull(amqpAdmin, "amqpAdmin");
        this.ttlPolicyManager = Objects.requireNonNull(ttlPolicyManager, "ttlPolicyManager");
        this.declarableFactory = Objects.requireNonNull(declarableFactory, "declarableFactory");
    }

    /**
     * Declares the topology of {@code config}, routing {@code topic} to its main queue.
     *
     * @throws TtlPolicyUndefinedException when the retry delay is delegated to a policy and the
     *                                     policy could not be applied
     * @throws TopologyException when the broker refuses a declaration
     */
    public TopologyNames assertTopology(String topic, ProcessorConfig config) {
        Objects.requireNonNull(config, "config");
        TopologyNames names = TopologyNames.forProcessor(config.name());
        Declarables declarables = declarableFactory.create(topic, config);
        for (Declarable declarable : declarables.getDeclarables()) {
            declare(declarable, config.name());
        }
        if (config.usePolicyForDelay()) {
            if (!ttlPolicyManager.apply(names.retry(), config.retryDelay())) {
                log.error("TTL policy could not be applied processor={} queue={} enabled={}",
                    config.name(), names.retry(), ttlPolicyManager.isEnabled());
                throw new TtlPolicyUndefinedException(names.retry());
            }
        }
        log.info("topology asserted processor={} topic={} main={} retry={} dlq={} retryDelayMs={} policyDelay={}",
            config.name(), topic, names.main(), names.retry(), names.deadLetter(),
            config.retryDelay().toMillis(), config.usePolicyForDelay());
        return names;
    }

    private void declare(Declarable declarable, String processor) {
        try {
            if (declarable instanceof Exchange exchange) {
                amqpAdmin.declareExchange(exchange);
            } else if (declarable instanceof Queue queue) {
                amqpAdmin.declareQueue(queue);
            } else if (declarable instanceof Binding binding) {
                amqpAdmin.declareBinding(binding);
            } else {
                throw new IllegalArgumentException("Unsupported declarable " + declarable);
            }
        } catch (AmqpException ex) {
            throw new TopologyException("Failed to declare " + describe(declarable)
                + " for processor '" + processor + "'", ex);
        }
    }

    private static String describe(Declarable declarable) {
        if (declarable instanceof Exchange exchange) {
            return "exchange '" + exchange.getName() + "'";
        }
        if (declarable instanceof Queue queue) {
            return "queue '" + queue.getName() + "' with arguments " + queue.getArguments();
        }
        if (declarable instanceof Binding binding) {
            return "binding " + binding.getExchange() + " -> " + binding.getDestination()
                + " on '" + binding.getRoutingKey() + "'";
        }
        return String.valueOf(declarable);
    }
}
