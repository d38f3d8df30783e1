package io.relayhive.core.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.relayhive.core.message.InboundMessage;
import io.relayhive.core.pipeline.ProcessingPipeline;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.RabbitUtils;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.amqp.rabbit.support.DefaultMessagePropertiesConverter;
import org.springframework.amqp.rabbit.support.MessagePropertiesConverter;

/**
 * Runs each delivery of a processor's listener container through a fresh pipeline, on the
 * channel the container consumed it from.
 * <p>
 * A failure that escapes the pipeline leaves the delivery unsettled. The channel is then closed
 * physically so the broker requeues the delivery and the container replaces the consumer.
 */
final class ProcessorListener implements ChannelAwareMessageListener {

    static final String MDC_PROCESSOR = "relayhive.processor";
    static final String MDC_MESSAGE_ID = "relayhive.messageId";

    private static final Logger log = LoggerFactory.getLogger(ProcessorListener.class);

    private final String processor;
    private final String queue;
    private final Supplier<ProcessingPipeline> pipelines;
    private final MessagePropertiesConverter propertiesConverter = new DefaultMessagePropertiesConverter();

    ProcessorListener(String processor, String queue, Supplier<ProcessingPipeline> pipelines) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pipelines = Objects.requireNonNull(pipelines, "pipelines");
    }

    @Override
    public void onMessage(Message message, Channel channel) {
        InboundMessage inbound = toInbound(message, channel);
        String previousProcessor = MDC.get(MDC_PROCESSOR);
        String previousMessageId = MDC.get(MDC_MESSAGE_ID);
        try {
            MDC.put(MDC_PROCESSOR, processor);
            if (inbound.messageId() != null) {
                MDC.put(MDC_MESSAGE_ID, inbound.messageId());
            }
            pipelines.get().process(inbound);
        } catch (RuntimeException ex) {
            if (!inbound.isSettled()) {
                closeChannel(channel, inbound);
            }
            throw ex;
        } finally {
            restore(MDC_PROCESSOR, previousProcessor);
            restore(MDC_MESSAGE_ID, previousMessageId);
        }
    }

    InboundMessage toInbound(Message message, Channel channel) {
        MessageProperties props = message.getMessageProperties();
        AMQP.BasicProperties properties =
            propertiesConverter.fromMessageProperties(props, StandardCharsets.UTF_8.name());
        return new InboundMessage(
            channel,
            queue,
            props.getDeliveryTag(),
            props.getReceivedExchange(),
            props.getReceivedRoutingKey(),
            Boolean.TRUE.equals(props.getRedelivered()),
            properties,
            message.getBody());
    }

    private void closeChannel(Channel channel, InboundMessage inbound) {
        log.warn("closing consumer channel, delivery left unsettled processor={} queue={} deliveryTag={}",
            processor, queue, inbound.deliveryTag());
        RabbitUtils.setPhysicalCloseRequired(channel, true);
        RabbitUtils.closeChannel(channel);
    }

    private static void restore(String key, String previousValue) {
        if (previousValue == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previousValue);
        }
    }
}
