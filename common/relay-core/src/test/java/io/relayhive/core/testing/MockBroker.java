package io.relayhive.core.testing;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

/**
 * A Spring AMQP connection factory whose single channel records the consumers a listener
 * container subscribes, so tests can deliver to them and cut their channel.
 */
public final class MockBroker {

    private final ConnectionFactory connectionFactory = mock(ConnectionFactory.class);
    private final Connection connection = mock(Connection.class);
    private final Channel channel = mock(Channel.class);
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger tags = new AtomicInteger();

    public MockBroker() {
        when(connectionFactory.createConnection()).thenReturn(connection);
        when(connectionFactory.getHost()).thenReturn("localhost");
        when(connectionFactory.getPort()).thenReturn(5672);
        when(connection.isOpen()).thenReturn(true);
        when(connection.createChannel(anyBoolean())).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        try {
            when(channel.basicConsume(anyString(), anyBoolean(), anyString(), anyBoolean(), anyBoolean(), anyMap(),
                any(Consumer.class)))
                .thenAnswer(invocation -> {
                    String tag = "ctag-" + tags.incrementAndGet();
                    Consumer consumer = invocation.getArgument(6);
                    consumer.handleConsumeOk(tag);
                    subscriptions.add(new Subscription(invocation.getArgument(0), tag, consumer));
                    return tag;
                });
        } catch (IOException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public ConnectionFactory connectionFactory() {
        return connectionFactory;
    }

    public Channel channel() {
        return channel;
    }

    public List<Subscription> subscriptions() {
        return List.copyOf(subscriptions);
    }

    /**
     * Waits until at least {@code count} subscriptions were made and returns the latest one.
     */
    public Subscription awaitSubscriptions(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (subscriptions.size() < count) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("expected " + count + " subscriptions but saw " + subscriptions.size());
            }
            Thread.sleep(10);
        }
        return subscriptions.get(subscriptions.size() - 1);
    }

    public record Subscription(String queue, String tag, Consumer consumer) {

        public void deliver(long deliveryTag, String routingKey, AMQP.BasicProperties properties, String body)
            throws IOException {
            consumer.handleDelivery(tag, new Envelope(deliveryTag, false, "relayhive.router", routingKey), properties,
                body.getBytes(StandardCharsets.UTF_8));
        }

        /**
         * Signals the consumer that its channel was closed by the broker.
         */
        public void channelClosed(Channel channel) {
            consumer.handleShutdownSignal(tag, new ShutdownSignalException(false, false, null, channel));
        }
    }
}
