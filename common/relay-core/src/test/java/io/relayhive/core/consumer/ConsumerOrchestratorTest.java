package io.relayhive.core.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import io.relayhive.core.config.ConsumerSettings;
import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.connection.ConnectionManager;
import io.relayhive.core.management.QueueMetadataManager;
import io.relayhive.core.message.EnvelopeCodec;
import io.relayhive.core.metrics.ProcessingMetrics;
import io.relayhive.core.retry.XDeathRetryLedger;
import io.relayhive.core.testing.Deliveries;
import io.relayhive.core.testing.MockBroker;
import io.relayhive.core.topology.TopologyException;
import io.relayhive.core.topology.TopologyNames;
import io.relayhive.core.topology.TopologyPlanner;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ConsumerOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final MockBroker broker = new MockBroker();
    private final Channel channel = broker.channel();
    private final ConnectionManager connections = mock(ConnectionManager.class);
    private final TopologyPlanner planner = mock(TopologyPlanner.class);
    private final QueueMetadataManager metadata = mock(QueueMetadataManager.class);
    private final ProcessorConfig config = ProcessorConfig.builder("billing").consumersCount(2).maxAttempts(3).build();
    private final ProcessorConfig single = ProcessorConfig.builder("billing").maxAttempts(3).build();
    private final List<Order> handled = new CopyOnWriteArrayList<>();
    private ConsumerOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        when(connections.connectionFactory()).thenReturn(broker.connectionFactory());
        when(planner.assertTopology(eq("order.created"), any(ProcessorConfig.class)))
            .thenReturn(TopologyNames.forProcessor("billing"));
        orchestrator = new ConsumerOrchestrator(connections, planner, metadata,
            new EnvelopeCodec(new ObjectMapper()), new XDeathRetryLedger(), ProcessingMetrics.simple(),
            new ConsumerSettings(5, Duration.ofSeconds(10), Duration.ofMillis(100)));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    @Test
    void startsManualAckConsumersWithPrefetch() throws Exception {
        orchestrator.createConsumer("order.created", config, Order.class, envelope -> handled.add(envelope.message()));

        verify(channel, timeout(WAIT.toMillis()).times(2)).basicQos(eq(5), anyBoolean());
        verify(channel, timeout(WAIT.toMillis()).times(2))
            .basicConsume(eq("billing"), eq(false), anyString(), anyBoolean(), anyBoolean(), anyMap(), any(Consumer.class));
        assertThat(orchestrator.processors()).containsExactly("billing");
        assertThat(orchestrator.activeConsumers("billing")).isEqualTo(2);
    }

    @Test
    void deliveryIsHandledAndAcknowledged() throws Exception {
        orchestrator.createConsumer("order.created", single, Order.class, envelope -> handled.add(envelope.message()));
        MockBroker.Subscription subscription = broker.awaitSubscriptions(1, WAIT);

        subscription.deliver(Deliveries.DELIVERY_TAG, "order.created", Deliveries.propertiesWithDeaths("m-1"),
            Deliveries.envelopeJson("{\"orderId\":\"o-1\"}", "m-1", 1L));

        verify(channel, timeout(WAIT.toMillis())).basicAck(Deliveries.DELIVERY_TAG, false);
        assertThat(handled).containsExactly(new Order("o-1"));
    }

    @Test
    void consumerIsReplacedAfterItsChannelCloses() throws Exception {
        orchestrator.createConsumer("order.created", single, Order.class, envelope -> handled.add(envelope.message()));
        MockBroker.Subscription first = broker.awaitSubscriptions(1, WAIT);

        first.channelClosed(channel);

        MockBroker.Subscription replacement = broker.awaitSubscriptions(2, WAIT);
        assertThat(replacement.queue()).isEqualTo("billing");
        assertThat(replacement.tag()).isNotEqualTo(first.tag());
        replacement.deliver(7L, "order.created", Deliveries.propertiesWithDeaths("m-2"),
            Deliveries.envelopeJson("{\"orderId\":\"o-2\"}", "m-2", 1L));
        verify(channel, timeout(WAIT.toMillis())).basicAck(7L, false);
        assertThat(handled).containsExactly(new Order("o-2"));
    }

    @Test
    void stopWaitsForInFlightDeliveryBeforeClosingChannel() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        orchestrator.createConsumer("order.created", single, Order.class, envelope -> {
            entered.countDown();
            assertThat(release.await(10, TimeUnit.SECONDS)).isTrue();
            handled.add(envelope.message());
        });
        MockBroker.Subscription subscription = broker.awaitSubscriptions(1, WAIT);
        subscription.deliver(Deliveries.DELIVERY_TAG, "order.created", Deliveries.propertiesWithDeaths("m-3"),
            Deliveries.envelopeJson("{\"orderId\":\"o-3\"}", "m-3", 1L));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        Thread stopper = new Thread(() -> orchestrator.stop("billing"), "stopper");
        stopper.start();
        verify(channel, timeout(WAIT.toMillis())).basicCancel(subscription.tag());
        Thread.sleep(200);

        assertThat(stopper.isAlive()).isTrue();
        verify(channel, never()).close();
        verify(channel, never()).basicAck(anyLong(), anyBoolean());

        release.countDown();
        stopper.join(WAIT.toMillis() * 2);

        assertThat(stopper.isAlive()).isFalse();
        verify(channel, timeout(WAIT.toMillis())).close();
        InOrder order = inOrder(channel);
        order.verify(channel).basicAck(Deliveries.DELIVERY_TAG, false);
        order.verify(channel).close();
        assertThat(handled).containsExactly(new Order("o-3"));
        assertThat(orchestrator.processors()).isEmpty();
        assertThat(orchestrator.activeConsumers("billing")).isZero();
    }

    @Test
    void storesMetadataWhenManagementIsEnabled() {
        when(metadata.isEnabled()).thenReturn(true);
        when(metadata.apply("billing", 3)).thenReturn(true);

        orchestrator.createConsumer("order.created", config, Order.class, envelope -> { });

        verify(metadata).apply("billing", 3);
    }

    @Test
    void skipsMetadataWhenManagementIsDisabled() {
        orchestrator.createConsumer("order.created", config, Order.class, envelope -> { });

        verify(metadata, never()).apply(anyString(), anyInt());
    }

    @Test
    void duplicateProcessorNameIsRejected() {
        orchestrator.createConsumer("order.created", config, Order.class, envelope -> { });

        assertThatThrownBy(() -> orchestrator.createConsumer("order.created", config, Order.class, envelope -> { }))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("billing");
        verify(planner, times(1)).assertTopology("order.created", config);
    }

    @Test
    void topologyFailureStartsNoConsumer() {
        when(planner.assertTopology("order.created", config)).thenThrow(new TopologyException("queue mismatch"));

        assertThatThrownBy(() -> orchestrator.createConsumer("order.created", config, Order.class, envelope -> { }))
            .isInstanceOf(TopologyException.class);
        verify(broker.connectionFactory(), never()).createConnection();
        assertThat(orchestrator.processors()).isEmpty();
    }

    @Test
    void stoppingUnknownProcessorIsIgnored() {
        orchestrator.stop("unknown");

        assertThat(orchestrator.activeConsumers("unknown")).isZero();
    }

    record Order(String orderId) {
    }
}
