package io.relayhive.core.topology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.relayhive.core.config.ProcessorConfig;
import io.relayhive.core.management.TtlPolicyManager;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpIOException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;

@ExtendWith(MockitoExtension.class)
class TopologyPlannerTest {

    @Mock
    private AmqpAdmin amqpAdmin;

    @Mock
    private TtlPolicyManager ttlPolicyManager;

    private TopologyPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new TopologyPlanner(amqpAdmin, ttlPolicyManager);
    }

    @Test
    void declaresExchangesQueuesAndBindings() {
        TopologyNames names = planner.assertTopology("order.created", ProcessorConfig.builder("billing").build());

        assertThat(names).isEqualTo(new TopologyNames("billing", "relayhive.retry.billing", "relayhive.dlq.billing"));
        verify(amqpAdmin, times(2)).declareExchange(any(Exchange.class));
        verify(amqpAdmin, times(3)).declareQueue(any(Queue.class));
        verify(amqpAdmin, times(4)).declareBinding(any(Binding.class));
        verify(ttlPolicyManager, never()).apply(any(), any());
    }

    @Test
    void assertingTwiceDeclaresIdenticalTopology() {
        List<Queue> declared = new ArrayList<>();
        when(amqpAdmin.declareQueue(any(Queue.class))).thenAnswer(invocation -> {
            Queue queue = invocation.getArgument(0);
            declared.add(queue);
            return queue.getName();
        });
        ProcessorConfig config = ProcessorConfig.builder("billing").maxAttempts(3).build();

        planner.assertTopology("order.created", config);
        planner.assertTopology("order.created", config);

        assertThat(declared).hasSize(6);
        for (int i = 0; i < 3; i++) {
            assertThat(declared.get(i + 3).getName()).isEqualTo(declared.get(i).getName());
            assertThat(declared.get(i + 3).getArguments()).isEqualTo(declared.get(i).getArguments());
        }
    }

    @Test
    void appliesTtlPolicyWhenDelayIsDelegated() {
        when(ttlPolicyManager.apply("relayhive.retry.billing", Duration.ofSeconds(30))).thenReturn(true);
        ProcessorConfig config = ProcessorConfig.builder("billing")
            .retryDelay(Duration.ofSeconds(30))
            .usePolicyForDelay(true)
            .build();

        planner.assertTopology("order.created", config);

        verify(amqpAdmin).declareQueue(argThat((Queue q) ->
            q.getName().equals("relayhive.retry.billing") && !q.getArguments().containsKey("x-message-ttl")));
        verify(ttlPolicyManager).apply("relayhive.retry.billing", Duration.ofSeconds(30));
    }

    @Test
    void failsWhenDelegatedTtlPolicyCannotBeApplied() {
        when(ttlPolicyManager.apply(any(), any())).thenReturn(false);
        ProcessorConfig config = ProcessorConfig.builder("billing").usePolicyForDelay(true).build();

        assertThatThrownBy(() -> planner.assertTopology("order.created", config))
            .isInstanceOf(TtlPolicyUndefinedException.class)
            .isInstanceOf(TopologyException.class)
            .hasMessageContaining("relayhive.retry.billing");
    }

    @Test
    void wrapsBrokerRefusalWithDeclarationContext() {
        when(amqpAdmin.declareQueue(any(Queue.class))).thenAnswer(invocation -> {
            Queue queue = invocation.getArgument(0);
            if (queue.getName().equals("relayhive.retry.billing")) {
                throw new AmqpIOException(new IOException("PRECONDITION_FAILED - inequivalent arg 'x-message-ttl'"));
            }
            return queue.getName();
        });

        assertThatThrownBy(() -> planner.assertTopology("order.created", ProcessorConfig.builder("billing").build()))
            .isInstanceOf(TopologyException.class)
            .hasMessageContaining("relayhive.retry.billing")
            .hasMessageContaining("billing")
            .hasCauseInstanceOf(AmqpIOException.class);
    }
}
