package io.ussopmm.ems.collector.listener;

import io.ussopmm.ems.collector.router.InboundMessage;
import io.ussopmm.ems.collector.router.IngestionRouter;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelemetryListenerTest {

    @Mock
    IngestionRouter router;
    @Mock
    Acknowledgment ack;

    TelemetryListener listener;

    @BeforeEach
    void setUp() {
        listener = new TelemetryListener(router);
    }

    private static ConsumerRecord<String, String> record(long offset, String mqttTopic, String payload) {
        return new ConsumerRecord<>("ems-telemetry", 1, offset, mqttTopic, payload);
    }

    @Test
    void listen_routesBatchInOrderThenAcks() {
        // given
        when(router.route(any())).thenReturn(Mono.empty());
        List<ConsumerRecord<String, String>> batch = List.of(
                record(1, "ems/hvac", "{\"n\":1}"),
                record(2, "ems/hvac", "{\"n\":2}"),
                record(3, "ems/dhw", "{\"n\":3}"));

        // when
        listener.listen(batch, ack);

        // then
        InOrder order = inOrder(router, ack);
        order.verify(router).route(new InboundMessage("ems/hvac", "{\"n\":1}"));
        order.verify(router).route(new InboundMessage("ems/hvac", "{\"n\":2}"));
        order.verify(router).route(new InboundMessage("ems/dhw", "{\"n\":3}"));
        order.verify(ack).acknowledge();
    }

    @Test
    void listen_waitsForSlowRouteBeforeStartingNext() {
        // given
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(router.route(any())).thenAnswer(inv -> Mono.delay(Duration.ofMillis(20))
                .doOnSubscribe(s -> maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                .doOnTerminate(inFlight::decrementAndGet)
                .then());

        // when
        listener.listen(List.of(record(1, "ems/hvac", "a"), record(2, "ems/hvac", "b")), ack);

        // then
        assertThat(maxInFlight.get()).isEqualTo(1);
        verify(ack).acknowledge();
    }
}
