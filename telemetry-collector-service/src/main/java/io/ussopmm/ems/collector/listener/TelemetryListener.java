package io.ussopmm.ems.collector.listener;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.ussopmm.ems.collector.router.InboundMessage;
import io.ussopmm.ems.collector.router.IngestionRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Consumes the bridge topic. The rule engine keys each record with the MQTT topic it came from,
 * so messages of one sensor type stay on one partition and are routed in arrival order; other
 * partitions run in parallel on the other consumers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ems.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class TelemetryListener {

    private final IngestionRouter router;

    @KafkaListener(
            topics = "${ems.router.topic}",
            groupId = "${spring.kafka.consumer.group-id}",
            batch = "true",
            containerFactory = "kafkaConsumerContainerFactory"
    )
    public void listen(List<ConsumerRecord<String, String>> records, Acknowledgment ack) {
        log.info("Telemetry received: {} messages", records.size());
        var tracer = GlobalOpenTelemetry.getTracer(TelemetryListener.class.getName());
        var span = tracer.spanBuilder("telemetryListener.listen").startSpan();
        try (var ignored = span.makeCurrent()) {
            // sequential and blocking: the next poll must not overtake this batch
            Flux.fromIterable(records)
                    .concatMap(rec -> router.route(new InboundMessage(rec.key(), rec.value())))
                    .then()
                    .block();
            ack.acknowledge();
            span.setAttribute("routed.count", records.size());
            log.info("Telemetry batch [amount of {}] routed & acked", records.size());
        } finally {
            span.end();
        }
    }
}
