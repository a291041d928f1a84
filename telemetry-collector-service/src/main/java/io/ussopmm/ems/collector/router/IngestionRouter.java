package io.ussopmm.ems.collector.router;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import io.ussopmm.ems.collector.config.RouterProperties;
import io.ussopmm.ems.collector.helpers.IngestMetrics;
import io.ussopmm.ems.model.Reading;
import io.ussopmm.ems.model.ReadingCodec;
import io.ussopmm.ems.model.ReadingValidationException;
import io.ussopmm.ems.model.SensorType;
import io.ussopmm.ems.store.StorageRecord;
import io.ussopmm.ems.store.StoreUnavailableException;
import io.ussopmm.ems.store.TimeSeriesStore;
import io.ussopmm.ems.store.config.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps inbound device messages to storage records.
 * <p>
 * The partition key comes from the topic, the sort key from the ingest clock (second precision),
 * never from the device. Store writes are retried while the store reports itself unavailable.
 * Whatever fails, the message ends up as an error record and {@link #route} completes normally:
 * the message counts as consumed either way.
 * <p>
 * Two messages of the same sensor type ingested within the same second share a key; the later
 * write wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionRouter {

    private static final int MAX_REASON_LENGTH = 1000;

    private final TimeSeriesStore store;
    private final ReadingCodec codec;
    private final IngestMetrics metrics;
    private final RouterProperties properties;
    private final StoreProperties storeProperties;
    private final Clock clock;

    @WithSpan("ingestionRouter.route")
    public Mono<Void> route(InboundMessage message) {
        // store writes complete on boundedElastic, where this span is no longer current
        Span span = Span.current();
        return Mono.defer(() -> {
                    Instant ingestedAt = clock.instant();
                    StorageRecord record;
                    try {
                        record = toRecord(message, ingestedAt);
                    } catch (RuntimeException e) {
                        return divert(span, message, null, ingestedAt, e);
                    }
                    return withRetry(Mono.fromRunnable(() -> store.put(record)), message)
                            .doOnSuccess(v -> {
                                metrics.incStored(record.getPartitionKey());
                                log.debug("Stored reading of {} in {} at {}",
                                        record.getDeviceId(), record.getPartitionKey(), record.getSortKey());
                            })
                            .onErrorResume(ex -> divert(span, message, record.getDeviceId(), ingestedAt, ex));
                })
                .onErrorResume(ex -> {
                    log.error("Routing of message from {} failed unexpectedly", message.topic(), ex);
                    return Mono.empty();
                });
    }

    StorageRecord toRecord(InboundMessage message, Instant ingestedAt) {
        String partition = sensorTypeOf(message.topic());
        Reading reading = codec.decode(message.payload());
        if (reading.sensorType() != null && !reading.sensorType().equals(partition)) {
            throw new ReadingValidationException("payload sensor_type " + reading.sensorType()
                    + " does not match topic " + message.topic());
        }
        return StorageRecord.builder()
                .partitionKey(partition)
                .sortKey(ingestedAt.truncatedTo(ChronoUnit.SECONDS))
                .deviceId(reading.deviceId())
                .payload(reading.values())
                .ttlEpochSeconds(ingestedAt.plus(storeProperties.getRetention()).getEpochSecond())
                .schemaVersion(reading.schemaVersion())
                .build();
    }

    String sensorTypeOf(String topic) {
        if (topic == null) {
            throw new ReadingValidationException("message has no topic");
        }
        String[] segments = topic.split("/");
        int index = properties.getSensorTypeSegment();
        if (index >= segments.length) {
            throw new ReadingValidationException("topic " + topic + " has no sensor type segment");
        }
        return SensorType.fromId(segments[index])
                .map(SensorType::id)
                .orElseThrow(() -> new ReadingValidationException(
                        "topic " + topic + " does not name a known sensor type"));
    }

    private Mono<Void> divert(Span span, InboundMessage message, String deviceId, Instant ingestedAt, Throwable ex) {
        String partition = partitionTag(message.topic());
        String cause = causeCode(ex);
        try (var ignored1 = MDC.putCloseable("topic", String.valueOf(message.topic()));
             var ignored2 = MDC.putCloseable("partition", partition);
             var ignored3 = MDC.putCloseable("deviceId", String.valueOf(deviceId))) {
            if (ex instanceof ReadingValidationException) {
                log.warn("Rejected message from {}: {}", message.topic(), ex.getMessage());
            } else {
                log.error("Storing message from {} failed, diverting to {}", message.topic(),
                        SensorType.ERROR_PARTITION, ex);
            }
        }
        metrics.incError(partition, cause);
        spanCompletion(span, message, ex, cause);

        StorageRecord error = StorageRecord.builder()
                .partitionKey(SensorType.ERROR_PARTITION)
                .sortKey(ingestedAt.truncatedTo(ChronoUnit.MILLIS))
                .deviceId(deviceId)
                .ttlEpochSeconds(ingestedAt.plus(storeProperties.getRetention()).getEpochSecond())
                .rawPayload(message.payload())
                .sourceTopic(message.topic())
                .failureReason(cause + ": " + safeMsg(ex))
                .build();
        return withRetry(Mono.fromRunnable(() -> store.put(error)), message)
                .onErrorResume(writeEx -> {
                    log.error("Error record for message from {} could not be written either", message.topic(), writeEx);
                    return Mono.empty();
                });
    }

    private Mono<Void> withRetry(Mono<Object> write, InboundMessage message) {
        RouterProperties.Retry retry = properties.getRetry();
        return write
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(Retry.backoff(retry.getMaxAttempts(), retry.getMinBackoff())
                        .maxBackoff(retry.getMaxBackoff())
                        .jitter(0.5)
                        .filter(StoreUnavailableException.class::isInstance)
                        .doBeforeRetry(sig -> log.warn("Retry #{} for message from {}, cause={}",
                                sig.totalRetries() + 1, message.topic(), sig.failure().toString()))
                        .onRetryExhaustedThrow((spec, sig) -> sig.failure()))
                .then();
    }

    private String partitionTag(String topic) {
        try {
            return sensorTypeOf(topic);
        } catch (ReadingValidationException e) {
            return "unknown";
        }
    }

    static String causeCode(Throwable ex) {
        if (ex instanceof ReadingValidationException) {
            return "VALIDATION";
        }
        Throwable e = ex;
        while (e.getCause() != null && e != e.getCause()) {
            e = e.getCause();
        }
        if (e instanceof TimeoutException || e instanceof SocketTimeoutException) {
            return "STORE_TIMEOUT";
        }
        if (ex instanceof StoreUnavailableException) {
            return "STORE_UNAVAILABLE";
        }
        return "OTHER";
    }

    private static void spanCompletion(Span span, InboundMessage message, Throwable ex, String cause) {
        span.setAttribute("mqtt.topic", String.valueOf(message.topic()));
        span.setAttribute("ingest.cause", cause);
        span.recordException(ex);
        span.setStatus(StatusCode.ERROR, ex.getMessage() == null ? "" : ex.getMessage());
    }

    private static String safeMsg(Throwable ex) {
        String m = ex.getMessage();
        return m == null ? ex.getClass().getSimpleName() : (m.length() > MAX_REASON_LENGTH ? m.substring(0, MAX_REASON_LENGTH) : m);
    }
}
