package io.ussopmm.ems.query.engine;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.ussopmm.ems.model.Reading;
import io.ussopmm.ems.model.SensorType;
import io.ussopmm.ems.query.mapper.ReadingMapper;
import io.ussopmm.ems.store.RecordPage;
import io.ussopmm.ems.store.StorageRecord;
import io.ussopmm.ems.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reconstructs the series of one sensor type or one device over an inclusive window.
 * <p>
 * The series is emitted page by page. The next store page is fetched only once the previous one
 * has been handed downstream and the subscriber asks for more, so a slow consumer holds at most
 * the page it is working on plus one fetched ahead, however large the window. Records whose TTL
 * has elapsed but which the store has not purged yet are left out and counted per page.
 * <p>
 * The timeout is a deadline for the whole query, paging included.
 */
@Slf4j
@Service
public class QueryEngine {

    private static final Comparator<StorageRecord> BY_SORT_KEY = Comparator.comparing(StorageRecord::getSortKey);

    private final Tracer tracer = GlobalOpenTelemetry.getTracer("telemetry-query-service");

    private final TimeSeriesStore store;
    private final ReadingMapper mapper;
    private final Clock clock;
    private final Scheduler scheduler;

    @Autowired
    public QueryEngine(TimeSeriesStore store, ReadingMapper mapper, Clock clock) {
        this(store, mapper, clock, Schedulers.boundedElastic());
    }

    QueryEngine(TimeSeriesStore store, ReadingMapper mapper, Clock clock, Scheduler scheduler) {
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public Flux<SeriesPage> series(Selector selector, Window window, Duration timeout) {
        return Flux.defer(() -> {
            if (window.isInverted()) {
                return Flux.error(new InvalidWindowException(window.from(), window.to()));
            }
            if (!isQueryable(selector)) {
                log.debug("Selector {} {} matches no partition", selector.kind().id(), selector.value());
                return Flux.empty();
            }
            return pages(selector, window, new Deadline(timeout, System.nanoTime() + timeout.toNanos()));
        });
    }

    private Flux<SeriesPage> pages(Selector selector, Window window, Deadline deadline) {
        Span span = tracer.spanBuilder("queryEngine.series").startSpan();
        span.setAttribute("ems.selector." + selector.kind().id(), selector.value());
        Instant now = clock.instant();
        AtomicLong pages = new AtomicLong();
        AtomicLong readings = new AtomicLong();
        AtomicLong expired = new AtomicLong();

        return fetch(selector, window, null, deadline)
                .expand(page -> page.hasNext() ? fetch(selector, window, page.nextCursor(), deadline) : Mono.empty())
                .map(page -> live(page, now))
                .doOnNext(page -> {
                    pages.incrementAndGet();
                    readings.addAndGet(page.readings().size());
                    expired.addAndGet(page.expiredCount());
                })
                .doOnComplete(() -> log.debug("Series {} {} [{}, {}]: {} readings, {} expired, {} pages",
                        selector.kind().id(), selector.value(), window.from(), window.to(),
                        readings.get(), expired.get(), pages.get()))
                .doOnError(ex -> {
                    span.recordException(ex);
                    span.setStatus(StatusCode.ERROR, ex.getClass().getSimpleName());
                })
                .doFinally(signal -> span.end());
    }

    private Mono<RecordPage> fetch(Selector selector, Window window, ByteBuffer cursor, Deadline deadline) {
        return Mono.defer(() -> {
            long remaining = deadline.remainingNanos();
            if (remaining <= 0) {
                return Mono.error(new QueryTimeoutException(selector, deadline.timeout(), null));
            }
            return Mono.fromCallable(() -> selector.kind() == Selector.Kind.SENSOR_TYPE
                            ? store.queryByPartition(selector.value(), window.from(), window.to(), cursor)
                            : store.queryByDevice(selector.value(), window.from(), window.to(), cursor))
                    .subscribeOn(scheduler)
                    .timeout(Duration.ofNanos(remaining))
                    .onErrorMap(TimeoutException.class, e -> new QueryTimeoutException(selector, deadline.timeout(), e));
        });
    }

    // order across pages comes from the cursor, order within a page is restored here
    private SeriesPage live(RecordPage page, Instant now) {
        List<StorageRecord> records = new ArrayList<>(page.records().size());
        long expired = 0;
        for (StorageRecord record : page.records()) {
            if (record.isError()) {
                continue;
            }
            if (record.isExpiredAt(now)) {
                expired++;
            } else {
                records.add(record);
            }
        }
        records.sort(BY_SORT_KEY);
        List<Reading> readings = new ArrayList<>(records.size());
        for (StorageRecord record : records) {
            readings.add(mapper.from(record));
        }
        return new SeriesPage(readings, expired);
    }

    private static boolean isQueryable(Selector selector) {
        // the error partition is not a sensor type, so it is never queryable
        return selector.kind() == Selector.Kind.DEVICE || SensorType.fromId(selector.value()).isPresent();
    }

    private record Deadline(Duration timeout, long atNanos) {

        long remainingNanos() {
            return atNanos - System.nanoTime();
        }
    }
}
