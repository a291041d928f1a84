package io.ussopmm.ems.query.web;

import io.opentelemetry.instrumentation.annotations.WithSpan;
import io.ussopmm.ems.query.config.QueryProperties;
import io.ussopmm.ems.query.engine.QueryEngine;
import io.ussopmm.ems.query.engine.Selector;
import io.ussopmm.ems.query.engine.Window;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Series endpoint used by the dashboard.
 * <p>
 * The body is newline-delimited JSON: one line per reading in ascending time order, then one
 * {@link SeriesSummary} line. Readings are written as pages arrive, so the response never holds
 * the whole window. An empty window answers 200 with the summary line only. A failure before the
 * first line is an error status; a failure after it ends the stream without a summary.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/series")
@RequiredArgsConstructor
public class SeriesController {

    private final QueryEngine queryEngine;
    private final QueryProperties properties;

    @WithSpan("seriesController.series")
    @GetMapping(produces = {MediaType.APPLICATION_NDJSON_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public Flux<Object> series(@RequestParam(required = false) String sensorType,
                               @RequestParam(required = false) String deviceId,
                               @RequestParam Instant from,
                               @RequestParam Instant to) {
        Selector selector = Selector.of(sensorType, deviceId);
        Window window = new Window(from, to);
        return Flux.defer(() -> {
            AtomicLong count = new AtomicLong();
            AtomicLong expired = new AtomicLong();
            return queryEngine.series(selector, window, properties.getTimeout())
                    .concatMapIterable(page -> {
                        count.addAndGet(page.readings().size());
                        expired.addAndGet(page.expiredCount());
                        return page.readings();
                    }, 1)
                    .cast(Object.class)
                    .concatWith(Mono.fromSupplier(() -> new SeriesSummary(selector, from, to, count.get(), expired.get())));
        });
    }
}
