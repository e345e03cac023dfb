package com.novaware.catalog.admin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans out the progress lines of a pipeline run to SSE subscribers. Late subscribers
 * replay the most recent lines of the run.
 */
@Service
public class LogSseService {
    private static final Logger log = LoggerFactory.getLogger(LogSseService.class);
    private static final int REPLAY_LINES = 200;

    private final Map<String, Sinks.Many<String>> sinks = new ConcurrentHashMap<>();

    public void append(String runId, String line) {
        if (runId == null || line == null) return;
        sink(runId).tryEmitNext(line);
    }

    /** Ends the stream of a finished run; subscribers receive the replayed lines and complete. */
    public void complete(String runId) {
        if (runId == null) return;
        sink(runId).tryEmitComplete();
    }

    public Flux<ServerSentEvent<String>> stream(String runId) {
        Flux<String> lines = sink(runId).asFlux();
        Flux<String> heartbeat = Flux.interval(Duration.ofSeconds(10)).map(i -> "").takeUntilOther(lines.then(Mono.just(Boolean.TRUE)));
        return Flux.merge(lines, heartbeat)
                .map(s -> ServerSentEvent.builder(s).build())
                .doOnCancel(() -> log.debug("SSE client disconnected for runId={}", runId));
    }

    private Sinks.Many<String> sink(String runId) {
        return sinks.computeIfAbsent(runId, k -> Sinks.many().replay().limit(REPLAY_LINES));
    }
}
