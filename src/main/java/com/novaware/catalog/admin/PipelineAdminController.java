package com.novaware.catalog.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novaware.catalog.config.AppProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.service.pipeline.PipelineService;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/admin")
public class PipelineAdminController {
    private static final Logger log = LoggerFactory.getLogger(PipelineAdminController.class);
    private static final String DEFAULT_RUN_HISTORY_DIR = "tmp/pipeline-runs";

    private final PipelineService pipelineService;
    private final RunRegistry runRegistry;
    private final LogSseService logSseService;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public PipelineAdminController(PipelineService pipelineService,
                                   RunRegistry runRegistry,
                                   LogSseService logSseService,
                                   AppProperties appProperties,
                                   ObjectMapper objectMapper) {
        this.pipelineService = pipelineService;
        this.runRegistry = runRegistry;
        this.logSseService = logSseService;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Starts a stage (or "all") in the background and returns its run id. Only one run may
     * be active at a time.
     */
    @PostMapping(path = "/pipeline/{stage}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> trigger(@PathVariable String stage,
                                                             @RequestParam(value = "cursor", required = false) Long cursor,
                                                             @RequestParam(value = "restart", required = false, defaultValue = "false") boolean restart) {
        if (!pipelineService.isKnownStage(stage)) {
            return Mono.just(ResponseEntity.badRequest().body(Map.of(
                    "error", "unknown_stage",
                    "stage", stage,
                    "expected", pipelineService.stageNames())));
        }
        if (cursor != null && cursor < 0) {
            return Mono.just(ResponseEntity.badRequest().body(Map.of("error", "bad_request", "reason", "cursor must not be negative")));
        }
        String runId = UUID.randomUUID().toString();
        RunRegistry.RunInfo info = new RunRegistry.RunInfo();
        info.runId = runId;
        info.stage = stage;
        info.status = "running";
        info.startedAt = Instant.now();
        if (!runRegistry.tryStart(info)) {
            return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "run_in_progress")));
        }

        PipelineContext ctx = pipelineService.newContext(runId,
                line -> logSseService.append(runId, line),
                (done, total) -> {
                    info.processed = done;
                    info.total = total;
                    runRegistry.put(info);
                });
        pipelineService.run(stage, new StageRunOptions(cursor, restart), ctx)
                .doOnSubscribe(s -> logSseService.append(runId, "Pipeline " + stage + " started"))
                .doOnError(e -> {
                    info.status = "failed";
                    info.endedAt = Instant.now();
                    info.message = e.toString();
                    runRegistry.put(info);
                    logSseService.append(runId, "ERROR: " + e);
                    logSseService.complete(runId);
                })
                .doOnSuccess(report -> {
                    info.status = "completed";
                    info.endedAt = Instant.now();
                    info.processed = report.totalProcessed();
                    try {
                        info.resultPath = persistRunResult(runId, report);
                    } catch (IOException ex) {
                        log.warn("Could not persist report of run {}: {}", runId, ex.toString());
                        info.message = "persist failed: " + ex;
                    }
                    runRegistry.put(info);
                    logSseService.append(runId, "Completed. Processed=" + info.processed);
                    logSseService.complete(runId);
                })
                .subscribe(r -> { }, e -> log.warn("Pipeline run {} failed: {}", runId, e.toString()));

        return Mono.just(ResponseEntity.ok(Map.of("runId", runId, "stage", stage, "status", info.status)));
    }

    @GetMapping(path = "/runs/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> latest(@RequestParam(value = "stage", required = false) String stage) {
        RunRegistry.RunInfo r = runRegistry.latest(stage);
        if (r == null) return Mono.just(ResponseEntity.ok(Map.of()));
        return Mono.just(ResponseEntity.ok(toMap(r)));
    }

    @GetMapping(path = "/runs/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> run(@PathVariable String runId) {
        RunRegistry.RunInfo r = runRegistry.get(runId);
        if (r == null) return Mono.just(ResponseEntity.notFound().build());
        return Mono.just(ResponseEntity.ok(toMap(r)));
    }

    @GetMapping(path = "/runs/{runId}/logs/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> logs(@PathVariable String runId) {
        return logSseService.stream(runId);
    }

    @GetMapping(path = "/runs/{runId}/result", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> runResult(@PathVariable String runId) {
        RunRegistry.RunInfo r = runRegistry.get(runId);
        if (r == null || r.resultPath == null || r.resultPath.isBlank()) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        Path p = Paths.get(r.resultPath);
        if (!Files.exists(p)) return Mono.just(ResponseEntity.notFound().build());
        return Mono.fromCallable(() -> (Object) objectMapper.readValue(p.toFile(), PipelineDtos.PipelineReport.class))
                .map(ResponseEntity::ok);
    }

    private static Map<String, Object> toMap(RunRegistry.RunInfo r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("runId", r.runId);
        m.put("stage", r.stage);
        m.put("status", r.status);
        m.put("processed", r.processed);
        m.put("total", r.total);
        m.put("startedAt", r.startedAt != null ? r.startedAt.toString() : null);
        m.put("updatedAt", r.updatedAt != null ? r.updatedAt.toString() : null);
        m.put("endedAt", r.endedAt != null ? r.endedAt.toString() : null);
        m.put("message", r.message);
        m.put("resultPath", r.resultPath);
        return m;
    }

    private String persistRunResult(String runId, PipelineDtos.PipelineReport report) throws IOException {
        String baseDir = appProperties.getRunHistoryDir() == null || appProperties.getRunHistoryDir().isBlank()
                ? DEFAULT_RUN_HISTORY_DIR : appProperties.getRunHistoryDir();
        Path dir = Paths.get(baseDir);
        Files.createDirectories(dir);
        Path out = dir.resolve(runId + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), report);
        return out.toAbsolutePath().toString();
    }
}
