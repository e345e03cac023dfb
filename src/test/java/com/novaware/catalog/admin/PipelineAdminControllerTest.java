package com.novaware.catalog.admin;

import com.novaware.catalog.PipelineFixtures;
import com.novaware.catalog.config.AppProperties;
import com.novaware.catalog.config.JacksonConfig;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.service.pipeline.PipelineService;
import com.novaware.catalog.service.pipeline.PipelineStage;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import com.novaware.catalog.store.InMemoryCatalogStore;
import com.novaware.catalog.store.InMemoryCheckpointStore;
import com.novaware.catalog.store.InMemoryReviewerIdentityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineAdminControllerTest {

    @TempDir
    Path dir;

    private RunRegistry registry;
    private PipelineAdminController controller;

    static class CountingStage implements PipelineStage {
        @Override
        public String name() {
            return "resolve";
        }

        @Override
        public Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options) {
            PipelineDtos.StageReport report = new PipelineDtos.StageReport("resolve");
            report.setProcessed(7);
            ctx.mirror("resolve working");
            return Mono.just(report);
        }
    }

    @BeforeEach
    void setUp() {
        PipelineService service = new PipelineService(List.of(new CountingStage()), new InMemoryCatalogStore(),
                new InMemoryReviewerIdentityStore(), new InMemoryCheckpointStore(), PipelineFixtures.props(), new Random(1));
        AppProperties app = new AppProperties();
        app.setRunHistoryDir(dir.toString());
        registry = new RunRegistry();
        controller = new PipelineAdminController(service, registry, new LogSseService(), app, new JacksonConfig().objectMapper());
    }

    @Test
    public void triggeredRunCompletesAndPersistsItsReport() {
        ResponseEntity<Map<String, Object>> started = controller.trigger("resolve", null, false).block();

        assertNotNull(started);
        assertEquals(200, started.getStatusCode().value());
        String runId = (String) started.getBody().get("runId");

        RunRegistry.RunInfo info = registry.get(runId);
        assertEquals("completed", info.status);
        assertEquals(7, info.processed);
        assertTrue(Files.exists(Paths.get(info.resultPath)));

        ResponseEntity<Map<String, Object>> latest = controller.latest(null).block();
        assertNotNull(latest);
        assertEquals(runId, latest.getBody().get("runId"));

        ResponseEntity<Object> result = controller.runResult(runId).block();
        assertNotNull(result);
        PipelineDtos.PipelineReport report = (PipelineDtos.PipelineReport) result.getBody();
        assertEquals(7, report.totalProcessed());
    }

    @Test
    public void secondRunIsRefusedWhileOneIsActive() {
        RunRegistry.RunInfo active = new RunRegistry.RunInfo();
        active.runId = "busy";
        active.stage = "variants";
        active.status = "running";
        active.startedAt = Instant.now();
        registry.put(active);

        ResponseEntity<Map<String, Object>> resp = controller.trigger("resolve", null, false).block();

        assertNotNull(resp);
        assertEquals(409, resp.getStatusCode().value());
    }

    @Test
    public void unknownStageAndNegativeCursorAreBadRequests() {
        assertEquals(400, controller.trigger("bogus", null, false).block().getStatusCode().value());
        assertEquals(400, controller.trigger("resolve", -1L, false).block().getStatusCode().value());
    }

    @Test
    public void missingRunIsNotFound() {
        assertEquals(404, controller.run("nope").block().getStatusCode().value());
        assertEquals(404, controller.runResult("nope").block().getStatusCode().value());
    }
}
