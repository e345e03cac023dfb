package com.novaware.catalog.service.pipeline;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.service.enrichment.EnrichmentStage;
import com.novaware.catalog.service.features.FeatureStage;
import com.novaware.catalog.service.identity.ReviewMergeStage;
import com.novaware.catalog.service.resolve.ResolutionStage;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.store.CheckpointStore;
import com.novaware.catalog.store.ReviewerIdentityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Entry point for running one stage, or the whole chain, against the catalog.
 */
@Service
public class PipelineService {
    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    public static final String ALL = "all";
    /** Stages run by {@link #ALL}, in order. Seeding is a separate bootstrap step. */
    public static final List<String> ALL_ORDER = List.of(
            ResolutionStage.NAME, EnrichmentStage.NAME, ReviewMergeStage.NAME, FeatureStage.NAME,
            CatalogOrchestrationStage.NAME);

    private final Map<String, PipelineStage> stages = new LinkedHashMap<>();
    private final CatalogStore catalogStore;
    private final ReviewerIdentityStore identityStore;
    private final CheckpointStore checkpointStore;
    private final PipelineProperties props;
    private final Random random;

    public PipelineService(List<PipelineStage> stages, CatalogStore catalogStore, ReviewerIdentityStore identityStore,
                           CheckpointStore checkpointStore, PipelineProperties props, Random random) {
        for (PipelineStage s : stages) this.stages.put(s.name(), s);
        this.catalogStore = catalogStore;
        this.identityStore = identityStore;
        this.checkpointStore = checkpointStore;
        this.props = props;
        this.random = random;
    }

    public Set<String> stageNames() {
        return stages.keySet();
    }

    public boolean isKnownStage(String stage) {
        return ALL.equals(stage) || stages.containsKey(stage);
    }

    public PipelineContext newContext(String runId, Consumer<String> logSink, BiConsumer<Integer, Integer> progressSink) {
        return new PipelineContext(runId, random, props.getIdentityQuota(), logSink, progressSink);
    }

    public Mono<PipelineDtos.PipelineReport> run(String stage, StageRunOptions options, PipelineContext ctx) {
        if (!isKnownStage(stage)) {
            return Mono.error(new IllegalArgumentException("unknown stage '" + stage + "', expected one of "
                    + stages.keySet() + " or " + ALL));
        }
        List<String> order = ALL.equals(stage) ? ALL_ORDER : List.of(stage);
        PipelineDtos.PipelineReport report = new PipelineDtos.PipelineReport();
        report.setRun_id(ctx.getRunId());
        report.setStage(stage);
        log.info("pipeline run {} starting: stage={} {}", ctx.getRunId(), stage, options);
        return Mono.when(catalogStore.init(), identityStore.init(), checkpointStore.init())
                .thenMany(Flux.fromIterable(order)
                        .concatMap(name -> stages.get(name).run(ctx, options)
                                .doOnNext(r -> report.getStages().add(r))))
                .then(Mono.fromCallable(() -> {
                    report.setStatus("completed");
                    log.info("pipeline run {} completed: {} stages", ctx.getRunId(), report.getStages().size());
                    return report;
                }));
    }
}
