package com.novaware.catalog.service.pipeline;

import com.novaware.catalog.dto.PipelineDtos;
import reactor.core.publisher.Mono;

/**
 * One resumable pass of the pipeline over the catalog.
 *
 * <p>Stages walk the catalog in cursor batches, never fail on a single bad record, and are
 * safe to run again: a rerun either finds nothing left to do or converges to the same state.
 */
public interface PipelineStage {
    /** Stage name as accepted on the command line and the admin endpoint. */
    String name();

    Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options);
}
