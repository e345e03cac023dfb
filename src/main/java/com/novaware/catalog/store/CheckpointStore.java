package com.novaware.catalog.store;

import reactor.core.publisher.Mono;

/** Last processed cursor per stage. */
public interface CheckpointStore {

    Mono<Void> init();

    /** Stored cursor of the stage, empty when the stage never checkpointed. */
    Mono<Long> load(String stage);

    Mono<Void> save(String stage, long cursor);
}
