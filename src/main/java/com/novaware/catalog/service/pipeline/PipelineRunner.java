package com.novaware.catalog.service.pipeline;

import com.novaware.catalog.service.io.InputFileException;
import com.novaware.catalog.store.CatalogConnectionException;
import com.novaware.catalog.store.StoreErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Runs a stage from the command line: {@code --stage=<name> [--cursor=<seq>] [--restart]}.
 * Without {@code --stage} the application only serves the admin endpoints.
 */
@Component
public class PipelineRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_INVALID_ARGS = 2;
    public static final int EXIT_CONNECTION = 3;

    private final PipelineService pipelineService;
    private final ConfigurableApplicationContext context;

    public PipelineRunner(PipelineService pipelineService, ConfigurableApplicationContext context) {
        this.pipelineService = pipelineService;
        this.context = context;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("stage")) return;
        int code = execute(args);
        // closing the context disposes the connection pool before the JVM exits
        int exit = SpringApplication.exit(context, () -> code);
        System.exit(exit);
    }

    int execute(ApplicationArguments args) {
        String stage = single(args.getOptionValues("stage"));
        StageRunOptions options;
        try {
            options = parseOptions(args);
        } catch (IllegalArgumentException e) {
            log.error("invalid arguments: {}", e.getMessage());
            return EXIT_INVALID_ARGS;
        }
        if (stage == null || !pipelineService.isKnownStage(stage)) {
            log.error("unknown stage '{}', expected one of {} or {}", stage, pipelineService.stageNames(), PipelineService.ALL);
            return EXIT_INVALID_ARGS;
        }
        String runId = UUID.randomUUID().toString();
        try {
            pipelineService.run(stage, options, pipelineService.newContext(runId, null, null)).block();
            return EXIT_OK;
        } catch (InputFileException e) {
            log.error("stage {} not started: {}", stage, e.getMessage());
            return EXIT_INVALID_ARGS;
        } catch (RuntimeException e) {
            if (e instanceof CatalogConnectionException || StoreErrors.isConnectionFailure(e)) {
                log.error("catalog connection lost during stage {}: {}", stage, e.toString());
                return EXIT_CONNECTION;
            }
            log.error("stage {} failed", stage, e);
            return EXIT_FAILED;
        }
    }

    static StageRunOptions parseOptions(ApplicationArguments args) {
        boolean restart = args.containsOption("restart");
        String cursor = single(args.getOptionValues("cursor"));
        if (cursor == null || cursor.isBlank()) {
            return new StageRunOptions(null, restart);
        }
        try {
            long c = Long.parseLong(cursor.trim());
            if (c < 0) throw new IllegalArgumentException("--cursor must not be negative: " + cursor);
            return new StageRunOptions(c, restart);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--cursor must be a number: " + cursor);
        }
    }

    private static String single(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
