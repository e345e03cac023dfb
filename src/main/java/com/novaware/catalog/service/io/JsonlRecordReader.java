package com.novaware.catalog.service.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novaware.catalog.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * Streams newline-delimited JSON files one line at a time.
 *
 * <p>Each subscription opens the file anew and reads it from the start. Blank lines are
 * ignored; lines that are not a JSON object are counted as malformed and skipped. Invalid
 * UTF-8 sequences are decoded as U+FFFD, so a bad byte only affects the line it sits on.
 */
@Component
public class JsonlRecordReader {
    private static final Logger log = LoggerFactory.getLogger(JsonlRecordReader.class);

    private final ObjectMapper objectMapper;
    private final int progressEvery;

    public JsonlRecordReader(ObjectMapper objectMapper, PipelineProperties pipelineProperties) {
        this.objectMapper = objectMapper;
        this.progressEvery = Math.max(1, pipelineProperties.getReaderProgressEvery());
    }

    /**
     * Resolves and validates a configured input path.
     *
     * @throws InputFileException when the path is blank or not a readable regular file
     */
    public static Path requireReadable(String configured, String what) {
        if (configured == null || configured.isBlank()) {
            throw new InputFileException(what + " is not configured");
        }
        Path path = Paths.get(configured);
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new InputFileException(what + " not found or unreadable: " + path.toAbsolutePath());
        }
        return path;
    }

    public <T> Flux<T> read(Path path, Function<JsonNode, T> mapper, ReadStats stats) {
        String name = path.getFileName().toString();
        return Flux.using(
                        () -> open(path),
                        reader -> Flux.fromStream(reader.lines()),
                        reader -> close(reader, path))
                .<T>handle((line, sink) -> {
                    long n = stats.nextLine();
                    if (n % progressEvery == 0) {
                        log.info("{}: read {} lines ({} records, {} malformed)", name, n, stats.getRecords(), stats.getMalformed());
                    }
                    if (line.isBlank()) {
                        stats.blank();
                        return;
                    }
                    JsonNode node = parse(line);
                    if (node == null || !node.isObject()) {
                        stats.malformed();
                        log.debug("{}: skipping malformed line {}", name, n);
                        return;
                    }
                    T record = mapper.apply(node);
                    if (record != null) {
                        stats.record();
                        sink.next(record);
                    }
                })
                .doOnComplete(() -> log.info("{}: finished, {}", name, stats))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static BufferedReader open(Path path) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder));
    }

    private JsonNode parse(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static void close(BufferedReader reader, Path path) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("failed to close {}: {}", path, e.toString());
        }
    }
}
