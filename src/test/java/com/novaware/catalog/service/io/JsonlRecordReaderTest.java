package com.novaware.catalog.service.io;

import com.novaware.catalog.PipelineFixtures;
import com.novaware.catalog.config.JacksonConfig;
import com.novaware.catalog.model.ExternalReview;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonlRecordReaderTest {

    @TempDir
    Path dir;

    private final JsonlRecordReader reader = new JsonlRecordReader(new JacksonConfig().objectMapper(), PipelineFixtures.props());

    @Test
    public void skipsBlankAndMalformedLines() throws Exception {
        Path file = PipelineFixtures.writeLines(dir, "reviews.jsonl",
                "{\"parent_asin\":\"B1\",\"user_id\":\"U1\",\"rating\":5.0,\"text\":\"Great\"}",
                "",
                "{not json",
                "[1,2,3]",
                "   ",
                "{\"parentKey\":\"B2\",\"reviewerKey\":\"U2\",\"rating\":3}");
        ReadStats stats = new ReadStats();

        List<ExternalReview> records = reader.read(file, ExternalReview::fromJsonNode, stats).collectList().block();

        assertNotNull(records);
        assertEquals(2, records.size());
        assertEquals("B1", records.get(0).getParent_key());
        assertEquals("U2", records.get(1).getReviewer_key());
        assertEquals(6, stats.getLines());
        assertEquals(2, stats.getRecords());
        assertEquals(2, stats.getBlank());
        assertEquals(2, stats.getMalformed());
    }

    @Test
    public void invalidUtf8OnlyAffectsItsOwnLine() throws Exception {
        byte[] bad = {(byte) 0xC3, (byte) 0x28};
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("{\"a\":1}\n{\"a\":2,\"t\":\"x".getBytes(StandardCharsets.UTF_8));
        bytes.write(bad);
        bytes.write("y\"}\n".getBytes(StandardCharsets.UTF_8));
        bytes.write(bad);
        bytes.write("{\"a\":3}\n{\"a\":4}\n".getBytes(StandardCharsets.UTF_8));
        Path file = dir.resolve("mixed.jsonl");
        Files.write(file, bytes.toByteArray());
        ReadStats stats = new ReadStats();

        List<Integer> values = reader.read(file, n -> n.path("a").asInt(), stats).collectList().block();

        assertEquals(List.of(1, 2, 4), values);
        assertEquals(4, stats.getLines());
        assertEquals(3, stats.getRecords());
        assertEquals(1, stats.getMalformed());
    }

    @Test
    public void everySubscriptionRereadsTheFile() throws Exception {
        Path file = PipelineFixtures.writeLines(dir, "meta.jsonl", "{\"a\":1}", "{\"a\":2}");
        ReadStats stats = new ReadStats();
        Flux<Integer> flux = reader.read(file, n -> n.path("a").asInt(), stats);

        assertEquals(List.of(1, 2), flux.collectList().block());
        assertEquals(List.of(1, 2), flux.collectList().block());
    }

    @Test
    public void missingFileIsRejectedBeforeReading() {
        InputFileException e = assertThrows(InputFileException.class,
                () -> JsonlRecordReader.requireReadable(dir.resolve("absent.jsonl").toString(), "reviews file"));
        assertTrue(e.getMessage().contains("reviews file"));
        assertThrows(InputFileException.class, () -> JsonlRecordReader.requireReadable("  ", "metadata file"));
    }
}
