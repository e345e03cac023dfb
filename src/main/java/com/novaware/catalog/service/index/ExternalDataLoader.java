package com.novaware.catalog.service.index;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.model.ExternalMetadata;
import com.novaware.catalog.model.ExternalReview;
import com.novaware.catalog.service.io.JsonlRecordReader;
import com.novaware.catalog.service.io.ReadStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.Set;

/** Reads the configured external datasets and builds the run's in-memory indexes. */
@Service
public class ExternalDataLoader {
    private static final Logger log = LoggerFactory.getLogger(ExternalDataLoader.class);

    private final JsonlRecordReader reader;
    private final PipelineProperties props;

    public ExternalDataLoader(JsonlRecordReader reader, PipelineProperties props) {
        this.reader = reader;
        this.props = props;
    }

    public Path metadataPath() {
        return JsonlRecordReader.requireReadable(props.getMetadataFile(), "metadata file (METADATA_FILE)");
    }

    public Path reviewsPath() {
        return JsonlRecordReader.requireReadable(props.getReviewsFile(), "reviews file (REVIEWS_FILE)");
    }

    public Flux<ExternalMetadata> streamMetadata(ReadStats stats) {
        return Flux.defer(() -> reader.read(metadataPath(), ExternalMetadata::fromJsonNode, stats));
    }

    public Mono<MetadataIndex> loadMetadataIndex(ReadStats stats) {
        return streamMetadata(stats)
                .reduceWith(() -> MetadataIndex.builder(props.getKeywordsPerTitle(), props.getKeywordFanOutCap()),
                        MetadataIndex.Builder::add)
                .map(MetadataIndex.Builder::build)
                .doOnNext(idx -> log.info("metadata index built: {} keys", idx.size()));
    }

    /** Reviews grouped by parent key, restricted to the given keys. */
    public Mono<GroupedIndex<ExternalReview>> loadReviews(Set<String> parentKeys, ReadStats stats) {
        return Flux.defer(() -> reader.read(reviewsPath(), ExternalReview::fromJsonNode, stats))
                .as(records -> GroupedIndex.collect(records, ExternalReview::getParent_key, parentKeys::contains))
                .doOnNext(idx -> log.info("review index built: {} keys of {} requested", idx.size(), parentKeys.size()));
    }
}
