package com.novaware.catalog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

public class PipelineDtos {

    /** Counters of a single stage run, logged per batch and returned as JSON. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StageReport {
        private String stage;
        private String started_at;
        private String ended_at;
        private Long start_cursor;
        private Long last_cursor;
        private int batches;
        private int processed;
        private int created;
        private int updated;
        private int skipped;
        private int not_found;
        private int failed;
        // resolve
        private Integer matched;
        private Integer unmatched;
        private Double match_rate;
        // reviews
        private Integer reviews_added;
        private Integer duplicate_reviews;
        private Integer quota_dropped_reviews;
        private Integer unmapped_reviews;
        private Integer identities_created;
        // input files
        private Long malformed_lines;

        public StageReport() {}

        public StageReport(String stage) {
            this.stage = stage;
        }

        public void incProcessed() { processed++; }
        public void incCreated() { created++; }
        public void incUpdated() { updated++; }
        public void incSkipped() { skipped++; }
        public void incNotFound() { not_found++; }
        public void incFailed() { failed++; }
        public void addCreated(int n) { created += n; }
        public void addUpdated(int n) { updated += n; }
        public void addSkipped(int n) { skipped += n; }
        public void addFailed(int n) { failed += n; }

        public void incMatched() { matched = (matched == null ? 0 : matched) + 1; }
        public void incUnmatched() { unmatched = (unmatched == null ? 0 : unmatched) + 1; }
        public void addReviewsAdded(int n) { reviews_added = (reviews_added == null ? 0 : reviews_added) + n; }
        public void addDuplicateReviews(int n) { duplicate_reviews = (duplicate_reviews == null ? 0 : duplicate_reviews) + n; }
        public void addQuotaDroppedReviews(int n) { quota_dropped_reviews = (quota_dropped_reviews == null ? 0 : quota_dropped_reviews) + n; }
        public void addUnmappedReviews(int n) { unmapped_reviews = (unmapped_reviews == null ? 0 : unmapped_reviews) + n; }
        public void addIdentitiesCreated(int n) { identities_created = (identities_created == null ? 0 : identities_created) + n; }

        /** Recomputes match_rate from matched and unmatched. */
        public void refreshMatchRate() {
            int m = matched == null ? 0 : matched;
            int u = unmatched == null ? 0 : unmatched;
            match_rate = (m + u) == 0 ? 0.0 : Math.round(m * 10000.0 / (m + u)) / 10000.0;
        }

        public String getStage() { return stage; }
        public void setStage(String stage) { this.stage = stage; }
        public String getStarted_at() { return started_at; }
        public void setStarted_at(String started_at) { this.started_at = started_at; }
        public String getEnded_at() { return ended_at; }
        public void setEnded_at(String ended_at) { this.ended_at = ended_at; }
        public Long getStart_cursor() { return start_cursor; }
        public void setStart_cursor(Long start_cursor) { this.start_cursor = start_cursor; }
        public Long getLast_cursor() { return last_cursor; }
        public void setLast_cursor(Long last_cursor) { this.last_cursor = last_cursor; }
        public int getBatches() { return batches; }
        public void setBatches(int batches) { this.batches = batches; }
        public int getProcessed() { return processed; }
        public void setProcessed(int processed) { this.processed = processed; }
        public int getCreated() { return created; }
        public void setCreated(int created) { this.created = created; }
        public int getUpdated() { return updated; }
        public void setUpdated(int updated) { this.updated = updated; }
        public int getSkipped() { return skipped; }
        public void setSkipped(int skipped) { this.skipped = skipped; }
        public int getNot_found() { return not_found; }
        public void setNot_found(int not_found) { this.not_found = not_found; }
        public int getFailed() { return failed; }
        public void setFailed(int failed) { this.failed = failed; }
        public Integer getMatched() { return matched; }
        public void setMatched(Integer matched) { this.matched = matched; }
        public Integer getUnmatched() { return unmatched; }
        public void setUnmatched(Integer unmatched) { this.unmatched = unmatched; }
        public Double getMatch_rate() { return match_rate; }
        public void setMatch_rate(Double match_rate) { this.match_rate = match_rate; }
        public Integer getReviews_added() { return reviews_added; }
        public void setReviews_added(Integer reviews_added) { this.reviews_added = reviews_added; }
        public Integer getDuplicate_reviews() { return duplicate_reviews; }
        public void setDuplicate_reviews(Integer duplicate_reviews) { this.duplicate_reviews = duplicate_reviews; }
        public Integer getQuota_dropped_reviews() { return quota_dropped_reviews; }
        public void setQuota_dropped_reviews(Integer quota_dropped_reviews) { this.quota_dropped_reviews = quota_dropped_reviews; }
        public Integer getUnmapped_reviews() { return unmapped_reviews; }
        public void setUnmapped_reviews(Integer unmapped_reviews) { this.unmapped_reviews = unmapped_reviews; }
        public Integer getIdentities_created() { return identities_created; }
        public void setIdentities_created(Integer identities_created) { this.identities_created = identities_created; }
        public Long getMalformed_lines() { return malformed_lines; }
        public void setMalformed_lines(Long malformed_lines) { this.malformed_lines = malformed_lines; }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(stage).append(": processed=").append(processed)
                    .append(" created=").append(created)
                    .append(" updated=").append(updated)
                    .append(" skipped=").append(skipped)
                    .append(" not_found=").append(not_found)
                    .append(" failed=").append(failed);
            if (matched != null || unmatched != null) {
                sb.append(" matched=").append(matched == null ? 0 : matched)
                        .append(" unmatched=").append(unmatched == null ? 0 : unmatched)
                        .append(" match_rate=").append(match_rate);
            }
            if (reviews_added != null) sb.append(" reviews_added=").append(reviews_added);
            if (duplicate_reviews != null) sb.append(" duplicate_reviews=").append(duplicate_reviews);
            if (quota_dropped_reviews != null) sb.append(" quota_dropped_reviews=").append(quota_dropped_reviews);
            if (unmapped_reviews != null) sb.append(" unmapped_reviews=").append(unmapped_reviews);
            if (identities_created != null) sb.append(" identities_created=").append(identities_created);
            if (malformed_lines != null) sb.append(" malformed_lines=").append(malformed_lines);
            sb.append(" last_cursor=").append(last_cursor);
            return sb.toString();
        }
    }

    /** Overall report of one pipeline invocation, covering one or more stages. */
    public static class PipelineReport {
        private String run_id;
        private String stage; // requested stage, "all" for the full chain
        private String status; // completed|failed
        private List<StageReport> stages = new ArrayList<>();

        public String getRun_id() { return run_id; }
        public void setRun_id(String run_id) { this.run_id = run_id; }
        public String getStage() { return stage; }
        public void setStage(String stage) { this.stage = stage; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public List<StageReport> getStages() { return stages; }
        public void setStages(List<StageReport> stages) { this.stages = stages; }

        public int totalProcessed() {
            return stages.stream().mapToInt(StageReport::getProcessed).sum();
        }
    }
}
