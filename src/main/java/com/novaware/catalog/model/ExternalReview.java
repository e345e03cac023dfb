package com.novaware.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One row of the external review stream.
 *
 * <p>Both the dataset's native field names ({@code user_id}, {@code parent_asin}) and the
 * neutral ones ({@code reviewerKey}, {@code parentKey}) are accepted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExternalReview {
    private String parent_key;
    private String reviewer_key;
    private String title;
    private String text;
    private Double rating;
    private Long timestamp; // epoch millis

    public static ExternalReview fromJsonNode(JsonNode n) {
        ExternalReview r = new ExternalReview();
        r.setParent_key(firstText(n, "parent_asin", "parentKey"));
        r.setReviewer_key(firstText(n, "user_id", "reviewerKey"));
        r.setTitle(n.path("title").asText(null));
        r.setText(n.path("text").asText(null));
        r.setRating(n.path("rating").isNumber() ? n.path("rating").asDouble() : null);
        r.setTimestamp(n.path("timestamp").canConvertToLong() ? n.path("timestamp").asLong() : null);
        return r;
    }

    static String firstText(JsonNode n, String... fields) {
        for (String f : fields) {
            JsonNode v = n.path(f);
            if (v.isTextual() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }

    public String getParent_key() { return parent_key; }
    public void setParent_key(String parent_key) { this.parent_key = parent_key; }
    public String getReviewer_key() { return reviewer_key; }
    public void setReviewer_key(String reviewer_key) { this.reviewer_key = reviewer_key; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }
    public Double getRating() { return rating; }
    public void setRating(Double rating) { this.rating = rating; }
    public Long getTimestamp() { return timestamp; }
    public void setTimestamp(Long timestamp) { this.timestamp = timestamp; }
}
