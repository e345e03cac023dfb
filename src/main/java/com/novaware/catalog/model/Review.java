package com.novaware.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Review {
    private String reviewer_id;
    private String reviewer_name;
    private int rating;
    private String comment;
    private long created_at; // epoch millis

    public Review() {}

    public Review(String reviewer_id, String reviewer_name, int rating, String comment, long created_at) {
        this.reviewer_id = reviewer_id;
        this.reviewer_name = reviewer_name;
        this.rating = rating;
        this.comment = comment;
        this.created_at = created_at;
    }

    /** Key under which two reviews on the same item count as duplicates. */
    public static String dedupKey(String reviewerId, String comment) {
        return Objects.toString(reviewerId, "") + "_" + Objects.toString(comment, "");
    }

    public String dedupKey() {
        return dedupKey(reviewer_id, comment);
    }

    public String getReviewer_id() { return reviewer_id; }
    public void setReviewer_id(String reviewer_id) { this.reviewer_id = reviewer_id; }
    public String getReviewer_name() { return reviewer_name; }
    public void setReviewer_name(String reviewer_name) { this.reviewer_name = reviewer_name; }
    public int getRating() { return rating; }
    public void setRating(int rating) { this.rating = rating; }
    public String getComment() { return comment; }
    public void setComment(String comment) { this.comment = comment; }
    public long getCreated_at() { return created_at; }
    public void setCreated_at(long created_at) { this.created_at = created_at; }
}
