package com.novaware.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Internal identity synthesized for an external reviewer. The id is derived from the
 * external key, so repeated synthesis of the same reviewer yields the same record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReviewerIdentity {
    private String id;
    private String external_key;
    private String name;
    private String email;
    private long created_at; // epoch millis

    public ReviewerIdentity() {}

    public ReviewerIdentity(String id, String external_key, String name, String email, long created_at) {
        this.id = id;
        this.external_key = external_key;
        this.name = name;
        this.email = email;
        this.created_at = created_at;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getExternal_key() { return external_key; }
    public void setExternal_key(String external_key) { this.external_key = external_key; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public long getCreated_at() { return created_at; }
    public void setCreated_at(long created_at) { this.created_at = created_at; }
}
