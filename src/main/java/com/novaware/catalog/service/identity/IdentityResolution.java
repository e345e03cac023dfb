package com.novaware.catalog.service.identity;

import com.novaware.catalog.model.ReviewerIdentity;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/** Identities available to a batch, and the reviewers left without one. */
public class IdentityResolution {
    private final Map<String, ReviewerIdentity> byExternalKey;
    private final Set<String> quotaDropped;
    private final int created;

    public IdentityResolution(Map<String, ReviewerIdentity> byExternalKey, Set<String> quotaDropped, int created) {
        this.byExternalKey = Collections.unmodifiableMap(byExternalKey);
        this.quotaDropped = Collections.unmodifiableSet(quotaDropped);
        this.created = created;
    }

    public ReviewerIdentity get(String externalKey) {
        return byExternalKey.get(externalKey);
    }

    public boolean isQuotaDropped(String externalKey) {
        return quotaDropped.contains(externalKey);
    }

    public int getCreated() { return created; }
    public int size() { return byExternalKey.size(); }
}
