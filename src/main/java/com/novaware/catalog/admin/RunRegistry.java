package com.novaware.catalog.admin;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class RunRegistry {
    public static class RunInfo {
        public String runId;
        public String stage; // resolve | enrich | reviews | features | variants | seed | all
        public String status; // running|completed|failed
        public int processed;
        public Integer total;
        public Instant startedAt;
        public Instant updatedAt;
        public Instant endedAt;
        public String message;
        public String resultPath;

        public boolean isActive() {
            return "running".equals(status);
        }
    }

    private final Map<String, RunInfo> runs = new ConcurrentHashMap<>();

    public void put(RunInfo info) {
        if (info != null && info.runId != null) {
            info.updatedAt = Instant.now();
            runs.put(info.runId, info);
        }
    }

    /**
     * Registers {@code info} only when no other run is active, so two stages never write
     * to the catalog at the same time.
     */
    public synchronized boolean tryStart(RunInfo info) {
        if (hasActiveRun()) return false;
        put(info);
        return true;
    }

    public boolean hasActiveRun() {
        return runs.values().stream().anyMatch(RunInfo::isActive);
    }

    public RunInfo get(String runId) {
        return runs.get(runId);
    }

    public RunInfo latest(String stage) {
        return runs.values().stream()
                .filter(r -> stage == null || stage.equals(r.stage))
                .max(Comparator.comparing(r -> r.startedAt))
                .orElse(null);
    }
}
