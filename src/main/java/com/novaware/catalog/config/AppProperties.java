package com.novaware.catalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Shared secret expected in the x-admin-key header of every /admin request.
     */
    private String adminKey;
    /**
     * Directory where reports of admin-triggered runs are saved as pretty-printed JSON.
     * Defaults to "tmp/pipeline-runs" when not set.
     */
    private String runHistoryDir;

    public String getAdminKey() {
        return adminKey;
    }

    public void setAdminKey(String adminKey) {
        this.adminKey = adminKey;
    }

    public String getRunHistoryDir() {
        return runHistoryDir;
    }

    public void setRunHistoryDir(String runHistoryDir) {
        this.runHistoryDir = runHistoryDir;
    }
}
