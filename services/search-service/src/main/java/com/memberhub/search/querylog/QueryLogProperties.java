package com.memberhub.search.querylog;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.query-log")
public class QueryLogProperties {
    private boolean enabled = true;
    private Duration clickWindow = Duration.ofDays(30);
    private int maxRecentQueries = 100;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getClickWindow() {
        return clickWindow;
    }

    public void setClickWindow(Duration clickWindow) {
        this.clickWindow = clickWindow;
    }

    public int getMaxRecentQueries() {
        return maxRecentQueries;
    }

    public void setMaxRecentQueries(int maxRecentQueries) {
        this.maxRecentQueries = maxRecentQueries;
    }
}
