package com.esign.search.analytics;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.analytics")
public class AnalyticsProperties {
    private int batchSize = 100;
    private Duration flushInterval = Duration.ofSeconds(30);
    private Duration shutdownTimeout = Duration.ofSeconds(5);
    private int retentionDays = 90;
    private long latencyTargetMs = 200;
    private double ctrTarget = 0.5;
    private double ctrGoal = 0.6;
    private boolean mlRecommendations = true;
    private int searchHistoryCap = 50;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
        this.flushInterval = flushInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public long getLatencyTargetMs() {
        return latencyTargetMs;
    }

    public void setLatencyTargetMs(long latencyTargetMs) {
        this.latencyTargetMs = latencyTargetMs;
    }

    public double getCtrTarget() {
        return ctrTarget;
    }

    public void setCtrTarget(double ctrTarget) {
        this.ctrTarget = ctrTarget;
    }

    public double getCtrGoal() {
        return ctrGoal;
    }

    public void setCtrGoal(double ctrGoal) {
        this.ctrGoal = ctrGoal;
    }

    public boolean isMlRecommendations() {
        return mlRecommendations;
    }

    public void setMlRecommendations(boolean mlRecommendations) {
        this.mlRecommendations = mlRecommendations;
    }

    public int getSearchHistoryCap() {
        return searchHistoryCap;
    }

    public void setSearchHistoryCap(int searchHistoryCap) {
        this.searchHistoryCap = searchHistoryCap;
    }
}
