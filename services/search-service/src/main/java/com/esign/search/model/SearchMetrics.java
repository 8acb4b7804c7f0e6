package com.esign.search.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class SearchMetrics {
    private QueryPerformance queryPerformance = new QueryPerformance();
    private Relevance relevance = new Relevance();
    private Usage usage = new Usage();
    private IndexHealth indexHealth = new IndexHealth();

    public QueryPerformance getQueryPerformance() {
        return queryPerformance;
    }

    public void setQueryPerformance(QueryPerformance queryPerformance) {
        this.queryPerformance = queryPerformance;
    }

    public Relevance getRelevance() {
        return relevance;
    }

    public void setRelevance(Relevance relevance) {
        this.relevance = relevance;
    }

    public Usage getUsage() {
        return usage;
    }

    public void setUsage(Usage usage) {
        this.usage = usage;
    }

    public IndexHealth getIndexHealth() {
        return indexHealth;
    }

    public void setIndexHealth(IndexHealth indexHealth) {
        this.indexHealth = indexHealth;
    }

    public static class QueryPerformance {
        private double averageResponseTime;
        private double p95ResponseTime;
        private double p99ResponseTime;
        private double throughput;

        public double getAverageResponseTime() {
            return averageResponseTime;
        }

        public void setAverageResponseTime(double averageResponseTime) {
            this.averageResponseTime = averageResponseTime;
        }

        public double getP95ResponseTime() {
            return p95ResponseTime;
        }

        public void setP95ResponseTime(double p95ResponseTime) {
            this.p95ResponseTime = p95ResponseTime;
        }

        public double getP99ResponseTime() {
            return p99ResponseTime;
        }

        public void setP99ResponseTime(double p99ResponseTime) {
            this.p99ResponseTime = p99ResponseTime;
        }

        public double getThroughput() {
            return throughput;
        }

        public void setThroughput(double throughput) {
            this.throughput = throughput;
        }
    }

    public static class Relevance {
        private double clickThroughRate;
        private double meanReciprocalRank;
        private double normalizedDiscountedCumulativeGain;

        public double getClickThroughRate() {
            return clickThroughRate;
        }

        public void setClickThroughRate(double clickThroughRate) {
            this.clickThroughRate = clickThroughRate;
        }

        public double getMeanReciprocalRank() {
            return meanReciprocalRank;
        }

        public void setMeanReciprocalRank(double meanReciprocalRank) {
            this.meanReciprocalRank = meanReciprocalRank;
        }

        public double getNormalizedDiscountedCumulativeGain() {
            return normalizedDiscountedCumulativeGain;
        }

        public void setNormalizedDiscountedCumulativeGain(double normalizedDiscountedCumulativeGain) {
            this.normalizedDiscountedCumulativeGain = normalizedDiscountedCumulativeGain;
        }
    }

    public static class Usage {
        private long totalQueries;
        private long uniqueUsers;
        private List<QueryCount> topQueries = new ArrayList<>();
        private List<QueryCount> zeroResultQueries = new ArrayList<>();

        public long getTotalQueries() {
            return totalQueries;
        }

        public void setTotalQueries(long totalQueries) {
            this.totalQueries = totalQueries;
        }

        public long getUniqueUsers() {
            return uniqueUsers;
        }

        public void setUniqueUsers(long uniqueUsers) {
            this.uniqueUsers = uniqueUsers;
        }

        public List<QueryCount> getTopQueries() {
            return topQueries;
        }

        public void setTopQueries(List<QueryCount> topQueries) {
            this.topQueries = topQueries;
        }

        public List<QueryCount> getZeroResultQueries() {
            return zeroResultQueries;
        }

        public void setZeroResultQueries(List<QueryCount> zeroResultQueries) {
            this.zeroResultQueries = zeroResultQueries;
        }
    }

    public static class IndexHealth {
        private long documentCount;
        private long indexSize;
        private String shardHealth = "unknown";
        private Instant lastIndexed;

        public long getDocumentCount() {
            return documentCount;
        }

        public void setDocumentCount(long documentCount) {
            this.documentCount = documentCount;
        }

        public long getIndexSize() {
            return indexSize;
        }

        public void setIndexSize(long indexSize) {
            this.indexSize = indexSize;
        }

        public String getShardHealth() {
            return shardHealth;
        }

        public void setShardHealth(String shardHealth) {
            this.shardHealth = shardHealth;
        }

        public Instant getLastIndexed() {
            return lastIndexed;
        }

        public void setLastIndexed(Instant lastIndexed) {
            this.lastIndexed = lastIndexed;
        }
    }

    public record QueryCount(String query, long count) {
    }
}
