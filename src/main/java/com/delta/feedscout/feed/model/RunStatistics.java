package com.delta.feedscout.feed.model;

public record RunStatistics(int total, int valid) {

    public double validPercentage() {
        if (total <= 0) {
            return 0.0;
        }
        return (valid * 100.0) / total;
    }

    public int invalid() {
        return Math.max(0, total - valid);
    }
}
