package com.admissionsim.metrics;

/**
 * Result of sampling the cluster once: load statistics and balance scores for both resources.
 */
public final class StatisticsSample {

    private final long timestamp;
    private final LoadStatistics cpuStats;
    private final LoadStatistics memoryStats;
    private final int cpuBalance;
    private final int memoryBalance;

    public StatisticsSample(long timestamp, LoadStatistics cpuStats, LoadStatistics memoryStats,
                            int cpuBalance, int memoryBalance) {
        this.timestamp = timestamp;
        this.cpuStats = cpuStats;
        this.memoryStats = memoryStats;
        this.cpuBalance = cpuBalance;
        this.memoryBalance = memoryBalance;
    }

    public long getTimestamp() { return timestamp; }
    public LoadStatistics getCpuStats() { return cpuStats; }
    public LoadStatistics getMemoryStats() { return memoryStats; }
    public int getCpuBalance() { return cpuBalance; }
    public int getMemoryBalance() { return memoryBalance; }

    public BalanceSample toBalanceSample() {
        return new BalanceSample(timestamp, cpuBalance, memoryBalance);
    }
}
