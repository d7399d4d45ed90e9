package com.admissionsim.model;

import java.util.Objects;

/**
 * Point-in-time view of one server, safe to hand to reporting code.
 */
public final class ServerSnapshot {

    private final int index;
    private final double cpuLoad;
    private final double memoryLoad;
    private final int activeCount;
    private final double averageResponseTime;
    private final int completedCount;
    private final int rejectedCount;

    public ServerSnapshot(int index, double cpuLoad, double memoryLoad, int activeCount,
                          double averageResponseTime, int completedCount, int rejectedCount) {
        this.index = index;
        this.cpuLoad = cpuLoad;
        this.memoryLoad = memoryLoad;
        this.activeCount = activeCount;
        this.averageResponseTime = averageResponseTime;
        this.completedCount = completedCount;
        this.rejectedCount = rejectedCount;
    }

    public int getIndex() { return index; }
    public double getCpuLoad() { return cpuLoad; }
    public double getMemoryLoad() { return memoryLoad; }
    public int getActiveCount() { return activeCount; }
    public double getAverageResponseTime() { return averageResponseTime; }
    public int getCompletedCount() { return completedCount; }
    public int getRejectedCount() { return rejectedCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServerSnapshot)) return false;
        ServerSnapshot that = (ServerSnapshot) o;
        return index == that.index
                && activeCount == that.activeCount
                && completedCount == that.completedCount
                && rejectedCount == that.rejectedCount
                && Double.compare(that.cpuLoad, cpuLoad) == 0
                && Double.compare(that.memoryLoad, memoryLoad) == 0
                && Double.compare(that.averageResponseTime, averageResponseTime) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, cpuLoad, memoryLoad, activeCount, averageResponseTime,
                completedCount, rejectedCount);
    }

    @Override
    public String toString() {
        return String.format("ServerSnapshot[%d: cpu=%.1f, mem=%.1f, active=%d, avg=%.1fms, done=%d, rejected=%d]",
                index, cpuLoad, memoryLoad, activeCount, averageResponseTime, completedCount, rejectedCount);
    }
}
