package com.admissionsim.metrics;

import com.admissionsim.model.Server;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Samples the cluster once per tick and keeps a bounded balance history.
 *
 * Each sample computes, for cpu and memory separately:
 *   - Mean, variance (population), std dev, min, max of per-server load
 *   - Balance score in [0, 100]
 *
 * BALANCE SCORE:
 * --------------
 *   mean         = average(loads)
 *   maxDeviation = max |load_i - mean|
 *   score        = round(max(0, 100 * (1 - maxDeviation / (2 * mean))))
 *
 * An empty cluster or an all-idle cluster scores 100. The score tracks the
 * single worst server, not the overall spread: one hot server out of ten
 * drags it down as much as ten slightly uneven ones.
 *
 * The history holds the last {@code historyCapacity} (cpu, memory) scores,
 * oldest first; the oldest entry is evicted when it is full.
 */
public class MetricsCollector {

    public static final int DEFAULT_HISTORY_CAPACITY = 50;

    private final int historyCapacity;
    private final Deque<BalanceSample> history;
    private StatisticsSample latestSample;

    public MetricsCollector() {
        this(DEFAULT_HISTORY_CAPACITY);
    }

    public MetricsCollector(int historyCapacity) {
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive, got " + historyCapacity);
        }
        this.historyCapacity = historyCapacity;
        this.history = new ArrayDeque<>(historyCapacity);
    }

    /**
     * Samples current server loads and appends the balance scores to the history.
     */
    public StatisticsSample sample(List<Server> servers, long now) {
        double[] cpuLoads = new double[servers.size()];
        double[] memoryLoads = new double[servers.size()];
        for (int i = 0; i < servers.size(); i++) {
            cpuLoads[i] = servers.get(i).getCpuLoad();
            memoryLoads[i] = servers.get(i).getMemoryLoad();
        }

        StatisticsSample sample = new StatisticsSample(now,
                LoadStatistics.of(cpuLoads),
                LoadStatistics.of(memoryLoads),
                balanceScore(cpuLoads),
                balanceScore(memoryLoads));

        history.addLast(sample.toBalanceSample());
        while (history.size() > historyCapacity) {
            history.removeFirst();
        }
        latestSample = sample;
        return sample;
    }

    /**
     * Worst-case-deviation balance score, see class comment.
     */
    public static int balanceScore(double[] values) {
        if (values.length == 0) return 100;

        double sum = 0.0;
        for (double v : values) sum += v;
        double mean = sum / values.length;
        if (mean == 0) return 100;

        double maxDeviation = 0.0;
        for (double v : values) {
            maxDeviation = Math.max(maxDeviation, Math.abs(v - mean));
        }

        double score = Math.max(0.0, 100.0 * (1.0 - maxDeviation / (2.0 * mean)));
        return (int) Math.round(score);
    }

    /**
     * Returns the balance history, oldest first.
     */
    public List<BalanceSample> getBalanceHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    /**
     * Returns the most recent sample, or null before the first tick.
     */
    public StatisticsSample getLatestSample() { return latestSample; }

    public int getHistoryCapacity() { return historyCapacity; }

    public void clear() {
        history.clear();
        latestSample = null;
    }
}
