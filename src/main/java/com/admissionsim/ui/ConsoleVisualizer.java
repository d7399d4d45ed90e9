package com.admissionsim.ui;

import com.admissionsim.metrics.BalanceSample;
import com.admissionsim.metrics.LoadStatistics;
import com.admissionsim.metrics.StatisticsSample;
import com.admissionsim.model.ServerSnapshot;
import com.admissionsim.simulation.SimulationSummary;

import java.io.PrintStream;
import java.util.List;

/**
 * Console-based report for simulation results.
 *
 * Works only from snapshots and summaries, never from live servers,
 * so printing cannot affect the simulation.
 */
public class ConsoleVisualizer {

    private static final int CHART_WIDTH = 40;
    private static final String BAR_CHAR = "█";
    private static final String[] SPARK_CHARS = {" ", "▁", "▂", "▃", "▄", "▅", "▆", "▇", "█"};

    private final PrintStream out;

    public ConsoleVisualizer(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints one row per server with load bars and counters.
     */
    public void printServerTable(List<ServerSnapshot> servers) {
        out.println();
        out.println("  Server   CPU                                             MEM      Active  Avg Latency  Done   Rejected");
        out.println("  " + "─".repeat(104));
        for (ServerSnapshot s : servers) {
            out.printf("  #%-6d %-40s %5.1f%%  %5.1f%%  %6d  %9.1fms  %5d  %8d%n",
                    s.getIndex(), bar(s.getCpuLoad(), 100.0), s.getCpuLoad(), s.getMemoryLoad(),
                    s.getActiveCount(), s.getAverageResponseTime(), s.getCompletedCount(), s.getRejectedCount());
        }
        out.println("  " + "─".repeat(104));
    }

    /**
     * Prints the load statistics of a sample, rounded to one decimal.
     */
    public void printStatistics(StatisticsSample sample) {
        if (sample == null) {
            out.println("  No statistics sampled yet.");
            return;
        }
        out.printf("%n  Load statistics at t=%dms:%n", sample.getTimestamp());
        printStatsRow("CPU", sample.getCpuStats(), sample.getCpuBalance());
        printStatsRow("Memory", sample.getMemoryStats(), sample.getMemoryBalance());
    }

    private void printStatsRow(String label, LoadStatistics stats, int balance) {
        out.printf("    %-7s mean=%5.1f  var=%7.1f  std=%5.1f  min=%5.1f  max=%5.1f  balance=%3d%n",
                label, stats.getMean(), stats.getVariance(), stats.getStdDev(),
                stats.getMin(), stats.getMax(), balance);
    }

    /**
     * Prints the balance history as two sparklines, oldest on the left.
     */
    public void printBalanceTrend(List<BalanceSample> history) {
        out.println("\n  Balance Trend (time →, 0..100):");
        if (history.isEmpty()) {
            out.println("    (no samples)");
            return;
        }
        StringBuilder cpu = new StringBuilder();
        StringBuilder memory = new StringBuilder();
        for (BalanceSample sample : history) {
            cpu.append(spark(sample.getCpuBalance()));
            memory.append(spark(sample.getMemoryBalance()));
        }
        BalanceSample last = history.get(history.size() - 1);
        out.printf("    %-7s │%s│ now=%d%n", "CPU", cpu, last.getCpuBalance());
        out.printf("    %-7s │%s│ now=%d%n", "Memory", memory, last.getMemoryBalance());
    }

    /**
     * Prints the full report for one run.
     */
    public void printSummary(SimulationSummary summary) {
        out.println("\n" + "=".repeat(60));
        out.printf("  POLICY: %s%n", summary.getPolicyName());
        out.println("=".repeat(60));
        out.printf("  Simulated Time  : %d ms (%d ticks)%n", summary.getElapsedMillis(), summary.getTicks());
        out.printf("  Submitted       : %d%n", summary.getSubmitted());
        out.printf("  Admitted        : %d%n", summary.getAdmitted());
        out.printf("  Rejected        : %d (%.1f%%)%n", summary.getRejected(), 100.0 * summary.getRejectionRate());
        out.printf("  Completed       : %d%n", summary.getCompleted());
        out.printf("  Mean Response   : %.1f ms%n", summary.getMeanResponseTime());

        printServerTable(summary.getServers());
        printStatistics(summary.getLatestSample());
        printBalanceTrend(summary.getBalanceHistory());
    }

    /**
     * Prints a side-by-side table of several runs.
     */
    public void printComparisonTable(List<SimulationSummary> results) {
        out.println();
        out.println("╔══════════════════════╦═══════════╦══════════╦═══════════╦═════════╦═════════╗");
        out.println("║ Policy               ║ Submitted ║ Rejected ║ Mean Resp ║ CPU Bal ║ MEM Bal ║");
        out.println("╠══════════════════════╬═══════════╬══════════╬═══════════╬═════════╬═════════╣");
        for (SimulationSummary s : results) {
            out.printf("║ %-20s ║ %9d ║ %8d ║ %7.1fms ║ %7.1f ║ %7.1f ║%n",
                    truncate(s.getPolicyName(), 20), s.getSubmitted(), s.getRejected(),
                    s.getMeanResponseTime(), s.getAverageCpuBalance(), s.getAverageMemoryBalance());
        }
        out.println("╚══════════════════════╩═══════════╩══════════╩═══════════╩═════════╩═════════╝");

        results.stream()
                .max((a, b) -> Double.compare(a.getAverageCpuBalance(), b.getAverageCpuBalance()))
                .ifPresent(best -> out.printf("%n  Best CPU balance: %s (%.1f)%n",
                        best.getPolicyName(), best.getAverageCpuBalance()));
        results.stream()
                .min((a, b) -> Long.compare(a.getRejected(), b.getRejected()))
                .ifPresent(best -> out.printf("  Fewest rejections: %s (%d)%n",
                        best.getPolicyName(), best.getRejected()));
    }

    static String bar(double value, double max) {
        int length = (int) (CHART_WIDTH * Math.max(0.0, Math.min(value, max)) / max);
        return BAR_CHAR.repeat(length);
    }

    static String spark(int score) {
        int level = Math.max(0, Math.min(8, score * 8 / 100));
        return SPARK_CHARS[level];
    }

    private static String truncate(String s, int maxLen) {
        if (s.length() <= maxLen) return s;
        return s.substring(0, maxLen - 1) + "…";
    }
}
