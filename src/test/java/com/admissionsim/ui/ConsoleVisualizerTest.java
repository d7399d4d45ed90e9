package com.admissionsim.ui;

import com.admissionsim.algorithm.PolicyType;
import com.admissionsim.metrics.BalanceSample;
import com.admissionsim.simulation.Simulation;
import com.admissionsim.simulation.SimulationConfig;
import com.admissionsim.simulation.SimulationSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleVisualizerTest {

    private ByteArrayOutputStream buffer;
    private ConsoleVisualizer visualizer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        visualizer = new ConsoleVisualizer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static SimulationSummary run(PolicyType policy) {
        return new Simulation(SimulationConfig.builder()
                .policy(policy)
                .arrivalRate(40)
                .runDuration(Duration.ofSeconds(3))
                .seed(11L)
                .build()).run();
    }

    @Test
    @DisplayName("Summary report lists totals, every server and the balance trend")
    void testPrintSummary() {
        SimulationSummary summary = run(PolicyType.LEAST_REQUESTS);

        visualizer.printSummary(summary);

        String out = output();
        assertTrue(out.contains("POLICY: Least Requests"));
        assertTrue(out.contains("Submitted       : " + summary.getSubmitted()));
        for (int i = 0; i < summary.getServers().size(); i++) {
            assertTrue(out.contains("#" + i), "Missing row for server " + i);
        }
        assertTrue(out.contains("Balance Trend"));
        assertTrue(out.contains("Load statistics at t=3000ms"));
    }

    @Test
    @DisplayName("Comparison table has one row per run")
    void testComparisonTable() {
        visualizer.printComparisonTable(List.of(run(PolicyType.ROUND_ROBIN), run(PolicyType.DYNAMIC_CPU)));

        String out = output();
        assertTrue(out.contains("Round Robin"));
        assertTrue(out.contains("Dynamic CPU"));
        assertTrue(out.contains("Fewest rejections"));
    }

    @Test
    @DisplayName("Balance sparkline maps 0 and 100 to the lowest and highest glyph")
    void testSpark() {
        assertEquals(" ", ConsoleVisualizer.spark(0));
        assertEquals("█", ConsoleVisualizer.spark(100));
        assertEquals("▄", ConsoleVisualizer.spark(50));
    }

    @Test
    @DisplayName("Empty history prints a placeholder")
    void testEmptyTrend() {
        visualizer.printBalanceTrend(List.<BalanceSample>of());

        assertTrue(output().contains("(no samples)"));
    }
}
