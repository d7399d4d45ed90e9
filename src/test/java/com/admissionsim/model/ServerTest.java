package com.admissionsim.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the capacity-bounded server.
 *
 * Tests cover:
 *   1. Admission test on both resources
 *   2. Capacity invariant enforced by admit()
 *   3. Completion reclamation and latency counters
 *   4. Reset and snapshots
 */
class ServerTest {

    private Server server;

    @BeforeEach
    void setUp() {
        server = new Server(0);
    }

    private static Request request(int id, double cpu, double memory, double duration, long arrival) {
        return new Request(id, cpu, memory, duration, arrival);
    }

    // ─── Admission Tests ──────────────────────────────────────────────────────

    @Test
    @DisplayName("A request that exactly fills the remaining capacity is accepted")
    void testExactFitAccepted() {
        server.admit(request(0, 60, 10, 100, 0));

        assertTrue(server.canAccept(request(1, 40, 90, 100, 0)),
                "60 + 40 cpu and 10 + 90 memory are both within 100");
    }

    @Test
    @DisplayName("A server with custom capacity admits against its own limits")
    void testCustomCapacity() {
        Server small = new Server(7, 20, 50);

        assertEquals(20, small.getCapacityCpu(), 1e-9);
        assertEquals(50, small.getCapacityMemory(), 1e-9);
        assertTrue(small.canAccept(request(0, 20, 50, 100, 0)));
        assertFalse(small.canAccept(request(1, 21, 10, 100, 0)), "21 cpu exceeds a capacity of 20");
        assertFalse(small.canAccept(request(2, 10, 51, 100, 0)), "51 memory exceeds a capacity of 50");
    }

    @Test
    @DisplayName("Cpu overflow alone makes a request unacceptable")
    void testCpuOverflowRejected() {
        server.admit(request(0, 60, 10, 100, 0));

        assertFalse(server.canAccept(request(1, 50, 10, 100, 0)), "60 + 50 cpu exceeds 100");
    }

    @Test
    @DisplayName("Memory overflow alone makes a request unacceptable")
    void testMemoryOverflowRejected() {
        server.admit(request(0, 10, 95, 100, 0));

        assertFalse(server.canAccept(request(1, 10, 10, 100, 0)), "95 + 10 memory exceeds 100");
    }

    @Test
    @DisplayName("admit() refuses a request that would break the capacity invariant")
    void testAdmitOverCapacityThrows() {
        server.admit(request(0, 90, 10, 100, 0));

        assertThrows(IllegalStateException.class, () -> server.admit(request(1, 20, 10, 100, 0)));
        assertEquals(1, server.getActiveRequestCount(), "Failed admission must not change the active set");
        assertEquals(90.0, server.getCpuLoad(), 1e-9);
    }

    @Test
    @DisplayName("Loads are the sums of active demands")
    void testLoadsAreSums() {
        server.admit(request(0, 5, 3, 100, 0));
        server.admit(request(1, 8, 4, 100, 0));
        server.admit(request(2, 4, 8, 100, 0));

        assertEquals(17.0, server.getCpuLoad(), 1e-9);
        assertEquals(15.0, server.getMemoryLoad(), 1e-9);
        assertEquals(3, server.getActiveRequestCount());
    }

    // ─── Reclamation Tests ────────────────────────────────────────────────────

    @Test
    @DisplayName("A request completes once its full service duration has elapsed")
    void testReclaimAtServiceDuration() {
        server.admit(request(0, 10, 10, 100, 0));

        assertTrue(server.reclaimCompleted(99).isEmpty(), "99ms < 100ms service duration");
        assertEquals(1, server.getActiveRequestCount());

        List<Request> completed = server.reclaimCompleted(100);
        assertEquals(1, completed.size());
        assertEquals(0, completed.get(0).getId());
        assertEquals(0, server.getActiveRequestCount());
        assertEquals(0.0, server.getCpuLoad(), 1e-9);
    }

    @Test
    @DisplayName("Completion updates completed count, cumulative and average response time")
    void testCompletionCounters() {
        server.admit(request(0, 10, 10, 100, 0));
        server.admit(request(1, 10, 10, 300, 0));
        server.admit(request(2, 10, 10, 1000, 0));

        server.reclaimCompleted(500);

        assertEquals(2, server.getCompletedCount());
        assertEquals(400.0, server.getCumulativeResponseTime(), 1e-9);
        assertEquals(200.0, server.getAverageResponseTime(), 1e-9);
        assertEquals(1, server.getActiveRequestCount(), "The 1000ms request is still running");
    }

    @Test
    @DisplayName("Average response time is zero before any completion")
    void testAverageWithoutHistory() {
        assertEquals(0.0, server.getAverageResponseTime(), 1e-9);
    }

    // ─── Reset & Snapshot Tests ──────────────────────────────────────────────

    @Test
    @DisplayName("Reset clears active requests and all counters")
    void testReset() {
        server.admit(request(0, 10, 10, 100, 0));
        server.admit(request(1, 10, 10, 900, 0));
        server.reclaimCompleted(100);
        server.recordRejection();

        server.reset();

        assertEquals(0, server.getActiveRequestCount());
        assertEquals(0, server.getCompletedCount());
        assertEquals(0.0, server.getCumulativeResponseTime(), 1e-9);
        assertEquals(0, server.getRejectedCount());
    }

    @Test
    @DisplayName("Snapshot reflects current loads and counters")
    void testSnapshot() {
        server.admit(request(0, 10, 6, 100, 0));
        server.admit(request(1, 5, 3, 900, 0));
        server.reclaimCompleted(100);
        server.recordRejection();

        ServerSnapshot snapshot = server.snapshot();

        assertEquals(new ServerSnapshot(0, 5.0, 3.0, 1, 100.0, 1, 1), snapshot);
        assertEquals(snapshot, server.snapshot(), "Snapshots without changes in between are equal");
    }

    @Test
    @DisplayName("Active request list is read-only")
    void testActiveRequestsUnmodifiable() {
        server.admit(request(0, 10, 10, 100, 0));

        assertThrows(UnsupportedOperationException.class,
                () -> server.getActiveRequests().add(request(1, 95, 95, 100, 0)));
    }
}
