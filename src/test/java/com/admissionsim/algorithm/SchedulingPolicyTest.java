package com.admissionsim.algorithm;

import com.admissionsim.model.Request;
import com.admissionsim.model.Server;
import com.admissionsim.simulation.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the five scheduling policies.
 *
 * Policies are pure functions of the server list (plus the cursor for
 * round robin), so each test builds servers in a known state and checks
 * the selected index.
 */
class SchedulingPolicyTest {

    private static final Request SMALL = new Request(999, 10, 6, 100, 0);

    private int nextId = 0;

    /** Server hosting {@code count} long-running requests of the given size. */
    private Server server(int id, int count, double cpuEach, double memoryEach) {
        Server server = new Server(id);
        for (int i = 0; i < count; i++) {
            server.admit(new Request(nextId++, cpuEach, memoryEach, 1_000_000, 0));
        }
        return server;
    }

    private Server fullServer(int id) {
        return server(id, 1, 100, 100);
    }

    private List<Server> emptyServers(int n) {
        List<Server> servers = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            servers.add(new Server(i));
        }
        return servers;
    }

    // ─── Round Robin Tests ────────────────────────────────────────────────────

    @Test
    @DisplayName("Round robin returns the cursor when that server has room")
    void testRoundRobinReturnsCursor() {
        RoundRobinPolicy rr = new RoundRobinPolicy();

        assertEquals(2, rr.selectServer(emptyServers(4), 2, SMALL));
    }

    @Test
    @DisplayName("Round robin skips a full server at the cursor")
    void testRoundRobinSkipsFullServer() {
        List<Server> servers = emptyServers(4);
        servers.set(2, fullServer(2));

        assertEquals(3, new RoundRobinPolicy().selectServer(servers, 2, SMALL));
    }

    @Test
    @DisplayName("Round robin scan wraps around the end of the list")
    void testRoundRobinWrapsAround() {
        List<Server> servers = emptyServers(4);
        servers.set(3, fullServer(3));

        assertEquals(0, new RoundRobinPolicy().selectServer(servers, 3, SMALL));
    }

    @Test
    @DisplayName("Round robin returns the cursor unchanged when no server has room")
    void testRoundRobinNoneAvailable() {
        List<Server> servers = List.of(fullServer(0), fullServer(1), fullServer(2));

        assertEquals(1, new RoundRobinPolicy().selectServer(servers, 1, SMALL));
    }

    @Test
    @DisplayName("Round robin with an advancing cursor visits every server evenly")
    void testRoundRobinDistribution() {
        RoundRobinPolicy rr = new RoundRobinPolicy();
        List<Server> servers = emptyServers(5);
        int[] counts = new int[5];
        int cursor = 0;

        for (int i = 0; i < 500; i++) {
            int selected = rr.selectServer(servers, cursor, SMALL);
            counts[selected]++;
            cursor = (selected + 1) % servers.size();
        }

        for (int i = 0; i < 5; i++) {
            assertEquals(100, counts[i], "Round robin should select each server exactly 100 times");
        }
    }

    // ─── Random Tests ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("Random always finds the only server with room")
    void testRandomFindsOnlyAvailableServer() {
        List<Server> servers = List.of(fullServer(0), fullServer(1), new Server(2), fullServer(3));
        RandomPolicy random = new RandomPolicy(new Random(7L));

        for (int i = 0; i < 50; i++) {
            assertEquals(2, random.selectServer(servers, 0, SMALL));
        }
    }

    @Test
    @DisplayName("Random still returns a valid index when every server is full")
    void testRandomFallbackInRange() {
        List<Server> servers = List.of(fullServer(0), fullServer(1), fullServer(2));
        RandomPolicy random = new RandomPolicy(new Random(7L));

        for (int i = 0; i < 50; i++) {
            int selected = random.selectServer(servers, 0, SMALL);
            assertTrue(selected >= 0 && selected < 3, "Index out of range: " + selected);
        }
    }

    @Test
    @DisplayName("Random spreads selections over all servers")
    void testRandomCoversAllServers() {
        List<Server> servers = emptyServers(4);
        RandomPolicy random = new RandomPolicy(new Random(7L));
        int[] counts = new int[4];

        for (int i = 0; i < 400; i++) {
            counts[random.selectServer(servers, 0, SMALL)]++;
        }

        for (int i = 0; i < 4; i++) {
            assertTrue(counts[i] > 0, "Server " + i + " was never selected");
        }
    }

    // ─── Least Requests Tests ─────────────────────────────────────────────────

    @Test
    @DisplayName("Least requests picks the first server with the fewest active requests")
    void testLeastRequestsFirstOccurrence() {
        List<Server> servers = List.of(
                server(0, 3, 1, 1),
                server(1, 1, 1, 1),
                server(2, 4, 1, 1),
                server(3, 1, 1, 1));

        assertEquals(1, new LeastRequestsPolicy().selectServer(servers, 0, SMALL),
                "Active counts [3,1,4,1] must select index 1");
    }

    @Test
    @DisplayName("Least requests ignores the cursor")
    void testLeastRequestsIgnoresCursor() {
        List<Server> servers = List.of(server(0, 2, 1, 1), server(1, 0, 1, 1), server(2, 2, 1, 1));

        assertEquals(1, new LeastRequestsPolicy().selectServer(servers, 2, SMALL));
    }

    // ─── Least Response Time Tests ────────────────────────────────────────────

    private Server serverWithHistory(int id, double responseTime) {
        Server server = new Server(id);
        server.admit(new Request(nextId++, 1, 1, responseTime, 0));
        server.reclaimCompleted((long) responseTime);
        return server;
    }

    @Test
    @DisplayName("Least response time picks the lowest average response time")
    void testLeastResponseTimeLowestAverage() {
        List<Server> servers = List.of(serverWithHistory(0, 300), serverWithHistory(1, 120), serverWithHistory(2, 200));

        assertEquals(1, new LeastResponseTimePolicy().selectServer(servers, 0, SMALL));
    }

    @Test
    @DisplayName("A fresh idle server scores zero and wins")
    void testLeastResponseTimeFreshIdleServerWins() {
        List<Server> servers = List.of(serverWithHistory(0, 200), new Server(1));

        assertEquals(1, new LeastResponseTimePolicy().selectServer(servers, 0, SMALL));
    }

    @Test
    @DisplayName("A fresh busy server is penalized by 100 per active request")
    void testLeastResponseTimePenalizesFreshBusyServer() {
        List<Server> servers = List.of(serverWithHistory(0, 200), server(1, 3, 1, 1));

        assertEquals(300.0, LeastResponseTimePolicy.effectiveResponseTime(servers.get(1)), 1e-9);
        assertEquals(0, new LeastResponseTimePolicy().selectServer(servers, 0, SMALL),
                "3 active * 100 = 300 > 200 average");
    }

    @Test
    @DisplayName("Least response time ties go to the lower index")
    void testLeastResponseTimeTieBreak() {
        List<Server> servers = List.of(serverWithHistory(0, 150), serverWithHistory(1, 150));

        assertEquals(0, new LeastResponseTimePolicy().selectServer(servers, 1, SMALL));
    }

    // ─── Dynamic CPU Tests ────────────────────────────────────────────────────

    @Test
    @DisplayName("Dynamic CPU picks the server with the lowest cpu load")
    void testDynamicCpuLowestLoad() {
        List<Server> servers = List.of(server(0, 3, 10, 1), server(1, 1, 10, 90), server(2, 1, 10, 1), server(3, 5, 10, 1));

        assertEquals(1, new DynamicCpuPolicy().selectServer(servers, 0, SMALL),
                "Cpu loads [30,10,10,50]: lower index wins, memory is ignored");
    }

    // ─── Policy Registry Tests ────────────────────────────────────────────────

    @Test
    @DisplayName("Policies resolve by display name or constant name")
    void testFromName() {
        assertEquals(PolicyType.ROUND_ROBIN, PolicyType.fromName("Round Robin"));
        assertEquals(PolicyType.LEAST_REQUESTS, PolicyType.fromName("least requests"));
        assertEquals(PolicyType.LEAST_RESPONSE_TIME, PolicyType.fromName("LEAST_RESPONSE_TIME"));
        assertEquals(PolicyType.DYNAMIC_CPU, PolicyType.fromName("dynamic-cpu"));
        assertEquals(PolicyType.RANDOM, PolicyType.fromName("RANDOM"));
    }

    @Test
    @DisplayName("Unknown policy names fail fast")
    void testFromNameUnknown() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> PolicyType.fromName("Fastest First"));
        assertTrue(e.getMessage().contains("Fastest First"));
        assertThrows(InvalidConfigurationException.class, () -> PolicyType.fromName(" "));
        assertThrows(InvalidConfigurationException.class, () -> PolicyType.fromName(null));
    }

    @Test
    @DisplayName("Every policy type creates a policy reporting its display name")
    void testCreate() {
        for (PolicyType type : PolicyType.values()) {
            SchedulingPolicy policy = type.create(new Random(1L));
            assertEquals(type.getDisplayName(), policy.getName());
        }
    }
}
