package com.admissionsim.algorithm;

import com.admissionsim.model.Request;
import com.admissionsim.model.Server;

import java.util.List;

/**
 * Common interface for all scheduling policies.
 * Implementations include: RoundRobinPolicy, RandomPolicy, LeastRequestsPolicy,
 * LeastResponseTimePolicy, DynamicCpuPolicy.
 *
 * A policy only proposes a server. The simulation's admission test decides
 * whether the request is actually hosted, so a policy may return a server
 * that turns out to be full.
 */
public interface SchedulingPolicy {

    /**
     * Selects a server for the next request.
     *
     * @param servers Servers in index order, never empty
     * @param cursor  Rotation cursor held by the simulation, in [0, servers.size())
     * @param request The request being placed
     * @return Index of the selected server
     */
    int selectServer(List<Server> servers, int cursor, Request request);

    /**
     * Returns the name of this policy for logging/reporting.
     */
    String getName();
}
