package com.admissionsim.algorithm;

import com.admissionsim.model.Request;
import com.admissionsim.model.Server;

import java.util.List;

/**
 * Least-Response-Time Policy
 *
 * Picks the server with the lowest average response time
 * (cumulativeResponseTime / completedCount).
 *
 * A server that has not completed anything yet has an average of 0, which
 * would make it win every time. Such a server is scored instead as
 *
 *   effective = activeRequests * 100
 *
 * so an idle fresh server still wins but a busy one does not.
 * Ties go to the lower index.
 */
public class LeastResponseTimePolicy implements SchedulingPolicy {

    static final double NO_HISTORY_PENALTY = 100.0;

    @Override
    public int selectServer(List<Server> servers, int cursor, Request request) {
        int selected = 0;
        double minScore = Double.POSITIVE_INFINITY;
        for (int i = 0; i < servers.size(); i++) {
            double score = effectiveResponseTime(servers.get(i));
            if (score < minScore) {
                minScore = score;
                selected = i;
            }
        }
        return selected;
    }

    static double effectiveResponseTime(Server server) {
        if (server.getCompletedCount() == 0) {
            return server.getActiveRequestCount() * NO_HISTORY_PENALTY;
        }
        return server.getAverageResponseTime();
    }

    @Override
    public String getName() { return PolicyType.LEAST_RESPONSE_TIME.getDisplayName(); }
}
