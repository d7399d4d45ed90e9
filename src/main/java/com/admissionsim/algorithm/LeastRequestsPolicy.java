package com.admissionsim.algorithm;

import com.admissionsim.model.Request;
import com.admissionsim.model.Server;

import java.util.List;

/**
 * Least-Requests Policy
 *
 * Picks the server hosting the fewest active requests.
 * Ties go to the first server in index order.
 */
public class LeastRequestsPolicy implements SchedulingPolicy {

    @Override
    public int selectServer(List<Server> servers, int cursor, Request request) {
        int selected = 0;
        int minRequests = Integer.MAX_VALUE;
        for (int i = 0; i < servers.size(); i++) {
            int count = servers.get(i).getActiveRequestCount();
            if (count < minRequests) {
                minRequests = count;
                selected = i;
            }
        }
        return selected;
    }

    @Override
    public String getName() { return PolicyType.LEAST_REQUESTS.getDisplayName(); }
}
