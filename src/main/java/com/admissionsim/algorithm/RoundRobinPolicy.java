package com.admissionsim.algorithm;

import com.admissionsim.model.Request;
import com.admissionsim.model.Server;

import java.util.List;

/**
 * Round-Robin Policy
 *
 * Starts at the simulation's cursor and walks the servers circularly,
 * returning the first one with room for the request. The cursor itself
 * is advanced by the simulation after a successful admission.
 *
 * Pros:  Simple, predictable, even spread when servers are equal
 * Cons:  Blind to how loaded each server is
 */
public class RoundRobinPolicy implements SchedulingPolicy {

    @Override
    public int selectServer(List<Server> servers, int cursor, Request request) {
        int n = servers.size();
        for (int i = 0; i < n; i++) {
            int index = (cursor + i) % n;
            if (servers.get(index).canAccept(request)) {
                return index;
            }
        }
        // Nobody has room: hand back the cursor and let admission reject it
        return cursor;
    }

    @Override
    public String getName() { return PolicyType.ROUND_ROBIN.getDisplayName(); }
}
