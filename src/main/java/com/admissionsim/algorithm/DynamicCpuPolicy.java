package com.admissionsim.algorithm;

import com.admissionsim.model.Request;
import com.admissionsim.model.Server;

import java.util.List;

/**
 * Dynamic CPU Policy
 *
 * Picks the server whose active requests currently demand the least cpu.
 * Ties go to the lower index.
 */
public class DynamicCpuPolicy implements SchedulingPolicy {

    @Override
    public int selectServer(List<Server> servers, int cursor, Request request) {
        int selected = 0;
        double minCpu = Double.POSITIVE_INFINITY;
        for (int i = 0; i < servers.size(); i++) {
            double cpu = servers.get(i).getCpuLoad();
            if (cpu < minCpu) {
                minCpu = cpu;
                selected = i;
            }
        }
        return selected;
    }

    @Override
    public String getName() { return PolicyType.DYNAMIC_CPU.getDisplayName(); }
}
