package com.admissionsim.algorithm;

import com.admissionsim.model.Request;
import com.admissionsim.model.Server;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Random Policy
 *
 * Draws server indices without replacement until one has room for the
 * request. If every server is full it still returns a uniformly random
 * index, which the admission test will then reject.
 *
 * Serves as a baseline for comparison.
 */
public class RandomPolicy implements SchedulingPolicy {

    private final Random random;

    public RandomPolicy(Random random) {
        this.random = random;
    }

    @Override
    public int selectServer(List<Server> servers, int cursor, Request request) {
        int n = servers.size();
        List<Integer> untried = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            untried.add(i);
        }
        while (!untried.isEmpty()) {
            int index = untried.remove(random.nextInt(untried.size()));
            if (servers.get(index).canAccept(request)) {
                return index;
            }
        }
        return random.nextInt(n);
    }

    @Override
    public String getName() { return PolicyType.RANDOM.getDisplayName(); }
}
