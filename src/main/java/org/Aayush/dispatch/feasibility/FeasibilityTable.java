package org.Aayush.dispatch.feasibility;

import org.Aayush.dispatch.route.RouteProfile;

import java.util.List;

/**
 * Read-only per-drone feasible route sets, indexed by internal drone index.
 *
 * <p>Each drone's list preserves route generation order.</p>
 */
public final class FeasibilityTable {
    private final List<List<RouteProfile>> feasibleRoutes;

    FeasibilityTable(List<List<RouteProfile>> feasibleRoutes) {
        this.feasibleRoutes = List.copyOf(feasibleRoutes);
    }

    public int droneCount() {
        return feasibleRoutes.size();
    }

    /**
     * Returns the immutable feasible route set of one drone.
     */
    public List<RouteProfile> feasibleRoutes(int droneIndex) {
        return feasibleRoutes.get(droneIndex);
    }

    /**
     * Returns feasible route counts in drone order.
     */
    public int[] feasibleRouteCounts() {
        int[] counts = new int[feasibleRoutes.size()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = feasibleRoutes.get(i).size();
        }
        return counts;
    }
}
