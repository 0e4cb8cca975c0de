package org.Aayush.dispatch.core;

import java.util.Arrays;

/**
 * Deterministic telemetry for one planning run.
 */
public final class DispatchExecutionStats {
    private final int orderCount;
    private final int availableDroneCount;
    private final int routeCount;
    private final int[] feasibleRouteCounts;
    private final long searchStates;
    private final int validAssignmentCount;

    private DispatchExecutionStats(
            int orderCount,
            int availableDroneCount,
            int routeCount,
            int[] feasibleRouteCounts,
            long searchStates,
            int validAssignmentCount
    ) {
        this.orderCount = orderCount;
        this.availableDroneCount = availableDroneCount;
        this.routeCount = routeCount;
        this.feasibleRouteCounts = feasibleRouteCounts.clone();
        this.searchStates = searchStates;
        this.validAssignmentCount = validAssignmentCount;
    }

    static DispatchExecutionStats of(
            int orderCount,
            int availableDroneCount,
            int routeCount,
            int[] feasibleRouteCounts,
            long searchStates,
            int validAssignmentCount
    ) {
        return new DispatchExecutionStats(
                orderCount,
                availableDroneCount,
                routeCount,
                feasibleRouteCounts,
                searchStates,
                validAssignmentCount
        );
    }

    public int orderCount() {
        return orderCount;
    }

    public int availableDroneCount() {
        return availableDroneCount;
    }

    public int routeCount() {
        return routeCount;
    }

    /**
     * Returns feasible route counts per available drone, in fleet order.
     */
    public int[] feasibleRouteCounts() {
        return feasibleRouteCounts.clone();
    }

    public long searchStates() {
        return searchStates;
    }

    public int validAssignmentCount() {
        return validAssignmentCount;
    }

    @Override
    public String toString() {
        return "DispatchExecutionStats{orders=" + orderCount
                + ", drones=" + availableDroneCount
                + ", routes=" + routeCount
                + ", feasible=" + Arrays.toString(feasibleRouteCounts)
                + ", searchStates=" + searchStates
                + ", validAssignments=" + validAssignmentCount + '}';
    }
}
