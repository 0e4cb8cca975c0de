package org.Aayush.dispatch.assignment;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.Aayush.dispatch.route.RouteProfile;

import java.util.Arrays;

/**
 * One route-or-idle choice per drone with fleet-wide order disjointness.
 *
 * <p>Derived totals are computed once at construction. Total time counts only the outbound
 * leg ({@code lastCumulativeDistance / speed}); total distance counts full round trips.</p>
 */
public final class Assignment {
    private final RouteProfile[] legs;
    private final double[] legTimes;
    private final double totalTime;
    private final double totalDistance;
    private final IntSet coveredOrders;
    private final boolean fullCoverage;

    /**
     * Builds an assignment and validates disjointness.
     *
     * @param legs per-drone route profile, {@code null} for idle; index is the internal drone index.
     * @param speeds per-drone speed, same indexing as {@code legs}.
     * @param orderCount total number of orders in the planning run.
     * @throws IllegalArgumentException if an order is claimed by two drones.
     */
    public Assignment(RouteProfile[] legs, double[] speeds, int orderCount) {
        if (legs.length != speeds.length) {
            throw new IllegalArgumentException(
                    "legs/speeds length mismatch: " + legs.length + " vs " + speeds.length
            );
        }
        this.legs = legs.clone();
        this.legTimes = new double[legs.length];

        IntOpenHashSet covered = new IntOpenHashSet();
        double time = 0.0d;
        double distance = 0.0d;
        for (int d = 0; d < legs.length; d++) {
            RouteProfile leg = legs[d];
            if (leg == null) {
                continue;
            }
            for (int stop : leg.route().stops()) {
                if (!covered.add(stop)) {
                    throw new IllegalArgumentException("order " + stop + " assigned to more than one drone");
                }
            }
            legTimes[d] = leg.lastCumulativeDistance() / speeds[d];
            time += legTimes[d];
            distance += leg.totalRoundTripDistance();
        }
        this.totalTime = time;
        this.totalDistance = distance;
        this.coveredOrders = IntSets.unmodifiable(covered);
        this.fullCoverage = covered.size() == orderCount;
    }

    public int droneCount() {
        return legs.length;
    }

    public boolean isIdle(int droneIndex) {
        return legs[droneIndex] == null;
    }

    /**
     * Returns the route flown by one drone.
     *
     * @return route profile, or {@code null} when the drone is idle.
     */
    public RouteProfile legOf(int droneIndex) {
        return legs[droneIndex];
    }

    /**
     * Returns outbound flight time of one drone, {@code 0} when idle.
     */
    public double timeOf(int droneIndex) {
        return legTimes[droneIndex];
    }

    /**
     * Returns round-trip distance of one drone, {@code 0} when idle.
     */
    public double distanceOf(int droneIndex) {
        RouteProfile leg = legs[droneIndex];
        return leg == null ? 0.0d : leg.totalRoundTripDistance();
    }

    public double totalTime() {
        return totalTime;
    }

    public double totalDistance() {
        return totalDistance;
    }

    /**
     * Returns an unmodifiable view of every covered internal order index.
     */
    public IntSet coveredOrders() {
        return coveredOrders;
    }

    public int orderCount() {
        return coveredOrders.size();
    }

    /**
     * Returns true when every order of the planning run is covered.
     */
    public boolean isFullCoverage() {
        return fullCoverage;
    }

    @Override
    public String toString() {
        return "Assignment{legs=" + Arrays.toString(legs)
                + ", totalTime=" + totalTime
                + ", covered=" + coveredOrders.size()
                + ", fullCoverage=" + fullCoverage + '}';
    }
}
