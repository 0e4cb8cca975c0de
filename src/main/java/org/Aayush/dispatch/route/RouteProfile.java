package org.Aayush.dispatch.route;

import org.Aayush.dispatch.geometry.RouteMetrics;

import java.util.Objects;

/**
 * A route together with its derived attributes, computed once at generation time.
 */
public final class RouteProfile {
    private final Route route;
    private final RouteMetrics metrics;
    private final double totalWeight;
    private final double[] deadlines;

    RouteProfile(Route route, RouteMetrics metrics, double totalWeight, double[] deadlines) {
        this.route = Objects.requireNonNull(route, "route");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.totalWeight = totalWeight;
        this.deadlines = deadlines;
    }

    public Route route() {
        return route;
    }

    public RouteMetrics metrics() {
        return metrics;
    }

    /**
     * Returns the summed weight of every order on the route.
     */
    public double totalWeight() {
        return totalWeight;
    }

    /**
     * Returns member deadlines in visit order.
     */
    public double[] deadlines() {
        return deadlines.clone();
    }

    public double deadlineAt(int position) {
        return deadlines[position];
    }

    public double totalRoundTripDistance() {
        return metrics.totalRoundTripDistance();
    }

    public double lastCumulativeDistance() {
        return metrics.lastCumulativeDistance();
    }

    @Override
    public String toString() {
        return "RouteProfile{" + route
                + ", weight=" + totalWeight
                + ", roundTrip=" + metrics.totalRoundTripDistance() + '}';
    }
}
