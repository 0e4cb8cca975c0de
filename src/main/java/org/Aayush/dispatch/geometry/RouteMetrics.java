package org.Aayush.dispatch.geometry;

/**
 * Manhattan distance profile of one ordered stop sequence.
 *
 * <p>Array-valued fields are exposed through defensive copies; scalar accessors cover
 * the values the planner reads on hot paths.</p>
 */
public final class RouteMetrics {
    private final double[] distanceFromDepot;
    private final double[] relativeDistance;
    private final double[] cumulativeDistance;
    private final double totalRoundTripDistance;

    RouteMetrics(
            double[] distanceFromDepot,
            double[] relativeDistance,
            double[] cumulativeDistance,
            double totalRoundTripDistance
    ) {
        this.distanceFromDepot = distanceFromDepot;
        this.relativeDistance = relativeDistance;
        this.cumulativeDistance = cumulativeDistance;
        this.totalRoundTripDistance = totalRoundTripDistance;
    }

    /**
     * Returns number of stops.
     */
    public int stopCount() {
        return cumulativeDistance.length;
    }

    public double[] distanceFromDepot() {
        return distanceFromDepot.clone();
    }

    public double[] relativeDistance() {
        return relativeDistance.clone();
    }

    public double[] cumulativeDistance() {
        return cumulativeDistance.clone();
    }

    /**
     * Returns cumulative outbound distance at stop {@code index}.
     */
    public double cumulativeDistanceAt(int index) {
        return cumulativeDistance[index];
    }

    /**
     * Returns cumulative outbound distance at the final stop, or {@code 0} for no stops.
     */
    public double lastCumulativeDistance() {
        return cumulativeDistance.length == 0 ? 0.0d : cumulativeDistance[cumulativeDistance.length - 1];
    }

    /**
     * Returns outbound distance plus the direct return leg from the final stop to the depot.
     */
    public double totalRoundTripDistance() {
        return totalRoundTripDistance;
    }
}
