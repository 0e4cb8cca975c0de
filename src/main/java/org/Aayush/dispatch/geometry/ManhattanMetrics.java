package org.Aayush.dispatch.geometry;

import lombok.experimental.UtilityClass;

/**
 * Manhattan-distance route metrics relative to a depot at the origin.
 */
@UtilityClass
public final class ManhattanMetrics {

    /**
     * Computes {@code |x2 - x1| + |y2 - y1|}.
     */
    public static double distance(double x1, double y1, double x2, double y2) {
        return Math.abs(x2 - x1) + Math.abs(y2 - y1);
    }

    /**
     * Computes {@code |x| + |y|}.
     */
    public static double distanceFromDepot(double x, double y) {
        return Math.abs(x) + Math.abs(y);
    }

    /**
     * Computes the metric profile of an ordered stop sequence.
     *
     * <p>The first leg starts at the depot. The return leg is measured directly from the
     * last stop to the depot, not by retracing the outbound legs.</p>
     *
     * @param xs stop x coordinates in visit order.
     * @param ys stop y coordinates in visit order.
     * @return metric profile; all arrays are empty and the round trip is {@code 0} for no stops.
     */
    public static RouteMetrics compute(double[] xs, double[] ys) {
        if (xs == null || ys == null) {
            throw new IllegalArgumentException("coordinates cannot be null");
        }
        if (xs.length != ys.length) {
            throw new IllegalArgumentException(
                    "coordinate length mismatch: xs=" + xs.length + ", ys=" + ys.length
            );
        }
        int stops = xs.length;
        double[] fromDepot = new double[stops];
        double[] relative = new double[stops];
        double[] cumulative = new double[stops];

        for (int i = 0; i < stops; i++) {
            fromDepot[i] = distanceFromDepot(xs[i], ys[i]);
            if (i == 0) {
                relative[i] = fromDepot[i];
                cumulative[i] = relative[i];
            } else {
                relative[i] = distance(xs[i - 1], ys[i - 1], xs[i], ys[i]);
                cumulative[i] = cumulative[i - 1] + relative[i];
            }
        }

        double roundTrip = stops == 0 ? 0.0d : cumulative[stops - 1] + fromDepot[stops - 1];
        return new RouteMetrics(fromDepot, relative, cumulative, roundTrip);
    }
}
