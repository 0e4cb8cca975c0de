package org.Aayush.dispatch.route;

import java.util.Arrays;

/**
 * Ordered, duplicate-free sequence of internal order indices flown by one drone.
 *
 * <p>Identity is the ordered sequence itself: two permutations of the same order set
 * are distinct routes.</p>
 */
public final class Route {
    private final int[] stops;
    private final int hash;

    private Route(int[] stops) {
        this.stops = stops;
        this.hash = Arrays.hashCode(stops);
    }

    /**
     * Creates a route from internal order indices in visit order.
     *
     * @param stops non-empty, duplicate-free, non-negative order indices.
     */
    public static Route of(int... stops) {
        if (stops == null || stops.length == 0) {
            throw new IllegalArgumentException("route must contain at least one order");
        }
        int[] copy = stops.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] < 0) {
                throw new IllegalArgumentException("order index must be >= 0, got " + copy[i]);
            }
            for (int j = 0; j < i; j++) {
                if (copy[j] == copy[i]) {
                    throw new IllegalArgumentException("order " + copy[i] + " repeats within route");
                }
            }
        }
        return new Route(copy);
    }

    /**
     * Wraps an already validated array owned by the generator.
     */
    static Route trusted(int[] stops) {
        return new Route(stops);
    }

    public int size() {
        return stops.length;
    }

    public int orderAt(int position) {
        return stops[position];
    }

    /**
     * Returns a copy of the stop sequence.
     */
    public int[] stops() {
        return stops.clone();
    }

    public boolean contains(int orderIndex) {
        for (int stop : stops) {
            if (stop == orderIndex) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Route)) {
            return false;
        }
        Route route = (Route) other;
        return hash == route.hash && Arrays.equals(stops, route.stops);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "Route" + Arrays.toString(stops);
    }
}
