package org.Aayush.dispatch.route;

import org.Aayush.core.concurrent.FanOut;
import org.Aayush.dispatch.budget.EnumerationBudget;
import org.Aayush.dispatch.geometry.ManhattanMetrics;
import org.Aayush.dispatch.geometry.RouteMetrics;
import org.Aayush.dispatch.model.Order;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exhaustive generator of every ordered, non-empty, duplicate-free order sequence.
 *
 * <p>Generation order is deterministic: sequence length ascending, then subsets in
 * lexicographic index order, then permutations of each subset in lexicographic order.
 * For {@code n} orders the catalog holds {@code sum(k=1..n) n!/(n-k)!} routes.</p>
 */
public final class RouteGenerator {
    private static final int INITIAL_CAPACITY_CAP = 1 << 20;

    private final EnumerationBudget budget;
    private final int parallelism;

    public RouteGenerator(EnumerationBudget budget, int parallelism) {
        this.budget = Objects.requireNonNull(budget, "budget");
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Returns the exact number of routes for {@code orderCount} orders, saturating at
     * {@link Long#MAX_VALUE}.
     */
    public static long routeCount(int orderCount) {
        if (orderCount < 0) {
            throw new IllegalArgumentException("orderCount must be >= 0, got " + orderCount);
        }
        long total = 0L;
        long arrangements = 1L;
        for (int k = 1; k <= orderCount; k++) {
            arrangements = saturatedMultiply(arrangements, orderCount - k + 1);
            total = saturatedAdd(total, arrangements);
        }
        return total;
    }

    /**
     * Enumerates every route over orders {@code 0..orderCount-1} without computing metrics.
     */
    public List<Route> enumerate(int orderCount) {
        long expected = routeCount(orderCount);
        budget.checkRouteCount(expected);

        List<Route> routes = new ArrayList<>((int) Math.min(expected, INITIAL_CAPACITY_CAP));
        for (int length = 1; length <= orderCount; length++) {
            int[] subset = new int[length];
            for (int i = 0; i < length; i++) {
                subset[i] = i;
            }
            do {
                int[] permutation = subset.clone();
                do {
                    routes.add(Route.trusted(permutation.clone()));
                } while (nextPermutation(permutation));
            } while (nextCombination(subset, orderCount));
        }
        return routes;
    }

    /**
     * Generates the full route catalog for the given orders.
     *
     * <p>Internal order index {@code i} refers to {@code orders.get(i)}. Profiles are computed
     * on up to {@code parallelism} workers and merged in generation order.</p>
     */
    public RouteCatalog generate(List<Order> orders) {
        Objects.requireNonNull(orders, "orders");
        List<Route> routes = enumerate(orders.size());
        List<RouteProfile> profiles = FanOut.map(routes, route -> profile(route, orders), parallelism);
        return new RouteCatalog(orders.size(), profiles);
    }

    /**
     * Computes the derived attributes of one route.
     */
    static RouteProfile profile(Route route, List<Order> orders) {
        int stops = route.size();
        double[] xs = new double[stops];
        double[] ys = new double[stops];
        double[] deadlines = new double[stops];
        double weight = 0.0d;
        for (int i = 0; i < stops; i++) {
            Order order = orders.get(route.orderAt(i));
            xs[i] = order.getX();
            ys[i] = order.getY();
            deadlines[i] = order.getDeadline();
            weight += order.getWeight();
        }
        RouteMetrics metrics = ManhattanMetrics.compute(xs, ys);
        return new RouteProfile(route, metrics, weight, deadlines);
    }

    /**
     * Advances {@code subset} to the next k-combination of {@code 0..n-1} in lexicographic order.
     */
    private static boolean nextCombination(int[] subset, int n) {
        int k = subset.length;
        int i = k - 1;
        while (i >= 0 && subset[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        subset[i]++;
        for (int j = i + 1; j < k; j++) {
            subset[j] = subset[j - 1] + 1;
        }
        return true;
    }

    /**
     * Advances {@code values} to the next lexicographic permutation.
     */
    private static boolean nextPermutation(int[] values) {
        int i = values.length - 2;
        while (i >= 0 && values[i] >= values[i + 1]) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        int j = values.length - 1;
        while (values[j] <= values[i]) {
            j--;
        }
        swap(values, i, j);
        for (int left = i + 1, right = values.length - 1; left < right; left++, right--) {
            swap(values, left, right);
        }
        return true;
    }

    private static void swap(int[] values, int i, int j) {
        int tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }

    private static long saturatedMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }
}
