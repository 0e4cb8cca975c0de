package org.Aayush.dispatch.route;

import org.Aayush.dispatch.budget.EnumerationBudget;
import org.Aayush.dispatch.model.Order;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.Aayush.dispatch.testutil.DispatchFixtures.order;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouteGeneratorTest {
    private static final double EPS = 1e-9;

    private final RouteGenerator generator = new RouteGenerator(EnumerationBudget.unbounded(), 1);

    @Test
    @DisplayName("Route count is the sum of n!/(n-k)! over every length")
    void testRouteCount() {
        assertEquals(0L, RouteGenerator.routeCount(0));
        assertEquals(1L, RouteGenerator.routeCount(1));
        assertEquals(4L, RouteGenerator.routeCount(2));
        assertEquals(15L, RouteGenerator.routeCount(3));
        assertEquals(64L, RouteGenerator.routeCount(4));
        assertEquals(325L, RouteGenerator.routeCount(5));
        assertEquals(Long.MAX_VALUE, RouteGenerator.routeCount(21));
        assertThrows(IllegalArgumentException.class, () -> RouteGenerator.routeCount(-1));
    }

    @Test
    @DisplayName("Enumeration is exhaustive, duplicate-free and matches the closed form")
    void testEnumerationExhaustive() {
        for (int n = 0; n <= 5; n++) {
            List<Route> routes = generator.enumerate(n);
            assertEquals(RouteGenerator.routeCount(n), routes.size());
            Set<Route> distinct = new HashSet<>(routes);
            assertEquals(routes.size(), distinct.size());
            for (Route route : routes) {
                Set<Integer> seen = new HashSet<>();
                for (int stop : route.stops()) {
                    assertTrue(stop >= 0 && stop < n);
                    assertTrue(seen.add(stop), "stop repeats in " + route);
                }
            }
        }
    }

    @Test
    @DisplayName("Generation order: length, then subset, then permutation")
    void testGenerationOrder() {
        List<Route> routes = generator.enumerate(3);
        int[][] expectedPrefix = {
                {0}, {1}, {2},
                {0, 1}, {1, 0}, {0, 2}, {2, 0}, {1, 2}, {2, 1},
                {0, 1, 2}, {0, 2, 1}, {1, 0, 2}, {1, 2, 0}, {2, 0, 1}, {2, 1, 0}
        };
        assertEquals(expectedPrefix.length, routes.size());
        for (int i = 0; i < expectedPrefix.length; i++) {
            assertArrayEquals(expectedPrefix[i], routes.get(i).stops());
        }
    }

    @Test
    @DisplayName("Route identity is the ordered sequence")
    void testRouteIdentity() {
        assertEquals(Route.of(0, 1), Route.of(0, 1));
        assertEquals(Route.of(0, 1).hashCode(), Route.of(0, 1).hashCode());
        assertNotEquals(Route.of(0, 1), Route.of(1, 0));
        assertThrows(IllegalArgumentException.class, () -> Route.of());
        assertThrows(IllegalArgumentException.class, () -> Route.of(1, 1));
        assertThrows(IllegalArgumentException.class, () -> Route.of(-1));
    }

    @Test
    @DisplayName("Profiles cache metrics, weight and deadlines in route order")
    void testProfiles() {
        List<Order> orders = List.of(
                order("A", 3.0d, 4.0d, 9.0d, 2.0d),
                order("B", 0.0d, 4.0d, 12.0d, 1.5d)
        );
        RouteCatalog catalog = generator.generate(orders);
        assertEquals(4, catalog.size());
        assertEquals(2, catalog.orderCount());

        RouteProfile forward = catalog.profileOf(Route.of(0, 1));
        assertNotNull(forward);
        assertArrayEquals(new double[]{7.0d, 10.0d}, forward.metrics().cumulativeDistance(), EPS);
        assertEquals(14.0d, forward.totalRoundTripDistance(), EPS);
        assertEquals(3.5d, forward.totalWeight(), EPS);
        assertArrayEquals(new double[]{9.0d, 12.0d}, forward.deadlines(), EPS);

        RouteProfile backward = catalog.profileOf(Route.of(1, 0));
        assertArrayEquals(new double[]{4.0d, 7.0d}, backward.metrics().cumulativeDistance(), EPS);
        assertEquals(14.0d, backward.totalRoundTripDistance(), EPS);
        assertArrayEquals(new double[]{12.0d, 9.0d}, backward.deadlines(), EPS);

        assertNull(catalog.profileOf(Route.of(2)));
    }

    @Test
    @DisplayName("Invariant: cumulative distance non-decreasing, round trip covers last stop")
    void testMetricInvariants() {
        List<Order> orders = List.of(
                order("A", 3.0d, -4.0d),
                order("B", -2.0d, 1.0d),
                order("C", 0.0d, 0.0d),
                order("D", 5.0d, 5.0d)
        );
        for (RouteProfile profile : generator.generate(orders).profiles()) {
            double[] cumulative = profile.metrics().cumulativeDistance();
            for (int i = 1; i < cumulative.length; i++) {
                assertTrue(cumulative[i] >= cumulative[i - 1]);
            }
            assertTrue(profile.totalRoundTripDistance() >= profile.lastCumulativeDistance());
        }
    }

    @Test
    @DisplayName("Parallel profiling yields the same catalog order")
    void testParallelMatchesSequential() {
        List<Order> orders = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            orders.add(order("O" + i, i - 2.0d, 3.0d - i));
        }
        RouteCatalog sequential = generator.generate(orders);
        RouteCatalog parallel = new RouteGenerator(EnumerationBudget.unbounded(), 4).generate(orders);
        assertEquals(sequential.size(), parallel.size());
        for (int i = 0; i < sequential.size(); i++) {
            RouteProfile a = sequential.profiles().get(i);
            RouteProfile b = parallel.profiles().get(i);
            assertEquals(a.route(), b.route());
            assertEquals(a.totalRoundTripDistance(), b.totalRoundTripDistance(), EPS);
        }
    }

    @Test
    @DisplayName("Budget: oversized route space fails before generation")
    void testRouteBudget() {
        RouteGenerator bounded = new RouteGenerator(EnumerationBudget.of(14L, 0L), 1);
        EnumerationBudget.BudgetExceededException ex = assertThrows(
                EnumerationBudget.BudgetExceededException.class,
                () -> bounded.enumerate(3)
        );
        assertEquals(EnumerationBudget.REASON_ROUTES_EXCEEDED, ex.reasonCode());
        assertEquals(15, new RouteGenerator(EnumerationBudget.of(15L, 0L), 1).enumerate(3).size());
    }
}
