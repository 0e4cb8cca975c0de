package org.Aayush.dispatch.route;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.Collections;
import java.util.List;

/**
 * Immutable keyed association from route identity to its precomputed profile.
 *
 * <p>Profiles are also kept in generation order, which is the canonical iteration order
 * for every downstream stage.</p>
 */
public final class RouteCatalog {
    private final int orderCount;
    private final List<RouteProfile> profiles;
    private final Object2ObjectOpenHashMap<Route, RouteProfile> byRoute;

    RouteCatalog(int orderCount, List<RouteProfile> profiles) {
        this.orderCount = orderCount;
        this.profiles = Collections.unmodifiableList(profiles);
        this.byRoute = new Object2ObjectOpenHashMap<>(profiles.size());
        for (RouteProfile profile : profiles) {
            if (byRoute.put(profile.route(), profile) != null) {
                throw new IllegalStateException("route generated twice: " + profile.route());
            }
        }
        this.byRoute.trim();
    }

    /**
     * Returns number of orders the catalog was generated from.
     */
    public int orderCount() {
        return orderCount;
    }

    public int size() {
        return profiles.size();
    }

    /**
     * Returns all profiles in generation order.
     */
    public List<RouteProfile> profiles() {
        return profiles;
    }

    /**
     * Looks up the profile of one route.
     *
     * @return profile, or {@code null} when the route is not part of this catalog.
     */
    public RouteProfile profileOf(Route route) {
        return byRoute.get(route);
    }
}
