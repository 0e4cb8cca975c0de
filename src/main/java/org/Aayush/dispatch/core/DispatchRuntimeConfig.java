package org.Aayush.dispatch.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.dispatch.budget.EnumerationBudget;

/**
 * Runtime configuration bound once when a {@link DispatchCore} is built.
 */
@Value
@Builder
public class DispatchRuntimeConfig {
    public static final String PROP_PARALLELISM = "dispatch.engine.parallelism";
    public static final String PROP_MAX_ROUTES = "dispatch.engine.maxRoutes";
    public static final String PROP_MAX_SEARCH_STATES = "dispatch.engine.maxSearchStates";

    /** Worker count for route profiling and feasibility evaluation; {@code 1} is sequential. */
    @Builder.Default
    int parallelism = 1;
    /** Route generation bound; {@code <= 0} is unbounded. */
    long maxRoutes;
    /** Assignment search bound in candidate placements; {@code <= 0} is unbounded. */
    long maxSearchStates;

    /**
     * Returns sequential, unbounded configuration.
     */
    public static DispatchRuntimeConfig sequential() {
        return DispatchRuntimeConfig.builder().build();
    }

    /**
     * Loads configuration from system properties, falling back to {@link #sequential()}
     * values for missing or malformed entries.
     */
    public static DispatchRuntimeConfig defaults() {
        return DispatchRuntimeConfig.builder()
                .parallelism((int) Math.max(1L, Math.min(Integer.MAX_VALUE, readLong(PROP_PARALLELISM, 1L))))
                .maxRoutes(readLong(PROP_MAX_ROUTES, 0L))
                .maxSearchStates(readLong(PROP_MAX_SEARCH_STATES, 0L))
                .build();
    }

    /**
     * Builds the enumeration budget described by this configuration.
     */
    public EnumerationBudget enumerationBudget() {
        return EnumerationBudget.of(maxRoutes, maxSearchStates);
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
