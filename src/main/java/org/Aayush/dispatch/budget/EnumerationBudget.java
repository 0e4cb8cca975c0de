package org.Aayush.dispatch.budget;

/**
 * Deterministic bounds for the exhaustive route and assignment enumerations.
 *
 * <p>Both enumerations grow factorially with the input. A bound of {@code <= 0} means
 * unbounded; exceeding a configured bound fails fast instead of exhausting memory.</p>
 */
public final class EnumerationBudget {
    public static final long UNBOUNDED = Long.MAX_VALUE;

    public static final String REASON_ROUTES_EXCEEDED = "BUDGET_ROUTES_EXCEEDED";
    public static final String REASON_SEARCH_STATES_EXCEEDED = "BUDGET_SEARCH_STATES_EXCEEDED";

    private static final EnumerationBudget UNLIMITED = new EnumerationBudget(UNBOUNDED, UNBOUNDED);

    private final long maxRoutes;
    private final long maxSearchStates;

    private EnumerationBudget(long maxRoutes, long maxSearchStates) {
        this.maxRoutes = normalizeBound(maxRoutes);
        this.maxSearchStates = normalizeBound(maxSearchStates);
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static EnumerationBudget of(long maxRoutes, long maxSearchStates) {
        return new EnumerationBudget(maxRoutes, maxSearchStates);
    }

    /**
     * Returns a budget without bounds.
     */
    public static EnumerationBudget unbounded() {
        return UNLIMITED;
    }

    public long maxRoutes() {
        return maxRoutes;
    }

    public long maxSearchStates() {
        return maxSearchStates;
    }

    /**
     * Validates the number of routes about to be generated.
     */
    public void checkRouteCount(long routeCount) {
        if (routeCount > maxRoutes) {
            throw new BudgetExceededException(
                    REASON_ROUTES_EXCEEDED,
                    "route budget exceeded: " + routeCount + " > " + maxRoutes
            );
        }
    }

    /**
     * Validates the number of candidate placements tried by the assignment search.
     */
    public void checkSearchStates(long searchStates) {
        if (searchStates > maxSearchStates) {
            throw new BudgetExceededException(
                    REASON_SEARCH_STATES_EXCEEDED,
                    "assignment search budget exceeded: " + searchStates + " > " + maxSearchStates
            );
        }
    }

    private static long normalizeBound(long bound) {
        if (bound <= 0L) {
            return UNBOUNDED;
        }
        return bound;
    }

    /**
     * Fail-fast exception for exhausted enumeration budgets.
     */
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}
