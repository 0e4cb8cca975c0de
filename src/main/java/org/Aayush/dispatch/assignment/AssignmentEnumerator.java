package org.Aayush.dispatch.assignment;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dispatch.budget.EnumerationBudget;
import org.Aayush.dispatch.feasibility.FeasibilityTable;
import org.Aayush.dispatch.model.Drone;
import org.Aayush.dispatch.route.RouteProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates the cross product of per-drone candidate lists and keeps order-disjoint tuples.
 *
 * <p>Each drone's candidate list is its feasible route set in generation order followed by
 * idle. Tuples are visited in lexicographic candidate order. A prefix that already claims
 * some order twice cannot be completed into a valid tuple, so its subtree is skipped; the
 * surviving tuples and their order are exactly those of a filter over the full product.
 * The all-idle tuple is always valid, so the result is never empty.</p>
 */
@Slf4j
public final class AssignmentEnumerator {
    private final EnumerationBudget budget;

    public AssignmentEnumerator(EnumerationBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Enumerates every valid assignment.
     *
     * @param table per-drone feasible route sets.
     * @param drones available drones, indexed like {@code table}.
     * @param orderCount total number of orders.
     * @return valid assignments in enumeration order.
     */
    public Enumeration enumerate(FeasibilityTable table, List<Drone> drones, int orderCount) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(drones, "drones");
        if (drones.isEmpty()) {
            throw new IllegalArgumentException("at least one drone is required to enumerate assignments");
        }
        if (table.droneCount() != drones.size()) {
            throw new IllegalArgumentException(
                    "feasibility table covers " + table.droneCount() + " drones, fleet has " + drones.size()
            );
        }

        double[] speeds = new double[drones.size()];
        for (int d = 0; d < speeds.length; d++) {
            speeds[d] = drones.get(d).getSpeed();
        }

        SearchState state = new SearchState(table, speeds, orderCount);
        state.descend(0);
        log.debug("assignment search visited {} states, kept {} assignments",
                state.searchStates, state.valid.size());
        return new Enumeration(List.copyOf(state.valid), state.searchStates);
    }

    /**
     * Result of one enumeration.
     */
    public static final class Enumeration {
        private final List<Assignment> assignments;
        private final long searchStates;

        Enumeration(List<Assignment> assignments, long searchStates) {
            this.assignments = assignments;
            this.searchStates = searchStates;
        }

        /**
         * Returns valid assignments in enumeration order.
         */
        public List<Assignment> assignments() {
            return assignments;
        }

        /**
         * Returns number of candidate placements tried.
         */
        public long searchStates() {
            return searchStates;
        }
    }

    /**
     * Mutable depth-first search state, confined to one enumeration call.
     */
    private final class SearchState {
        private final FeasibilityTable table;
        private final double[] speeds;
        private final int orderCount;
        private final RouteProfile[] legs;
        private final int[] claimCount;
        private final List<Assignment> valid = new ArrayList<>();
        private long searchStates;

        private SearchState(FeasibilityTable table, double[] speeds, int orderCount) {
            this.table = table;
            this.speeds = speeds;
            this.orderCount = orderCount;
            this.legs = new RouteProfile[speeds.length];
            this.claimCount = new int[orderCount];
        }

        private void descend(int droneIndex) {
            if (droneIndex == legs.length) {
                valid.add(new Assignment(legs, speeds, orderCount));
                return;
            }
            for (RouteProfile candidate : table.feasibleRoutes(droneIndex)) {
                budget.checkSearchStates(++searchStates);
                if (claim(candidate)) {
                    legs[droneIndex] = candidate;
                    descend(droneIndex + 1);
                }
                release(candidate);
                legs[droneIndex] = null;
            }
            budget.checkSearchStates(++searchStates);
            descend(droneIndex + 1);
        }

        /**
         * Marks every order of {@code candidate} claimed; returns false on any conflict.
         */
        private boolean claim(RouteProfile candidate) {
            boolean disjoint = true;
            int size = candidate.route().size();
            for (int i = 0; i < size; i++) {
                if (++claimCount[candidate.route().orderAt(i)] > 1) {
                    disjoint = false;
                }
            }
            return disjoint;
        }

        private void release(RouteProfile candidate) {
            int size = candidate.route().size();
            for (int i = 0; i < size; i++) {
                claimCount[candidate.route().orderAt(i)]--;
            }
        }
    }
}
