package org.Aayush.dispatch.selection;

import org.Aayush.dispatch.assignment.Assignment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Picks the best assignment: full coverage first, then maximum order count, then minimum
 * total time.
 *
 * <p>Ties on total time resolve to the earliest assignment in input order, since ranking is
 * a stable ascending sort. Stateless and safe to share.</p>
 */
public final class AssignmentSelector {
    /** Ascending total time. */
    public static final Comparator<Assignment> BY_TOTAL_TIME = Comparator.comparingDouble(Assignment::totalTime);

    /**
     * Returns a copy of {@code assignments} stably sorted by ascending total time.
     */
    public List<Assignment> rank(List<Assignment> assignments) {
        Objects.requireNonNull(assignments, "assignments");
        List<Assignment> ranked = new ArrayList<>(assignments);
        ranked.sort(BY_TOTAL_TIME);
        return ranked;
    }

    /**
     * Selects the optimal assignment.
     *
     * @param assignments every valid assignment, in enumeration order.
     * @return selected assignment.
     * @throws IllegalArgumentException if {@code assignments} is empty.
     */
    public Assignment select(List<Assignment> assignments) {
        Objects.requireNonNull(assignments, "assignments");
        if (assignments.isEmpty()) {
            throw new IllegalArgumentException("at least one assignment is required for selection");
        }
        List<Assignment> ranked = rank(assignments);

        for (Assignment assignment : ranked) {
            if (assignment.isFullCoverage()) {
                return assignment;
            }
        }

        int maxOrderCount = 0;
        for (Assignment assignment : ranked) {
            maxOrderCount = Math.max(maxOrderCount, assignment.orderCount());
        }
        for (Assignment assignment : ranked) {
            if (assignment.orderCount() == maxOrderCount) {
                return assignment;
            }
        }
        throw new IllegalStateException("no assignment reached the maximum order count " + maxOrderCount);
    }
}
