package org.Aayush.dispatch.feasibility;

import lombok.Value;
import org.Aayush.dispatch.route.Route;

/**
 * Verdict of one (route, drone) pair.
 */
@Value
public class FeasibilityVerdict {
    /** Route that was evaluated. */
    Route route;
    /** Internal index of the evaluated drone. */
    int droneIndex;
    /** Total route weight fits the drone payload. */
    boolean weightFeasible;
    /** Round-trip distance fits the drone range. */
    boolean distanceFeasible;
    /** Every stop is reached within its deadline. */
    boolean deadlineFeasible;

    /**
     * Returns true when every individual check passes.
     */
    public boolean isOverall() {
        return weightFeasible && distanceFeasible && deadlineFeasible;
    }
}
