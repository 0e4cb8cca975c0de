package org.Aayush.dispatch.feasibility;

import org.Aayush.core.concurrent.FanOut;
import org.Aayush.dispatch.geometry.RouteMetrics;
import org.Aayush.dispatch.model.Drone;
import org.Aayush.dispatch.route.RouteCatalog;
import org.Aayush.dispatch.route.RouteProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates payload, range and deadline feasibility of routes against drones.
 *
 * <p>Verdicts are pure functions of the route profile and drone constants. Fleet-wide
 * evaluation fans out over routes; every worker returns one overall-flag row per route and
 * the rows are folded into per-drone lists only after all workers finish.</p>
 */
public final class FeasibilityEvaluator {
    private final int parallelism;

    public FeasibilityEvaluator(int parallelism) {
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Evaluates one (route, drone) pair.
     *
     * @param profile route profile.
     * @param droneIndex internal drone index recorded in the verdict.
     * @param drone drone constants.
     * @return verdict with the three individual checks.
     */
    public static FeasibilityVerdict evaluate(RouteProfile profile, int droneIndex, Drone drone) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(drone, "drone");
        return new FeasibilityVerdict(
                profile.route(),
                droneIndex,
                isWeightFeasible(profile, drone),
                isDistanceFeasible(profile, drone),
                isDeadlineFeasible(profile, drone)
        );
    }

    static boolean isWeightFeasible(RouteProfile profile, Drone drone) {
        return profile.totalWeight() <= drone.getMaxPayload();
    }

    static boolean isDistanceFeasible(RouteProfile profile, Drone drone) {
        return profile.totalRoundTripDistance() <= drone.getMaxDistance();
    }

    /**
     * Checks {@code deadline[i] >= cumulativeDistance[i] / speed} for every stop in visit order.
     *
     * <p>A drone that cannot move (zero, negative or NaN speed) only satisfies an empty route.</p>
     */
    static boolean isDeadlineFeasible(RouteProfile profile, Drone drone) {
        RouteMetrics metrics = profile.metrics();
        int stops = metrics.stopCount();
        double speed = drone.getSpeed();
        if (!(speed > 0.0d)) {
            return stops == 0;
        }
        for (int i = 0; i < stops; i++) {
            if (profile.deadlineAt(i) < metrics.cumulativeDistanceAt(i) / speed) {
                return false;
            }
        }
        return true;
    }

    /**
     * Computes the feasible route set of every drone.
     *
     * @param catalog generated routes.
     * @param drones available drones; list position is the internal drone index.
     * @return per-drone feasible route sets in generation order.
     */
    public FeasibilityTable evaluateFleet(RouteCatalog catalog, List<Drone> drones) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(drones, "drones");
        int droneCount = drones.size();

        List<boolean[]> rows = FanOut.map(catalog.profiles(), profile -> {
            boolean[] overall = new boolean[droneCount];
            for (int d = 0; d < droneCount; d++) {
                overall[d] = evaluate(profile, d, drones.get(d)).isOverall();
            }
            return overall;
        }, parallelism);

        List<List<RouteProfile>> perDrone = new ArrayList<>(droneCount);
        for (int d = 0; d < droneCount; d++) {
            perDrone.add(new ArrayList<>());
        }
        List<RouteProfile> profiles = catalog.profiles();
        for (int r = 0; r < profiles.size(); r++) {
            boolean[] overall = rows.get(r);
            for (int d = 0; d < droneCount; d++) {
                if (overall[d]) {
                    perDrone.get(d).add(profiles.get(r));
                }
            }
        }

        List<List<RouteProfile>> frozen = new ArrayList<>(droneCount);
        for (List<RouteProfile> routes : perDrone) {
            frozen.add(List.copyOf(routes));
        }
        return new FeasibilityTable(frozen);
    }
}
