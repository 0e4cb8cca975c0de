package org.Aayush.dispatch.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Selected fleet assignment in external-id space.
 */
@Value
@Builder
public class DispatchPlan {
    /** One entry per available drone, in fleet order. */
    @Singular("droneAssignment")
    List<DroneAssignment> droneAssignments;
    /** Sum of per-drone outbound flight times. */
    double totalTime;
    /** Sum of per-drone round-trip distances. */
    double totalDistance;
    /** Number of distinct orders served. */
    int coveredOrderCount;
    /** True when every order is served. */
    boolean fullCoverage;
    /** Enumeration telemetry of the run that produced this plan. */
    DispatchExecutionStats executionStats;
}
