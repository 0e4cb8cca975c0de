package org.Aayush.dispatch.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Final plan entry for one available drone.
 */
@Value
@Builder
public class DroneAssignment {
    /** External drone id. */
    String droneId;
    /** External order ids in delivery order; empty when idle. */
    @Singular("orderId")
    List<String> orderIds;
    /** Round-trip distance flown by this drone; {@code 0} when idle. */
    double totalDistance;
    /** Outbound flight time to the last stop; {@code 0} when idle. */
    double totalTime;

    public boolean isIdle() {
        return orderIds.isEmpty();
    }
}
