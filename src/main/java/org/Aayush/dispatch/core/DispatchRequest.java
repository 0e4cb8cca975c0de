package org.Aayush.dispatch.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.dispatch.model.Drone;
import org.Aayush.dispatch.model.Order;

import java.util.List;

/**
 * One planning run's input: the order set and the whole fleet.
 *
 * <p>Unavailable drones may be included; they are filtered out once before planning.</p>
 */
@Value
@Builder
public class DispatchRequest {
    /** Orders in canonical input order. */
    @Singular
    List<Order> orders;
    /** Fleet drones in canonical input order. */
    @Singular
    List<Drone> drones;
}
