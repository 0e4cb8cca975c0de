package org.Aayush.dispatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * One fleet drone and its physical limits.
 */
@Value
@Builder
public class Drone {
    /** Client-facing drone identifier. */
    String id;
    /** Maximum total package weight per trip. */
    double maxPayload;
    /** Maximum round-trip distance per trip. */
    double maxDistance;
    /** Distance per time unit. */
    double speed;
    /** Only available drones take part in planning. */
    boolean available;
}
