package org.Aayush.dispatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * One delivery order, positioned relative to the shared depot at the origin.
 */
@Value
@Builder
public class Order {
    /** Client-facing order identifier. */
    String id;
    /** Delivery x coordinate relative to the depot. */
    double x;
    /** Delivery y coordinate relative to the depot. */
    double y;
    /** Time budget for delivery, in distance/speed units. */
    double deadline;
    /** Package weight. */
    double weight;
}
