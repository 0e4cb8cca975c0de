package org.Aayush.serialization.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Wire shape of a dispatch input document.
 *
 * <p>Numeric fields are boxed so that missing values can be reported instead of
 * silently defaulting to zero. Ids stay raw JSON so string and numeric ids both survive
 * to the output document.</p>
 */
@Value
@Builder
@Jacksonized
public class InputDocument {
    @JsonProperty("orders")
    List<OrderRecord> orders;
    @JsonProperty("drones")
    FleetRecord drones;

    @Value
    @Builder
    @Jacksonized
    public static class OrderRecord {
        @JsonProperty("id")
        JsonNode id;
        @JsonProperty("delivery_x")
        Double deliveryX;
        @JsonProperty("delivery_y")
        Double deliveryY;
        @JsonProperty("deadline")
        Double deadline;
        @JsonProperty("package_weight")
        Double packageWeight;
    }

    @Value
    @Builder
    @Jacksonized
    public static class FleetRecord {
        @JsonProperty("fleet")
        List<DroneRecord> fleet;
    }

    @Value
    @Builder
    @Jacksonized
    public static class DroneRecord {
        @JsonProperty("id")
        JsonNode id;
        @JsonProperty("max_payload")
        Double maxPayload;
        @JsonProperty("max_distance")
        Double maxDistance;
        @JsonProperty("speed")
        Double speed;
        @JsonProperty("available")
        Boolean available;
    }
}
