package org.Aayush.serialization.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Wire shape of a dispatch output document. Write-only.
 *
 * <p>Ids are the nodes read from the input document, so a numeric id is written back as a number.</p>
 */
@Value
@Builder
public class OutputDocument {
    @JsonProperty("assignments")
    @Singular
    List<AssignmentRecord> assignments;

    @Value
    @Builder
    public static class AssignmentRecord {
        @JsonProperty("drone")
        JsonNode drone;
        @JsonProperty("orders")
        @Singular
        List<JsonNode> orders;
        @JsonProperty("total_distance")
        double totalDistance;
    }
}
