package org.Aayush.serialization.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.Value;
import org.Aayush.dispatch.core.DispatchRequest;

import java.util.Map;

/**
 * Validated input document: the engine request plus the identifiers exactly as the
 * document spelled them.
 *
 * <p>The engine keys orders and drones by their textual id; numeric ids are restored
 * from here when the plan is written back out.</p>
 */
@Value
public class DispatchInput {
    DispatchRequest request;
    Map<String, JsonNode> orderIds;
    Map<String, JsonNode> droneIds;

    DispatchInput(DispatchRequest request, Map<String, JsonNode> orderIds, Map<String, JsonNode> droneIds) {
        this.request = request;
        this.orderIds = Map.copyOf(orderIds);
        this.droneIds = Map.copyOf(droneIds);
    }

    /**
     * Returns the original order id node, or a text node for ids this document never held.
     */
    public JsonNode originalOrderId(String orderId) {
        return originalOf(orderIds, orderId);
    }

    /**
     * Returns the original drone id node, or a text node for ids this document never held.
     */
    public JsonNode originalDroneId(String droneId) {
        return originalOf(droneIds, droneId);
    }

    private static JsonNode originalOf(Map<String, JsonNode> ids, String key) {
        JsonNode node = ids.get(key);
        return node == null ? TextNode.valueOf(key) : node;
    }
}
