package org.Aayush.serialization.json;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import org.Aayush.dispatch.core.DispatchRequest;
import org.Aayush.dispatch.model.Drone;
import org.Aayush.dispatch.model.Order;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fail-fast contract validation of a parsed input document.
 *
 * <p>Every failure is an {@link IllegalArgumentException} whose message starts with the
 * logical loader name and the offending field path.</p>
 */
@UtilityClass
public final class DispatchInputValidator {

    /**
     * Validates the document and converts it into a dispatch request.
     *
     * <p>Ids may be JSON strings or numbers; the engine sees their text, the returned
     * input keeps the original nodes.</p>
     *
     * @param document parsed input document.
     * @param loaderName logical loader name for error messages.
     * @return request holding every order and every fleet drone in document order,
     * together with the original id nodes.
     */
    public static DispatchInput toInput(InputDocument document, String loaderName) {
        if (document == null) {
            throw new IllegalArgumentException(loaderName + ": document root cannot be null");
        }
        List<InputDocument.OrderRecord> orders = document.getOrders();
        if (orders == null) {
            throw new IllegalArgumentException(loaderName + ": orders missing");
        }
        if (orders.isEmpty()) {
            throw new IllegalArgumentException(loaderName + ": orders must be non-empty");
        }
        if (document.getDrones() == null || document.getDrones().getFleet() == null) {
            throw new IllegalArgumentException(loaderName + ": drones.fleet missing");
        }
        List<InputDocument.DroneRecord> fleet = document.getDrones().getFleet();
        if (fleet.isEmpty()) {
            throw new IllegalArgumentException(loaderName + ": drones.fleet must be non-empty");
        }

        DispatchRequest.DispatchRequestBuilder builder = DispatchRequest.builder();
        Map<String, JsonNode> orderIds = new HashMap<>();
        for (int i = 0; i < orders.size(); i++) {
            String path = "orders[" + i + "]";
            InputDocument.OrderRecord record = requireRecord(orders.get(i), loaderName, path);
            String id = requireUniqueId(record.getId(), orderIds, loaderName, path);
            builder.order(Order.builder()
                    .id(id)
                    .x(requireFinite(record.getDeliveryX(), loaderName, path + ".delivery_x"))
                    .y(requireFinite(record.getDeliveryY(), loaderName, path + ".delivery_y"))
                    .deadline(requireNonNegative(record.getDeadline(), loaderName, path + ".deadline"))
                    .weight(requireNonNegative(record.getPackageWeight(), loaderName, path + ".package_weight"))
                    .build());
        }

        Map<String, JsonNode> droneIds = new HashMap<>();
        for (int i = 0; i < fleet.size(); i++) {
            String path = "drones.fleet[" + i + "]";
            InputDocument.DroneRecord record = requireRecord(fleet.get(i), loaderName, path);
            String id = requireUniqueId(record.getId(), droneIds, loaderName, path);
            if (record.getAvailable() == null) {
                throw new IllegalArgumentException(loaderName + ": " + path + ".available missing");
            }
            builder.drone(Drone.builder()
                    .id(id)
                    .maxPayload(requireNonNegative(record.getMaxPayload(), loaderName, path + ".max_payload"))
                    .maxDistance(requireNonNegative(record.getMaxDistance(), loaderName, path + ".max_distance"))
                    .speed(requireNonNegative(record.getSpeed(), loaderName, path + ".speed"))
                    .available(record.getAvailable())
                    .build());
        }
        return new DispatchInput(builder.build(), orderIds, droneIds);
    }

    private static <T> T requireRecord(T record, String loaderName, String path) {
        if (record == null) {
            throw new IllegalArgumentException(loaderName + ": " + path + " cannot be null");
        }
        return record;
    }

    private static String requireUniqueId(
            JsonNode node,
            Map<String, JsonNode> seen,
            String loaderName,
            String path
    ) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(loaderName + ": " + path + ".id missing");
        }
        if (!node.isTextual() && !node.isNumber()) {
            throw new IllegalArgumentException(
                    loaderName + ": " + path + ".id must be a string or number, got " + node.getNodeType()
            );
        }
        String id = node.asText();
        if (id.isBlank()) {
            throw new IllegalArgumentException(loaderName + ": " + path + ".id missing");
        }
        if (seen.putIfAbsent(id, node) != null) {
            throw new IllegalArgumentException(loaderName + ": " + path + ".id duplicate: " + id);
        }
        return id;
    }

    private static double requireFinite(Double value, String loaderName, String field) {
        if (value == null) {
            throw new IllegalArgumentException(loaderName + ": " + field + " missing");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(loaderName + ": " + field + " must be finite, got " + value);
        }
        return value;
    }

    private static double requireNonNegative(Double value, String loaderName, String field) {
        double finite = requireFinite(value, loaderName, field);
        if (finite < 0.0d) {
            throw new IllegalArgumentException(loaderName + ": " + field + " must be >= 0, got " + finite);
        }
        return finite;
    }
}
