package org.Aayush.serialization.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.dispatch.core.DispatchCore;
import org.Aayush.dispatch.core.DispatchPlan;
import org.Aayush.dispatch.core.DispatchRequest;
import org.Aayush.dispatch.core.DispatchRuntimeConfig;
import org.Aayush.dispatch.core.DroneAssignment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchJsonTest {
    private static final double EPS = 1e-9;
    private static final String ONE_DRONE_FLEET =
            "\"drones\":{\"fleet\":[{\"id\":\"D1\",\"max_payload\":5,\"max_distance\":20,\"speed\":1,\"available\":true}]}";
    private static final String ONE_ORDER =
            "\"orders\":[{\"id\":\"A\",\"delivery_x\":3,\"delivery_y\":4,\"deadline\":10,\"package_weight\":2}]";

    private final DispatchJsonReader reader = new DispatchJsonReader();
    private final DispatchJsonWriter writer = new DispatchJsonWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    private static DispatchPlan plan(DispatchInput input) {
        return DispatchCore.builder().config(DispatchRuntimeConfig.sequential()).build().plan(input.getRequest());
    }

    private DispatchInput readSample() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/sample-input.json")) {
            return reader.read(in);
        }
    }

    @Test
    @DisplayName("Reader: sample document maps fields, keys numeric ids by text, ignores extras")
    void testReadSample() throws IOException {
        DispatchInput input = readSample();
        DispatchRequest request = input.getRequest();

        assertEquals(3, request.getOrders().size());
        assertEquals("ORD-2", request.getOrders().get(1).getId());
        assertEquals(-2.0d, request.getOrders().get(1).getX(), EPS);
        assertEquals(1.5d, request.getOrders().get(1).getWeight(), EPS);
        assertEquals(3, request.getDrones().size());
        assertEquals("101", request.getDrones().get(0).getId());
        assertEquals(30.0d, request.getDrones().get(0).getMaxDistance(), EPS);
        assertFalse(request.getDrones().get(1).isAvailable());

        assertTrue(input.originalDroneId("101").isNumber());
        assertTrue(input.originalOrderId("ORD-1").isTextual());
    }

    @Test
    @DisplayName("Writer: one entry per available drone with orders and distance")
    void testWriteSamplePlan(@TempDir Path dir) throws IOException {
        DispatchInput input = readSample();
        DispatchPlan plan = plan(input);
        Path output = dir.resolve("output.json");
        writer.write(plan, input, output);

        JsonNode assignments = mapper.readTree(Files.readString(output)).get("assignments");
        assertEquals(2, assignments.size());
        assertEquals(101, assignments.get(0).get("drone").asInt());
        assertEquals(103, assignments.get(1).get("drone").asInt());

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < assignments.size(); i++) {
            JsonNode entry = assignments.get(i);
            DroneAssignment expected = plan.getDroneAssignments().get(i);
            assertEquals(expected.getTotalDistance(), entry.get("total_distance").asDouble(), EPS);
            assertEquals(expected.getOrderIds().size(), entry.get("orders").size());
            for (JsonNode order : entry.get("orders")) {
                assertTrue(order.isTextual());
                assertTrue(seen.add(order.asText()));
            }
        }
        assertEquals(plan.getCoveredOrderCount(), seen.size());
    }

    @Test
    @DisplayName("Numeric ids are written back as numbers, string ids as strings")
    void testIdTypesSurvive() throws IOException {
        String json = "{\"orders\":[{\"id\":7,\"delivery_x\":1,\"delivery_y\":1,\"deadline\":10,\"package_weight\":1}],"
                + "\"drones\":{\"fleet\":["
                + "{\"id\":101,\"max_payload\":5,\"max_distance\":20,\"speed\":1,\"available\":true},"
                + "{\"id\":\"spare\",\"max_payload\":5,\"max_distance\":20,\"speed\":1,\"available\":true}]}}";
        DispatchInput input = reader.readString(json);

        JsonNode assignments = mapper.readTree(writer.writeString(plan(input), input)).get("assignments");
        JsonNode first = assignments.get(0);
        assertTrue(first.get("drone").isNumber());
        assertEquals(101, first.get("drone").asInt());
        assertTrue(first.get("orders").get(0).isNumber());
        assertEquals(7, first.get("orders").get(0).asInt());
        assertTrue(assignments.get(1).get("drone").isTextual());
        assertEquals("spare", assignments.get(1).get("drone").asText());
    }

    @Test
    @DisplayName("Round trip: single order document yields a 14-unit trip")
    void testSingleOrderDocument() throws IOException {
        DispatchInput input = reader.readString("{" + ONE_ORDER + "," + ONE_DRONE_FLEET + "}");

        JsonNode entry = mapper.readTree(writer.writeString(plan(input), input)).get("assignments").get(0);

        assertEquals("D1", entry.get("drone").asText());
        assertEquals("A", entry.get("orders").get(0).asText());
        assertEquals(14.0d, entry.get("total_distance").asDouble(), EPS);
    }

    @Test
    @DisplayName("Idle drones render an empty order list")
    void testIdleRendering() throws IOException {
        String json = "{\"orders\":[{\"id\":\"HEAVY\",\"delivery_x\":1,\"delivery_y\":1,\"deadline\":10,\"package_weight\":50}],"
                + ONE_DRONE_FLEET + "}";
        DispatchInput input = reader.readString(json);

        JsonNode entry = mapper.readTree(writer.writeString(plan(input), input)).get("assignments").get(0);
        assertTrue(entry.get("orders").isArray());
        assertEquals(0, entry.get("orders").size());
        assertEquals(0.0d, entry.get("total_distance").asDouble(), EPS);
    }

    @Test
    @DisplayName("Validation: contract violations name the offending field")
    void testValidation() {
        IllegalArgumentException negativeWeight = assertThrows(IllegalArgumentException.class, () -> reader.readString(
                "{\"orders\":[{\"id\":\"A\",\"delivery_x\":1,\"delivery_y\":1,\"deadline\":5,\"package_weight\":-1}],"
                        + ONE_DRONE_FLEET + "}"));
        assertTrue(negativeWeight.getMessage().contains("orders[0].package_weight"));

        IllegalArgumentException missingFleet = assertThrows(IllegalArgumentException.class,
                () -> reader.readString("{" + ONE_ORDER + "}"));
        assertTrue(missingFleet.getMessage().contains("drones.fleet missing"));

        IllegalArgumentException emptyFleet = assertThrows(IllegalArgumentException.class,
                () -> reader.readString("{" + ONE_ORDER + ",\"drones\":{\"fleet\":[]}}"));
        assertTrue(emptyFleet.getMessage().contains("drones.fleet must be non-empty"));

        IllegalArgumentException duplicate = assertThrows(IllegalArgumentException.class, () -> reader.readString(
                "{" + ONE_ORDER + ",\"drones\":{\"fleet\":["
                        + "{\"id\":\"D\",\"max_payload\":1,\"max_distance\":1,\"speed\":1,\"available\":true},"
                        + "{\"id\":\"D\",\"max_payload\":1,\"max_distance\":1,\"speed\":1,\"available\":true}]}}"));
        assertTrue(duplicate.getMessage().contains("drones.fleet[1].id duplicate"));

        IllegalArgumentException missingAvailability = assertThrows(IllegalArgumentException.class, () -> reader.readString(
                "{" + ONE_ORDER + ",\"drones\":{\"fleet\":[{\"id\":\"D\",\"max_payload\":1,\"max_distance\":1,\"speed\":1}]}}"));
        assertTrue(missingAvailability.getMessage().contains("available missing"));

        IllegalArgumentException missingCoordinate = assertThrows(IllegalArgumentException.class, () -> reader.readString(
                "{\"orders\":[{\"id\":\"A\",\"delivery_y\":1,\"deadline\":5,\"package_weight\":1}]," + ONE_DRONE_FLEET + "}"));
        assertTrue(missingCoordinate.getMessage().contains("orders[0].delivery_x missing"));

        IllegalArgumentException objectId = assertThrows(IllegalArgumentException.class, () -> reader.readString(
                "{\"orders\":[{\"id\":{\"k\":1},\"delivery_x\":1,\"delivery_y\":1,\"deadline\":5,\"package_weight\":1}],"
                        + ONE_DRONE_FLEET + "}"));
        assertTrue(objectId.getMessage().contains("orders[0].id must be a string or number"));
    }

    @Test
    @DisplayName("Validation: an empty order list is rejected before planning")
    void testEmptyOrdersRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> reader.readString("{\"orders\":[]," + ONE_DRONE_FLEET + "}"));
        assertEquals("DispatchJsonReader: orders must be non-empty", ex.getMessage());
    }

    @Test
    @DisplayName("Malformed JSON is invalid input; a missing file is an I/O failure")
    void testParseAndIoFailures(@TempDir Path dir) {
        IllegalArgumentException malformed = assertThrows(IllegalArgumentException.class,
                () -> reader.readString("{not json"));
        assertTrue(malformed.getMessage().startsWith("DispatchJsonReader: malformed document"));

        assertThrows(UncheckedIOException.class, () -> reader.read(dir.resolve("absent.json")));
    }
}
