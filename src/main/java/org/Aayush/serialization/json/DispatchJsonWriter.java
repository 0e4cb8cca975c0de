package org.Aayush.serialization.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.dispatch.core.DispatchPlan;
import org.Aayush.dispatch.core.DroneAssignment;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renders a selected plan as a dispatch output document.
 */
public final class DispatchJsonWriter {
    private final ObjectMapper objectMapper;

    public DispatchJsonWriter() {
        this(DispatchJson.objectMapper());
    }

    public DispatchJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Maps a plan to its wire document, one entry per planned drone, restoring the ids
     * as the input document spelled them.
     */
    public static OutputDocument toDocument(DispatchPlan plan, DispatchInput input) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(input, "input");
        OutputDocument.OutputDocumentBuilder builder = OutputDocument.builder();
        for (DroneAssignment assignment : plan.getDroneAssignments()) {
            OutputDocument.AssignmentRecord.AssignmentRecordBuilder record = OutputDocument.AssignmentRecord.builder()
                    .drone(input.originalDroneId(assignment.getDroneId()))
                    .totalDistance(assignment.getTotalDistance());
            for (String orderId : assignment.getOrderIds()) {
                record.order(input.originalOrderId(orderId));
            }
            builder.assignment(record.build());
        }
        return builder.build();
    }

    /**
     * Writes the plan to {@code path}, replacing any existing file.
     *
     * @throws UncheckedIOException when the file cannot be written.
     */
    public void write(DispatchPlan plan, DispatchInput input, Path path) {
        try {
            objectMapper.writeValue(path.toFile(), toDocument(plan, input));
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write dispatch output " + path, ex);
        }
    }

    /**
     * Renders the plan as a JSON string.
     */
    public String writeString(DispatchPlan plan, DispatchInput input) {
        try {
            return objectMapper.writeValueAsString(toDocument(plan, input));
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("failed to render dispatch output", ex);
        }
    }
}
