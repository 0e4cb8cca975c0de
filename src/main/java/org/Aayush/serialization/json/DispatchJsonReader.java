package org.Aayush.serialization.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads dispatch input documents into validated requests.
 *
 * <p>Unreadable sources surface as {@link UncheckedIOException}; documents that are not
 * valid JSON, or that violate the input contract, as {@link IllegalArgumentException}.</p>
 */
public final class DispatchJsonReader {
    private static final String LOADER_NAME = "DispatchJsonReader";

    private final ObjectMapper objectMapper;

    public DispatchJsonReader() {
        this(DispatchJson.objectMapper());
    }

    public DispatchJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads and validates one input file.
     *
     * @throws UncheckedIOException when the file cannot be read.
     * @throws IllegalArgumentException when the document is malformed or violates the input contract.
     */
    public DispatchInput read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read dispatch input " + path, ex);
        }
    }

    /**
     * Reads and validates one input stream. The stream is not closed.
     */
    public DispatchInput read(InputStream in) {
        final InputDocument document;
        try {
            document = objectMapper.readValue(in, InputDocument.class);
        } catch (JsonProcessingException ex) {
            throw malformed(ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to parse dispatch input", ex);
        }
        return DispatchInputValidator.toInput(document, LOADER_NAME);
    }

    /**
     * Reads and validates one in-memory document.
     */
    public DispatchInput readString(String json) {
        final InputDocument document;
        try {
            document = objectMapper.readValue(json, InputDocument.class);
        } catch (JsonProcessingException ex) {
            throw malformed(ex);
        }
        return DispatchInputValidator.toInput(document, LOADER_NAME);
    }

    private static IllegalArgumentException malformed(JsonProcessingException ex) {
        return new IllegalArgumentException(LOADER_NAME + ": malformed document: " + ex.getOriginalMessage(), ex);
    }
}
