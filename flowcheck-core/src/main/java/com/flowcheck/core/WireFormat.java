package com.flowcheck.core;

import com.flowcheck.core.model.Diagnostic;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of requests and responses exchanged with a hosting tool server.
 *
 * <p>Responses are written from their {@code toWire()} maps, so field names and order
 * follow the wire schema rather than Java naming.</p>
 */
public final class WireFormat {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<List<Map<String, Object>>> ENTRY_LIST = new TypeReference<>() {
    };

    private WireFormat() {
        // Utility class - no instantiation
    }

    /**
     * Writes a wire map or list as indented JSON.
     *
     * @param wire value built from {@code toWire()} maps
     * @return JSON text
     * @throws IOException if the value cannot be serialized
     */
    public static String toJson(Object wire) throws IOException {
        return MAPPER.writeValueAsString(wire);
    }

    /**
     * Reads a JSON array of connection objects.
     *
     * @param json JSON text
     * @return entries in array order
     * @throws IOException if the text is not a JSON array of objects
     */
    public static List<Map<String, Object>> readConnections(String json) throws IOException {
        List<Map<String, Object>> entries = MAPPER.readValue(json, ENTRY_LIST);
        return entries != null ? entries : List.of();
    }

    /**
     * Reads a JSON array of diagnostics in wire form.
     *
     * @param json JSON text
     * @return diagnostics in array order
     * @throws IOException if the text is not a JSON array of objects
     */
    public static List<Diagnostic> readDiagnostics(String json) throws IOException {
        List<Map<String, Object>> entries = MAPPER.readValue(json, ENTRY_LIST);
        if (entries == null) {
            return List.of();
        }
        return entries.stream().filter(Objects::nonNull).map(Diagnostic::fromWire).toList();
    }
}
