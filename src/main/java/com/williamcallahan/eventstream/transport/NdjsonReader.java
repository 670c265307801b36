package com.williamcallahan.eventstream.transport;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.williamcallahan.eventstream.domain.wire.WireFormatException;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads an NDJSON stream back into JSON trees as a sequence of root-level values. Blank
 * lines are skipped.
 */
public final class NdjsonReader {

    private final Reader source;
    private final ObjectReader jsonReader;
    private MappingIterator<JsonNode> values;

    public NdjsonReader(Reader source, ObjectMapper objectMapper) {
        this.source = Objects.requireNonNull(source, "source");
        this.jsonReader = Objects.requireNonNull(objectMapper, "objectMapper").readerFor(JsonNode.class);
    }

    /**
     * Reads the next value.
     *
     * @return the parsed value, or empty at end of input
     * @throws WireFormatException if the input is not valid JSON
     */
    public Optional<JsonNode> next() throws IOException {
        try {
            if (values == null) {
                values = jsonReader.readValues(source);
            }
            return values.hasNextValue() ? Optional.of(values.nextValue()) : Optional.empty();
        } catch (JsonProcessingException malformed) {
            JsonLocation location = malformed.getLocation();
            String where = location == null ? "" : " at line " + location.getLineNr();
            throw new WireFormatException("Invalid NDJSON" + where, malformed);
        }
    }

    /** Reads every remaining value. */
    public List<JsonNode> readAll() throws IOException {
        List<JsonNode> all = new ArrayList<>();
        Optional<JsonNode> value;
        while ((value = next()).isPresent()) {
            all.add(value.get());
        }
        return all;
    }
}
