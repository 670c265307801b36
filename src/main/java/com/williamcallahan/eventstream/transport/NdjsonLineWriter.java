package com.williamcallahan.eventstream.transport;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writes JSON values one per line.
 *
 * <p>The spaced rendering used when compact output is off keeps every value on a single
 * line; only separators gain whitespace. The underlying stream is never closed here.</p>
 */
public final class NdjsonLineWriter {

    private static final byte NEWLINE = '\n';

    private final OutputStream out;
    private final ObjectWriter jsonWriter;

    public NdjsonLineWriter(OutputStream out, ObjectMapper objectMapper, boolean compact) {
        this.out = Objects.requireNonNull(out, "out");
        ObjectWriter writer = objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (!compact) {
            // arrays already use a fixed single space; objects lose their line feeds
            DefaultPrettyPrinter singleLine = new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("", ""));
            writer = writer.with(singleLine);
        }
        this.jsonWriter = writer;
    }

    /** Writes {@code value} followed by a newline. Does not flush. */
    public void writeLine(JsonNode value) throws IOException {
        jsonWriter.writeValue(out, value);
        out.write(NEWLINE);
    }

    public void flush() throws IOException {
        out.flush();
    }
}
