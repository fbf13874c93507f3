package io.clustersearch.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clustersearch.exceptions.SearchCommandException;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes each record as one UTF-8 JSON object per line.
 *
 * A write failure on the underlying stream (closed pipe, reader gone) surfaces as a
 * {@link SearchCommandException} from {@link #emit}, so the search stops and releases its cursor.
 */
public class JsonLinesRecordEmitter implements RecordEmitter {

    private final PrintStream out;
    private final ObjectMapper objectMapper;

    public JsonLinesRecordEmitter(OutputStream out, ObjectMapper objectMapper) {
        this.out = new PrintStream(out, false, StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    public void emit(Map<String, Object> record) {
        String line;
        try {
            line = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record: " + e.getMessage(), e);
        }
        out.println(line);
        // PrintStream records IO failures instead of throwing; checkError also flushes
        if (out.checkError()) {
            throw new SearchCommandException("Output stream closed, stopping search");
        }
    }

    @Override
    public void flush() {
        out.flush();
    }
}
