package com.deepansh.gateway.stream;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Extracts {@code data:} payloads from a Server-Sent Events body.
 * Comments, blank lines and other fields are skipped; {@code [DONE]} ends the stream.
 */
public class SseLineDecoder implements AutoCloseable {

    public static final String DONE = "[DONE]";

    private final BufferedReader reader;
    private boolean finished;

    public SseLineDecoder(InputStream body) {
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
    }

    /**
     * @return the next data payload, or null at end of stream
     */
    public String nextData() throws IOException {
        if (finished) {
            return null;
        }
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank() || line.startsWith(":")) {
                continue;
            }
            if (!line.startsWith("data:")) {
                continue;
            }
            String data = line.substring(5).trim();
            if (DONE.equals(data)) {
                finished = true;
                return null;
            }
            if (!data.isEmpty()) {
                return data;
            }
        }
        finished = true;
        return null;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
