package com.mikov.emailverifier.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mikov.emailverifier.model.BatchProgressEvent;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes each event as one line of JSON and flushes it immediately.
 */
public class NdjsonProgressSink implements BatchProgressSink {

    private final ObjectMapper objectMapper;
    private final OutputStream output;

    public NdjsonProgressSink(final ObjectMapper objectMapper, final OutputStream output) {
        this.objectMapper = objectMapper;
        this.output = output;
    }

    @Override
    public void accept(final BatchProgressEvent event) throws IOException {
        output.write(objectMapper.writeValueAsBytes(event));
        output.write('\n');
        output.flush();
    }
}
