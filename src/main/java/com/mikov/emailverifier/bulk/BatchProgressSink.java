package com.mikov.emailverifier.bulk;

import com.mikov.emailverifier.model.BatchProgressEvent;

import java.io.IOException;

/**
 * Receives the events of a bulk job; each event is delivered as an independently parseable unit.
 */
@FunctionalInterface
public interface BatchProgressSink {

    void accept(BatchProgressEvent event) throws IOException;
}
