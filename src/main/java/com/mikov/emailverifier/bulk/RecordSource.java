package com.mikov.emailverifier.bulk;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Supplies the rows of a bulk job, in order.
 */
@FunctionalInterface
public interface RecordSource {

    List<Map<String, String>> readRecords() throws IOException;
}
