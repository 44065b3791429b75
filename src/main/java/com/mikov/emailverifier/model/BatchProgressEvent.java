package com.mikov.emailverifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Event emitted while a bulk validation runs. Exactly one payload field is
 * populated per type; the others are left out of the serialized form.
 *
 * @author zahari.mikov
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "progress", "partialResults", "results", "error"})
public class BatchProgressEvent {

    private final EventType type;
    private final Double progress;
    private final List<Map<String, Object>> partialResults;
    private final List<Map<String, Object>> results;
    private final String error;

    public static BatchProgressEvent progress(final double progress, final List<Map<String, Object>> partialResults) {
        return BatchProgressEvent.builder()
                .type(EventType.PROGRESS)
                .progress(progress)
                .partialResults(partialResults)
                .build();
    }

    public static BatchProgressEvent complete(final List<Map<String, Object>> results) {
        return BatchProgressEvent.builder()
                .type(EventType.COMPLETE)
                .results(results)
                .build();
    }

    public static BatchProgressEvent error(final String error) {
        return BatchProgressEvent.builder()
                .type(EventType.ERROR)
                .error(error)
                .build();
    }

    public enum EventType {
        PROGRESS,
        COMPLETE,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
