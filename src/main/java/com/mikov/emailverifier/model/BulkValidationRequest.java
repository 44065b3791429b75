package com.mikov.emailverifier.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Model for WebSocket bulk validation requests
 */
@Data
@NoArgsConstructor
public class BulkValidationRequest {

    /**
     * Unique session ID used to route progress events back to the caller.
     * A missing or blank value is replaced with a random one.
     */
    private String sessionId = newSessionId();

    /**
     * Rows to validate, each expected to carry an email column
     */
    private List<Map<String, String>> records;

    public BulkValidationRequest(final String sessionId, final List<Map<String, String>> records) {
        setSessionId(sessionId);
        this.records = records;
    }

    public void setSessionId(final String sessionId) {
        this.sessionId = sessionId == null || sessionId.isBlank() ? newSessionId() : sessionId;
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }
}
