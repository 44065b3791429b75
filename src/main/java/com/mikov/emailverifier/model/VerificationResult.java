package com.mikov.emailverifier.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of verifying a single address.
 *
 * @author zahari.mikov
 */
@Value
@Builder
@JsonPropertyOrder({"email", "valid", "checks", "reason"})
public class VerificationResult {

    public static final String INVALID_FORMAT = "Invalid email format";

    String email;
    boolean valid;
    CheckSet checks;
    String reason;

    /**
     * Builds a result whose validity is derived from the checks.
     *
     * @param email  the address as verified
     * @param checks the collected signals
     * @param reason human readable explanation, never empty
     * @return the result
     */
    public static VerificationResult of(final String email, final CheckSet checks, final String reason) {
        return VerificationResult.builder()
                .email(email)
                .valid(checks.allPassed())
                .checks(checks)
                .reason(reason)
                .build();
    }

    public static VerificationResult invalidFormat(final String email) {
        return of(email, CheckSet.none(), INVALID_FORMAT);
    }
}
