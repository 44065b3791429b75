package com.mikov.emailverifier.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * The individual signals collected while verifying one address.
 * {@code mailbox} and {@code smtp} are only ever set together.
 *
 * @author zahari.mikov
 */
@Value
@Builder
@JsonPropertyOrder({"mx", "dns", "spf", "mailbox", "smtp"})
public class CheckSet {

    boolean mx;
    boolean dns;
    boolean spf;
    boolean mailbox;
    boolean smtp;

    public static CheckSet none() {
        return CheckSet.builder().build();
    }

    public boolean allPassed() {
        return mx && dns && spf && mailbox && smtp;
    }
}
