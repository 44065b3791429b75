package com.mikov.emailverifier.smtp.verification;

/**
 * States of a probe dialogue, in the order they are walked.
 */
public enum ProbeState {
    CONNECTING,
    AWAITING_HELO,
    AWAITING_MAIL_FROM,
    AWAITING_RCPT,
    AWAITING_QUIT,
    CLOSED;

    public ProbeState next() {
        return this == CLOSED ? CLOSED : values()[ordinal() + 1];
    }
}
