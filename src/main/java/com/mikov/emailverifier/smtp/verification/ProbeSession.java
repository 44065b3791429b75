package com.mikov.emailverifier.smtp.verification;

import com.mikov.emailverifier.smtp.core.SmtpResponse;
import com.mikov.emailverifier.smtp.model.ProviderDialect;
import lombok.Getter;

import java.util.Set;

/**
 * State machine of a single callout dialogue: greeting, HELO, MAIL FROM, RCPT TO, QUIT.
 *
 * <p>The session performs no I/O. The caller feeds it the final line of every
 * server reply and sends whatever command it returns; connection-level events
 * (timeout, error, close) are reported through the {@code on*} methods. Once a
 * verdict is reached it never changes.
 *
 * <p>Transitions, by the code of the reply:
 * <ul>
 *   <li>2xx, 451, 452: send the next command (QUIT replies end the session)</li>
 *   <li>5xx: end the session as invalid</li>
 *   <li>450: end the session as invalid for provider dialects; on the RCPT reply of
 *       the generic dialect it counts as a soft accept and the dialogue moves on</li>
 *   <li>anything else: ignored, the session keeps waiting</li>
 * </ul>
 */
public class ProbeSession {
    private static final Set<Integer> TEMPORARY_CODES = Set.of(450, 451, 452);

    private final ProviderDialect dialect;
    private final String sender;
    private final String recipient;

    @Getter
    private ProbeState state = ProbeState.CONNECTING;
    @Getter
    private int commandsSent;
    @Getter
    private boolean valid;
    @Getter
    private boolean rcptObserved;
    private Boolean verdict;

    public ProbeSession(ProviderDialect dialect, String sender, String recipient) {
        this.dialect = dialect;
        this.sender = sender;
        this.recipient = recipient;
    }

    /**
     * Consumes one server reply.
     *
     * @return the command to send next, or null if nothing should be sent
     */
    public String onResponse(SmtpResponse response) {
        if (isFinished() || !response.hasCode()) {
            return null;
        }

        recordEvidence(response);

        if (state == ProbeState.AWAITING_QUIT) {
            finish(resolveOnClose());
            return null;
        }

        if (advances(response)) {
            state = state.next();
            commandsSent++;
            return commandFor(state);
        }

        if (aborts(response)) {
            valid = false;
            finish(false);
        }
        return null;
    }

    /**
     * The server stayed silent past the dialect's timeout.
     */
    public boolean onTimeout() {
        return finish(dialect.lenientFallback() ? commandsSent >= 2 : valid);
    }

    /**
     * The socket failed (refused, reset, unreachable).
     */
    public boolean onConnectionError() {
        return finish(dialect.lenientFallback() ? commandsSent >= 1 : valid);
    }

    /**
     * The server closed the connection.
     */
    public boolean onClose() {
        return finish(resolveOnClose());
    }

    public boolean isFinished() {
        return verdict != null;
    }

    public boolean getVerdict() {
        return Boolean.TRUE.equals(verdict);
    }

    private void recordEvidence(SmtpResponse response) {
        final var code = response.getCode();
        if (!dialect.lenientFallback()) {
            if (dialect.isSuccessCode(code)) {
                valid = true;
            }
            return;
        }

        if (state == ProbeState.AWAITING_RCPT) {
            rcptObserved = true;
            if (dialect.isSuccessCode(code) || TEMPORARY_CODES.contains(code)) {
                valid = true;
            } else if (response.isPermanentFailure()) {
                valid = false;
            }
        }
    }

    private boolean advances(SmtpResponse response) {
        final var code = response.getCode();
        if (response.isPositive() || code == 451 || code == 452) {
            return true;
        }
        return dialect.lenientFallback() && state == ProbeState.AWAITING_RCPT && code == 450;
    }

    private boolean aborts(SmtpResponse response) {
        return response.isPermanentFailure() || (!dialect.lenientFallback() && response.getCode() == 450);
    }

    private boolean resolveOnClose() {
        if (dialect.lenientFallback()) {
            return valid || (commandsSent > 1 && !rcptObserved);
        }
        return valid;
    }

    private String commandFor(ProbeState awaiting) {
        switch (awaiting) {
            case AWAITING_HELO:
                return "HELO " + dialect.heloIdentity();
            case AWAITING_MAIL_FROM:
                return "MAIL FROM:<" + sender + ">";
            case AWAITING_RCPT:
                return "RCPT TO:<" + recipient + ">";
            case AWAITING_QUIT:
                return "QUIT";
            default:
                throw new IllegalStateException("No command leads to state " + awaiting);
        }
    }

    private boolean finish(boolean result) {
        if (verdict == null) {
            verdict = result;
            state = ProbeState.CLOSED;
        }
        return verdict;
    }
}
