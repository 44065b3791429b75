package com.mikov.emailverifier.smtp.verification;

import com.mikov.emailverifier.smtp.core.SmtpConnection;
import com.mikov.emailverifier.smtp.dns.MxRecord;
import com.mikov.emailverifier.smtp.model.ProviderDialect;
import com.mikov.emailverifier.smtp.model.SmtpConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;

/**
 * Runs callout probes against mail exchangers. Every attempt owns exactly one
 * connection, released on every exit path.
 *
 * @author zahari.mikov
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpProber {
    private final SmtpConfig config;

    /**
     * Probes the exchangers in the given order and stops at the first positive answer.
     *
     * @return true if any exchanger indicated that the mailbox exists
     */
    public boolean probeAny(List<MxRecord> exchangers, String email, ProviderDialect dialect) {
        for (final var exchanger : exchangers) {
            if (probe(exchanger.hostname(), email, dialect)) {
                return true;
            }
            log.debug("Exchanger {} gave no positive answer for {}", exchanger.hostname(), email);
        }
        return false;
    }

    public boolean probe(String mxHost, String email, ProviderDialect dialect) {
        final var session = new ProbeSession(dialect, config.senderAddress(dialect.heloIdentity()), email);
        final var deadline = System.currentTimeMillis() + dialect.timeoutMs();
        log.debug("Probing {} for {} using the {} dialect", mxHost, email, dialect.name());

        final boolean verdict = runSession(mxHost, session, dialect, deadline);
        log.debug("Probe of {} for {} finished in state {} after {} commands: {}",
                mxHost, email, session.getState(), session.getCommandsSent(), verdict);
        return verdict;
    }

    private boolean runSession(String mxHost, ProbeSession session, ProviderDialect dialect, long deadline) {
        try (var connection = SmtpConnection.open(mxHost, config.getPort(), dialect.timeoutMs())) {
            while (!session.isFinished()) {
                final var readTimeout = readTimeout(dialect, deadline);
                if (readTimeout <= 0) {
                    return session.onTimeout();
                }
                connection.setReadTimeout(readTimeout);

                final var response = connection.readResponse();
                if (response == null) {
                    return session.onClose();
                }

                final var command = session.onResponse(response);
                if (command != null) {
                    connection.sendCommand(command);
                }
            }
            return session.getVerdict();
        } catch (SocketTimeoutException e) {
            log.debug("SMTP session with {} timed out: {}", mxHost, e.getMessage());
            return session.onTimeout();
        } catch (IOException e) {
            log.debug("SMTP session with {} failed: {}", mxHost, e.getMessage());
            return session.onConnectionError();
        }
    }

    private int readTimeout(ProviderDialect dialect, long deadline) {
        if (dialect.lenientFallback()) {
            return dialect.timeoutMs();
        }
        return (int) Math.max(0, deadline - System.currentTimeMillis());
    }
}
