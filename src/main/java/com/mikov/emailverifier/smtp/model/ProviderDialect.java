package com.mikov.emailverifier.smtp.model;

import java.util.Locale;
import java.util.Set;

/**
 * SMTP parameters governing how a probe session talks to one receiving provider.
 *
 * <p>The generic dialect is used for every domain the registry does not know. It
 * evaluates success codes on the RCPT reply only, tolerates temporary failures
 * there and resolves timeouts, errors and ambiguous closes in favour of the
 * mailbox ({@code lenientFallback}). Provider dialects instead accept any reply
 * carrying one of their success codes and resolve to what was observed.
 *
 * @param name            provider key, {@value #GENERIC} for the generic dialect
 * @param matchDomains    lower-case receiving domains served by the provider
 * @param heloIdentity    identity announced in HELO and used as the MAIL FROM domain
 * @param timeoutMs       idle timeout for the generic dialect, whole-session budget otherwise
 * @param successCodes    reply codes taken as evidence that the mailbox exists
 * @param lenientFallback whether ambiguity resolves towards "valid"
 */
public record ProviderDialect(String name,
                              Set<String> matchDomains,
                              String heloIdentity,
                              int timeoutMs,
                              Set<Integer> successCodes,
                              boolean lenientFallback) {

    public static final String GENERIC = "generic";

    private static final Set<Integer> GENERIC_SUCCESS_CODES = Set.of(250, 251, 252);

    public ProviderDialect {
        matchDomains = Set.copyOf(matchDomains);
        successCodes = Set.copyOf(successCodes);
    }

    public static ProviderDialect provider(String name, Set<String> matchDomains, String heloIdentity,
                                           int timeoutMs, Set<Integer> successCodes) {
        return new ProviderDialect(name, matchDomains, heloIdentity, timeoutMs, successCodes, false);
    }

    public static ProviderDialect generic(String heloIdentity, int timeoutMs) {
        return new ProviderDialect(GENERIC, Set.of(), heloIdentity, timeoutMs, GENERIC_SUCCESS_CODES, true);
    }

    public boolean matches(String domain) {
        return domain != null && matchDomains.contains(domain.toLowerCase(Locale.ROOT));
    }

    public boolean isSuccessCode(int code) {
        return successCodes.contains(code);
    }
}
