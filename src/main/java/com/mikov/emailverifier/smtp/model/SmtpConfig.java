package com.mikov.emailverifier.smtp.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SmtpConfig {
    public static final int DEFAULT_PORT = 25;
    public static final int DEFAULT_GENERIC_TIMEOUT = 7000;
    public static final String DEFAULT_SENDER_LOCAL_PART = "verify";

    @Builder.Default
    private final int port = DEFAULT_PORT;
    @Builder.Default
    private final int genericTimeout = DEFAULT_GENERIC_TIMEOUT;
    @Builder.Default
    private final String senderLocalPart = DEFAULT_SENDER_LOCAL_PART;
    private final String heloDomain;

    public static SmtpConfig getDefault() {
        return SmtpConfig.builder().build();
    }

    /**
     * Generic dialect for a recipient domain. Without a configured HELO domain the
     * recipient's own domain is announced.
     */
    public ProviderDialect genericDialect(String recipientDomain) {
        final var helo = heloDomain == null || heloDomain.isBlank() ? recipientDomain : heloDomain;
        return ProviderDialect.generic(helo, genericTimeout);
    }

    public String senderAddress(String heloIdentity) {
        return senderLocalPart + "@" + heloIdentity;
    }
}
