package com.mikov.emailverifier.smtp.provider;

import com.mikov.emailverifier.smtp.model.ProviderDialect;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static lookup from well-known receiving domains to their SMTP dialect.
 * Read-only after class initialisation.
 *
 * @author zahari.mikov
 */
@Component
public class ProviderRegistry {

    private static final Map<String, ProviderDialect> DIALECTS = new LinkedHashMap<>();

    static {
        register(ProviderDialect.provider("outlook.com",
                Set.of("outlook.com", "hotmail.com", "live.com"),
                "outlook-com.olc.protection.outlook.com", 15000, Set.of(250, 251)));
        register(ProviderDialect.provider("yahoo.com",
                Set.of("yahoo.com", "ymail.com", "yahoo.co.uk"),
                "yahoo-smtp-in.l.yahoo.com", 12000, Set.of(250, 235)));
        register(ProviderDialect.provider("icloud.com",
                Set.of("icloud.com", "me.com", "mac.com"),
                "icloud-com.mail.protection.outlook.com", 10000, Set.of(250, 220)));
    }

    private static void register(final ProviderDialect dialect) {
        DIALECTS.put(dialect.name(), dialect);
    }

    /**
     * Finds the dialect serving a domain. Matching is exact and case-insensitive;
     * subdomains of a listed alias do not match.
     *
     * @param domain the receiving domain
     * @return the dialect, or null for domains handled by the generic dialect
     */
    public ProviderDialect findDialect(final String domain) {
        for (final var dialect : DIALECTS.values()) {
            if (dialect.matches(domain)) {
                return dialect;
            }
        }
        return null;
    }
}
