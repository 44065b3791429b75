package com.mikov.emailverifier.services;

import com.mikov.emailverifier.model.CheckSet;
import com.mikov.emailverifier.model.VerificationResult;
import com.mikov.emailverifier.smtp.dns.DomainResolutionException;
import com.mikov.emailverifier.smtp.dns.DomainResolver;
import com.mikov.emailverifier.smtp.dns.MxRecord;
import com.mikov.emailverifier.smtp.model.SmtpConfig;
import com.mikov.emailverifier.smtp.provider.ProviderRegistry;
import com.mikov.emailverifier.smtp.verification.SmtpProber;
import com.mikov.emailverifier.validation.SyntaxValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Verifies a single address: syntax, DNS, MX, SPF and an SMTP callout, folded
 * into one {@link VerificationResult}.
 *
 * <p>Domains outside the provider registry are judged leniently: a missing SPF
 * record is waived and an inconclusive callout still counts as deliverable.
 * Registry domains get neither allowance.
 *
 * @author zahari.mikov
 */
@Service
public class EmailVerificationService {
    private static final Logger logger = LoggerFactory.getLogger(EmailVerificationService.class);

    static final String DOMAIN_DOES_NOT_EXIST = "Domain does not exist";
    static final String NO_MAIL_SERVER = "No mail server found for domain";
    static final String MAIL_SERVER_LOOKUP_FAILED = "Failed to verify mail server";
    static final String MISSING_SPF = "Domain lacks SPF record";
    static final String SPF_LOOKUP_FAILED = "Failed to verify SPF record";
    static final String MAILBOX_NOT_CONFIRMED = "Mailbox verification failed";
    static final String MAILBOX_PROBE_FAILED = "Failed to verify mailbox";
    static final String UNCONFIRMED_BUT_PLAUSIBLE = "Email appears valid but could not fully verify";
    static final String VERIFIED = "Email verified successfully";
    static final String NOT_VERIFIED = "Failed to verify email";
    static final String VALIDATION_FAILED = "Validation failed";

    private final SyntaxValidator syntaxValidator;
    private final DomainResolver domainResolver;
    private final ProviderRegistry providerRegistry;
    private final SmtpProber smtpProber;
    private final SmtpConfig smtpConfig;

    public EmailVerificationService(final SyntaxValidator syntaxValidator,
                                    final DomainResolver domainResolver,
                                    final ProviderRegistry providerRegistry,
                                    final SmtpProber smtpProber,
                                    final SmtpConfig smtpConfig) {
        this.syntaxValidator = syntaxValidator;
        this.domainResolver = domainResolver;
        this.providerRegistry = providerRegistry;
        this.smtpProber = smtpProber;
        this.smtpConfig = smtpConfig;
    }

    /**
     * Verifies one address exactly as given; surrounding whitespace fails the syntax check.
     * Never throws: every failure ends up in the result's reason.
     *
     * @param email the candidate address
     * @return the verdict with the individual checks
     */
    public VerificationResult validateOne(final String email) {
        if (!syntaxValidator.isValidFormat(email)) {
            logger.debug("Email {} failed syntax validation", email);
            return VerificationResult.invalidFormat(email);
        }

        final var checks = CheckSet.builder();
        try {
            final var result = verify(email, checks);
            logger.info("Verified {}: valid={}, reason={}", email, result.isValid(), result.getReason());
            return result;
        } catch (final RuntimeException e) {
            logger.error("Unexpected error verifying {}: {}", email, e.getMessage(), e);
            return VerificationResult.of(email, checks.build(), VALIDATION_FAILED);
        }
    }

    private VerificationResult verify(final String email, final CheckSet.CheckSetBuilder checks) {
        final var domain = email.substring(email.indexOf('@') + 1).toLowerCase(Locale.ROOT);

        try {
            if (!domainResolver.hostExists(domain)) {
                logger.debug("Domain {} does not resolve", domain);
                return VerificationResult.of(email, checks.build(), DOMAIN_DOES_NOT_EXIST);
            }
        } catch (final DomainResolutionException e) {
            logger.warn("Existence check failed for {}: {}", domain, e.getMessage());
            return VerificationResult.of(email, checks.build(), DOMAIN_DOES_NOT_EXIST);
        }
        checks.dns(true);

        final List<MxRecord> exchangers;
        try {
            exchangers = domainResolver.resolveMailExchangers(domain);
        } catch (final DomainResolutionException e) {
            logger.warn("MX lookup failed for {}: {}", domain, e.getMessage());
            return VerificationResult.of(email, checks.build(), MAIL_SERVER_LOOKUP_FAILED);
        }
        if (exchangers.isEmpty()) {
            logger.debug("Domain {} publishes no MX records", domain);
            return VerificationResult.of(email, checks.build(), NO_MAIL_SERVER);
        }
        checks.mx(true);

        final var providerDialect = providerRegistry.findDialect(domain);
        final var registered = providerDialect != null;

        try {
            final var hasSpf = domainResolver.hasSpfRecord(domain);
            if (!hasSpf && registered) {
                return VerificationResult.of(email, checks.build(), MISSING_SPF);
            }
            checks.spf(true);
        } catch (final DomainResolutionException e) {
            if (registered) {
                logger.warn("SPF lookup failed for {}: {}", domain, e.getMessage());
                return VerificationResult.of(email, checks.build(), SPF_LOOKUP_FAILED);
            }
            logger.debug("Ignoring SPF lookup failure for unregistered domain {}", domain);
            checks.spf(true);
        }

        final var dialect = registered ? providerDialect : smtpConfig.genericDialect(domain);
        final boolean mailboxExists;
        try {
            mailboxExists = smtpProber.probeAny(exchangers, email, dialect);
        } catch (final RuntimeException e) {
            logger.warn("Mailbox probe for {} failed: {}", email, e.getMessage());
            return VerificationResult.of(email, checks.build(), MAILBOX_PROBE_FAILED);
        }

        if (!mailboxExists) {
            if (registered) {
                return VerificationResult.of(email, checks.build(), MAILBOX_NOT_CONFIRMED);
            }
            checks.mailbox(true).smtp(true);
            return VerificationResult.of(email, checks.build(), UNCONFIRMED_BUT_PLAUSIBLE);
        }

        checks.mailbox(true).smtp(true);
        final var verified = checks.build();
        return VerificationResult.of(email, verified, verified.allPassed() ? VERIFIED : NOT_VERIFIED);
    }
}
