package com.mikov.emailverifier.smtp.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SmtpConfig")
class SmtpConfigTest {

    @Test
    @DisplayName("Should default to port 25, a seven second timeout and the verify sender")
    void shouldProvideDefaults() {
        final var config = SmtpConfig.getDefault();

        assertThat(config.getPort()).isEqualTo(25);
        assertThat(config.getGenericTimeout()).isEqualTo(7000);
        assertThat(config.getSenderLocalPart()).isEqualTo("verify");
        assertThat(config.getHeloDomain()).isNull();
    }

    @Test
    @DisplayName("Should announce the recipient domain when no HELO domain is configured")
    void shouldAnnounceRecipientDomainByDefault() {
        final var dialect = SmtpConfig.getDefault().genericDialect("example.org");

        assertThat(dialect.name()).isEqualTo(ProviderDialect.GENERIC);
        assertThat(dialect.heloIdentity()).isEqualTo("example.org");
        assertThat(dialect.timeoutMs()).isEqualTo(7000);
        assertThat(dialect.successCodes()).containsExactlyInAnyOrder(250, 251, 252);
        assertThat(dialect.lenientFallback()).isTrue();
    }

    @Test
    @DisplayName("Should announce the configured HELO domain when set")
    void shouldAnnounceConfiguredHeloDomain() {
        final var config = SmtpConfig.builder().heloDomain("probe.example.net").genericTimeout(1500).build();

        final var dialect = config.genericDialect("example.org");

        assertThat(dialect.heloIdentity()).isEqualTo("probe.example.net");
        assertThat(dialect.timeoutMs()).isEqualTo(1500);
        assertThat(config.senderAddress(dialect.heloIdentity())).isEqualTo("verify@probe.example.net");
    }

    @Test
    @DisplayName("Should ignore a blank HELO domain")
    void shouldIgnoreBlankHeloDomain() {
        final var config = SmtpConfig.builder().heloDomain("  ").build();

        assertThat(config.genericDialect("example.org").heloIdentity()).isEqualTo("example.org");
    }
}
