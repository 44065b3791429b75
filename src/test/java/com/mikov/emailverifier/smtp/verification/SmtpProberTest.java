package com.mikov.emailverifier.smtp.verification;

import com.mikov.emailverifier.smtp.dns.MxRecord;
import com.mikov.emailverifier.smtp.model.ProviderDialect;
import com.mikov.emailverifier.smtp.model.SmtpConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SmtpProber")
class SmtpProberTest {

    private static final String EMAIL = "user@example.com";
    private static final List<String> GREETING = List.of("220 fake.example.com ESMTP");

    private FakeSmtpServer server;

    @AfterEach
    void tearDown() throws IOException {
        if (server != null) {
            server.close();
        }
    }

    private SmtpProber proberFor(int port) {
        return new SmtpProber(SmtpConfig.builder().port(port).genericTimeout(300).build());
    }

    private ProviderDialect genericDialect() {
        return SmtpConfig.builder().genericTimeout(300).build().genericDialect("example.com");
    }

    private static Function<String, String> silentOn(String prefix) {
        final var accepting = FakeSmtpServer.accepting();
        return line -> line.startsWith(prefix) ? null : accepting.apply(line);
    }

    @Test
    @DisplayName("Should confirm an accepted mailbox after a full conversation")
    void shouldConfirmAcceptedMailbox() throws Exception {
        server = new FakeSmtpServer(GREETING, FakeSmtpServer.accepting());

        final var result = proberFor(server.getPort()).probe(FakeSmtpServer.HOST, EMAIL, genericDialect());

        assertThat(result).isTrue();
        assertThat(server.awaitReceived("QUIT", 1000)).isTrue();
        assertThat(server.getReceived()).containsExactly(
                "HELO example.com",
                "MAIL FROM:<verify@example.com>",
                "RCPT TO:<user@example.com>",
                "QUIT");
    }

    @Test
    @DisplayName("Should reject a refused mailbox and still say QUIT")
    void shouldRejectRefusedMailbox() throws Exception {
        final var accepting = FakeSmtpServer.accepting();
        server = new FakeSmtpServer(GREETING,
                line -> line.startsWith("RCPT TO") ? "550 5.1.1 User unknown" : accepting.apply(line));

        final var result = proberFor(server.getPort()).probe(FakeSmtpServer.HOST, EMAIL, genericDialect());

        assertThat(result).isFalse();
        assertThat(server.awaitReceived("QUIT", 1000)).isTrue();
    }

    @Test
    @DisplayName("Should skip continuation lines of a multi-line greeting")
    void shouldHandleMultiLineGreeting() throws Exception {
        server = new FakeSmtpServer(
                List.of("220-fake.example.com ESMTP", "220-Unsolicited mail prohibited", "220 Ready"),
                FakeSmtpServer.accepting());

        final var result = proberFor(server.getPort()).probe(FakeSmtpServer.HOST, EMAIL, genericDialect());

        assertThat(result).isTrue();
        assertThat(server.awaitReceived("QUIT", 1000)).isTrue();
        assertThat(server.getReceived().get(0)).isEqualTo("HELO example.com");
    }

    @Test
    @DisplayName("Should treat silence after MAIL FROM as deliverable for generic domains")
    void shouldTreatSilenceAfterMailFromAsDeliverable() throws Exception {
        server = new FakeSmtpServer(GREETING, silentOn("MAIL FROM"));

        final var result = proberFor(server.getPort()).probe(FakeSmtpServer.HOST, EMAIL, genericDialect());

        assertThat(result).isTrue();
        assertThat(server.awaitReceived("QUIT", 1000)).isTrue();
    }

    @Test
    @DisplayName("Should treat silence after HELO as undeliverable for generic domains")
    void shouldTreatSilenceAfterHeloAsUndeliverable() throws Exception {
        server = new FakeSmtpServer(GREETING, silentOn("HELO"));

        final var result = proberFor(server.getPort()).probe(FakeSmtpServer.HOST, EMAIL, genericDialect());

        assertThat(result).isFalse();
    }

    @Test
    @DisplayName("Should report false when the exchanger refuses the connection")
    void shouldReportFalseOnRefusedConnection() throws Exception {
        final int port;
        try (var probe = new ServerSocket(0, 1, InetAddress.getByName(FakeSmtpServer.HOST))) {
            port = probe.getLocalPort();
        }

        assertThat(proberFor(port).probe(FakeSmtpServer.HOST, EMAIL, genericDialect())).isFalse();
    }

    @Test
    @DisplayName("Should give up at the provider deadline without evidence")
    void shouldGiveUpAtProviderDeadline() throws Exception {
        server = new FakeSmtpServer(GREETING, silentOn("HELO"));
        final var dialect = ProviderDialect.provider("outlook.com", Set.of("outlook.com"),
                "outlook-com.olc.protection.outlook.com", 300, Set.of(250, 251));

        final var result = proberFor(server.getPort()).probe(FakeSmtpServer.HOST, "user@outlook.com", dialect);

        assertThat(result).isFalse();
        assertThat(server.awaitReceived("HELO outlook-com.olc.protection.outlook.com", 1000)).isTrue();
    }

    @Test
    @DisplayName("Should keep provider evidence gathered before the deadline")
    void shouldKeepProviderEvidenceAtDeadline() throws Exception {
        server = new FakeSmtpServer(GREETING, silentOn("HELO"));
        final var dialect = ProviderDialect.provider("icloud.com", Set.of("icloud.com"),
                "icloud-com.mail.protection.outlook.com", 300, Set.of(250, 220));

        assertThat(proberFor(server.getPort()).probe(FakeSmtpServer.HOST, "user@icloud.com", dialect)).isTrue();
    }

    @Test
    @DisplayName("Should fall back to the next exchanger until one confirms")
    void shouldFallBackToNextExchanger() throws Exception {
        final var rcptCount = new AtomicInteger();
        final var accepting = FakeSmtpServer.accepting();
        server = new FakeSmtpServer(GREETING, line -> {
            if (line.startsWith("RCPT TO")) {
                return rcptCount.incrementAndGet() == 1 ? "550 No such user here" : "250 Ok";
            }
            return accepting.apply(line);
        });
        final var exchangers = List.of(
                new MxRecord(FakeSmtpServer.HOST, 10),
                new MxRecord(FakeSmtpServer.HOST, 20));

        final var result = proberFor(server.getPort()).probeAny(exchangers, EMAIL, genericDialect());

        assertThat(result).isTrue();
        assertThat(rcptCount.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report false when no exchanger confirms")
    void shouldReportFalseWhenNoExchangerConfirms() throws Exception {
        final var accepting = FakeSmtpServer.accepting();
        server = new FakeSmtpServer(GREETING,
                line -> line.startsWith("RCPT TO") ? "550 No such user here" : accepting.apply(line));

        final var result = proberFor(server.getPort())
                .probeAny(List.of(new MxRecord(FakeSmtpServer.HOST, 10)), EMAIL, genericDialect());

        assertThat(result).isFalse();
        assertThat(proberFor(server.getPort()).probeAny(List.of(), EMAIL, genericDialect())).isFalse();
    }
}
