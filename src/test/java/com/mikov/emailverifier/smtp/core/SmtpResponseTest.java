package com.mikov.emailverifier.smtp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SmtpResponse")
class SmtpResponseTest {

    @Test
    @DisplayName("Should extract the leading status code")
    void shouldExtractLeadingCode() {
        final var response = new SmtpResponse("250 2.1.5 Ok");

        assertThat(response.getCode()).isEqualTo(250);
        assertThat(response.isPositive()).isTrue();
        assertThat(response.getReplyClass()).isEqualTo(ReplyClass.POSITIVE);
    }

    @Test
    @DisplayName("Should classify temporary and permanent failures")
    void shouldClassifyFailures() {
        assertThat(new SmtpResponse("451 4.7.1 Try again later").getReplyClass()).isEqualTo(ReplyClass.TRANSIENT_FAILURE);
        assertThat(new SmtpResponse("451 4.7.1 Try again later").isPermanentFailure()).isFalse();
        assertThat(new SmtpResponse("650 Out of range").isPermanentFailure()).isTrue();
        assertThat(new SmtpResponse("550 5.1.1 User unknown").isPermanentFailure()).isTrue();
        assertThat(new SmtpResponse("550 5.1.1 User unknown").isPositive()).isFalse();
        assertThat(new SmtpResponse("354 Start mail input").getReplyClass()).isEqualTo(ReplyClass.INTERMEDIATE);
    }

    @Test
    @DisplayName("Should yield code 0 for lines without a code")
    void shouldYieldZeroWithoutCode() {
        assertThat(new SmtpResponse("hello").hasCode()).isFalse();
        assertThat(new SmtpResponse("").hasCode()).isFalse();
        assertThat(new SmtpResponse(null).hasCode()).isFalse();
        assertThat(new SmtpResponse("-25 odd").hasCode()).isFalse();
        assertThat(new SmtpResponse("099 too low").hasCode()).isFalse();
        assertThat(new SmtpResponse("hello").getReplyClass()).isNull();
    }
}
