package com.mikov.emailverifier.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SyntaxValidator")
class SyntaxValidatorTest {

    private final SyntaxValidator validator = new SyntaxValidator();

    @ParameterizedTest
    @ValueSource(strings = {
            "user@example.com",
            "first.last@example.co.uk",
            "user+tag@mail.example.org",
            "a@b.io",
            "under_score%x@sub-domain.example.com",
            "user@zzz-nonexistent-domain-test.invalid",
            "USER@EXAMPLE.COM",
            "user@123.example.com"
    })
    @DisplayName("Should accept well-formed addresses")
    void shouldAcceptWellFormedAddresses(String email) {
        assertThat(validator.isValidFormat(email)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "   ",
            "not-an-email",
            "@example.com",
            "user@",
            "user@example",
            "user@example.c",
            "user@example.c0m",
            ".user@example.com",
            "user.@example.com",
            "user@-example.com",
            "user@example-.com",
            "user@@example.com",
            "us er@example.com",
            "user@exa_mple.com",
            "user@example..com",
            "user!@example.com"
    })
    @DisplayName("Should reject malformed addresses")
    void shouldRejectMalformedAddresses(String email) {
        assertThat(validator.isValidFormat(email)).isFalse();
    }

    @Test
    @DisplayName("Should enforce the 63 character local part limit")
    void shouldEnforceLocalPartLimit() {
        assertThat(validator.isValidFormat("a".repeat(63) + "@example.com")).isTrue();
        assertThat(validator.isValidFormat("a".repeat(64) + "@example.com")).isFalse();
    }

    @Test
    @DisplayName("Should enforce the 63 character label limit")
    void shouldEnforceLabelLimit() {
        assertThat(validator.isValidFormat("user@" + "d".repeat(63) + ".com")).isTrue();
        assertThat(validator.isValidFormat("user@" + "d".repeat(64) + ".com")).isFalse();
    }

    @Test
    @DisplayName("Should reject addresses longer than 254 characters")
    void shouldRejectOverlongAddresses() {
        final var domain = String.join(".", "d".repeat(60), "d".repeat(60), "d".repeat(60), "d".repeat(60), "d".repeat(60)) + ".com";
        assertThat(validator.isValidFormat("user@" + domain)).isFalse();
    }
}
