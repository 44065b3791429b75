package com.mikov.emailverifier.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validator for email syntax and format.
 * Performs a quick, network-free check that gates every later verification step.
 *
 * @author zahari.mikov
 */
@Component
public class SyntaxValidator {

    private static final String LOCAL_PART = "[A-Za-z0-9_%+-](?:[A-Za-z0-9._%+-]{0,61}[A-Za-z0-9_%+-])?";
    private static final String DOMAIN_LABEL = "[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?";
    private static final String TOP_LEVEL_LABEL = "[A-Za-z]{2,63}";

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^" + LOCAL_PART + "@(?:" + DOMAIN_LABEL + "\\.)+" + TOP_LEVEL_LABEL + "$");

    private static final int MAX_EMAIL_LENGTH = 254;

    /**
     * Checks whether the candidate is a syntactically acceptable address.
     *
     * @param email the candidate, may be null
     * @return true if the address matches the accepted grammar
     */
    public boolean isValidFormat(final String email) {
        if (email == null || email.isBlank()) {
            return false;
        }

        if (email.length() > MAX_EMAIL_LENGTH) {
            return false;
        }

        return EMAIL_PATTERN.matcher(email).matches();
    }
}
