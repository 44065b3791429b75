package com.mikov.emailverifier.smtp.core;

import lombok.Getter;

/**
 * Final line of a server reply, reduced to its status code.
 * A line without a leading three digit code yields code 0.
 */
@Getter
public class SmtpResponse {
    private final int code;
    private final String message;
    private final ReplyClass replyClass;

    public SmtpResponse(String response) {
        this.code = extractCode(response);
        this.message = response;
        this.replyClass = ReplyClass.of(code);
    }

    private int extractCode(String response) {
        if (response == null || response.length() < 3) {
            return 0;
        }
        for (int i = 0; i < 3; i++) {
            if (!Character.isDigit(response.charAt(i))) {
                return 0;
            }
        }
        final var code = Integer.parseInt(response.substring(0, 3));
        return code >= 100 ? code : 0;
    }

    public boolean hasCode() {
        return code != 0;
    }

    public boolean isPositive() {
        return replyClass == ReplyClass.POSITIVE;
    }

    public boolean isPermanentFailure() {
        return replyClass == ReplyClass.PERMANENT_FAILURE;
    }

    @Override
    public String toString() {
        return message;
    }
}
