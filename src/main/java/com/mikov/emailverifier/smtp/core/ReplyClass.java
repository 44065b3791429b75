package com.mikov.emailverifier.smtp.core;

/**
 * Reply categories, taken from the first digit of the reply code.
 */
public enum ReplyClass {
    PRELIMINARY,
    POSITIVE,
    INTERMEDIATE,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE;

    /**
     * Codes from 600 upward are outside the protocol and count as permanent failures.
     *
     * @return the category, or null for codes below 100
     */
    public static ReplyClass of(int code) {
        switch (code / 100) {
            case 1:
                return PRELIMINARY;
            case 2:
                return POSITIVE;
            case 3:
                return INTERMEDIATE;
            case 4:
                return TRANSIENT_FAILURE;
            case 5:
            case 6:
            case 7:
            case 8:
            case 9:
                return PERMANENT_FAILURE;
            default:
                return null;
        }
    }
}
