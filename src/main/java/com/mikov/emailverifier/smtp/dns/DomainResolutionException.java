package com.mikov.emailverifier.smtp.dns;

import lombok.Getter;

/**
 * A DNS lookup could not be answered (timeout, server failure, malformed name).
 * An authoritative "no such record" answer is not an error.
 */
@Getter
public class DomainResolutionException extends Exception {
    private final String domain;
    private final String recordType;

    public DomainResolutionException(String domain, String recordType, String message) {
        super(recordType + " lookup for " + domain + " failed: " + message);
        this.domain = domain;
        this.recordType = recordType;
    }

    public DomainResolutionException(String domain, String recordType, Throwable cause) {
        super(recordType + " lookup for " + domain + " failed: " + cause.getMessage(), cause);
        this.domain = domain;
        this.recordType = recordType;
    }
}
