package com.mikov.emailverifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the email deliverability verifier.
 *
 * @author zahari.mikov
 */
@SpringBootApplication
public class EmailVerifierApplication {

    public static void main(final String[] args) {
        SpringApplication.run(EmailVerifierApplication.class, args);
    }
}
