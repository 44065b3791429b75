package com.mikov.emailverifier.config;

import com.mikov.emailverifier.smtp.model.SmtpConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SmtpConfiguration {

    @Bean
    public SmtpConfig smtpConfig(@Value("${emailverifier.smtp.port:25}") final int port,
                                 @Value("${emailverifier.smtp.generic-timeout-ms:7000}") final int genericTimeout,
                                 @Value("${emailverifier.smtp.sender-local-part:verify}") final String senderLocalPart,
                                 @Value("${emailverifier.smtp.helo-domain:}") final String heloDomain) {
        return SmtpConfig.builder()
                .port(port)
                .genericTimeout(genericTimeout)
                .senderLocalPart(senderLocalPart)
                .heloDomain(heloDomain)
                .build();
    }
}
