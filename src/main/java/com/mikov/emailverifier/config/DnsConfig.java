package com.mikov.emailverifier.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Resolver;

import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;

@Slf4j
@Configuration
public class DnsConfig {

    public static final int RESOLVER_TIMEOUT = 3000;

    /**
     * Resolver shared by all DNS checks. Without configured servers the
     * system's resolver configuration is used.
     */
    @Bean
    public Resolver dnsResolver(@Value("${emailverifier.dns.servers:}") final String[] servers,
                                @Value("${emailverifier.dns.timeout-ms:" + RESOLVER_TIMEOUT + "}") final int timeoutMs)
            throws UnknownHostException {
        final var configuredServers = Arrays.stream(servers)
                .map(String::trim)
                .filter(server -> !server.isEmpty())
                .toArray(String[]::new);

        final ExtendedResolver resolver;
        if (configuredServers.length == 0) {
            resolver = new ExtendedResolver();
            log.info("Using system DNS resolver configuration");
        } else {
            resolver = new ExtendedResolver(configuredServers);
            log.info("Using DNS servers {}", Arrays.toString(configuredServers));
        }
        resolver.setTimeout(Duration.ofMillis(timeoutMs));
        return resolver;
    }
}
