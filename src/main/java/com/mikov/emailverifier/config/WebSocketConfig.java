package com.mikov.emailverifier.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over SockJS for bulk jobs submitted from a browser. Jobs arrive on
 * {@value #APPLICATION_PREFIX} and report back on {@value #TOPIC_PREFIX}.
 */
@Slf4j
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String ENDPOINT = "/ws-emailverifier";
    public static final String TOPIC_PREFIX = "/topic";
    public static final String APPLICATION_PREFIX = "/app";

    private static final int MAX_CONCURRENT_JOBS = 4;

    private final int batchSize;

    public WebSocketConfig(@Value("${emailverifier.bulk.batch-size:10}") final int batchSize) {
        this.batchSize = batchSize;
    }

    @Override
    public void configureMessageBroker(final MessageBrokerRegistry config) {
        config.enableSimpleBroker(TOPIC_PREFIX);
        config.setApplicationDestinationPrefixes(APPLICATION_PREFIX);
    }

    @Override
    public void registerStompEndpoints(final StompEndpointRegistry registry) {
        registry.addEndpoint(ENDPOINT)
                .setAllowedOriginPatterns("*")
                .withSockJS();
        log.info("Bulk validation STOMP endpoint registered at {}", ENDPOINT);
    }

    /**
     * A bulk job holds its inbound thread until the complete event is published.
     */
    @Override
    public void configureClientInboundChannel(final ChannelRegistration registration) {
        registration.taskExecutor()
                .corePoolSize(MAX_CONCURRENT_JOBS)
                .maxPoolSize(MAX_CONCURRENT_JOBS * 2);
    }

    @Override
    public void configureWebSocketTransport(final WebSocketTransportRegistration registration) {
        // inbound frames carry a whole job, outbound ones a batch of annotated rows
        final var frameLimit = Math.max(512, batchSize * 16) * 1024;
        registration.setMessageSizeLimit(frameLimit)
                .setSendBufferSizeLimit(frameLimit * 2)
                .setSendTimeLimit(20000);
        log.debug("WebSocket frame limit set to {} bytes", frameLimit);
    }
}
