package com.mikov.emailverifier.bulk;

import com.mikov.emailverifier.config.WebSocketConfig;
import com.mikov.emailverifier.model.BatchProgressEvent;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Publishes events to the progress topic of one WebSocket session.
 */
public class StompProgressSink implements BatchProgressSink {

    public static final String DESTINATION_PREFIX = WebSocketConfig.TOPIC_PREFIX + "/validation-progress/";

    private final SimpMessagingTemplate messagingTemplate;
    private final String destination;

    public StompProgressSink(final SimpMessagingTemplate messagingTemplate, final String sessionId) {
        this.messagingTemplate = messagingTemplate;
        this.destination = DESTINATION_PREFIX + sessionId;
    }

    @Override
    public void accept(final BatchProgressEvent event) {
        messagingTemplate.convertAndSend(destination, event);
    }
}
